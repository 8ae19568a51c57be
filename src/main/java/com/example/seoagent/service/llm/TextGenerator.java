package com.example.seoagent.service.llm;

import org.slf4j.MDC;

/**
 * Генерация свободного текста по промпту с ограничением на длину ответа.
 */
public interface TextGenerator {

    /**
     * Ключ MDC с именем вызывающего агента или раздела плана.
     */
    String CALLER_KEY = "llmCaller";

    /**
     * @param prompt промпт пользователя
     * @param maxTokens максимальное количество токенов в ответе
     * @return непустой текст ответа
     * @throws TextGenerationException если модель недоступна, вызов упал или ответ пуст
     */
    String generateText(String prompt, int maxTokens);

    /**
     * То же, но вызов помечается именем вызывающего на время запроса.
     */
    default String generateText(String caller, String prompt, int maxTokens) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable(CALLER_KEY, caller)) {
            return generateText(prompt, maxTokens);
        }
    }
}
