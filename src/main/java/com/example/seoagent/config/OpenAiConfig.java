package com.example.seoagent.config;

import com.example.seoagent.metrics.ChatModelMetricsListener;
import dev.langchain4j.model.openai.OpenAiChatModel;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * Конфигурация OpenAI через langchain4j-open-ai.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "openai")
public class OpenAiConfig {
    /**
     * Ключ API; без него модель не создаётся и все генеративные вызовы уходят в fallback
     */
    private String apiKey;

    /**
     * URL для API запросов
     */
    private String baseUrl = "https://api.openai.com/v1";

    /**
     * Модель для использования
     */
    private String model = "gpt-3.5-turbo";

    /**
     * Температура для генерации (0.0 - 2.0)
     */
    private double temperature = 0.7;

    /**
     * Максимальное количество токенов в ответе по умолчанию
     */
    private int maxTokens = 3000;

    /**
     * Таймаут запроса в секундах
     */
    private int timeoutSeconds = 60;

    /**
     * Логировать запросы и ответы модели
     */
    private boolean logRequests = false;

    /**
     * Создаёт бин OpenAiChatModel для использования в сервисах.
     */
    @Bean
    public OpenAiChatModel openAiChatModel(MeterRegistry meterRegistry) {
        if (apiKey == null || apiKey.isBlank()) {
            return null;
        }

        return OpenAiChatModel.builder()
                .apiKey(apiKey)
                .baseUrl(baseUrl)
                .modelName(model)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .logRequests(logRequests)
                .logResponses(logRequests)
                .listeners(List.of(new ChatModelMetricsListener(meterRegistry)))
                .build();
    }
}
