package com.example.seoagent.support;

import com.example.seoagent.service.llm.TextGenerationException;
import com.example.seoagent.service.llm.TextGenerator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Детерминированный генератор текста: ответ выбирается функцией от промпта.
 */
public class FakeTextGenerator implements TextGenerator {

    private final Function<String, String> responder;
    private final List<String> prompts = Collections.synchronizedList(new ArrayList<>());

    public FakeTextGenerator(Function<String, String> responder) {
        this.responder = responder;
    }

    public static FakeTextGenerator replying(String response) {
        return new FakeTextGenerator(prompt -> response);
    }

    public static FakeTextGenerator failing() {
        return new FakeTextGenerator(prompt -> {
            throw new TextGenerationException("Model is not configured");
        });
    }

    @Override
    public String generateText(String prompt, int maxTokens) {
        prompts.add(prompt);
        return responder.apply(prompt);
    }

    public List<String> getPrompts() {
        return new ArrayList<>(prompts);
    }
}
