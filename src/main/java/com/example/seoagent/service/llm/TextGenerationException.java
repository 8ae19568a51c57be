package com.example.seoagent.service.llm;

/**
 * Ошибка обращения к генеративной модели.
 */
public class TextGenerationException extends RuntimeException {

    public TextGenerationException(String message) {
        super(message);
    }

    public TextGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
