package com.example.seoagent.service.plan;

/**
 * Ответ модели не является JSON ожидаемой формы.
 */
public class SynthesisParseException extends RuntimeException {

    public SynthesisParseException(String message) {
        super(message);
    }

    public SynthesisParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
