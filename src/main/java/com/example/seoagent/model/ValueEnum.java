package com.example.seoagent.model;

import java.util.Optional;

/**
 * Перечисление со строковым значением для JSON и промптов.
 */
public interface ValueEnum {

    String getValue();

    /**
     * Ищет константу по точному строковому значению; другой регистр не принимается.
     */
    static <E extends Enum<E> & ValueEnum> Optional<E> fromValue(Class<E> type, String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        for (E constant : type.getEnumConstants()) {
            if (constant.getValue().equals(raw)) {
                return Optional.of(constant);
            }
        }
        return Optional.empty();
    }
}
