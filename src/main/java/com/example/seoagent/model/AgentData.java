package com.example.seoagent.model;

import java.util.OptionalInt;

/**
 * Структурированные данные, которые агент вычисляет помимо текстовых выводов.
 */
public interface AgentData {

    /**
     * Оценка агента, участвующая в расчёте общего балла плана.
     */
    default OptionalInt planScore() {
        return OptionalInt.empty();
    }
}
