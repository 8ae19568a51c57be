package com.example.seoagent.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Пункт плана действий.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ActionItem {
    /**
     * Уникален в пределах одного плана
     */
    private String id;
    private String title;
    private String description;
    private Priority priority;
    private Level impact;
    private Level effort;
    private ActionCategory category;
    private Timeframe timeframe;

    @Builder.Default
    private List<String> steps = new ArrayList<>();

    /**
     * Необязательный список инструментов
     */
    private List<String> tools;
    private String expectedImprovement;

    /**
     * Идентификаторы других пунктов; носят справочный характер
     */
    private List<String> dependencies;
}
