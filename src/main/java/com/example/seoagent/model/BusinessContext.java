package com.example.seoagent.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Описание бизнеса, для которого строится план. Не изменяется в течение прогона.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BusinessContext {
    /**
     * Домен анализируемого сайта
     */
    @NotBlank(message = "Domain is required")
    private String domain;

    /**
     * Тип бизнеса (например: restaurant, law firm)
     */
    private String businessType;

    /**
     * Отрасль
     */
    private String industry;

    /**
     * Регион присутствия
     */
    private String location;

    @Builder.Default
    private List<String> products = new ArrayList<>();

    @Builder.Default
    private List<String> services = new ArrayList<>();

    /**
     * Целевые ключевые слова бизнеса
     */
    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    private String description;

    /**
     * Количество продуктов и услуг вместе
     */
    public int offeringsCount() {
        return (products != null ? products.size() : 0) + (services != null ? services.size() : 0);
    }
}
