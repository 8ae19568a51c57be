package com.example.seoagent.dto;

import com.example.seoagent.model.BaselineMetrics;
import com.example.seoagent.model.BusinessContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Запрос на запуск анализа.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRequest {
    /**
     * ID прогона (опционально, иначе генерируется)
     */
    private String runId;

    @Valid
    @NotNull(message = "Business context is required")
    private BusinessContext businessContext;

    /**
     * Базовые метрики сайта из предварительного анализа
     */
    @Valid
    @NotNull(message = "Baseline metrics are required")
    private BaselineMetrics baseline;
}
