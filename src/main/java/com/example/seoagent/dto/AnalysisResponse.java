package com.example.seoagent.dto;

import com.example.seoagent.model.AnalysisStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ответ на запуск анализа.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResponse {
    private String analysisId;
    private AnalysisStatus status;
    private String message;
}
