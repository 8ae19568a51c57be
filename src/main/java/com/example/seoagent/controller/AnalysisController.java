package com.example.seoagent.controller;

import com.example.seoagent.dto.AnalysisRequest;
import com.example.seoagent.dto.AnalysisResponse;
import com.example.seoagent.model.AnalysisStatus;
import com.example.seoagent.model.ComprehensiveAnalysis;
import com.example.seoagent.service.AnalysisService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API контроллер для анализа сайтов.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AnalysisController {

    private final AnalysisService analysisService;

    /**
     * Запускает анализ.
     *
     * POST /api/v1/analyses
     */
    @PostMapping("/analyses")
    public ResponseEntity<AnalysisResponse> startAnalysis(@RequestBody @Valid AnalysisRequest request) {
        log.info("Starting analysis for domain: {}", request.getBusinessContext().getDomain());

        String analysisId = analysisService.startAnalysis(request);

        return ResponseEntity.accepted().body(AnalysisResponse.builder()
                .analysisId(analysisId)
                .status(AnalysisStatus.PENDING)
                .message("Analysis started")
                .build());
    }

    /**
     * Текущее состояние прогона.
     *
     * GET /api/v1/analyses/{analysisId}
     */
    @GetMapping("/analyses/{analysisId}")
    public ResponseEntity<ComprehensiveAnalysis> getAnalysis(@PathVariable String analysisId) {
        log.debug("Getting analysis: {}", analysisId);
        return analysisService.getAnalysis(analysisId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * GET /api/v1/health
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
