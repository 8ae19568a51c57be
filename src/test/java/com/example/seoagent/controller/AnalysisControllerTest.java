package com.example.seoagent.controller;

import com.example.seoagent.dto.AnalysisRequest;
import com.example.seoagent.model.BusinessContext;
import com.example.seoagent.model.ComprehensiveAnalysis;
import com.example.seoagent.service.AnalysisService;
import com.example.seoagent.support.TestData;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AnalysisController.class)
class AnalysisControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private AnalysisService analysisService;

    @Test
    void shouldStartAnalysis() throws Exception {
        // Given
        String analysisId = UUID.randomUUID().toString();
        when(analysisService.startAnalysis(any())).thenReturn(analysisId);

        AnalysisRequest request = AnalysisRequest.builder()
                .businessContext(TestData.bakery())
                .baseline(TestData.baseline())
                .build();

        // When & Then
        mockMvc.perform(post("/api/v1/analyses")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.analysisId").value(analysisId))
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.message").value("Analysis started"));
    }

    @Test
    void shouldReturnBadRequestForMissingBaseline() throws Exception {
        AnalysisRequest request = AnalysisRequest.builder()
                .businessContext(TestData.bakery())
                .build();

        mockMvc.perform(post("/api/v1/analyses")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldReturnBadRequestForBlankDomain() throws Exception {
        BusinessContext context = TestData.bakery();
        context.setDomain(" ");
        AnalysisRequest request = AnalysisRequest.builder()
                .businessContext(context)
                .baseline(TestData.baseline())
                .build();

        mockMvc.perform(post("/api/v1/analyses")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldReturnAnalysis() throws Exception {
        // Given
        ComprehensiveAnalysis analysis = new ComprehensiveAnalysis("run-1", "sunrise-bakery.com",
                TestData.baseline(), TestData.NOW);
        analysis.markStarted();
        when(analysisService.getAnalysis("run-1")).thenReturn(Optional.of(analysis));

        // When & Then
        mockMvc.perform(get("/api/v1/analyses/run-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("run-1"))
                .andExpect(jsonPath("$.domain").value("sunrise-bakery.com"))
                .andExpect(jsonPath("$.status").value("running"))
                .andExpect(jsonPath("$.progress").value(0))
                .andExpect(jsonPath("$.agentResults.length()").value(6))
                .andExpect(jsonPath("$.agentResults[0].agentType").value("technical_seo"))
                .andExpect(jsonPath("$.agentResults[0].status").value("pending"));
    }

    @Test
    void shouldReturnNotFoundForUnknownAnalysis() throws Exception {
        when(analysisService.getAnalysis("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/analyses/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldReturnHealthStatus() throws Exception {
        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("OK"));
    }
}
