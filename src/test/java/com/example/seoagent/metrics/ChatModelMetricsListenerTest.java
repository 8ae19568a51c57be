package com.example.seoagent.metrics;

import com.example.seoagent.service.llm.TextGenerator;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.ModelProvider;
import dev.langchain4j.model.chat.listener.ChatModelErrorContext;
import dev.langchain4j.model.chat.listener.ChatModelRequestContext;
import dev.langchain4j.model.chat.listener.ChatModelResponseContext;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class ChatModelMetricsListenerTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final ChatModelMetricsListener listener = new ChatModelMetricsListener(registry);

    private final ChatRequest request = ChatRequest.builder()
            .messages(UserMessage.from("Analyze example.com"))
            .build();

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void shouldTagRequestTokensAndDurationWithCaller() {
        // Given
        Map<Object, Object> attributes = new HashMap<>();
        ChatResponse response = ChatResponse.builder()
                .aiMessage(AiMessage.from("Findings"))
                .tokenUsage(new TokenUsage(120, 40))
                .build();
        MDC.put(TextGenerator.CALLER_KEY, "technical_seo");

        // When
        listener.onRequest(new ChatModelRequestContext(request, ModelProvider.OPEN_AI, attributes));
        MDC.remove(TextGenerator.CALLER_KEY);
        listener.onResponse(new ChatModelResponseContext(response, request, ModelProvider.OPEN_AI, attributes));

        // Then
        assertEquals(1.0, registry.get("llm.requests.total").tag("caller", "technical_seo").counter().count());
        assertEquals(120.0, registry.get("llm.tokens")
                .tags("caller", "technical_seo", "direction", "input").summary().totalAmount());
        assertEquals(40.0, registry.get("llm.tokens")
                .tags("caller", "technical_seo", "direction", "output").summary().totalAmount());
        assertEquals(1L, registry.get("llm.duration")
                .tags("caller", "technical_seo", "outcome", "success").timer().count());
    }

    @Test
    void shouldCountErrorsPerCaller() {
        Map<Object, Object> attributes = new HashMap<>();
        MDC.put(TextGenerator.CALLER_KEY, "action_items");

        listener.onRequest(new ChatModelRequestContext(request, ModelProvider.OPEN_AI, attributes));
        listener.onError(new ChatModelErrorContext(new RuntimeException("timeout"), request,
                ModelProvider.OPEN_AI, attributes));

        assertEquals(1.0, registry.get("llm.errors.total").tag("caller", "action_items").counter().count());
        assertEquals(1L, registry.get("llm.duration")
                .tags("caller", "action_items", "outcome", "error").timer().count());
    }

    @Test
    void shouldFallBackToUnknownCallerOutsideTaggedCall() {
        Map<Object, Object> attributes = new HashMap<>();

        listener.onRequest(new ChatModelRequestContext(request, ModelProvider.OPEN_AI, attributes));

        assertEquals(1.0, registry.get("llm.requests.total")
                .tag("caller", ChatModelMetricsListener.UNKNOWN_CALLER).counter().count());
    }

    @Test
    void shouldExposeCallerOnlyDuringTaggedGeneration() {
        Map<String, String> seen = new HashMap<>();
        TextGenerator generator = (prompt, maxTokens) -> {
            seen.put("caller", MDC.get(TextGenerator.CALLER_KEY));
            return "text";
        };

        generator.generateText("summary", "prompt", 100);

        assertEquals("summary", seen.get("caller"));
        assertNull(MDC.get(TextGenerator.CALLER_KEY));
    }
}
