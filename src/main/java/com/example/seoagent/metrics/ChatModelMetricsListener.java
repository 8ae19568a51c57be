package com.example.seoagent.metrics;

import com.example.seoagent.service.llm.TextGenerator;
import dev.langchain4j.model.chat.listener.ChatModelErrorContext;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.chat.listener.ChatModelRequestContext;
import dev.langchain4j.model.chat.listener.ChatModelResponseContext;
import dev.langchain4j.model.output.TokenUsage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Map;

/**
 * Метрики запросов к генеративной модели с тегом {@code caller}:
 * тип агента или раздел плана, выставленный через {@link TextGenerator#CALLER_KEY}.
 */
@Slf4j
public class ChatModelMetricsListener implements ChatModelListener {

    static final String UNKNOWN_CALLER = "unknown";

    private static final String START_NANOS = "seo.llm.start";
    private static final String CALLER = "seo.llm.caller";

    private final MeterRegistry meterRegistry;

    public ChatModelMetricsListener(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void onRequest(ChatModelRequestContext requestContext) {
        String caller = MDC.get(TextGenerator.CALLER_KEY);
        if (caller == null || caller.isBlank()) {
            caller = UNKNOWN_CALLER;
        }
        requestContext.attributes().put(CALLER, caller);
        requestContext.attributes().put(START_NANOS, System.nanoTime());

        Counter.builder("llm.requests.total")
                .description("Chat model requests by caller")
                .tag("caller", caller)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void onResponse(ChatModelResponseContext responseContext) {
        Map<Object, Object> attributes = responseContext.attributes();
        String caller = callerOf(attributes);
        Long elapsedMillis = recordDuration(caller, "success", attributes);

        TokenUsage usage = responseContext.chatResponse().tokenUsage();
        if (usage != null) {
            recordTokens(caller, "input", usage.inputTokenCount());
            recordTokens(caller, "output", usage.outputTokenCount());
        }
        log.debug("Chat model call for {} took {} ms", caller, elapsedMillis);
    }

    @Override
    public void onError(ChatModelErrorContext errorContext) {
        Map<Object, Object> attributes = errorContext.attributes();
        String caller = callerOf(attributes);
        Counter.builder("llm.errors.total")
                .description("Failed chat model requests by caller")
                .tag("caller", caller)
                .register(meterRegistry)
                .increment();
        Long elapsedMillis = recordDuration(caller, "error", attributes);
        log.warn("Chat model call for {} failed after {} ms: {}",
                caller, elapsedMillis, errorContext.error().getMessage());
    }

    private void recordTokens(String caller, String direction, Integer count) {
        if (count == null) {
            return;
        }
        DistributionSummary.builder("llm.tokens")
                .description("Tokens per chat model request")
                .tag("caller", caller)
                .tag("direction", direction)
                .register(meterRegistry)
                .record(count);
    }

    private Long recordDuration(String caller, String outcome, Map<Object, Object> attributes) {
        if (!(attributes.get(START_NANOS) instanceof Long startNanos)) {
            return null;
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        Timer.builder("llm.duration")
                .description("Chat model request duration by caller")
                .tag("caller", caller)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .record(elapsed);
        return elapsed.toMillis();
    }

    private static String callerOf(Map<Object, Object> attributes) {
        Object caller = attributes.get(CALLER);
        return caller != null ? caller.toString() : UNKNOWN_CALLER;
    }
}
