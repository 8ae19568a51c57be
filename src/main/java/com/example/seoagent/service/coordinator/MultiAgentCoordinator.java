package com.example.seoagent.service.coordinator;

import com.example.seoagent.config.AppConfig;
import com.example.seoagent.model.AgentResult;
import com.example.seoagent.model.AgentResults;
import com.example.seoagent.model.AgentType;
import com.example.seoagent.model.AnalysisStatus;
import com.example.seoagent.model.BaselineMetrics;
import com.example.seoagent.model.BusinessContext;
import com.example.seoagent.service.agent.AgentFactory;
import com.example.seoagent.service.agent.AgentProgressListener;
import com.example.seoagent.service.agent.AnalysisAgent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Запускает всех агентов параллельно и ждёт завершения каждого.
 * Ошибка одного агента не прерывает остальных.
 */
@Slf4j
@Service
public class MultiAgentCoordinator {

    private final AgentFactory agentFactory;
    private final Executor agentExecutor;
    private final AppConfig appConfig;
    private final Clock clock;

    public MultiAgentCoordinator(AgentFactory agentFactory,
                                 @Qualifier("agentExecutor") Executor agentExecutor,
                                 AppConfig appConfig,
                                 Clock clock) {
        this.agentFactory = agentFactory;
        this.agentExecutor = agentExecutor;
        this.appConfig = appConfig;
        this.clock = clock;
    }

    public List<AgentResult> runAll(BusinessContext context, BaselineMetrics baseline) {
        return runAll(context, baseline, null);
    }

    /**
     * Запускает по одному агенту каждого типа.
     *
     * @return результаты в порядке {@link AgentType}
     */
    public List<AgentResult> runAll(BusinessContext context, BaselineMetrics baseline,
                                    AgentProgressListener listener) {
        long timeoutSeconds = appConfig.getAgents().getTimeoutSeconds();
        log.info("Starting multi-agent analysis for {} ({} agents, timeout {}s)",
                context != null ? context.getDomain() : null, AgentType.values().length, timeoutSeconds);

        Map<AgentType, CompletableFuture<AgentResult>> futures = new EnumMap<>(AgentType.class);
        for (AgentType type : AgentType.values()) {
            futures.put(type, launch(type, context, baseline, listener, timeoutSeconds));
        }

        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();

        List<AgentResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<AgentResult> future : futures.values()) {
            results.add(future.join());
        }

        log.info("Multi-agent analysis finished: status={}, progress={}%",
                aggregateStatus(results).getValue(), aggregateProgress(results));
        return results;
    }

    /**
     * Средний прогресс по результатам с округлением; 0, пока результатов нет.
     */
    public int aggregateProgress(Collection<AgentResult> results) {
        return AgentResults.averageProgress(results);
    }

    /**
     * failed, если упал хотя бы один агент; running, пока кто-то не завершился; иначе completed.
     */
    public AnalysisStatus aggregateStatus(Collection<AgentResult> results) {
        return AgentResults.combinedStatus(results);
    }

    private CompletableFuture<AgentResult> launch(AgentType type, BusinessContext context, BaselineMetrics baseline,
                                                  AgentProgressListener listener, long timeoutSeconds) {
        CompletableFuture<AgentResult> future;
        try {
            AnalysisAgent agent = agentFactory.create(type, context, baseline);
            future = CompletableFuture.supplyAsync(() -> agent.analyze(listener), agentExecutor);
        } catch (RuntimeException e) {
            log.error("Agent {} could not be started: {}", type.getValue(), e.getMessage(), e);
            return CompletableFuture.completedFuture(failed(type, e.getMessage(), listener));
        }
        return future
                .orTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .exceptionally(error -> failed(type, describe(error, timeoutSeconds), listener));
    }

    private AgentResult failed(AgentType type, String error, AgentProgressListener listener) {
        log.error("Agent {} failed: {}", type.getValue(), error);
        AgentResult result = new AgentResult(type);
        result.fail(error, clock.instant());
        if (listener != null) {
            listener.onProgress(result.snapshot(), result.getStatus().getValue());
        }
        return result;
    }

    private static String describe(Throwable error, long timeoutSeconds) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TimeoutException) {
            return "Agent timed out after " + timeoutSeconds + " seconds";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
