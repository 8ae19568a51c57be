package com.example.seoagent.metrics;

import com.example.seoagent.model.AgentResult;
import com.example.seoagent.model.AnalysisStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Метрики прогонов анализа и агентов.
 */
@Component
public class AnalysisMetrics {

    private final MeterRegistry meterRegistry;
    private final Timer totalDuration;
    private final Counter completedTotal;
    private final Counter failedTotal;
    private final AtomicInteger activeRuns;

    public AnalysisMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.totalDuration = Timer.builder("analysis.duration.total")
            .description("Total duration of an analysis run")
            .register(meterRegistry);

        this.completedTotal = Counter.builder("analysis.completed.total")
            .description("Total number of completed analysis runs")
            .register(meterRegistry);

        this.failedTotal = Counter.builder("analysis.failed.total")
            .description("Total number of failed analysis runs")
            .register(meterRegistry);

        this.activeRuns = new AtomicInteger(0);
        Gauge.builder("analysis.runs.active", activeRuns, AtomicInteger::get)
            .description("Number of active analysis runs")
            .register(meterRegistry);
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordTotalDuration(Timer.Sample sample) {
        sample.stop(totalDuration);
    }

    /**
     * Записывает время выполнения этапа прогона (agents, synthesis).
     */
    public void recordStepDuration(Timer.Sample sample, String stepName) {
        Timer stepTimer = Timer.builder("analysis.step.duration")
            .tag("step", stepName)
            .description("Duration of analysis step")
            .register(meterRegistry);
        sample.stop(stepTimer);
    }

    /**
     * Учитывает завершившегося агента: длительность и исход.
     */
    public void recordAgent(AgentResult result) {
        String agent = result.getAgentType().getValue();
        if (result.getStartTime() != null && result.getEndTime() != null) {
            Timer.builder("agent.duration")
                .tag("agent", agent)
                .description("Duration of a single agent")
                .register(meterRegistry)
                .record(Duration.between(result.getStartTime(), result.getEndTime()));
        }
        String outcome = result.getStatus() == AnalysisStatus.COMPLETED ? "completed" : "failed";
        Counter.builder("agent.results.total")
            .tag("agent", agent)
            .tag("outcome", outcome)
            .description("Agent results by outcome")
            .register(meterRegistry)
            .increment();
    }

    /**
     * Отмечает использование детерминированной замены в синтезе плана.
     */
    public void recordSynthesisFallback(String section) {
        Counter.builder("synthesis.fallback.total")
            .tag("section", section)
            .description("Plan sections produced by deterministic fallback")
            .register(meterRegistry)
            .increment();
    }

    public void incrementActiveRuns() {
        activeRuns.incrementAndGet();
    }

    public void decrementActiveRuns() {
        activeRuns.decrementAndGet();
    }

    public void recordCompleted() {
        completedTotal.increment();
    }

    public void recordFailed() {
        failedTotal.increment();
    }
}
