package com.pitchcraft.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for pitch workflow execution.
 */
@Service
public class PitchMetrics {

    private final MeterRegistry registry;

    public PitchMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordStepDuration(String step, long ms) {
        Timer.builder("pitchcraft.step.duration")
                .tag("step", step)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordGateResult(boolean passed) {
        Counter.builder("pitchcraft.gate.evaluations")
                .tag("result", passed ? "pass" : "fail")
                .register(registry)
                .increment();
    }

    /**
     * Records a critique that had to be synthesised locally because the
     * backend output was unusable.
     */
    public void recordDegradedCritique() {
        Counter.builder("pitchcraft.critique.degraded")
                .register(registry)
                .increment();
    }

    public void recordSessionOutcome(String phase) {
        Counter.builder("pitchcraft.sessions.total")
                .tag("phase", phase)
                .register(registry)
                .increment();
    }

    public void recordIterationDepth(int totalIterations) {
        DistributionSummary.builder("pitchcraft.iteration.depth")
                .register(registry)
                .record(totalIterations);
    }

    /**
     * @param reason "timeout", "error" or "empty"
     */
    public void recordBackendFailure(String reason) {
        Counter.builder("pitchcraft.backend.failures")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordSessionConflict() {
        Counter.builder("pitchcraft.sessions.conflicts")
                .register(registry)
                .increment();
    }

    public void recordEvictions(int count) {
        Counter.builder("pitchcraft.sessions.evicted")
                .register(registry)
                .increment(count);
    }
}
