package com.phillippitts.pptxmerger.service.metrics;

import com.phillippitts.pptxmerger.domain.MergeResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for merge operations.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Merge duration, tagged with the outcome</li>
 *   <li>Success/failure counts (failures tagged with the exception type)</li>
 *   <li>Slides imported and parts copied or skipped</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class MergeMetrics {

    private static final String METRIC_PREFIX = "pptxmerger";

    private final MeterRegistry registry;

    public MergeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records a completed merge.
     *
     * @param result merge summary
     */
    public void recordSuccess(MergeResult result) {
        recordDuration("success", result.elapsed().toNanos());
        Counter.builder(METRIC_PREFIX + ".merge.success")
                .description("Number of successful merges")
                .register(registry)
                .increment();

        int imported = result.inputs().stream()
                .filter(input -> !input.base())
                .mapToInt(input -> input.slidesImported())
                .sum();
        Counter.builder(METRIC_PREFIX + ".slides.imported")
                .description("Slides appended from non-base inputs")
                .register(registry)
                .increment(imported);
        Counter.builder(METRIC_PREFIX + ".parts.copied")
                .description("Parts copied into base packages")
                .register(registry)
                .increment(result.partsCopied());
        Counter.builder(METRIC_PREFIX + ".parts.skipped")
                .description("Dangling part references skipped during copying")
                .register(registry)
                .increment(result.partsSkipped());
    }

    /**
     * Records a failed merge.
     *
     * @param durationNanos time spent before the failure
     * @param failure       the exception that ended the merge
     */
    public void recordFailure(long durationNanos, Throwable failure) {
        recordDuration("failure", durationNanos);
        Counter.builder(METRIC_PREFIX + ".merge.failure")
                .description("Number of failed merges")
                .tag("exception", failure.getClass().getSimpleName())
                .register(registry)
                .increment();
    }

    private void recordDuration(String outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".merge.duration")
                .description("Time taken to merge presentation packages")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
