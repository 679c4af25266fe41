package uk.gegc.questionbank.features.aggregate.application;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Micrometer instruments for index maintenance, sampling, repair and health checks.
 */
@Component
public class AggregateMetrics {

    private final Counter samplingRetries;
    private final Counter samplingShortfalls;
    private final Counter syncDuplicates;
    private final Counter repairPages;
    private final Counter repairMismatches;
    private final Counter healthMismatches;
    private final Timer samplingLatency;

    public AggregateMetrics(MeterRegistry meterRegistry) {
        this.samplingRetries = Counter.builder("questionbank.sampling.retries")
                .description("Rank draws retried after a collision or a vanished entry")
                .register(meterRegistry);
        this.samplingShortfalls = Counter.builder("questionbank.sampling.shortfalls")
                .description("Sample requests that returned fewer entities than asked for")
                .register(meterRegistry);
        this.syncDuplicates = Counter.builder("questionbank.aggregates.sync.duplicates")
                .description("Live inserts that found the entry already indexed")
                .register(meterRegistry);
        this.repairPages = Counter.builder("questionbank.repair.pages")
                .description("Repair pages committed")
                .register(meterRegistry);
        this.repairMismatches = Counter.builder("questionbank.repair.mismatches")
                .description("Namespaces whose verified count differed from the rebuild counter")
                .register(meterRegistry);
        this.healthMismatches = Counter.builder("questionbank.aggregates.health.mismatches")
                .description("Health check comparisons whose index count differed from the primary store")
                .register(meterRegistry);
        this.samplingLatency = Timer.builder("questionbank.sampling.latency")
                .description("Latency of multi-scope sampling")
                .register(meterRegistry);
    }

    public void samplingRetry() {
        samplingRetries.increment();
    }

    public void samplingShortfall() {
        samplingShortfalls.increment();
    }

    public void syncDuplicate() {
        syncDuplicates.increment();
    }

    public void repairPage() {
        repairPages.increment();
    }

    public void repairMismatches(long count) {
        repairMismatches.increment(count);
    }

    public void healthMismatches(long count) {
        healthMismatches.increment(count);
    }

    public <T> T timeSampling(Supplier<T> action) {
        return samplingLatency.record(action);
    }
}
