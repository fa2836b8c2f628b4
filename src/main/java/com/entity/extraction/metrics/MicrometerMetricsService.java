package com.entity.extraction.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code extraction.merge.duration}: Timer</li>
 *   <li>{@code extraction.entities.added}: Counter</li>
 *   <li>{@code extraction.entities.deduplicated}: Counter</li>
 *   <li>{@code extraction.relationships.added}: Counter</li>
 *   <li>{@code extraction.capability.failures}: Counter (tag: extractor)</li>
 *   <li>{@code extraction.collection.size}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Timer mergeTimer;
    private final Counter entitiesAddedCounter;
    private final Counter entitiesDeduplicatedCounter;
    private final Counter relationshipsAddedCounter;
    private final DistributionSummary collectionSizeSummary;
    private final Map<String, Counter> failureCounters = new ConcurrentHashMap<>();

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.mergeTimer = Timer.builder("extraction.merge.duration")
                .description("Duration of composite extraction merges")
                .register(registry);
        this.entitiesAddedCounter = Counter.builder("extraction.entities.added")
                .description("Entities appended to merged collections")
                .register(registry);
        this.entitiesDeduplicatedCounter = Counter.builder("extraction.entities.deduplicated")
                .description("Entities collapsed into an existing entity with the same name and type")
                .register(registry);
        this.relationshipsAddedCounter = Counter.builder("extraction.relationships.added")
                .description("Relationships appended to merged collections")
                .register(registry);
        this.collectionSizeSummary = DistributionSummary.builder("extraction.collection.size")
                .description("Entity count of merged collections")
                .register(registry);
    }

    @Override
    public void recordMergeDuration(Duration duration) {
        mergeTimer.record(duration);
    }

    @Override
    public void incrementEntitiesAdded(int count) {
        entitiesAddedCounter.increment(count);
    }

    @Override
    public void incrementEntitiesDeduplicated(int count) {
        entitiesDeduplicatedCounter.increment(count);
    }

    @Override
    public void incrementRelationshipsAdded(int count) {
        relationshipsAddedCounter.increment(count);
    }

    @Override
    public void incrementCapabilityFailure(String extractorName) {
        Counter counter = failureCounters.computeIfAbsent(extractorName, name ->
                Counter.builder("extraction.capability.failures")
                        .description("Capabilities that failed or timed out during a merge")
                        .tag("extractor", name)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordCollectionSize(int entityCount) {
        collectionSizeSummary.record(entityCount);
    }
}
