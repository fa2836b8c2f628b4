package com.entity.extraction.metrics;

import java.time.Duration;

/**
 * Records composite extraction metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library runs
 * without any metrics dependency on the classpath.
 */
public interface MetricsService {

    void recordMergeDuration(Duration duration);

    void incrementEntitiesAdded(int count);

    void incrementEntitiesDeduplicated(int count);

    void incrementRelationshipsAdded(int count);

    void incrementCapabilityFailure(String extractorName);

    void recordCollectionSize(int entityCount);
}
