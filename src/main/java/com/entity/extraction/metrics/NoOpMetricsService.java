package com.entity.extraction.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordMergeDuration(Duration duration) {
    }

    @Override
    public void incrementEntitiesAdded(int count) {
    }

    @Override
    public void incrementEntitiesDeduplicated(int count) {
    }

    @Override
    public void incrementRelationshipsAdded(int count) {
    }

    @Override
    public void incrementCapabilityFailure(String extractorName) {
    }

    @Override
    public void recordCollectionSize(int entityCount) {
    }
}
