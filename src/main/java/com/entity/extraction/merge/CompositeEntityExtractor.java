package com.entity.extraction.merge;

import com.entity.extraction.core.model.Entity;
import com.entity.extraction.core.model.EntityCollection;
import com.entity.extraction.core.model.Relationship;
import com.entity.extraction.extraction.EntityExtractor;
import com.entity.extraction.extraction.ExtractionException;
import com.entity.extraction.extraction.ExtractionParameters;
import com.entity.extraction.logging.LogContext;
import com.entity.extraction.metrics.MetricsService;
import com.entity.extraction.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs several extraction capabilities over the same text and merges their output.
 *
 * <p>Merge process, per capability in list order:</p>
 * <ol>
 *   <li>Each entity is looked up by its (name, type) key among the entities merged so far.</li>
 *   <li>On a hit the existing entity keeps its id, its confidence is raised to the new one if
 *       strictly greater, and the new metadata is union-merged into it.</li>
 *   <li>Otherwise a copy of the entity is appended with the same id.</li>
 *   <li>A copy of every relationship is appended. Relationships are never de-duplicated and
 *       may reference entity ids that were collapsed into another entity.</li>
 * </ol>
 *
 * <p>The merged collection owns its records; the collections returned by the capabilities
 * are never modified.</p>
 *
 * <p>A capability that throws (or times out in parallel mode) is logged, reported in
 * {@link MergeResult#failures()} and contributes nothing. In parallel mode the capabilities
 * run on a fixed pool but their results are committed in list order, so the merged
 * collection is the same as in sequential mode.</p>
 *
 * <p>The composite is itself an {@link EntityExtractor}, so composites nest. Close it to
 * release the worker pool when parallel mode is used.</p>
 */
public class CompositeEntityExtractor implements EntityExtractor, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CompositeEntityExtractor.class);

    private final List<EntityExtractor> extractors;
    private final CompositeOptions options;
    private final MetricsService metricsService;
    private final ExecutorService executor;

    public CompositeEntityExtractor(List<? extends EntityExtractor> extractors) {
        this(extractors, CompositeOptions.defaults());
    }

    public CompositeEntityExtractor(List<? extends EntityExtractor> extractors, CompositeOptions options) {
        this(extractors, options, new NoOpMetricsService());
    }

    public CompositeEntityExtractor(List<? extends EntityExtractor> extractors, CompositeOptions options,
                                    MetricsService metricsService) {
        Objects.requireNonNull(extractors, "extractors is required");
        this.extractors = List.copyOf(extractors);
        this.options = Objects.requireNonNull(options, "options is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.executor = options.parallel() && !this.extractors.isEmpty()
                ? Executors.newFixedThreadPool(Math.min(options.maxThreads(), this.extractors.size()),
                        new WorkerThreadFactory())
                : null;
    }

    @Override
    public EntityCollection extractEntities(String text, ExtractionParameters parameters) {
        return merge(text, parameters).collection();
    }

    /**
     * Merges the output of every capability and reports what happened.
     */
    public MergeResult merge(String text, ExtractionParameters parameters) {
        Objects.requireNonNull(text, "text is required");
        ExtractionParameters params = parameters != null ? parameters : ExtractionParameters.empty();
        String correlationId = LogContext.generateCorrelationId();
        long startNanos = System.nanoTime();

        try (LogContext ctx = LogContext.forMerge(correlationId, params.getSourceId())) {
            log.debug("merge.started capabilities={} parallel={} textLength={}",
                    extractors.size(), executor != null, text.length());

            MergeAccumulator accumulator = new MergeAccumulator(params.getSourceId());
            List<CapabilityFailure> failures = new ArrayList<>();

            if (executor != null) {
                runParallel(text, params, accumulator, failures);
            } else {
                runSequential(text, params, accumulator, failures);
            }

            MergeResult result = accumulator.toResult(failures);
            recordMetrics(result, Duration.ofNanos(System.nanoTime() - startNanos));

            log.info("merge.completed entities={} added={} deduplicated={} relationships={} failures={}",
                    result.collection().entityCount(), result.entitiesAdded(), result.duplicatesCollapsed(),
                    result.relationshipsAdded(), failures.size());
            return result;
        }
    }

    private void runSequential(String text, ExtractionParameters params,
                               MergeAccumulator accumulator, List<CapabilityFailure> failures) {
        for (EntityExtractor extractor : extractors) {
            EntityCollection contribution;
            try {
                contribution = invoke(extractor, text, params);
            } catch (RuntimeException e) {
                failures.add(recordFailure(extractor, e));
                continue;
            }
            accumulator.commit(contribution);
        }
    }

    private void runParallel(String text, ExtractionParameters params,
                             MergeAccumulator accumulator, List<CapabilityFailure> failures) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        long timeoutNanos = options.capabilityTimeout().toNanos();
        long deadline = System.nanoTime() + timeoutNanos;

        List<Future<EntityCollection>> futures = new ArrayList<>(extractors.size());
        for (EntityExtractor extractor : extractors) {
            futures.add(executor.submit(() -> {
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                try {
                    return invoke(extractor, text, params);
                } finally {
                    MDC.clear();
                }
            }));
        }

        for (int i = 0; i < futures.size(); i++) {
            EntityExtractor extractor = extractors.get(i);
            Future<EntityCollection> future = futures.get(i);
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                accumulator.commit(future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                failures.add(recordFailure(extractor, new TimeoutException(
                        "Capability did not finish within " + options.capabilityTimeout())));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof Error error) {
                    futures.forEach(f -> f.cancel(true));
                    throw error;
                }
                failures.add(recordFailure(extractor, cause));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new ExtractionException("Interrupted while waiting for " + extractor.getName(), e);
            }
        }
    }

    private EntityCollection invoke(EntityExtractor extractor, String text, ExtractionParameters params) {
        try (LogContext ctx = LogContext.forExtraction(extractor.getName())) {
            EntityCollection contribution = extractor.extractEntities(text, params);
            if (contribution == null) {
                throw new ExtractionException("Extractor returned no collection");
            }
            log.debug("capability.completed entities={} relationships={}",
                    contribution.entityCount(), contribution.relationshipCount());
            return contribution;
        }
    }

    private CapabilityFailure recordFailure(EntityExtractor extractor, Throwable error) {
        CapabilityFailure failure = CapabilityFailure.of(extractor.getName(), error);
        log.warn("capability.failed extractor={} error={}: {}",
                failure.extractorName(), failure.exceptionType(), failure.message());
        log.debug("capability.failed stacktrace", error);
        metricsService.incrementCapabilityFailure(failure.extractorName());
        return failure;
    }

    private void recordMetrics(MergeResult result, Duration duration) {
        metricsService.recordMergeDuration(duration);
        metricsService.incrementEntitiesAdded(result.entitiesAdded());
        metricsService.incrementEntitiesDeduplicated(result.duplicatesCollapsed());
        metricsService.incrementRelationshipsAdded(result.relationshipsAdded());
        metricsService.recordCollectionSize(result.collection().entityCount());
    }

    @Override
    public String getName() {
        return "CompositeEntityExtractor";
    }

    public List<EntityExtractor> getExtractors() {
        return extractors;
    }

    public CompositeOptions getOptions() {
        return options;
    }

    @Override
    public void close() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * The merged collection plus its (name, type) index and counters.
     */
    private static final class MergeAccumulator {
        private final EntityCollection collection;
        private final Map<EntityKey, Entity> byKey = new HashMap<>();
        private int entitiesAdded;
        private int duplicatesCollapsed;
        private int relationshipsAdded;

        MergeAccumulator(String sourceId) {
            this.collection = new EntityCollection(sourceId);
        }

        void commit(EntityCollection contribution) {
            for (Entity entity : contribution.getEntities()) {
                EntityKey key = new EntityKey(entity.getName(), entity.getType());
                Entity existing = byKey.get(key);
                if (existing != null) {
                    collapse(existing, entity);
                    duplicatesCollapsed++;
                } else if (collection.getEntityById(entity.getId()).isPresent()) {
                    log.warn("merge.entity.skipped entityId={} reason=id already used by another entity",
                            entity.getId());
                } else {
                    Entity owned = Entity.builder(entity).build();
                    collection.addEntity(owned);
                    byKey.put(key, owned);
                    entitiesAdded++;
                }
            }
            for (Relationship relationship : contribution.getRelationships()) {
                collection.addRelationship(Relationship.builder(relationship).build());
                relationshipsAdded++;
            }
        }

        private void collapse(Entity existing, Entity incoming) {
            if (incoming.getConfidence() > existing.getConfidence()) {
                existing.setConfidence(incoming.getConfidence());
            }
            existing.getMetadata().mergeFrom(incoming.getMetadata());
            log.debug("merge.entity.collapsed entityId={} duplicateId={} name={} type={}",
                    existing.getId(), incoming.getId(), existing.getName(), existing.getType());
        }

        MergeResult toResult(List<CapabilityFailure> failures) {
            return new MergeResult(collection, failures, entitiesAdded, duplicatesCollapsed, relationshipsAdded);
        }
    }

    private record EntityKey(String name, String type) {
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();
        private final int pool = POOL_SEQUENCE.incrementAndGet();
        private final AtomicInteger threadSequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable,
                    "entity-extraction-" + pool + "-" + threadSequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
