package com.entity.extraction.merge;

import java.time.Duration;
import java.util.Objects;

/**
 * Options for {@link CompositeEntityExtractor}.
 *
 * @param parallel          run capabilities concurrently; results are still committed in list order
 * @param capabilityTimeout how long a capability may run in parallel mode before it counts as failed
 * @param maxThreads        upper bound on the worker pool in parallel mode
 */
public record CompositeOptions(boolean parallel, Duration capabilityTimeout, int maxThreads) {

    public static final Duration DEFAULT_CAPABILITY_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_THREADS = 4;

    public CompositeOptions {
        Objects.requireNonNull(capabilityTimeout, "capabilityTimeout is required");
        if (capabilityTimeout.isNegative() || capabilityTimeout.isZero()) {
            throw new IllegalArgumentException("capabilityTimeout must be > 0");
        }
        if (maxThreads <= 0) {
            throw new IllegalArgumentException("maxThreads must be > 0");
        }
    }

    /**
     * Sequential merge, 30s capability timeout.
     */
    public static CompositeOptions defaults() {
        return new CompositeOptions(false, DEFAULT_CAPABILITY_TIMEOUT, DEFAULT_MAX_THREADS);
    }

    /**
     * Parallel merge with the default timeout and pool size.
     */
    public static CompositeOptions parallelDefaults() {
        return new CompositeOptions(true, DEFAULT_CAPABILITY_TIMEOUT, DEFAULT_MAX_THREADS);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean parallel = false;
        private Duration capabilityTimeout = DEFAULT_CAPABILITY_TIMEOUT;
        private int maxThreads = DEFAULT_MAX_THREADS;

        public Builder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public Builder capabilityTimeout(Duration capabilityTimeout) {
            this.capabilityTimeout = capabilityTimeout;
            return this;
        }

        public Builder maxThreads(int maxThreads) {
            this.maxThreads = maxThreads;
            return this;
        }

        public CompositeOptions build() {
            return new CompositeOptions(parallel, capabilityTimeout, maxThreads);
        }
    }
}
