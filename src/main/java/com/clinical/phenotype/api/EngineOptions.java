package com.clinical.phenotype.api;

import com.clinical.phenotype.cache.CacheConfig;

import java.time.Duration;

/**
 * Engine-wide settings: worker pool size, per-task deadline, result cache and diagnostics.
 */
public class EngineOptions {

    private static final int DEFAULT_WORKER_THREADS = Math.max(2, Runtime.getRuntime().availableProcessors());
    private static final Duration DEFAULT_TASK_TIMEOUT = Duration.ofMinutes(5);

    private final int workerThreads;
    private final Duration taskTimeout;
    private final CacheConfig cacheConfig;
    private final boolean debug;

    private EngineOptions(Builder builder) {
        this.workerThreads = builder.workerThreads;
        this.taskTimeout = builder.taskTimeout;
        this.cacheConfig = builder.cacheConfig;
        this.debug = builder.debug;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public Duration getTaskTimeout() {
        return taskTimeout;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    /**
     * Whether every run logs diagnostics at INFO, as if its script declared {@code debug;}.
     */
    public boolean isDebug() {
        return debug;
    }

    public static EngineOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int workerThreads = DEFAULT_WORKER_THREADS;
        private Duration taskTimeout = DEFAULT_TASK_TIMEOUT;
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private boolean debug = false;

        public Builder workerThreads(int workerThreads) {
            if (workerThreads <= 0) {
                throw new IllegalArgumentException("workerThreads must be positive");
            }
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder taskTimeout(Duration taskTimeout) {
            if (taskTimeout == null || taskTimeout.isNegative() || taskTimeout.isZero()) {
                throw new IllegalArgumentException("taskTimeout must be positive");
            }
            this.taskTimeout = taskTimeout;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            if (cacheConfig == null) {
                throw new IllegalArgumentException("cacheConfig must not be null");
            }
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public EngineOptions build() {
            return new EngineOptions(this);
        }
    }
}
