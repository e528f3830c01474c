package com.phillippitts.classmate.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for thread pools.
 *
 * <p>Provides tuneable thread pool sizing for the event bus mailboxes, the analyzer lanes
 * and the language-model calls. Defaults are conservative; analyzer concurrency itself is
 * bounded per analyzer by {@link AnalysisProperties}, these pools only cap total threads.
 */
@Validated
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    @Valid
    private PoolProperties event = new PoolProperties(4, 8, 1000, "event-pool-");
    @Valid
    private PoolProperties analysis = new PoolProperties(5, 10, 100, "analysis-pool-");
    @Valid
    private PoolProperties model = new PoolProperties(5, 10, 50, "model-pool-");

    public PoolProperties getEvent() {
        return event;
    }

    public void setEvent(PoolProperties event) {
        this.event = event;
    }

    public PoolProperties getAnalysis() {
        return analysis;
    }

    public void setAnalysis(PoolProperties analysis) {
        this.analysis = analysis;
    }

    public PoolProperties getModel() {
        return model;
    }

    public void setModel(PoolProperties model) {
        this.model = model;
    }

    /**
     * Executor pool configuration.
     */
    public static class PoolProperties {
        @Min(1)
        private int corePoolSize;
        @Min(1)
        private int maxPoolSize;
        @Min(0)
        private int queueCapacity;
        @Min(1)
        private int keepAliveSeconds = 60;
        private String threadNamePrefix;

        public PoolProperties() {
            this(2, 4, 10, "pool-");
        }

        PoolProperties(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
