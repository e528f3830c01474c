package com.phillippitts.classmate.config;

import com.phillippitts.classmate.config.properties.ThreadPoolProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for the pipeline stages that run off the capture and receiver threads.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties}. All pools use
 * {@link ThreadPoolExecutor.CallerRunsPolicy} so a saturated pool pushes back on the
 * submitter instead of dropping work, and all propagate the Log4j2 ThreadContext.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Drains event bus mailboxes. Each mailbox holds at most one drain task at a time,
     * so this pool bounds how many subscribers run concurrently.
     */
    @Bean(name = "eventExecutor")
    public Executor eventExecutor() {
        return buildExecutor(threadPoolProperties.getEvent());
    }

    /**
     * Runs analyzer lane entries (prompt assembly, response parsing, publication).
     */
    @Bean(name = "analysisExecutor")
    public Executor analysisExecutor() {
        return buildExecutor(threadPoolProperties.getAnalysis());
    }

    /**
     * Runs the blocking model HTTP calls so that per-call timeouts can be enforced.
     */
    @Bean(name = "modelExecutor")
    public Executor modelExecutor() {
        return buildExecutor(threadPoolProperties.getModel());
    }

    /**
     * Schedules summary ticks, periodic suggestions and channel reconnect attempts.
     */
    @Bean(name = "pipelineScheduler")
    public ThreadPoolTaskScheduler pipelineScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("pipeline-sched-");
        scheduler.setTaskDecorator(new MdcTaskDecorator());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    private static Executor buildExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.initialize();
        return executor;
    }
}
