package com.phillippitts.clinicalai.config;

import com.phillippitts.clinicalai.config.logging.ThreadContextTaskDecorator;
import com.phillippitts.clinicalai.config.properties.ThreadPoolProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bounded executors for pipeline work.
 *
 * <p>The assessment pool uses {@link ThreadPoolExecutor.CallerRunsPolicy}: when pool and queue
 * are full the pipeline thread runs the assessment itself. The pipeline pool uses
 * {@link ThreadPoolExecutor.AbortPolicy}, so a saturated pool rejects a deadline-bound run
 * instead of running it on the caller past its deadline. Both copy the Log4j2 ThreadContext
 * into worker threads.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for the parallel assessments of a run ({@code threadpool.assessment.*}).
     */
    @Bean(name = "assessmentExecutor")
    public ThreadPoolTaskExecutor assessmentExecutor() {
        return build(threadPoolProperties.getAssessment(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Executor hosting runs started with a deadline ({@code threadpool.pipeline.*}).
     */
    @Bean(name = "pipelineExecutor")
    public ThreadPoolTaskExecutor pipelineExecutor() {
        return build(threadPoolProperties.getPipeline(), new ThreadPoolExecutor.AbortPolicy());
    }

    private static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props,
                                                RejectedExecutionHandler rejectionPolicy) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejectionPolicy);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(new ThreadContextTaskDecorator());
        executor.initialize();
        return executor;
    }
}
