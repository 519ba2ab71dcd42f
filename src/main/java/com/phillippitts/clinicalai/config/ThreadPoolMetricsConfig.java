package com.phillippitts.clinicalai.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Publishes {@code clinicalai.executor.*} gauges for the assessment and pipeline pools, tagged
 * with {@code pool}, and logs a saturation summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> assessmentExecutor;
    private final ObjectProvider<ThreadPoolTaskExecutor> pipelineExecutor;

    public ThreadPoolMetricsConfig(
            @Qualifier("assessmentExecutor") ObjectProvider<ThreadPoolTaskExecutor> assessmentExecutor,
            @Qualifier("pipelineExecutor") ObjectProvider<ThreadPoolTaskExecutor> pipelineExecutor) {
        this.assessmentExecutor = assessmentExecutor;
        this.pipelineExecutor = pipelineExecutor;
    }

    @Bean
    public MeterBinder executorPoolMetrics() {
        return registry -> pools().forEach((name, pool) -> bind(registry, name, pool));
    }

    @Scheduled(fixedRate = 300_000)
    public void logThreadPoolHealth() {
        pools().forEach((name, pool) -> {
            int queued = pool.getQueue().size();
            int remaining = pool.getQueue().remainingCapacity();
            if (pool.getActiveCount() >= pool.getMaximumPoolSize() && remaining == 0) {
                LOG.warn("Executor {} saturated: active={}, queued={}; new tasks run inline or are rejected",
                        name, pool.getActiveCount(), queued);
            } else {
                LOG.info("Executor {}: threads={}/{}, active={}, queued={}, completed={}",
                        name, pool.getPoolSize(), pool.getMaximumPoolSize(), pool.getActiveCount(),
                        queued, pool.getCompletedTaskCount());
            }
        });
    }

    private Map<String, ThreadPoolExecutor> pools() {
        Map<String, ThreadPoolExecutor> pools = new LinkedHashMap<>();
        ThreadPoolTaskExecutor assessment = assessmentExecutor.getIfAvailable();
        if (assessment != null) {
            pools.put("assessment", assessment.getThreadPoolExecutor());
        }
        ThreadPoolTaskExecutor pipeline = pipelineExecutor.getIfAvailable();
        if (pipeline != null) {
            pools.put("pipeline", pipeline.getThreadPoolExecutor());
        }
        return pools;
    }

    private static void bind(MeterRegistry registry, String name, ThreadPoolExecutor pool) {
        Gauge.builder("clinicalai.executor.threads", pool, ThreadPoolExecutor::getPoolSize)
                .tag("pool", name)
                .register(registry);
        Gauge.builder("clinicalai.executor.active", pool, ThreadPoolExecutor::getActiveCount)
                .tag("pool", name)
                .register(registry);
        Gauge.builder("clinicalai.executor.queued", pool, p -> p.getQueue().size())
                .tag("pool", name)
                .description("Tasks waiting for a worker")
                .register(registry);
        Gauge.builder("clinicalai.executor.completed", pool, ThreadPoolExecutor::getCompletedTaskCount)
                .tag("pool", name)
                .register(registry);
        LOG.debug("Registered executor gauges for pool={}", name);
    }
}
