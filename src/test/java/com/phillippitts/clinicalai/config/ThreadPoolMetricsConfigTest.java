package com.phillippitts.clinicalai.config;

import com.phillippitts.clinicalai.config.properties.ThreadPoolProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ThreadPoolMetricsConfigTest {

    private final ThreadPoolConfig pools = new ThreadPoolConfig(new ThreadPoolProperties());
    private final ThreadPoolTaskExecutor assessment = pools.assessmentExecutor();
    private final ThreadPoolTaskExecutor pipeline = pools.pipelineExecutor();

    @AfterEach
    void tearDown() {
        assessment.shutdown();
        pipeline.shutdown();
    }

    @Test
    void registersGaugesPerPool() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ThreadPoolMetricsConfig config = new ThreadPoolMetricsConfig(provider(assessment), provider(pipeline));

        config.executorPoolMetrics().bindTo(registry);

        assertThat(registry.get("clinicalai.executor.queued").tag("pool", "assessment").gauge().value()).isZero();
        assertThat(registry.get("clinicalai.executor.active").tag("pool", "pipeline").gauge()).isNotNull();
        assertThat(registry.find("clinicalai.executor.threads").gauges()).hasSize(2);
    }

    @Test
    void missingPoolIsSkipped() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ThreadPoolMetricsConfig config = new ThreadPoolMetricsConfig(provider(assessment), provider(null));

        config.executorPoolMetrics().bindTo(registry);

        assertThat(registry.find("clinicalai.executor.completed").gauges()).hasSize(1);
        assertThatCode(config::logThreadPoolHealth).doesNotThrowAnyException();
    }

    @SuppressWarnings("unchecked")
    private static ObjectProvider<ThreadPoolTaskExecutor> provider(ThreadPoolTaskExecutor executor) {
        ObjectProvider<ThreadPoolTaskExecutor> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(executor);
        return provider;
    }
}
