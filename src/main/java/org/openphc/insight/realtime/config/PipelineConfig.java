package org.openphc.insight.realtime.config;

import org.openphc.insight.realtime.backlog.RetentionPolicy;
import org.slf4j.MDC;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.util.backoff.BackOff;
import org.springframework.util.backoff.ExponentialBackOff;

import java.time.Clock;
import java.util.Map;

/**
 * Executors, clock and policies shared by the pipeline stages.
 */
@Configuration
@EnableConfigurationProperties(RealtimeProperties.class)
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Drain jobs; one runs per connection at a time. */
    @Bean(name = "deliveryExecutor")
    public ThreadPoolTaskExecutor deliveryExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(64);
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("delivery-");
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    @Bean(name = "replayExecutor")
    public ThreadPoolTaskExecutor replayExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(1_000);
        executor.setThreadNamePrefix("replay-");
        executor.initialize();
        return executor;
    }

    @Bean
    public BackOff upstreamBackOff(RealtimeProperties properties) {
        RealtimeProperties.Source source = properties.getSource();
        ExponentialBackOff backOff = new ExponentialBackOff(
                source.getInitialBackoff().toMillis(), source.getBackoffMultiplier());
        backOff.setMaxInterval(source.getMaxBackoff().toMillis());
        return backOff;
    }

    @Bean
    public RetentionPolicy retentionPolicy(RealtimeProperties properties) {
        return RetentionPolicy.from(properties.getBacklog());
    }

    private static TaskDecorator mdcPropagating() {
        return task -> {
            Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    task.run();
                } finally {
                    MDC.clear();
                }
            };
        };
    }
}
