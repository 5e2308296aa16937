package io.cadence4j.config;

import io.cadence4j.TaskRegistration;
import io.cadence4j.TaskScheduler;
import io.cadence4j.cron.CronEngine;
import io.cadence4j.internal.DefaultTaskScheduler;
import io.cadence4j.ratelimit.RateLimiterRegistry;
import io.cadence4j.retry.DefaultRetryExecutor;
import io.cadence4j.retry.RetryExecutor;
import io.cadence4j.retry.RetryOptions;
import io.cadence4j.time.SystemTimeSource;
import io.cadence4j.time.TimeSource;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for the scheduling runtime.
 */
@AutoConfiguration
@ConditionalOnClass(TaskScheduler.class)
@EnableConfigurationProperties(CadenceProperties.class)
@ConditionalOnProperty(prefix = "cadence", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CadenceAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public TimeSource timeSource(CadenceProperties props) {
        return new SystemTimeSource(props.getScheduler().getTimezone());
    }

    @Bean
    @ConditionalOnMissingBean
    public CronEngine cronEngine(TimeSource timeSource) {
        return new CronEngine(timeSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public RateLimiterRegistry rateLimiterRegistry(CadenceProperties props, TimeSource timeSource) {
        return new RateLimiterRegistry(props.toRateLimitConfigs(), timeSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryExecutor retryExecutor(TimeSource timeSource) {
        return new DefaultRetryExecutor(timeSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryOptions defaultRetryOptions(CadenceProperties props) {
        return props.getRetry().toRetryOptions();
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskScheduler taskScheduler(CadenceProperties props,
                                       TimeSource timeSource,
                                       CronEngine cronEngine,
                                       RetryExecutor retryExecutor,
                                       RateLimiterRegistry rateLimiterRegistry) {
        return new DefaultTaskScheduler(props.getScheduler(), timeSource, cronEngine, retryExecutor, rateLimiterRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public CadenceLifecycle cadenceLifecycle(TaskScheduler scheduler,
                                             ObjectProvider<List<TaskRegistration>> registrationsProvider,
                                             RetryOptions defaultRetryOptions) {
        return new CadenceLifecycle(scheduler, registrationsProvider.getIfAvailable(List::of), defaultRetryOptions);
    }
}
