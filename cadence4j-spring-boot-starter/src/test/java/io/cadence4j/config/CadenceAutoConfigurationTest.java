package io.cadence4j.config;

import io.cadence4j.TaskRegistration;
import io.cadence4j.TaskScheduler;
import io.cadence4j.TaskWork;
import io.cadence4j.core.ScheduledTask;
import io.cadence4j.cron.CronEngine;
import io.cadence4j.ratelimit.RateLimiterRegistry;
import io.cadence4j.retry.RetryExecutor;
import io.cadence4j.retry.RetryOptions;
import io.cadence4j.time.ManualTimeSource;
import io.cadence4j.time.TimeSource;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class CadenceAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(CadenceAutoConfiguration.class))
            .withPropertyValues(
                    "cadence.scheduler.poll-interval=1h",
                    "cadence.scheduler.shutdown-grace-period=2s",
                    "cadence.scheduler.max-concurrency=4",
                    "cadence.scheduler.timezone=Asia/Taipei",
                    "cadence.retry.max-attempts=5",
                    "cadence.retry.delay=250ms",
                    "cadence.rate-limits.exchange.limit=10",
                    "cadence.rate-limits.exchange.window=1m",
                    "cadence.rate-limits.telegram.limit=30"
            );

    @Test
    void shouldAutoConfigureSchedulerBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(TaskScheduler.class);
            assertThat(context).hasSingleBean(CadenceLifecycle.class);
            assertThat(context).hasSingleBean(CadenceProperties.class);
            assertThat(context).hasSingleBean(TimeSource.class);
            assertThat(context).hasSingleBean(CronEngine.class);
            assertThat(context).hasSingleBean(RetryExecutor.class);
            assertThat(context).hasSingleBean(RateLimiterRegistry.class);
            assertThat(context.getBean(TaskScheduler.class).isRunning()).isTrue();
        });
    }

    @Test
    void shouldBindProperties() {
        contextRunner.run(context -> {
            CadenceProperties props = context.getBean(CadenceProperties.class);
            assertThat(props.getScheduler().getPollInterval()).isEqualTo(Duration.ofHours(1));
            assertThat(props.getScheduler().getMaxConcurrency()).isEqualTo(4);
            assertThat(context.getBean(TimeSource.class).getTimezone()).isEqualTo("Asia/Taipei");

            RateLimiterRegistry registry = context.getBean(RateLimiterRegistry.class);
            assertThat(registry.keyClasses()).containsExactlyInAnyOrder("exchange", "telegram");
            assertThat(registry.getRequired("exchange").getStatus("binance").remaining()).isEqualTo(10);

            RetryOptions retry = context.getBean(RetryOptions.class);
            assertThat(retry.maxAttempts()).isEqualTo(5);
            assertThat(retry.delay()).isEqualTo(Duration.ofMillis(250));
        });
    }

    @Test
    void shouldScheduleTaskRegistrationBeans() {
        contextRunner
                .withBean(TaskRegistration.class, HeartbeatRegistration::new)
                .run(context -> {
                    TaskScheduler scheduler = context.getBean(TaskScheduler.class);
                    assertThat(scheduler.getTasks())
                            .extracting(ScheduledTask::name)
                            .containsExactly("heartbeat");
                });
    }

    @Test
    void shouldPreferUserTimeSource() {
        ManualTimeSource manual = new ManualTimeSource(Instant.parse("2026-01-01T00:00:00Z"), "UTC");
        contextRunner
                .withBean(TimeSource.class, () -> manual)
                .run(context -> assertThat(context.getBean(TimeSource.class)).isSameAs(manual));
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("cadence.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(TaskScheduler.class);
                    assertThat(context).doesNotHaveBean(CadenceLifecycle.class);
                });
    }

    @Test
    void invalidRateLimitShouldFailStartup() {
        contextRunner
                .withPropertyValues("cadence.rate-limits.broken.limit=0")
                .run(context -> assertThat(context).hasFailed());
    }

    static class HeartbeatRegistration implements TaskRegistration {
        @Override
        public String name() {
            return "heartbeat";
        }

        @Override
        public String schedule() {
            return "@hourly";
        }

        @Override
        public TaskWork work() {
            return token -> {
                // no-op for context bootstrap test
            };
        }
    }
}
