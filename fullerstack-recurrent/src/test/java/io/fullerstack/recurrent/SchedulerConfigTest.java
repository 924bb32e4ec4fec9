package io.fullerstack.recurrent;

import io.fullerstack.recurrent.config.ConfigurationException;
import io.fullerstack.recurrent.config.HierarchicalConfig;
import io.fullerstack.recurrent.testkit.ManualClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchedulerConfigTest {

    @Test
    void shouldDefaultToOneSecondUnthrottled() {
        SchedulerConfig config = SchedulerConfig.defaults();

        assertThat(config.name()).isEqualTo(SchedulerConfig.DEFAULT_NAME);
        assertThat(config.interval()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.throttle()).isEmpty();
        assertThat(config.throttled()).isFalse();
        assertThat(config.clock()).isEmpty();
        assertThat(config.threadFactory()).isEmpty();
        assertThat(config.daemonThreads()).isTrue();
    }

    @Test
    void shouldReadNamedSchedulerFromConfig() {
        SchedulerConfig config = SchedulerConfig.from(
            "cache-refresh",
            HierarchicalConfig.fromBundle("recurrent-test", "cache-refresh")
        );

        assertThat(config.name()).isEqualTo("cache-refresh");
        assertThat(config.interval()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.throttle()).contains(Duration.ofSeconds(5));
        assertThat(config.daemonThreads()).isFalse();
    }

    @Test
    void shouldFallBackToDefaultIntervalForNonPositiveValue() {
        System.setProperty("scheduler.idle.interval-ms", "0");
        try {
            SchedulerConfig config = SchedulerConfig.from(
                "idle",
                HierarchicalConfig.fromBundle("recurrent-test", "idle")
            );

            assertThat(config.interval()).isEqualTo(SchedulerConfig.DEFAULT_INTERVAL);
        } finally {
            System.clearProperty("scheduler.idle.interval-ms");
        }
    }

    @Test
    void shouldRejectMalformedThrottle() {
        HierarchicalConfig broken = HierarchicalConfig.fromBundle("recurrent-test", "broken");

        assertThatThrownBy(() -> SchedulerConfig.from("broken", broken))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("throttle-ms");
    }

    @Test
    void shouldApplyWithersWithoutMutating() {
        ManualClock clock = new ManualClock();
        SchedulerConfig base = SchedulerConfig.defaults();

        SchedulerConfig changed = base
            .withName("reports")
            .withInterval(Duration.ofMinutes(5))
            .withThrottle(Duration.ofSeconds(10))
            .withClock(clock);

        assertThat(changed.name()).isEqualTo("reports");
        assertThat(changed.interval()).isEqualTo(Duration.ofMinutes(5));
        assertThat(changed.throttle()).contains(Duration.ofSeconds(10));
        assertThat(changed.clock()).containsSame(clock);
        assertThat(changed.withoutThrottle().throttled()).isFalse();
        assertThat(base).isEqualTo(SchedulerConfig.defaults());
    }

    @Test
    void shouldRejectInvalidValues() {
        SchedulerConfig base = SchedulerConfig.defaults();

        assertThatThrownBy(() -> base.withInterval(Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("interval must be > 0");
        assertThatThrownBy(() -> base.withThrottle(Duration.ofMillis(-1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("throttle must be > 0");
        assertThatThrownBy(() -> base.withName(""))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("name cannot be blank");
        assertThatThrownBy(() -> new SchedulerConfig("x", null, Optional.empty(), Optional.empty(), Optional.empty(), true))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("interval cannot be null");
    }
}
