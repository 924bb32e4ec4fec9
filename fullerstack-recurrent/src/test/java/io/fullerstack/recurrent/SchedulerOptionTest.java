package io.fullerstack.recurrent;

import io.fullerstack.recurrent.testkit.ManualClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ThreadFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchedulerOptionTest {

    private static SchedulerConfig apply(SchedulerOption... options) {
        SchedulerConfig config = SchedulerConfig.defaults();
        for (SchedulerOption option : options) {
            config = option.applyTo(config);
        }
        return config;
    }

    @Test
    void shouldComposeIndependentOptions() {
        ManualClock clock = new ManualClock();
        ThreadFactory factory = Thread::new;

        SchedulerConfig config = apply(
            SchedulerOption.withInterval(Duration.ofSeconds(5)),
            SchedulerOption.withThrottle(Duration.ofMillis(250)),
            SchedulerOption.withClock(clock),
            SchedulerOption.withName("indexer"),
            SchedulerOption.withThreadFactory(factory)
        );

        assertThat(config.interval()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.throttle()).contains(Duration.ofMillis(250));
        assertThat(config.clock()).containsSame(clock);
        assertThat(config.name()).isEqualTo("indexer");
        assertThat(config.threadFactory()).containsSame(factory);
    }

    @Test
    void shouldLetLaterOptionWin() {
        SchedulerConfig config = apply(
            SchedulerOption.withInterval(Duration.ofSeconds(5)),
            SchedulerOption.withInterval(Duration.ofSeconds(9))
        );

        assertThat(config.interval()).isEqualTo(Duration.ofSeconds(9));
    }

    @Test
    void shouldLeaveUnrelatedSettingsAlone() {
        SchedulerConfig config = apply(SchedulerOption.withThrottle(Duration.ofSeconds(1)));

        assertThat(config.interval()).isEqualTo(SchedulerConfig.DEFAULT_INTERVAL);
        assertThat(config.throttled()).isTrue();
    }

    @Test
    void shouldValidateWhenOptionIsCreated() {
        assertThatThrownBy(() -> SchedulerOption.withInterval(Duration.ofSeconds(-1)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SchedulerOption.withThrottle(Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SchedulerOption.withInterval(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("interval cannot be null");
        assertThatThrownBy(() -> SchedulerOption.withClock(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("clock cannot be null");
        assertThatThrownBy(() -> SchedulerOption.withName("  "))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SchedulerOption.withThreadFactory(null))
            .isInstanceOf(NullPointerException.class);
    }
}
