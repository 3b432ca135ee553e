package com.bastion.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link MetricFactory}: service tagging and meter reuse.
 */
@DisplayName("MetricFactory")
class MetricFactoryTest {

    private SimpleMeterRegistry registry;
    private MetricFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = new MetricFactory(registry, "auth-gateway");
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject null registry")
        void shouldRejectNullRegistry() {
            assertThatThrownBy(() -> new MetricFactory(null, "svc"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("registry");
        }

        @Test
        @DisplayName("should reject blank service name")
        void shouldRejectBlankServiceName() {
            assertThatThrownBy(() -> new MetricFactory(registry, "  "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("serviceName");
        }
    }

    @Test
    @DisplayName("counter carries service and extra tags")
    void counterCarriesTags() {
        Counter counter = factory.counter("bastion.auth.attempts", "Authentication attempts",
                "method", "token", "outcome", "success");
        counter.increment();

        assertThat(counter.count()).isEqualTo(1.0);
        assertThat(counter.getId().getTag("service")).isEqualTo("auth-gateway");
        assertThat(counter.getId().getTag("outcome")).isEqualTo("success");
    }

    @Test
    @DisplayName("same name and tags resolve to the same counter")
    void sameCounterIsReused() {
        factory.counter("bastion.auth.attempts", "d", "outcome", "expired").increment();
        factory.counter("bastion.auth.attempts", "d", "outcome", "expired").increment();

        assertThat(registry.get("bastion.auth.attempts").tag("outcome", "expired").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    @DisplayName("timer records durations with service tag")
    void timerRecords() {
        Timer timer = factory.timer("bastion.auth.duration", "Authentication duration");
        timer.record(Duration.ofMillis(150));
        timer.record(Duration.ofMillis(250));

        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(400.0);
        assertThat(timer.getId().getTag("service")).isEqualTo("auth-gateway");
    }
}
