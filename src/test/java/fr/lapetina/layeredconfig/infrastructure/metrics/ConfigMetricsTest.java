package fr.lapetina.layeredconfig.infrastructure.metrics;

import fr.lapetina.layeredconfig.domain.model.ConfigErrorType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigMetricsTest {

    private MeterRegistry registry;
    private ConfigMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ConfigMetrics(registry, "test");
    }

    @Test
    @DisplayName("should count loads by outcome and record latency")
    void shouldCountLoads() {
        metrics.recordLoadSuccess(Duration.ofMillis(5));
        metrics.recordLoadSuccess(Duration.ofMillis(7));
        metrics.recordLoadFailure(ConfigErrorType.SOURCE_NOT_FOUND, Duration.ofMillis(1));

        assertThat(registry.get("test_loads_total").tag("outcome", "success").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("test_loads_total").tag("outcome", "source_not_found").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("test_load_latency").timer().count()).isEqualTo(3);
    }

    @Test
    @DisplayName("should count reloads, notifications and poll failures")
    void shouldCountWatchActivity() {
        metrics.recordReload(true);
        metrics.recordReload(false);
        metrics.recordReload(false);
        metrics.recordNotification();
        metrics.recordPollFailure();

        assertThat(registry.get("test_reloads_total").tag("outcome", "success").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("test_reloads_total").tag("outcome", "failure").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("test_watch_notifications_total").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("test_remote_poll_failures_total").counter().count()).isEqualTo(1.0);
    }
}
