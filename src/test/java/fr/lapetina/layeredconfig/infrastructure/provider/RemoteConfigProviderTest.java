package fr.lapetina.layeredconfig.infrastructure.provider;

import fr.lapetina.layeredconfig.domain.exception.ConfigException;
import fr.lapetina.layeredconfig.domain.model.ConfigErrorType;
import fr.lapetina.layeredconfig.domain.model.RemoteProvider;
import fr.lapetina.layeredconfig.infrastructure.metrics.ConfigMetrics;
import fr.lapetina.layeredconfig.infrastructure.remote.RemoteConfigFetcher;
import fr.lapetina.layeredconfig.infrastructure.remote.RemoteFetchers;
import fr.lapetina.layeredconfig.infrastructure.schema.SchemaBinder;
import fr.lapetina.layeredconfig.infrastructure.store.SettingsStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RemoteConfigProviderTest {

    private static final RemoteProvider DESCRIPTOR = RemoteProvider.of("consul", "localhost:8500", "app/config");

    private SettingsStore store;
    private SchemaBinder binder;
    private RemoteConfigProvider provider;

    @BeforeEach
    void setUp() {
        store = new SettingsStore(name -> null);
        binder = new SchemaBinder();
    }

    @AfterEach
    void tearDown() {
        if (provider != null) {
            provider.close();
        }
        binder.close();
    }

    @Test
    @DisplayName("should load remote JSON over defaults")
    void shouldLoadRemoteJson() {
        provider = provider(d -> json("{\"server\": {\"port\": 8080}}"), Map.of("db.port", 5432), Duration.ofSeconds(5));

        provider.load();

        assertThat(store.getInt("server.port")).isEqualTo(8080);
        assertThat(store.getInt("db.port")).isEqualTo(5432);
    }

    @Test
    @DisplayName("should fail with TIMED_OUT when the fetch exceeds the timeout")
    void shouldTimeOut() {
        CountDownLatch release = new CountDownLatch(1);
        provider = provider(d -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return json("{}");
        }, null, Duration.ofMillis(100));

        long start = System.nanoTime();
        assertThatThrownBy(provider::load)
                .isInstanceOf(ConfigException.class)
                .satisfies(e -> assertThat(((ConfigException) e).getType()).isEqualTo(ConfigErrorType.TIMED_OUT));
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(2));

        release.countDown();
    }

    @Test
    @DisplayName("should report an interrupted fetch as REMOTE_FETCH_FAILED, not TIMED_OUT")
    void shouldReportInterruptAsFetchFailure() {
        CountDownLatch release = new CountDownLatch(1);
        provider = provider(d -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return json("{}");
        }, null, Duration.ofSeconds(5));

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(provider::fetch)
                    .isInstanceOf(ConfigException.class)
                    .satisfies(e -> assertThat(((ConfigException) e).getType()).isEqualTo(ConfigErrorType.REMOTE_FETCH_FAILED));
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
            release.countDown();
        }
    }

    @Test
    @DisplayName("should fail with REMOTE_FETCH_FAILED when the fetcher throws")
    void shouldWrapFetchFailure() {
        provider = provider(d -> {
            throw new IOException("connection refused");
        }, null, Duration.ofSeconds(5));

        assertThatThrownBy(provider::load)
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("connection refused")
                .satisfies(e -> assertThat(((ConfigException) e).getType()).isEqualTo(ConfigErrorType.REMOTE_FETCH_FAILED));
    }

    @Test
    @DisplayName("should surface REMOTE_PROVIDER_UNSUPPORTED from the fetcher unchanged")
    void shouldSurfaceUnsupportedProvider() {
        provider = provider(RemoteFetchers.unsupported(), null, Duration.ofSeconds(5));

        assertThatThrownBy(provider::load)
                .isInstanceOf(ConfigException.class)
                .satisfies(e -> assertThat(((ConfigException) e).getType())
                        .isEqualTo(ConfigErrorType.REMOTE_PROVIDER_UNSUPPORTED));
    }

    @Test
    @DisplayName("should fail with SOURCE_UNPARSABLE on malformed payload and keep previous values")
    void shouldKeepPreviousValuesOnMalformedPayload() {
        String[] payload = {"{\"a\": 1}"};
        provider = provider(d -> json(payload[0]), null, Duration.ofSeconds(5));
        provider.load();

        payload[0] = "not json";

        assertThatThrownBy(provider::load)
                .isInstanceOf(ConfigException.class)
                .satisfies(e -> assertThat(((ConfigException) e).getType()).isEqualTo(ConfigErrorType.SOURCE_UNPARSABLE));
        assertThat(store.getInt("a")).isEqualTo(1);
    }

    @Test
    @DisplayName("should describe its descriptor")
    void shouldDescribeDescriptor() {
        provider = provider(d -> json("{}"), null, Duration.ofSeconds(1));

        assertThat(provider.describe()).isEqualTo("consul://localhost:8500/app/config");
    }

    private RemoteConfigProvider provider(RemoteConfigFetcher fetcher, Map<String, Object> defaults, Duration timeout) {
        ProviderContext context = new ProviderContext(
                store, new ReentrantReadWriteLock(), defaults, null, binder, null,
                new ConfigMetrics(new SimpleMeterRegistry(), "test"));
        return new RemoteConfigProvider(context, DESCRIPTOR, fetcher, timeout);
    }

    private static byte[] json(String content) {
        return content.getBytes(StandardCharsets.UTF_8);
    }
}
