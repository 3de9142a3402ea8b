package fr.lapetina.layeredconfig.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RemoteProviderTest {

    @Test
    @DisplayName("should normalize type and default missing path")
    void shouldNormalize() {
        RemoteProvider provider = RemoteProvider.of(" Consul ", "localhost:8500", null);

        assertThat(provider.type()).isEqualTo("consul");
        assertThat(provider.path()).isEmpty();
        assertThat(provider).hasToString("consul://localhost:8500/");
    }

    @Test
    @DisplayName("should require type and endpoint")
    void shouldRequireTypeAndEndpoint() {
        assertThatThrownBy(() -> RemoteProvider.of(" ", "localhost:8500", "app"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RemoteProvider.of("etcd3", "", "app"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RemoteProvider.of(null, "localhost", "app"))
                .isInstanceOf(NullPointerException.class);
    }
}
