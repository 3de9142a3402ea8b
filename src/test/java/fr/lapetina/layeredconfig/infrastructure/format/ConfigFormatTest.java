package fr.lapetina.layeredconfig.infrastructure.format;

import fr.lapetina.layeredconfig.domain.exception.ConfigException;
import fr.lapetina.layeredconfig.domain.model.ConfigErrorType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigFormatTest {

    @Test
    @DisplayName("should resolve format from file extension")
    void shouldResolveFromExtension() {
        assertThat(ConfigFormat.fromPath(Path.of("config.yaml"))).contains(ConfigFormat.YAML);
        assertThat(ConfigFormat.fromPath(Path.of("conf/app.YML"))).contains(ConfigFormat.YAML);
        assertThat(ConfigFormat.fromPath(Path.of("app.json"))).contains(ConfigFormat.JSON);
        assertThat(ConfigFormat.fromPath(Path.of("app.properties"))).contains(ConfigFormat.PROPERTIES);
        assertThat(ConfigFormat.fromExtension(".json")).contains(ConfigFormat.JSON);
        assertThat(ConfigFormat.fromPath(Path.of("app.toml"))).isEmpty();
        assertThat(ConfigFormat.fromPath(Path.of("Makefile"))).isEmpty();
    }

    @Test
    @DisplayName("should decode nested YAML")
    void shouldDecodeYaml() {
        String yaml = """
                server:
                  port: 8080
                  hosts:
                    - a
                    - b
                debug: true
                """;

        Map<String, Object> tree = ConfigFormat.YAML.decode(bytes(yaml));

        assertThat(tree).containsEntry("debug", true);
        assertThat(tree.get("server")).isEqualTo(Map.of("port", 8080, "hosts", List.of("a", "b")));
    }

    @Test
    @DisplayName("should decode an empty YAML document as an empty tree")
    void shouldDecodeEmptyYaml() {
        assertThat(ConfigFormat.YAML.decode(bytes(""))).isEmpty();
        assertThat(ConfigFormat.JSON.decode(bytes("  "))).isEmpty();
    }

    @Test
    @DisplayName("should reject YAML whose top level is not a mapping")
    void shouldRejectNonMappingYaml() {
        assertThatThrownBy(() -> ConfigFormat.YAML.decode(bytes("- a\n- b\n")))
                .isInstanceOf(ConfigException.class)
                .satisfies(e -> assertThat(((ConfigException) e).getType()).isEqualTo(ConfigErrorType.SOURCE_UNPARSABLE));
    }

    @Test
    @DisplayName("should reject malformed JSON")
    void shouldRejectMalformedJson() {
        assertThatThrownBy(() -> ConfigFormat.JSON.decode(bytes("{\"server\": ")))
                .isInstanceOf(ConfigException.class)
                .satisfies(e -> assertThat(((ConfigException) e).is(ConfigErrorType.SOURCE_UNPARSABLE)).isTrue());
    }

    @Test
    @DisplayName("should expand dotted property names into sections")
    void shouldExpandDottedProperties() {
        Map<String, Object> tree = ConfigFormat.PROPERTIES.decode(bytes("server.port=8080\nname=demo\n"));

        assertThat(tree).containsEntry("name", "demo");
        assertThat(tree.get("server")).isEqualTo(Map.of("port", "8080"));
    }

    private static byte[] bytes(String content) {
        return content.getBytes(StandardCharsets.UTF_8);
    }
}
