package fr.lapetina.layeredconfig.infrastructure.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.layeredconfig.domain.exception.ConfigException;
import fr.lapetina.layeredconfig.domain.model.ConfigErrorType;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;

/**
 * Structured formats a configuration source can be written in.
 *
 * Each format decodes raw bytes into a nested key/value tree. Decoding is
 * stateless; the underlying parsers are created per call.
 */
public enum ConfigFormat {

    YAML(Set.of("yaml", "yml")) {
        @Override
        Map<String, Object> parse(String content) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            Object document;
            try {
                document = yaml.load(content);
            } catch (YAMLException e) {
                throw unparsable("malformed YAML: " + e.getMessage(), e);
            }
            if (document == null) {
                return new LinkedHashMap<>();
            }
            if (!(document instanceof Map<?, ?> map)) {
                throw unparsable("top-level YAML node must be a mapping", null);
            }
            return stringKeys(map);
        }
    },

    JSON(Set.of("json")) {
        @Override
        Map<String, Object> parse(String content) {
            if (content.isBlank()) {
                return new LinkedHashMap<>();
            }
            try {
                Map<String, Object> tree = OBJECT_MAPPER.readValue(content, MAP_TYPE);
                return tree != null ? tree : new LinkedHashMap<>();
            } catch (JsonProcessingException e) {
                throw unparsable("malformed JSON: " + e.getOriginalMessage(), e);
            }
        }
    },

    PROPERTIES(Set.of("properties", "props")) {
        @Override
        Map<String, Object> parse(String content) {
            Properties properties = new Properties();
            try {
                properties.load(new StringReader(content));
            } catch (IOException | IllegalArgumentException e) {
                throw unparsable("malformed properties: " + e.getMessage(), e);
            }
            Map<String, Object> tree = new LinkedHashMap<>();
            for (String name : properties.stringPropertyNames()) {
                putDotted(tree, name, properties.getProperty(name));
            }
            return tree;
        }
    };

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final Set<String> extensions;

    ConfigFormat(Set<String> extensions) {
        this.extensions = extensions;
    }

    /**
     * Decodes raw source bytes (UTF-8) into a nested key/value tree.
     *
     * @throws ConfigException with {@link ConfigErrorType#SOURCE_UNPARSABLE} on malformed content
     */
    public Map<String, Object> decode(byte[] content) {
        return parse(new String(content, StandardCharsets.UTF_8));
    }

    abstract Map<String, Object> parse(String content);

    public Set<String> getExtensions() {
        return extensions;
    }

    /**
     * Resolves a format from a file extension, with or without the leading dot.
     */
    public static Optional<ConfigFormat> fromExtension(String extension) {
        if (extension == null) {
            return Optional.empty();
        }
        String normalized = extension.startsWith(".") ? extension.substring(1) : extension;
        normalized = normalized.toLowerCase(Locale.ROOT);
        for (ConfigFormat format : values()) {
            if (format.extensions.contains(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a format from a file name's extension.
     */
    public static Optional<ConfigFormat> fromPath(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return Optional.empty();
        }
        return fromExtension(name.substring(dot + 1));
    }

    private static ConfigException unparsable(String message, Throwable cause) {
        return new ConfigException(ConfigErrorType.SOURCE_UNPARSABLE, message, cause);
    }

    private static Map<String, Object> stringKeys(Map<?, ?> source) {
        Map<String, Object> result = new LinkedHashMap<>();
        source.forEach((k, v) -> result.put(String.valueOf(k),
                v instanceof Map<?, ?> nested ? stringKeys(nested) : v));
        return result;
    }

    @SuppressWarnings("unchecked")
    private static void putDotted(Map<String, Object> tree, String dottedKey, Object value) {
        String[] segments = dottedKey.split("\\.");
        Map<String, Object> section = tree;
        for (int i = 0; i < segments.length - 1; i++) {
            Object child = section.get(segments[i]);
            if (!(child instanceof Map<?, ?>)) {
                child = new LinkedHashMap<String, Object>();
                section.put(segments[i], child);
            }
            section = (Map<String, Object>) child;
        }
        section.put(segments[segments.length - 1], value);
    }
}
