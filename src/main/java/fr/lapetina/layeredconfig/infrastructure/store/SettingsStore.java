package fr.lapetina.layeredconfig.infrastructure.store;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Layered key/value container behind a config manager.
 *
 * Keys are dotted paths into nested sections ({@code server.port}) and are
 * case-insensitive. Three layers are resolved on every read, highest first:
 * <ul>
 *   <li>environment overlay ({@code <PREFIX>_SERVER_PORT}), when enabled</li>
 *   <li>values set or merged from a source</li>
 *   <li>registered defaults</li>
 * </ul>
 *
 * Typed getters never throw: a missing key or a value that cannot be
 * converted yields the type's zero value. Use {@link #isSet(String)} or
 * {@link #find(String, Class)} when absence matters.
 *
 * Not thread-safe. The owner guards every access with a single
 * reader-writer lock.
 */
public final class SettingsStore {

    private final Function<String, String> environment;

    private Map<String, Object> defaults = new LinkedHashMap<>();
    private Map<String, Object> values = new LinkedHashMap<>();
    private String envPrefix;

    public SettingsStore(Function<String, String> environment) {
        this.environment = Objects.requireNonNull(environment, "environment is required");
    }

    public SettingsStore() {
        this(System::getenv);
    }

    // ---- mutation -------------------------------------------------------

    public void set(String key, Object value) {
        if (value == null) {
            removePath(values, normalizeKey(key));
            return;
        }
        putPath(values, normalizeKey(key), normalizeValue(value));
    }

    public void setDefault(String key, Object value) {
        if (value == null) {
            removePath(defaults, normalizeKey(key));
            return;
        }
        putPath(defaults, normalizeKey(key), normalizeValue(value));
    }

    /**
     * Deep-merges a decoded source over the current values.
     * Sections merge key by key; scalars and sequences replace.
     */
    public void merge(Map<String, ?> source) {
        deepMerge(values, normalizeMap(source));
    }

    /**
     * Clears every value set or merged so far. Registered defaults survive.
     */
    public void reset() {
        values = new LinkedHashMap<>();
    }

    /**
     * Makes {@code <PREFIX>_<KEY>} environment variables override stored values.
     * The key is upper-cased with dots replaced by underscores.
     */
    public void enableEnvironmentOverlay(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("Environment prefix must not be blank");
        }
        this.envPrefix = prefix.trim().toUpperCase(Locale.ROOT);
    }

    public void disableEnvironmentOverlay() {
        this.envPrefix = null;
    }

    public Optional<String> getEnvironmentPrefix() {
        return Optional.ofNullable(envPrefix);
    }

    public Snapshot snapshot() {
        return new Snapshot(deepCopyMap(defaults), deepCopyMap(values), envPrefix);
    }

    public void restore(Snapshot snapshot) {
        this.defaults = deepCopyMap(snapshot.defaults);
        this.values = deepCopyMap(snapshot.values);
        this.envPrefix = snapshot.envPrefix;
    }

    // ---- reads ----------------------------------------------------------

    /**
     * Returns the resolved value for a key, or null when no layer sets it.
     * A section key returns the merged section as a detached map.
     */
    public Object get(String key) {
        String path = normalizeKey(key);
        if (path.isEmpty()) {
            return null;
        }

        String fromEnv = environmentValue(path);
        if (fromEnv != null) {
            return fromEnv;
        }

        Object value = lookup(values, path);
        Object fallback = lookup(defaults, path);

        if (value instanceof Map<?, ?> || (value == null && fallback instanceof Map<?, ?>)) {
            Map<String, Object> section = new LinkedHashMap<>();
            if (fallback instanceof Map<?, ?> defaultSection) {
                deepMerge(section, castMap(defaultSection));
            }
            if (value instanceof Map<?, ?> valueSection) {
                deepMerge(section, castMap(valueSection));
            }
            applyEnvironment(section, path);
            return section;
        }
        return deepCopy(value != null ? value : fallback);
    }

    public boolean isSet(String key) {
        String path = normalizeKey(key);
        if (path.isEmpty()) {
            return false;
        }
        return environmentValue(path) != null
                || lookup(values, path) != null
                || lookup(defaults, path) != null;
    }

    /**
     * Strict accessor: empty when the key is absent or its value cannot be
     * converted to the requested type.
     */
    public <T> Optional<T> find(String key, Class<T> type) {
        return ValueCoercion.to(get(key), type);
    }

    public String getString(String key) {
        return ValueCoercion.toStringValue(get(key)).orElse("");
    }

    public int getInt(String key) {
        return ValueCoercion.toInteger(get(key)).orElse(0);
    }

    public long getLong(String key) {
        return ValueCoercion.toLong(get(key)).orElse(0L);
    }

    public double getDouble(String key) {
        return ValueCoercion.toDouble(get(key)).orElse(0.0);
    }

    public boolean getBoolean(String key) {
        return ValueCoercion.toBoolean(get(key)).orElse(false);
    }

    public Duration getDuration(String key) {
        return ValueCoercion.toDuration(get(key)).orElse(Duration.ZERO);
    }

    /**
     * Zero value is {@link Instant#EPOCH}.
     */
    public Instant getTime(String key) {
        return ValueCoercion.toInstant(get(key)).orElse(Instant.EPOCH);
    }

    public List<String> getStringList(String key) {
        return ValueCoercion.toStringList(get(key)).orElse(List.of());
    }

    public Map<String, Object> getStringMap(String key) {
        return ValueCoercion.toStringMap(get(key)).orElse(Map.of());
    }

    /**
     * Every leaf key holding a value in the values or defaults layer, dotted.
     */
    public List<String> allKeys() {
        List<String> keys = new ArrayList<>();
        collectLeafKeys(mergedTree(), "", keys);
        return keys;
    }

    /**
     * Detached nested snapshot of every resolved setting, env overrides applied.
     */
    public Map<String, Object> allSettings() {
        Map<String, Object> tree = mergedTree();
        applyEnvironment(tree, "");
        return tree;
    }

    // ---- internals ------------------------------------------------------

    private Map<String, Object> mergedTree() {
        Map<String, Object> tree = deepCopyMap(defaults);
        deepMerge(tree, values);
        return tree;
    }

    private String environmentValue(String path) {
        if (envPrefix == null) {
            return null;
        }
        String name = envPrefix + "_" + path.replace('.', '_').toUpperCase(Locale.ROOT);
        String value = environment.apply(name);
        return value == null || value.isEmpty() ? null : value;
    }

    private void applyEnvironment(Map<String, Object> section, String sectionPath) {
        if (envPrefix == null) {
            return;
        }
        for (Map.Entry<String, Object> entry : section.entrySet()) {
            String path = sectionPath.isEmpty() ? entry.getKey() : sectionPath + "." + entry.getKey();
            if (entry.getValue() instanceof Map<?, ?> nested) {
                applyEnvironment(castMap(nested), path);
            } else {
                String fromEnv = environmentValue(path);
                if (fromEnv != null) {
                    entry.setValue(fromEnv);
                }
            }
        }
    }

    private static void collectLeafKeys(Map<String, Object> section, String prefix, List<String> keys) {
        for (Map.Entry<String, Object> entry : section.entrySet()) {
            String path = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            if (entry.getValue() instanceof Map<?, ?> nested && !nested.isEmpty()) {
                collectLeafKeys(castMap(nested), path, keys);
            } else {
                keys.add(path);
            }
        }
    }

    private static Object lookup(Map<String, Object> root, String path) {
        Object current = root;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> section)) {
                return null;
            }
            current = section.get(segment);
        }
        return current;
    }

    private static void putPath(Map<String, Object> root, String path, Object value) {
        String[] segments = path.split("\\.");
        Map<String, Object> section = root;
        for (int i = 0; i < segments.length - 1; i++) {
            Object child = section.get(segments[i]);
            if (!(child instanceof Map<?, ?>)) {
                child = new LinkedHashMap<String, Object>();
                section.put(segments[i], child);
            }
            section = castMap((Map<?, ?>) child);
        }
        section.put(segments[segments.length - 1], value);
    }

    private static void removePath(Map<String, Object> root, String path) {
        String[] segments = path.split("\\.");
        Map<String, Object> section = root;
        for (int i = 0; i < segments.length - 1; i++) {
            if (!(section.get(segments[i]) instanceof Map<?, ?> child)) {
                return;
            }
            section = castMap(child);
        }
        section.remove(segments[segments.length - 1]);
    }

    private static void deepMerge(Map<String, Object> target, Map<String, Object> source) {
        for (Map.Entry<String, Object> entry : source.entrySet()) {
            Object incoming = entry.getValue();
            Object existing = target.get(entry.getKey());
            if (incoming instanceof Map<?, ?> incomingSection && existing instanceof Map<?, ?> existingSection) {
                deepMerge(castMap(existingSection), castMap(incomingSection));
            } else {
                target.put(entry.getKey(), deepCopy(incoming));
            }
        }
    }

    private static String normalizeKey(String key) {
        Objects.requireNonNull(key, "key is required");
        return key.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Lower-cases keys and expands dotted keys into nested sections, so
     * {@code {"server.port": 8080}} and {@code {"server": {"port": 8080}}} read the same.
     */
    private static Map<String, Object> normalizeMap(Map<?, ?> source) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        source.forEach((k, v) -> {
            String key = normalizeKey(String.valueOf(k));
            Map<String, Object> entry = new LinkedHashMap<>();
            if (key.replace(".", "").isEmpty()) {
                entry.put(key, normalizeValue(v));
            } else {
                putPath(entry, key, normalizeValue(v));
            }
            deepMerge(normalized, entry);
        });
        return normalized;
    }

    private static Object normalizeValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return normalizeMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> normalized = new ArrayList<>(list.size());
            for (Object element : list) {
                normalized.add(normalizeValue(element));
            }
            return normalized;
        }
        return value;
    }

    private static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            return deepCopyMap(castMap(map));
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(deepCopy(element));
            }
            return copy;
        }
        return value;
    }

    private static Map<String, Object> deepCopyMap(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(k, deepCopy(v)));
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castMap(Map<?, ?> map) {
        return (Map<String, Object>) map;
    }

    /**
     * Point-in-time copy of the store, used to roll back a failed load.
     */
    public static final class Snapshot {
        private final Map<String, Object> defaults;
        private final Map<String, Object> values;
        private final String envPrefix;

        private Snapshot(Map<String, Object> defaults, Map<String, Object> values, String envPrefix) {
            this.defaults = defaults;
            this.values = values;
            this.envPrefix = envPrefix;
        }
    }
}
