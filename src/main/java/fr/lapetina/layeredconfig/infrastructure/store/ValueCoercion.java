package fr.lapetina.layeredconfig.infrastructure.store;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts dynamically-typed configuration values to the requested type.
 *
 * Every method returns an empty Optional when the value is absent or cannot be
 * converted; the lenient getters of {@link SettingsStore} map that to the
 * type's zero value.
 *
 * Conversion is permissive: numeric strings are numbers,
 * {@code "t"} is a boolean, {@code "1h30m"} is a duration.
 */
public final class ValueCoercion {

    private static final Set<String> TRUE_LITERALS = Set.of("1", "t", "T", "TRUE", "true", "True");
    private static final Set<String> FALSE_LITERALS = Set.of("0", "f", "F", "FALSE", "false", "False");

    private static final Pattern ZERO_DECIMAL = Pattern.compile("^([+-]?\\d+)\\.0*$");
    private static final Pattern DURATION_PART = Pattern.compile("(\\d*\\.?\\d+)(ns|us|µs|μs|ms|s|m|h)");

    private static final DateTimeFormatter SPACED_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final List<Function<String, Instant>> INSTANT_PARSERS = List.of(
            text -> OffsetDateTime.parse(text).toInstant(),
            text -> ZonedDateTime.parse(text).toInstant(),
            text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC),
            text -> LocalDateTime.parse(text, SPACED_DATE_TIME).toInstant(ZoneOffset.UTC),
            text -> LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC)
    );

    private ValueCoercion() {
        // Utility class
    }

    public static Optional<String> toStringValue(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof String s) {
            return Optional.of(s);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return Optional.of(String.valueOf(d));
            }
            return Optional.of(BigDecimal.valueOf(d).stripTrailingZeros().toPlainString());
        }
        if (value instanceof Number || value instanceof Boolean || value instanceof Character) {
            return Optional.of(value.toString());
        }
        if (value instanceof Duration || value instanceof TemporalAccessor) {
            return Optional.of(value.toString());
        }
        if (value instanceof Date date) {
            return Optional.of(date.toInstant().toString());
        }
        if (value instanceof byte[] bytes) {
            return Optional.of(new String(bytes));
        }
        return Optional.empty();
    }

    public static Optional<Long> toLong(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Number n) {
            return Optional.of(n.longValue());
        }
        if (value instanceof Boolean b) {
            return Optional.of(b ? 1L : 0L);
        }
        if (value instanceof String s) {
            String trimmed = s.trim().replace("_", "");
            Matcher matcher = ZERO_DECIMAL.matcher(trimmed);
            if (matcher.matches()) {
                trimmed = matcher.group(1);
            }
            try {
                return Optional.of(Long.decode(trimmed));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Empty when the value does not fit in an int.
     */
    public static Optional<Integer> toInteger(Object value) {
        return toLong(value)
                .filter(l -> l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE)
                .map(Long::intValue);
    }

    public static Optional<Double> toDouble(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (value instanceof Boolean b) {
            return Optional.of(b ? 1.0 : 0.0);
        }
        if (value instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public static Optional<Boolean> toBoolean(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Boolean b) {
            return Optional.of(b);
        }
        if (value instanceof Number n) {
            return Optional.of(n.doubleValue() != 0);
        }
        if (value instanceof String s) {
            String trimmed = s.trim();
            if (TRUE_LITERALS.contains(trimmed)) {
                return Optional.of(true);
            }
            if (FALSE_LITERALS.contains(trimmed)) {
                return Optional.of(false);
            }
        }
        return Optional.empty();
    }

    /**
     * Bare numbers are nanoseconds; strings accept units
     * ({@code 300ms}, {@code 1h30m}, {@code 1.5h}) or ISO-8601 ({@code PT30S}).
     */
    public static Optional<Duration> toDuration(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Duration d) {
            return Optional.of(d);
        }
        if (value instanceof Number n) {
            return Optional.of(Duration.ofNanos(n.longValue()));
        }
        if (value instanceof String s) {
            return parseDuration(s.trim());
        }
        return Optional.empty();
    }

    /**
     * Numbers are seconds since the epoch; strings are ISO-8601 instants,
     * offset or zoned date-times, or local date-times and dates taken as UTC.
     */
    public static Optional<Instant> toInstant(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Instant i) {
            return Optional.of(i);
        }
        if (value instanceof Date d) {
            return Optional.of(d.toInstant());
        }
        if (value instanceof OffsetDateTime odt) {
            return Optional.of(odt.toInstant());
        }
        if (value instanceof ZonedDateTime zdt) {
            return Optional.of(zdt.toInstant());
        }
        if (value instanceof LocalDateTime ldt) {
            return Optional.of(ldt.toInstant(ZoneOffset.UTC));
        }
        if (value instanceof LocalDate ld) {
            return Optional.of(ld.atStartOfDay().toInstant(ZoneOffset.UTC));
        }
        if (value instanceof Number n) {
            return epochSeconds(n);
        }
        if (value instanceof String s) {
            return parseInstant(s.trim());
        }
        return Optional.empty();
    }

    /**
     * Sequences are stringified element by element; a plain string is split on whitespace.
     */
    public static Optional<List<String>> toStringList(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Collection<?> collection) {
            return Optional.of(stringify(collection));
        }
        if (value instanceof Object[] array) {
            return Optional.of(stringify(Arrays.asList(array)));
        }
        if (value instanceof String s) {
            String trimmed = s.trim();
            if (trimmed.isEmpty()) {
                return Optional.of(List.of());
            }
            return Optional.of(List.of(trimmed.split("\\s+")));
        }
        return Optional.empty();
    }

    public static Optional<Map<String, Object>> toStringMap(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return Optional.of(copy);
        }
        return Optional.empty();
    }

    /**
     * Strict conversion to one of the supported target types.
     *
     * @throws IllegalArgumentException if the target type is not supported
     */
    @SuppressWarnings("unchecked")
    public static <T> Optional<T> to(Object value, Class<T> type) {
        Function<Object, Optional<?>> converter = converterFor(type);
        if (converter == null) {
            throw new IllegalArgumentException("Unsupported target type: " + type.getName());
        }
        return (Optional<T>) converter.apply(value);
    }

    private static Function<Object, Optional<?>> converterFor(Class<?> type) {
        if (type == String.class) {
            return ValueCoercion::toStringValue;
        }
        if (type == Integer.class || type == int.class) {
            return ValueCoercion::toInteger;
        }
        if (type == Long.class || type == long.class) {
            return ValueCoercion::toLong;
        }
        if (type == Double.class || type == double.class) {
            return ValueCoercion::toDouble;
        }
        if (type == Boolean.class || type == boolean.class) {
            return ValueCoercion::toBoolean;
        }
        if (type == Duration.class) {
            return ValueCoercion::toDuration;
        }
        if (type == Instant.class) {
            return ValueCoercion::toInstant;
        }
        if (type == List.class) {
            return ValueCoercion::toStringList;
        }
        if (type == Map.class) {
            return ValueCoercion::toStringMap;
        }
        if (type == Object.class) {
            return Optional::ofNullable;
        }
        return null;
    }

    private static List<String> stringify(Collection<?> values) {
        List<String> result = new ArrayList<>(values.size());
        for (Object element : values) {
            result.add(toStringValue(element).orElse(""));
        }
        return List.copyOf(result);
    }

    private static Optional<Duration> parseDuration(String text) {
        if (text.isEmpty()) {
            return Optional.empty();
        }
        String upper = text.toUpperCase(Locale.ROOT);
        if (upper.startsWith("P") || upper.startsWith("-P")) {
            try {
                return Optional.of(Duration.parse(text));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }

        boolean negative = false;
        String body = text;
        if (body.startsWith("-") || body.startsWith("+")) {
            negative = body.startsWith("-");
            body = body.substring(1);
        }
        if (body.equals("0")) {
            return Optional.of(Duration.ZERO);
        }
        if (body.chars().allMatch(c -> Character.isDigit(c) || c == '.')) {
            body = body + "ns";
        }

        Matcher matcher = DURATION_PART.matcher(body);
        BigDecimal nanos = BigDecimal.ZERO;
        int consumed = 0;
        while (matcher.find()) {
            if (matcher.start() != consumed) {
                return Optional.empty();
            }
            consumed = matcher.end();
            BigDecimal amount;
            try {
                amount = new BigDecimal(matcher.group(1));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
            nanos = nanos.add(amount.multiply(BigDecimal.valueOf(nanosPerUnit(matcher.group(2)))));
        }
        if (consumed == 0 || consumed != body.length()) {
            return Optional.empty();
        }
        long total;
        try {
            total = nanos.longValueExact();
        } catch (ArithmeticException e) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofNanos(negative ? -total : total));
    }

    private static Optional<Instant> epochSeconds(Number seconds) {
        double asDouble = seconds.doubleValue();
        if (Double.isNaN(asDouble) || Double.isInfinite(asDouble)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.ofEpochSecond(new BigDecimal(seconds.toString()).toBigInteger().longValueExact()));
        } catch (DateTimeException | ArithmeticException | NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static long nanosPerUnit(String unit) {
        return switch (unit) {
            case "ns" -> 1L;
            case "us", "µs", "μs" -> 1_000L;
            case "ms" -> 1_000_000L;
            case "s" -> 1_000_000_000L;
            case "m" -> 60_000_000_000L;
            case "h" -> 3_600_000_000_000L;
            default -> throw new IllegalStateException("Unknown duration unit: " + unit);
        };
    }

    private static Optional<Instant> parseInstant(String text) {
        if (text.isEmpty()) {
            return Optional.empty();
        }
        for (Function<String, Instant> parser : INSTANT_PARSERS) {
            Optional<Instant> parsed = attempt(parser, text);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    private static Optional<Instant> attempt(Function<String, Instant> parser, String text) {
        try {
            return Optional.of(parser.apply(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
