package fr.lapetina.layeredconfig.infrastructure.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueCoercionTest {

    @Test
    @DisplayName("should parse integers from strings and whole decimals")
    void shouldParseIntegers() {
        assertThat(ValueCoercion.toInteger("42")).contains(42);
        assertThat(ValueCoercion.toInteger(" 42 ")).contains(42);
        assertThat(ValueCoercion.toInteger("8080.0")).contains(8080);
        assertThat(ValueCoercion.toInteger("0x10")).contains(16);
        assertThat(ValueCoercion.toLong(3.9)).contains(3L);
        assertThat(ValueCoercion.toInteger("4.5")).isEmpty();
        assertThat(ValueCoercion.toInteger("abc")).isEmpty();
    }

    @Test
    @DisplayName("should accept boolean literals and numbers")
    void shouldParseBooleans() {
        assertThat(ValueCoercion.toBoolean("true")).contains(true);
        assertThat(ValueCoercion.toBoolean("T")).contains(true);
        assertThat(ValueCoercion.toBoolean("1")).contains(true);
        assertThat(ValueCoercion.toBoolean("False")).contains(false);
        assertThat(ValueCoercion.toBoolean(0)).contains(false);
        assertThat(ValueCoercion.toBoolean(2)).contains(true);
        assertThat(ValueCoercion.toBoolean("yes")).isEmpty();
    }

    @Test
    @DisplayName("should parse unit durations, ISO durations and bare nanoseconds")
    void shouldParseDurations() {
        assertThat(ValueCoercion.toDuration("1h30m")).contains(Duration.ofMinutes(90));
        assertThat(ValueCoercion.toDuration("250ms")).contains(Duration.ofMillis(250));
        assertThat(ValueCoercion.toDuration("1.5h")).contains(Duration.ofMinutes(90));
        assertThat(ValueCoercion.toDuration("-2s")).contains(Duration.ofSeconds(-2));
        assertThat(ValueCoercion.toDuration("PT30S")).contains(Duration.ofSeconds(30));
        assertThat(ValueCoercion.toDuration(1_000_000_000L)).contains(Duration.ofSeconds(1));
        assertThat(ValueCoercion.toDuration("1000")).contains(Duration.ofNanos(1000));
        assertThat(ValueCoercion.toDuration("0")).contains(Duration.ZERO);
        assertThat(ValueCoercion.toDuration("5 minutes")).isEmpty();
        assertThat(ValueCoercion.toDuration("")).isEmpty();
    }

    @Test
    @DisplayName("should parse times in several layouts")
    void shouldParseTimes() {
        Instant expected = Instant.parse("2024-03-01T10:15:30Z");

        assertThat(ValueCoercion.toInstant("2024-03-01T10:15:30Z")).contains(expected);
        assertThat(ValueCoercion.toInstant("2024-03-01T12:15:30+02:00")).contains(expected);
        assertThat(ValueCoercion.toInstant("2024-03-01T10:15:30")).contains(expected);
        assertThat(ValueCoercion.toInstant("2024-03-01 10:15:30")).contains(expected);
        assertThat(ValueCoercion.toInstant("2024-03-01")).contains(Instant.parse("2024-03-01T00:00:00Z"));
        assertThat(ValueCoercion.toInstant(expected.getEpochSecond())).contains(expected);
        assertThat(ValueCoercion.toInstant("yesterday")).isEmpty();
    }

    @Test
    @DisplayName("should give up on epoch seconds outside the instant range")
    void shouldRejectOutOfRangeEpochSeconds() {
        assertThat(ValueCoercion.toInstant(1.0e300)).isEmpty();
        assertThat(ValueCoercion.toInstant(Long.MAX_VALUE)).isEmpty();
        assertThat(ValueCoercion.toInstant(Double.NaN)).isEmpty();
        assertThat(ValueCoercion.toInstant(1.9)).contains(Instant.ofEpochSecond(1));
    }

    @Test
    @DisplayName("should give up on integers that do not fit in an int")
    void shouldRejectOutOfRangeIntegers() {
        assertThat(ValueCoercion.toInteger(3_000_000_000L)).isEmpty();
        assertThat(ValueCoercion.toInteger("-3000000000")).isEmpty();
        assertThat(ValueCoercion.toInteger(Integer.MAX_VALUE)).contains(Integer.MAX_VALUE);
        assertThat(ValueCoercion.toLong(3_000_000_000L)).contains(3_000_000_000L);
    }

    @Test
    @DisplayName("should give up on durations that overflow nanoseconds")
    void shouldRejectOverflowingDurations() {
        assertThat(ValueCoercion.toDuration("3000000h")).isEmpty();
        assertThat(ValueCoercion.toDuration("-3000000h")).isEmpty();
        assertThat(ValueCoercion.toDuration("2000000h")).contains(Duration.ofHours(2_000_000));
    }

    @Test
    @DisplayName("should build string lists from sequences and whitespace-separated strings")
    void shouldBuildStringLists() {
        assertThat(ValueCoercion.toStringList(List.of("a", 1, true))).contains(List.of("a", "1", "true"));
        assertThat(ValueCoercion.toStringList("a b  c")).contains(List.of("a", "b", "c"));
        assertThat(ValueCoercion.toStringList(42)).isEmpty();
    }

    @Test
    @DisplayName("should format floating point values without trailing zeros")
    void shouldFormatDoubles() {
        assertThat(ValueCoercion.toStringValue(1.50)).contains("1.5");
        assertThat(ValueCoercion.toStringValue(8080.0)).contains("8080");
        assertThat(ValueCoercion.toStringValue(Map.of())).isEmpty();
    }

    @Test
    @DisplayName("should reject unsupported target types")
    void shouldRejectUnsupportedTargetType() {
        assertThatThrownBy(() -> ValueCoercion.to("x", StringBuilder.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("StringBuilder");
    }
}
