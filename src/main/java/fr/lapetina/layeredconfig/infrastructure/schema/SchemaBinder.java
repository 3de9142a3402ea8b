package fr.lapetina.layeredconfig.infrastructure.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.layeredconfig.domain.exception.ConfigException;
import fr.lapetina.layeredconfig.domain.exception.ConfigValidationException;
import fr.lapetina.layeredconfig.domain.exception.ConfigValidationException.Violation;
import fr.lapetina.layeredconfig.domain.model.ConfigErrorType;
import fr.lapetina.layeredconfig.infrastructure.store.SettingsStore;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Binds a settings snapshot into a caller-owned schema object and validates it.
 *
 * Binding happens in three steps:
 * <ol>
 *   <li>decode the snapshot into a fresh instance of the schema's class
 *       (nested sections map to nested objects, property names match
 *       case-insensitively, unknown keys are ignored)</li>
 *   <li>evaluate the Jakarta Bean Validation constraints declared on it</li>
 *   <li>copy the validated values into the caller's object</li>
 * </ol>
 * The caller's object is only written in the last step, so a decoding or
 * validation failure leaves it untouched.
 *
 * Schemas are mutable POJOs with a no-arg constructor and getters/setters.
 *
 * Thread-safe.
 */
public final class SchemaBinder implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SchemaBinder.class);

    private static final Comparator<Violation> VIOLATION_ORDER = Comparator
            .comparing(Violation::fieldPath)
            .thenComparing(Violation::rule);

    private final ObjectMapper objectMapper;
    private final ValidatorFactory validatorFactory;
    private final Validator validator;

    public SchemaBinder() {
        this.objectMapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .addModule(new SimpleModule("layered-config-durations")
                        .addDeserializer(Duration.class, new DurationDeserializer()))
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
                .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .build();
        this.validatorFactory = Validation.byDefaultProvider()
                .configure()
                .messageInterpolator(new ParameterMessageInterpolator())
                .buildValidatorFactory();
        this.validator = validatorFactory.getValidator();
    }

    /**
     * Decodes the store's current settings into the schema and validates them.
     *
     * @throws ConfigException           with {@link ConfigErrorType#DECODE_FAILED} when a value
     *                                   cannot be converted to its field's type
     * @throws ConfigValidationException when a constraint is violated
     */
    public void bind(SettingsStore store, Object schema) {
        Objects.requireNonNull(schema, "schema is required");
        Object decoded = decode(store.allSettings(), schema.getClass());
        validate(decoded);
        commit(decoded, schema);
        log.debug("Schema bound: type={}", schema.getClass().getSimpleName());
    }

    /**
     * Decodes a settings tree into a new instance of the given type.
     */
    public <T> T decode(Map<String, Object> settings, Class<T> type) {
        try {
            return objectMapper.convertValue(settings, type);
        } catch (IllegalArgumentException e) {
            throw new ConfigException(ConfigErrorType.DECODE_FAILED,
                    "unable to decode configuration into " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Validates a decoded schema. Violations are reported in field-path order;
     * the exception message names the first one.
     */
    public void validate(Object schema) {
        Set<ConstraintViolation<Object>> violations = validator.validate(schema);
        if (violations.isEmpty()) {
            return;
        }
        List<Violation> ordered = violations.stream()
                .map(SchemaBinder::toViolation)
                .sorted(VIOLATION_ORDER)
                .toList();
        log.debug("Schema validation failed: type={}, violations={}",
                schema.getClass().getSimpleName(), ordered.size());
        throw new ConfigValidationException(ordered);
    }

    private void commit(Object decoded, Object schema) {
        try {
            objectMapper.updateValue(schema, decoded);
        } catch (JsonProcessingException e) {
            throw new ConfigException(ConfigErrorType.DECODE_FAILED,
                    "unable to update " + schema.getClass().getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    private static Violation toViolation(ConstraintViolation<Object> violation) {
        String rule = violation.getConstraintDescriptor()
                .getAnnotation()
                .annotationType()
                .getSimpleName();
        return new Violation(violation.getPropertyPath().toString(), rule, violation.getMessage());
    }

    @Override
    public void close() {
        validatorFactory.close();
    }
}
