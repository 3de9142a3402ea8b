package fr.lapetina.layeredconfig.infrastructure.schema;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Checks {@link OneOf} against the string form of the annotated value.
 */
public final class OneOfValidator implements ConstraintValidator<OneOf, Object> {

    private Set<String> allowed;
    private boolean ignoreCase;

    @Override
    public void initialize(OneOf annotation) {
        this.ignoreCase = annotation.ignoreCase();
        this.allowed = Stream.of(annotation.value())
                .map(this::canonical)
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public boolean isValid(Object value, ConstraintValidatorContext context) {
        if (value == null) {
            return true;
        }
        return allowed.contains(canonical(value.toString()));
    }

    private String canonical(String value) {
        return ignoreCase ? value.toLowerCase(Locale.ROOT) : value;
    }
}
