package fr.lapetina.layeredconfig.domain.exception;

import fr.lapetina.layeredconfig.domain.model.ConfigErrorType;

import java.util.List;

/**
 * Thrown when a decoded schema violates one of its declared constraints.
 *
 * The message describes the first violation in path order; every violation
 * found in the same pass is available through {@link #getViolations()}.
 */
public final class ConfigValidationException extends ConfigException {

    private final List<Violation> violations;

    public ConfigValidationException(List<Violation> violations) {
        super(ConfigErrorType.VALIDATION_FAILED, describe(violations));
        this.violations = List.copyOf(violations);
    }

    /**
     * Fully-qualified path of the first violated field, e.g. {@code server.port}.
     */
    public String getFieldPath() {
        return violations.get(0).fieldPath();
    }

    /**
     * Name of the first violated rule, e.g. {@code Min} or {@code NotBlank}.
     */
    public String getRule() {
        return violations.get(0).rule();
    }

    public List<Violation> getViolations() {
        return violations;
    }

    private static String describe(List<Violation> violations) {
        if (violations.isEmpty()) {
            throw new IllegalArgumentException("At least one violation is required");
        }
        Violation first = violations.get(0);
        return "validation failed for field '" + first.fieldPath() + "': " + first.rule();
    }

    /**
     * A single violated constraint.
     */
    public record Violation(String fieldPath, String rule, String message) {
    }
}
