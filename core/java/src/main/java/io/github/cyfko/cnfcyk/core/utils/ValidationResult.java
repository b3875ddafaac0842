package io.github.cyfko.cnfcyk.core.utils;

import java.util.List;
import java.util.Objects;

/**
 * Result of a validation operation: either success, or a failure carrying every error
 * message found.
 *
 * <p>Instances are immutable and created via the static methods
 * {@link #success()} and {@link #failure(List)}.</p>
 *
 * <pre>{@code
 * ValidationResult result = report.validateConversion();
 * if (!result.isValid()) {
 *     log.warning("Conversion check failed: " + result.getErrorMessage());
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public final class ValidationResult {

    private static final ValidationResult SUCCESS = new ValidationResult(List.of());

    private final List<String> errors;

    private ValidationResult(List<String> errors) {
        this.errors = errors;
    }

    public static ValidationResult success() {
        return SUCCESS;
    }

    /**
     * @param errors error messages; an empty list yields a successful result
     * @return the corresponding result
     */
    public static ValidationResult failure(List<String> errors) {
        Objects.requireNonNull(errors, "Errors are required");
        return errors.isEmpty() ? SUCCESS : new ValidationResult(List.copyOf(errors));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> getErrors() {
        return errors;
    }

    /**
     * @return all error messages joined with {@code "; "}, or {@code null} if valid
     */
    public String getErrorMessage() {
        return isValid() ? null : String.join("; ", errors);
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult[valid=true]"
                : "ValidationResult[valid=false, errors=" + errors + "]";
    }
}
