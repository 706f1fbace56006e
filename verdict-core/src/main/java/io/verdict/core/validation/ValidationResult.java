package io.verdict.core.validation;

import io.verdict.core.exception.TreeErrorKind;
import io.verdict.core.exception.TreeLoadException;
import java.util.Objects;

/// Outcome of validating a tree definition without throwing.
///
/// Used by editing surfaces that report failures to a user instead of aborting.
///
/// @param valid `true` if the definition loaded and passed every check
/// @param kind failure category, null when valid
/// @param message failure description, null when valid
public record ValidationResult(boolean valid, TreeErrorKind kind, String message) {

    private static final ValidationResult VALID = new ValidationResult(true, null, null);

    public static ValidationResult success() {
        return VALID;
    }

    /// Creates a failed result from a load failure.
    ///
    /// @param failure the parse or validation failure, not null
    /// @return invalid result carrying the failure's kind and message, never null
    public static ValidationResult invalid(TreeLoadException failure) {
        Objects.requireNonNull(failure, "failure must not be null");
        return new ValidationResult(false, failure.getKind(), failure.getMessage());
    }
}
