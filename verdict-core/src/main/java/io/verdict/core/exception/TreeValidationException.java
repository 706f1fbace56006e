package io.verdict.core.exception;

import java.io.Serial;

/// Base exception for structurally unsound trees that parsed successfully.
///
/// @see io.verdict.core.validation.DecisionTreeValidator
public abstract class TreeValidationException extends TreeLoadException {
    @Serial private static final long serialVersionUID = 6402571893270018353L;

    protected TreeValidationException(TreeErrorKind kind, String message) {
        super(kind, message);
    }
}
