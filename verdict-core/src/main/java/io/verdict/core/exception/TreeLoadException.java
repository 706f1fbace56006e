package io.verdict.core.exception;

import java.io.Serial;
import java.util.Objects;

/// Base exception for failures while loading a decision tree.
///
/// Raised only by parsing and validation, never by traversal. A failed load
/// leaves any previously active tree in effect.
///
/// @see TreeErrorKind for the failure categories
public class TreeLoadException extends Exception {
    @Serial private static final long serialVersionUID = 3184126902431560214L;

    private final TreeErrorKind kind;

    public TreeLoadException(TreeErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public TreeLoadException(TreeErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    /// @return the failure category, never null
    public TreeErrorKind getKind() {
        return kind;
    }
}
