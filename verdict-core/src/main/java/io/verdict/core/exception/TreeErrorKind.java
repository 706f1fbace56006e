package io.verdict.core.exception;

/// Categories of tree load failures.
public enum TreeErrorKind {
    /// Input is not well-formed structured data.
    PARSE,
    /// Missing or empty start node, id/key mismatch, or a dangling node reference.
    STRUCTURE,
    /// A cycle is reachable from the start node.
    CYCLE,
    /// One or more nodes cannot be reached from the start node.
    UNREACHABLE
}
