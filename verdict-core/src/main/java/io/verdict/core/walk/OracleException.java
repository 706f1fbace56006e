package io.verdict.core.walk;

import java.io.Serial;

/// Thrown by an {@link AnswerOracle} that cannot produce an answer.
public class OracleException extends Exception {
    @Serial private static final long serialVersionUID = 2756135940381722518L;

    public OracleException(String message) {
        super(message);
    }

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
