package io.verdict.core.exception;

import java.io.Serial;

public class TreeParseException extends TreeLoadException {
    @Serial private static final long serialVersionUID = -7126093118265534902L;

    public TreeParseException(String message) {
        super(TreeErrorKind.PARSE, message);
    }

    public TreeParseException(String message, Throwable cause) {
        super(TreeErrorKind.PARSE, message, cause);
    }
}
