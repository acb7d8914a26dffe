package io.rulekit.core.error;

/** Thrown when JSON in the nested-operator wire form cannot be read back into a logic tree. */
public final class WireFormatException extends LogicCompileException {

    private static final long serialVersionUID = 1L;

    public WireFormatException(String message) {
        super(message, null, null);
    }

    public WireFormatException(String message, Throwable cause) {
        super(message, cause, null, null);
    }
}
