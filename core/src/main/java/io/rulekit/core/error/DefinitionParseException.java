package io.rulekit.core.error;

/** Thrown when a table or pipeline definition document (YAML, JSON or CSV) is malformed. */
public final class DefinitionParseException extends LogicCompileException {

    private static final long serialVersionUID = 1L;

    public DefinitionParseException(String message, String definitionId, String source) {
        super(message, definitionId, source);
    }

    public DefinitionParseException(String message, Throwable cause, String definitionId, String source) {
        super(message, cause, definitionId, source);
    }
}
