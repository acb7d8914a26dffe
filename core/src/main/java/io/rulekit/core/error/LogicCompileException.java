package io.rulekit.core.error;

/**
 * Abstract parent for authoring-time errors: expression syntax, cell shorthand and definition
 * documents. Carries an additional {@code source} field identifying the file, resource or field
 * that caused the error.
 */
public abstract class LogicCompileException extends RuleKitException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected LogicCompileException(String message, String definitionId, String source) {
        super(message, definitionId, Phase.COMPILE);
        this.source = source;
    }

    protected LogicCompileException(String message, Throwable cause, String definitionId, String source) {
        super(message, cause, definitionId, Phase.COMPILE);
        this.source = source;
    }

    /** The file path, resource or field that caused the error, or {@code null}. */
    public String source() {
        return source;
    }

    @Override
    protected String locationSuffix() {
        return source != null ? " (" + source + ")" : "";
    }
}
