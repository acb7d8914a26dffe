package io.rulekit.core.model;

import java.util.Objects;

/**
 * An advisory validation finding. Validators return these as lists and never throw.
 *
 * @param severity {@link Severity#ERROR} for definitions that will not compile or run as
 *                 written, {@link Severity#WARNING} for suspicious but valid ones
 * @param subject  id of the row, column or step the finding is about, or {@code null} for the
 *                 definition as a whole
 * @param message  human-readable description
 */
public record Finding(Severity severity, String subject, String message) {

    public enum Severity {
        ERROR,
        WARNING
    }

    public Finding {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static Finding error(String subject, String message) {
        return new Finding(Severity.ERROR, subject, message);
    }

    public static Finding warning(String subject, String message) {
        return new Finding(Severity.WARNING, subject, message);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return severity + (subject != null ? " [" + subject + "] " : " ") + message;
    }
}
