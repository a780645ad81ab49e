package com.vidnyan.qguard.domain.constraint;

/**
 * A broken cross-field implication.
 */
public record ConstraintViolation(
    String constraint,
    Level level,
    String message
) {

    public enum Level {
        ERROR,      // structural, invalidates the query
        WARNING     // advisory
    }

    public static ConstraintViolation error(String constraint, String message) {
        return new ConstraintViolation(constraint, Level.ERROR, message);
    }

    public static ConstraintViolation warning(String constraint, String message) {
        return new ConstraintViolation(constraint, Level.WARNING, message);
    }

    public boolean isError() {
        return level == Level.ERROR;
    }
}
