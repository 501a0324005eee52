package org.Aayush.guna.core;

/**
 * Boolean outcome that may be unknown because an optional input was absent.
 *
 * <p>{@link #UNKNOWN} is never coerced to {@code false}.</p>
 */
public enum TriState {
    TRUE,
    FALSE,
    UNKNOWN;

    public static TriState of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean isTrue() {
        return this == TRUE;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }
}
