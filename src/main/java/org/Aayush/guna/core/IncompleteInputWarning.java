package org.Aayush.guna.core;

import java.util.Objects;

/**
 * Non-fatal notice that an optional input was absent and a derived value is unknown.
 *
 * @param field snake_case input field, optionally prefixed with the person role.
 * @param message what could not be computed.
 */
public record IncompleteInputWarning(String field, String message) {
    public IncompleteInputWarning {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(message, "message");
    }

    /**
     * Returns a copy whose field is qualified by {@code prefix}, e.g. {@code person_a.mars_house}.
     */
    public IncompleteInputWarning prefixed(String prefix) {
        return new IncompleteInputWarning(prefix + "." + field, message);
    }
}
