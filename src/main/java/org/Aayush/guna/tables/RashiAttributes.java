package org.Aayush.guna.tables;

import java.util.Objects;

/**
 * Koota-relevant attributes of one moon sign.
 *
 * @param varna varna class.
 * @param lord ruling planet (never a lunar node).
 */
public record RashiAttributes(Varna varna, Planet lord) {
    public RashiAttributes {
        Objects.requireNonNull(varna, "varna");
        Objects.requireNonNull(lord, "lord");
    }
}
