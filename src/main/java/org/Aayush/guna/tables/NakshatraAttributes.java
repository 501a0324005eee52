package org.Aayush.guna.tables;

import java.util.Objects;

/**
 * Koota-relevant attributes of one nakshatra.
 *
 * @param gana temperament class.
 * @param nadi pulse class.
 * @param yoni animal nature.
 */
public record NakshatraAttributes(Gana gana, Nadi nadi, Yoni yoni) {
    public NakshatraAttributes {
        Objects.requireNonNull(gana, "gana");
        Objects.requireNonNull(nadi, "nadi");
        Objects.requireNonNull(yoni, "yoni");
    }
}
