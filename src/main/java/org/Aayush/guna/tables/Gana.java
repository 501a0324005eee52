package org.Aayush.guna.tables;

/**
 * Temperament class of a nakshatra.
 */
public enum Gana {
    DEVA,
    MANUSHYA,
    RAKSHASA;

    private static final Gana[] VALUES = values();

    public int index() {
        return ordinal();
    }

    public static Gana fromIndex(int index) {
        return VALUES[Names.requireIndex(index, VALUES.length, "gana")];
    }
}
