package org.Aayush.guna.tables;

/**
 * Pulse (humor) class of a nakshatra: Aadi (Vata), Madhya (Pitta), Antya (Kapha).
 */
public enum Nadi {
    AADI,
    MADHYA,
    ANTYA;

    private static final Nadi[] VALUES = values();

    public int index() {
        return ordinal();
    }

    public static Nadi fromIndex(int index) {
        return VALUES[Names.requireIndex(index, VALUES.length, "nadi")];
    }
}
