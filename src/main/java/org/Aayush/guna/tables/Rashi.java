package org.Aayush.guna.tables;

import java.util.HashMap;
import java.util.Map;

/**
 * The 12 sidereal signs, index 0 (Aries) to 11 (Pisces).
 */
public enum Rashi {
    ARIES("Aries", "Mesha"),
    TAURUS("Taurus", "Vrishabha"),
    GEMINI("Gemini", "Mithuna"),
    CANCER("Cancer", "Karka"),
    LEO("Leo", "Simha"),
    VIRGO("Virgo", "Kanya"),
    LIBRA("Libra", "Tula"),
    SCORPIO("Scorpio", "Vrishchika"),
    SAGITTARIUS("Sagittarius", "Dhanu"),
    CAPRICORN("Capricorn", "Makara"),
    AQUARIUS("Aquarius", "Kumbha"),
    PISCES("Pisces", "Meena");

    /** Number of signs in the zodiac. */
    public static final int COUNT = 12;

    private static final Rashi[] VALUES = values();
    private static final Map<String, Rashi> BY_NAME = new HashMap<>();

    static {
        for (Rashi rashi : VALUES) {
            BY_NAME.put(Names.normalize(rashi.displayName), rashi);
            BY_NAME.put(Names.normalize(rashi.sanskritName), rashi);
        }
    }

    private final String displayName;
    private final String sanskritName;

    Rashi(String displayName, String sanskritName) {
        this.displayName = displayName;
        this.sanskritName = sanskritName;
    }

    /**
     * Returns the zero-based zodiacal index.
     */
    public int index() {
        return ordinal();
    }

    /**
     * Returns the English display name.
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Returns the Sanskrit name.
     */
    public String sanskritName() {
        return sanskritName;
    }

    /**
     * Counts forward from {@code from} to this sign, in {@code [0, 11]}.
     */
    public int distanceFrom(Rashi from) {
        return Math.floorMod(ordinal() - from.ordinal(), COUNT);
    }

    /**
     * Returns the sign {@code steps} positions forward (negative steps count backward).
     */
    public Rashi plus(int steps) {
        return VALUES[Math.floorMod(ordinal() + steps, COUNT)];
    }

    /**
     * Resolves a sign from its zero-based index.
     *
     * @throws IllegalArgumentException when the index is outside {@code [0, 11]}.
     */
    public static Rashi fromIndex(int index) {
        return VALUES[Names.requireIndex(index, COUNT, "rashi")];
    }

    /**
     * Resolves a sign from its English or Sanskrit name.
     *
     * @throws IllegalArgumentException when the name is unknown.
     */
    public static Rashi fromName(String name) {
        return Names.resolve(BY_NAME, name, "rashi");
    }
}
