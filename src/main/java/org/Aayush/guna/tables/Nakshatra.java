package org.Aayush.guna.tables;

import java.util.HashMap;
import java.util.Map;

/**
 * The 27 lunar mansions in zodiacal order, index 0 (Ashwini) to 26 (Revati).
 */
public enum Nakshatra {
    ASHWINI("Ashwini"),
    BHARANI("Bharani"),
    KRITTIKA("Krittika"),
    ROHINI("Rohini"),
    MRIGASHIRA("Mrigashira", "Mrigasira"),
    ARDRA("Ardra", "Arudra"),
    PUNARVASU("Punarvasu"),
    PUSHYA("Pushya", "Pushyami"),
    ASHLESHA("Ashlesha", "Aslesha"),
    MAGHA("Magha"),
    PURVA_PHALGUNI("Purva Phalguni", "Pubba"),
    UTTARA_PHALGUNI("Uttara Phalguni", "Uttaram"),
    HASTA("Hasta"),
    CHITRA("Chitra", "Chitta"),
    SWATI("Swati", "Svati"),
    VISHAKHA("Vishakha", "Visakha"),
    ANURADHA("Anuradha"),
    JYESHTHA("Jyeshtha", "Jyeshta"),
    MULA("Mula", "Moola"),
    PURVA_ASHADHA("Purva Ashadha", "Purvashadha"),
    UTTARA_ASHADHA("Uttara Ashadha", "Uttarashadha"),
    SHRAVANA("Shravana", "Sravana"),
    DHANISHTA("Dhanishta", "Dhanishtha"),
    SHATABHISHA("Shatabhisha", "Shatataraka"),
    PURVA_BHADRAPADA("Purva Bhadrapada", "Purvabhadra"),
    UTTARA_BHADRAPADA("Uttara Bhadrapada", "Uttarabhadra"),
    REVATI("Revati");

    /** Number of nakshatras in the zodiac. */
    public static final int COUNT = 27;

    private static final Nakshatra[] VALUES = values();
    private static final Map<String, Nakshatra> BY_NAME = new HashMap<>();

    static {
        for (Nakshatra nakshatra : VALUES) {
            BY_NAME.put(Names.normalize(nakshatra.displayName), nakshatra);
            BY_NAME.put(Names.normalize(nakshatra.name()), nakshatra);
            for (String alias : nakshatra.aliases) {
                BY_NAME.put(Names.normalize(alias), nakshatra);
            }
        }
    }

    private final String displayName;
    private final String[] aliases;

    Nakshatra(String displayName, String... aliases) {
        this.displayName = displayName;
        this.aliases = aliases;
    }

    /**
     * Returns the zero-based zodiacal index.
     */
    public int index() {
        return ordinal();
    }

    /**
     * Returns the conventional display name.
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Counts forward from {@code from} to this nakshatra, in {@code [0, 26]}.
     */
    public int distanceFrom(Nakshatra from) {
        return Math.floorMod(ordinal() - from.ordinal(), COUNT);
    }

    /**
     * Resolves a nakshatra from its zero-based index.
     *
     * @throws IllegalArgumentException when the index is outside {@code [0, 26]}.
     */
    public static Nakshatra fromIndex(int index) {
        return VALUES[Names.requireIndex(index, COUNT, "nakshatra")];
    }

    /**
     * Resolves a nakshatra from a display name or a common transliteration.
     *
     * @throws IllegalArgumentException when the name is unknown.
     */
    public static Nakshatra fromName(String name) {
        return Names.resolve(BY_NAME, name, "nakshatra");
    }
}
