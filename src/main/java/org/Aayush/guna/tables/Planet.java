package org.Aayush.guna.tables;

import java.util.HashMap;
import java.util.Map;

/**
 * The nine classical grahas, index 0 (Sun) to 8 (Ketu); also the Dasha lord domain.
 */
public enum Planet {
    SUN("Sun", "Surya", "Ravi"),
    MOON("Moon", "Chandra", "Soma"),
    MARS("Mars", "Mangal", "Kuja"),
    MERCURY("Mercury", "Budha", "Budh"),
    JUPITER("Jupiter", "Guru", "Brihaspati"),
    VENUS("Venus", "Shukra", "Sukra"),
    SATURN("Saturn", "Shani", "Sani"),
    RAHU("Rahu", "North Node"),
    KETU("Ketu", "South Node");

    /** Number of grahas. */
    public static final int COUNT = 9;

    private static final Planet[] VALUES = values();
    private static final Map<String, Planet> BY_NAME = new HashMap<>();

    static {
        for (Planet planet : VALUES) {
            BY_NAME.put(Names.normalize(planet.displayName), planet);
            for (String alias : planet.aliases) {
                BY_NAME.put(Names.normalize(alias), planet);
            }
        }
    }

    private final String displayName;
    private final String[] aliases;

    Planet(String displayName, String... aliases) {
        this.displayName = displayName;
        this.aliases = aliases;
    }

    public int index() {
        return ordinal();
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Returns whether this is one of the lunar nodes (Rahu, Ketu).
     */
    public boolean isNode() {
        return this == RAHU || this == KETU;
    }

    public static Planet fromIndex(int index) {
        return VALUES[Names.requireIndex(index, COUNT, "planet")];
    }

    /**
     * Resolves a planet from its English or Sanskrit name.
     *
     * @throws IllegalArgumentException when the name is unknown.
     */
    public static Planet fromName(String name) {
        return Names.resolve(BY_NAME, name, "planet");
    }
}
