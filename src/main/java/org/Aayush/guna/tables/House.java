package org.Aayush.guna.tables;

/**
 * Chart house position, 1 (ascendant) to 12.
 */
public enum House {
    FIRST,
    SECOND,
    THIRD,
    FOURTH,
    FIFTH,
    SIXTH,
    SEVENTH,
    EIGHTH,
    NINTH,
    TENTH,
    ELEVENTH,
    TWELFTH;

    /** Number of houses. */
    public static final int COUNT = 12;

    private static final House[] VALUES = values();

    /**
     * Returns the one-based house number.
     */
    public int number() {
        return ordinal() + 1;
    }

    /**
     * Returns this house counted from {@code reference} as the first house.
     *
     * <p>Uses {@code ((this - reference + 12) mod 12) + 1}, so counting from the
     * first house is the identity.</p>
     */
    public House countedFrom(House reference) {
        return VALUES[Math.floorMod(ordinal() - reference.ordinal(), COUNT)];
    }

    /**
     * Returns the sign occupying this house in a whole-sign chart rising in {@code ascendant}.
     */
    public Rashi signFrom(Rashi ascendant) {
        return ascendant.plus(ordinal());
    }

    /**
     * Returns the house occupied by {@code sign} in a whole-sign chart rising in {@code ascendant}.
     */
    public static House ofSign(Rashi sign, Rashi ascendant) {
        return VALUES[sign.distanceFrom(ascendant)];
    }

    /**
     * Resolves a house from its one-based number.
     *
     * @throws IllegalArgumentException when the number is outside {@code [1, 12]}.
     */
    public static House of(int number) {
        if (number < 1 || number > COUNT) {
            throw new IllegalArgumentException("house number must be in [1, 12], got " + number);
        }
        return VALUES[number - 1];
    }
}
