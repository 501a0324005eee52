package org.Aayush.guna.tables;

import lombok.experimental.UtilityClass;

import java.util.Objects;

/**
 * Natural (naisargika) friendship between grahas.
 *
 * <p>The relation is directional: {@code relation(a, b)} is how {@code a} regards
 * {@code b}, and need not equal {@code relation(b, a)}. Rahu is read as Saturn and Ketu
 * as Mars on both sides, so the relation is total over all nine planets. A planet is
 * always its own friend.</p>
 */
@UtilityClass
public final class PlanetaryFriendship {

    private static final int F = 0;
    private static final int N = 1;
    private static final int E = 2;

    // Rows: from; columns: toward. Sun, Moon, Mars, Mercury, Jupiter, Venus, Saturn.
    private static final int[][] NATURAL = TableChecks.requireRange(TableChecks.requireSquare(new int[][]{
            {F, F, F, N, F, E, E},
            {F, F, N, F, N, N, N},
            {F, F, F, E, F, N, N},
            {F, E, N, F, N, F, N},
            {F, F, F, E, F, E, N},
            {E, E, N, F, N, F, F},
            {E, E, E, F, N, F, F}
    }, 7, "NATURAL_FRIENDSHIP"), F, E, "NATURAL_FRIENDSHIP");

    private static final PlanetaryRelation[] RELATIONS = {
            PlanetaryRelation.FRIEND, PlanetaryRelation.NEUTRAL, PlanetaryRelation.ENEMY
    };

    /**
     * Returns how {@code from} regards {@code toward}.
     *
     * @param from viewing planet.
     * @param toward viewed planet.
     * @return natural relation; never null.
     */
    public static PlanetaryRelation relation(Planet from, Planet toward) {
        int row = proxy(Objects.requireNonNull(from, "from")).ordinal();
        int col = proxy(Objects.requireNonNull(toward, "toward")).ordinal();
        return RELATIONS[NATURAL[row][col]];
    }

    /**
     * Returns whether both planets regard each other as friends.
     */
    public static boolean mutualFriends(Planet a, Planet b) {
        return relation(a, b) == PlanetaryRelation.FRIEND && relation(b, a) == PlanetaryRelation.FRIEND;
    }

    /**
     * Maps a lunar node onto the planet whose friendships it follows.
     */
    public static Planet proxy(Planet planet) {
        return switch (planet) {
            case RAHU -> Planet.SATURN;
            case KETU -> Planet.MARS;
            default -> planet;
        };
    }
}
