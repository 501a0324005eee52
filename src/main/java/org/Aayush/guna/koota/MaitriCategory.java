package org.Aayush.guna.koota;

/**
 * Mutual planetary friendship of the two moon-sign lords.
 *
 * <p>Both directional relations are combined: a shared lord counts as mutual
 * friendship, and a single hostile side paired with a non-hostile one is
 * {@link #MIXED}.</p>
 */
public enum MaitriCategory {
    MUTUAL_FRIEND(5),
    ONE_SIDED(4),
    MUTUAL_NEUTRAL(3),
    MIXED(1),
    MUTUAL_ENEMY(0);

    private final int score;

    MaitriCategory(int score) {
        this.score = score;
    }

    public int score() {
        return score;
    }
}
