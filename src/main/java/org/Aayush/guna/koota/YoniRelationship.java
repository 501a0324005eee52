package org.Aayush.guna.koota;

/**
 * Relationship class between two yonis; the score is the Yoni koota points.
 */
public enum YoniRelationship {
    ENEMY(0),
    UNFRIENDLY(1),
    NEUTRAL(2),
    FRIENDLY(3),
    SAME(4);

    private static final YoniRelationship[] BY_SCORE = values();

    private final int score;

    YoniRelationship(int score) {
        this.score = score;
    }

    public int score() {
        return score;
    }

    static YoniRelationship ofScore(int score) {
        return BY_SCORE[score];
    }
}
