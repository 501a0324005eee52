package org.Aayush.guna.koota;

/**
 * The eight Ashtakoota factors with their maximum points (sum 36).
 */
public enum Koota {
    VARNA(1),
    VASHYA(2),
    TARA(3),
    YONI(4),
    GRAHA_MAITRI(5),
    GANA(6),
    BHAKOOT(7),
    NADI(8);

    /** Maximum attainable total over all kootas. */
    public static final int MAX_TOTAL = 36;

    private final int maxScore;

    Koota(int maxScore) {
        this.maxScore = maxScore;
    }

    public int maxScore() {
        return maxScore;
    }
}
