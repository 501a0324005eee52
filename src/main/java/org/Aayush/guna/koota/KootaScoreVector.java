package org.Aayush.guna.koota;

import lombok.Builder;
import lombok.Value;

/**
 * Eight validated koota subscores.
 *
 * <p>The total is always derived from the subscores and never stored, so it cannot
 * drift from their sum.</p>
 */
@Value
public class KootaScoreVector {
    int varna;
    int vashya;
    int tara;
    int yoni;
    int grahaMaitri;
    int gana;
    int bhakoot;
    int nadi;

    /**
     * Creates a score vector, rejecting any subscore outside its koota's value set.
     *
     * @throws IllegalArgumentException when a subscore is out of range.
     */
    @Builder
    public KootaScoreVector(int varna, int vashya, int tara, int yoni, int grahaMaitri, int gana, int bhakoot, int nadi) {
        this.varna = requireRange(Koota.VARNA, varna);
        this.vashya = requireRange(Koota.VASHYA, vashya);
        this.tara = requireAllOrNothing(Koota.TARA, tara);
        this.yoni = requireRange(Koota.YONI, yoni);
        this.grahaMaitri = requireRange(Koota.GRAHA_MAITRI, grahaMaitri);
        this.gana = requireRange(Koota.GANA, gana);
        this.bhakoot = requireAllOrNothing(Koota.BHAKOOT, bhakoot);
        this.nadi = requireAllOrNothing(Koota.NADI, nadi);
    }

    /**
     * Returns the sum of all eight subscores, in {@code [0, 36]}.
     */
    public int getTotalGuna() {
        int total = 0;
        for (Koota koota : Koota.values()) {
            total += score(koota);
        }
        return total;
    }

    /**
     * Returns the subscore of one koota.
     */
    public int score(Koota koota) {
        return switch (koota) {
            case VARNA -> varna;
            case VASHYA -> vashya;
            case TARA -> tara;
            case YONI -> yoni;
            case GRAHA_MAITRI -> grahaMaitri;
            case GANA -> gana;
            case BHAKOOT -> bhakoot;
            case NADI -> nadi;
        };
    }

    private static int requireRange(Koota koota, int value) {
        if (value < 0 || value > koota.maxScore()) {
            throw new IllegalArgumentException(
                    koota + " score must be in [0, " + koota.maxScore() + "], got " + value);
        }
        return value;
    }

    private static int requireAllOrNothing(Koota koota, int value) {
        if (value != 0 && value != koota.maxScore()) {
            throw new IllegalArgumentException(
                    koota + " score must be 0 or " + koota.maxScore() + ", got " + value);
        }
        return value;
    }
}
