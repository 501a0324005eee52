package org.Aayush.guna.koota;

/**
 * Nine-fold Tara cycle, selected by {@code distance mod 9}.
 */
public enum Tara {
    JANMA(false),
    SAMPAT(true),
    VIPAT(false),
    KSHEMA(true),
    PRATYAK(false),
    SADHAKA(true),
    NAIDHANA(false),
    MITRA(true),
    PARAMA_MITRA(true);

    private static final Tara[] VALUES = values();

    private final boolean auspicious;

    Tara(boolean auspicious) {
        this.auspicious = auspicious;
    }

    public boolean isAuspicious() {
        return auspicious;
    }

    /**
     * Returns the category for a cyclic nakshatra distance in {@code [0, 26]}.
     */
    public static Tara ofDistance(int distance) {
        return VALUES[Math.floorMod(distance, VALUES.length)];
    }
}
