package org.Aayush.guna.koota;

/**
 * Bhakoot affliction selected by the cyclic moon-sign distance.
 */
public enum BhakootDosha {
    /** No affliction, includes same sign and the 1/7 opposition. */
    NONE,
    /** 2/12 placement. */
    DWIRDWADASHA,
    /** 5/9 placement. */
    NAVAPANCHAMA,
    /** 6/8 placement. */
    SHADASHTAKA;

    /**
     * Returns the affliction for a distance {@code (rashiA - rashiB) mod 12}.
     */
    public static BhakootDosha ofDistance(int distance) {
        return switch (Math.floorMod(distance, 12)) {
            case 1, 11 -> DWIRDWADASHA;
            case 4, 8 -> NAVAPANCHAMA;
            case 5, 7 -> SHADASHTAKA;
            default -> NONE;
        };
    }

    public boolean isPresent() {
        return this != NONE;
    }
}
