package org.Aayush.guna.dasha;

/**
 * Relation between two concurrently running period lords.
 */
public enum DashaPhase {
    SAME(2),
    SUPPORTIVE(2),
    NEUTRAL(1),
    CONFLICTING(0);

    private final int alignmentScore;

    DashaPhase(int alignmentScore) {
        this.alignmentScore = alignmentScore;
    }

    public int alignmentScore() {
        return alignmentScore;
    }
}
