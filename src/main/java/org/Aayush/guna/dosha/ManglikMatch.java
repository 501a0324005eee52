package org.Aayush.guna.dosha;

import lombok.Value;
import org.Aayush.guna.core.TriState;

/**
 * Mutual Manglik compatibility: two charts match when their final statuses agree.
 */
@Value
public class ManglikMatch {
    ManglikAssessment sideA;
    ManglikAssessment sideB;

    /**
     * Returns {@code manglikA == manglikB}, unknown when either side is unknown.
     */
    public TriState getCompatible() {
        TriState a = sideA.getStatus().manglik();
        TriState b = sideB.getStatus().manglik();
        if (!a.isKnown() || !b.isKnown()) {
            return TriState.UNKNOWN;
        }
        return TriState.of(a == b);
    }

    /**
     * Returns whether the final statuses are known to differ.
     */
    public TriState getMismatch() {
        TriState compatible = getCompatible();
        if (!compatible.isKnown()) {
            return TriState.UNKNOWN;
        }
        return TriState.of(!compatible.isTrue());
    }

    /**
     * Returns the mismatch penalty, 0 unless the statuses are known to differ.
     */
    public int getPenalty() {
        return getMismatch().isTrue() ? ManglikAnalyzer.MANGLIK_MISMATCH_PENALTY : 0;
    }
}
