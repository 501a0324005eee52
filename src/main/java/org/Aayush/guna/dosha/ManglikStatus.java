package org.Aayush.guna.dosha;

import org.Aayush.guna.core.TriState;

/**
 * Final Manglik status of one chart.
 */
public enum ManglikStatus {
    /** Mars in no Manglik house for the evaluated references. */
    NONE,
    /** Raw dosha with no cancellation. */
    ACTIVE,
    /** Raw dosha neutralized by a cancellation rule. */
    CANCELLED,
    /** Mars house unavailable. */
    UNKNOWN;

    /**
     * Returns the post-cancellation Manglik flag.
     */
    public TriState manglik() {
        return switch (this) {
            case ACTIVE -> TriState.TRUE;
            case UNKNOWN -> TriState.UNKNOWN;
            case NONE, CANCELLED -> TriState.FALSE;
        };
    }
}
