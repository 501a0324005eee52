package org.Aayush.guna.aggregate;

/**
 * Rule that cancelled a Nadi dosha, in evaluation order.
 */
public enum NadiCancellation {
    NONE,
    /** Same moon sign, different nakshatra. */
    SAME_RASHI_DIFFERENT_NAKSHATRA,
    /** Same nakshatra, different moon sign. */
    SAME_NAKSHATRA_DIFFERENT_RASHI,
    /** Total guna at or above the configured threshold. */
    HIGH_TOTAL_GUNA,
    /** Moon-sign lords are mutual friends (or the same planet) across different signs. */
    FRIENDLY_LORDS_DIFFERENT_RASHI
}
