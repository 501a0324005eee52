package org.Aayush.guna.dosha;

/**
 * Rule that cancelled a raw Manglik dosha, in evaluation order.
 */
public enum ManglikCancellation {
    NONE,
    /** Mars in Aries or Scorpio. */
    OWN_SIGN,
    /** Mars in Capricorn. */
    EXALTED,
    /** Mars in Cancer; debilitation cancels fully. */
    DEBILITATED,
    /** Mars in the first house, in the ascendant sign. */
    MARS_IN_LAGNA_SIGN,
    /** Jupiter in the same house as Mars; only when enabled. */
    JUPITER_CONJUNCTION
}
