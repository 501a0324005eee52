package org.Aayush.guna.aggregate;

/**
 * Verdict band of a total guna score, lowest first.
 */
public enum VerdictBand {
    UNFAVORABLE,
    ACCEPTABLE,
    GOOD,
    EXCELLENT
}
