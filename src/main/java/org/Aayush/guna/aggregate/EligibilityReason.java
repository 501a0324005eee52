package org.Aayush.guna.aggregate;

/**
 * Reason a pair failed the eligibility gate.
 */
public enum EligibilityReason {
    BELOW_MINIMUM_SCORE,
    NADI_DOSHA_UNCANCELLED,
    MANGLIK_MISMATCH
}
