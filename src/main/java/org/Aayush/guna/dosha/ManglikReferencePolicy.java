package org.Aayush.guna.dosha;

/**
 * How the per-reference Manglik checks combine into the raw status.
 */
public enum ManglikReferencePolicy {
    /** Only the ascendant-referenced check counts. */
    LAGNA_ONLY,
    /** Manglik when any reference with available inputs flags it. */
    ANY_REFERENCE
}
