package org.Aayush.guna.match;

/**
 * What happens to candidates an {@link EarlyRejectionFilter} rejects.
 */
public enum EarlyRejectionMode {
    /** Not scored and not returned. */
    EXCLUDE,
    /** Scored and returned after every accepted candidate, flagged as rejected. */
    RANK_LAST
}
