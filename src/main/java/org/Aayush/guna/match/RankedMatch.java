package org.Aayush.guna.match;

import lombok.Value;

/**
 * One ranked batch entry.
 */
@Value
public class RankedMatch {
    String candidateId;
    MatchResult result;
    /** Rejected by the filter and ranked last. */
    boolean earlyRejected;
}
