package org.Aayush.guna.match;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;
import org.Aayush.guna.core.id.CandidateIdIndex;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ranked batch outcome.
 */
@Getter
@ToString(exclude = "rankIndex")
public final class BatchResult {
    /** Ranked entries, best first. */
    private final List<RankedMatch> pairs;
    /** Number of candidates submitted. */
    private final int totalPairs;
    /** Number of candidates the filter rejected, in either mode. */
    private final int earlyRejections;
    @Getter(AccessLevel.NONE)
    private final CandidateIdIndex rankIndex;

    BatchResult(List<RankedMatch> pairs, int totalPairs, int earlyRejections) {
        this.pairs = List.copyOf(pairs);
        this.totalPairs = totalPairs;
        this.earlyRejections = earlyRejections;
        List<String> ids = new ArrayList<>(pairs.size());
        for (RankedMatch pair : this.pairs) {
            ids.add(pair.getCandidateId());
        }
        this.rankIndex = CandidateIdIndex.of(ids);
    }

    /**
     * Returns the zero-based rank of a candidate, or -1 when it was not returned.
     */
    public int rankOf(String candidateId) {
        return rankIndex.contains(candidateId) ? rankIndex.positionOf(candidateId) : -1;
    }

    /**
     * Returns the ranked entry of a candidate, empty when it was excluded or cut off.
     */
    public Optional<RankedMatch> find(String candidateId) {
        int rank = rankOf(candidateId);
        return rank < 0 ? Optional.empty() : Optional.of(pairs.get(rank));
    }
}
