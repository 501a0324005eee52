package org.Aayush.guna.match;

import lombok.Builder;
import lombok.Value;

/**
 * Batch ranking configuration.
 *
 * <p>A rejection filter requires an explicit {@link EarlyRejectionMode}; there is no
 * implicit default for what happens to rejected candidates. {@code minimumTotal} and
 * {@code eligibleOnly} only drop accepted candidates; entries ranked last by
 * {@link EarlyRejectionMode#RANK_LAST} are always returned.</p>
 */
@Value
public class BatchConfig {
    public static final int DEFAULT_MAX_CANDIDATES = 50_000;

    /** Optional early rejection predicate. */
    EarlyRejectionFilter rejectionFilter;
    /** Mandatory when a filter is set. */
    EarlyRejectionMode rejectionMode;
    /** Drop accepted results with a lower total; null keeps all. */
    Integer minimumTotal;
    /** Drop accepted results whose eligibility gate fails. */
    boolean eligibleOnly;
    /** Keep at most this many ranked entries; null keeps all. */
    Integer maxResults;
    /** Worker threads; 1 scores on the calling thread. */
    int parallelism;
    /** Upper bound on candidates per call. */
    int maxCandidates;

    /**
     * Creates a validated batch configuration.
     *
     * @throws MatchValidationException with {@link MatchValidationException#REASON_BATCH_CONFIG_INVALID}.
     */
    @Builder
    public BatchConfig(
            EarlyRejectionFilter rejectionFilter,
            EarlyRejectionMode rejectionMode,
            Integer minimumTotal,
            Boolean eligibleOnly,
            Integer maxResults,
            Integer parallelism,
            Integer maxCandidates
    ) {
        if (rejectionFilter != null && rejectionMode == null) {
            throw invalid("config.rejection_mode", "rejection mode must be set when a rejection filter is set");
        }
        if (maxResults != null && maxResults < 1) {
            throw invalid("config.max_results", "maxResults must be >= 1, got " + maxResults);
        }
        if (parallelism != null && parallelism < 1) {
            throw invalid("config.parallelism", "parallelism must be >= 1, got " + parallelism);
        }
        if (maxCandidates != null && maxCandidates < 1) {
            throw invalid("config.max_candidates", "maxCandidates must be >= 1, got " + maxCandidates);
        }
        this.rejectionFilter = rejectionFilter;
        this.rejectionMode = rejectionMode;
        this.minimumTotal = minimumTotal;
        this.eligibleOnly = eligibleOnly != null && eligibleOnly;
        this.maxResults = maxResults;
        this.parallelism = parallelism == null ? 1 : parallelism;
        this.maxCandidates = maxCandidates == null ? DEFAULT_MAX_CANDIDATES : maxCandidates;
    }

    /**
     * Returns a configuration with no filter, no cut-offs, ineligible pairs kept and sequential scoring.
     */
    public static BatchConfig defaults() {
        return BatchConfig.builder().build();
    }

    private static MatchValidationException invalid(String field, String message) {
        return new MatchValidationException(MatchValidationException.REASON_BATCH_CONFIG_INVALID, field, message);
    }
}
