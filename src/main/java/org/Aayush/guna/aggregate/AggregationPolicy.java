package org.Aayush.guna.aggregate;

import lombok.Builder;
import lombok.Value;
import org.Aayush.guna.koota.Koota;

/**
 * Verdict, Nadi cancellation and eligibility settings of a {@link GunaAggregator}.
 */
@Value
public class AggregationPolicy {
    public static final int DEFAULT_NADI_CANCELLATION_MIN_TOTAL = 28;
    public static final int DEFAULT_ELIGIBILITY_MIN_TOTAL = 18;

    /** Verdict band bounds. */
    VerdictThresholds verdictThresholds;
    /** Whether Nadi cancellation rules are evaluated at all. */
    boolean nadiCancellationEnabled;
    /** Total at or above which a Nadi dosha is cancelled. */
    int nadiCancellationMinTotal;
    /** Total below which the eligibility gate fails. */
    int eligibilityMinTotal;
    /** Whether a known Manglik mismatch fails the eligibility gate. */
    boolean manglikGateEnabled;

    @Builder
    public AggregationPolicy(
            VerdictThresholds verdictThresholds,
            Boolean nadiCancellationEnabled,
            Integer nadiCancellationMinTotal,
            Integer eligibilityMinTotal,
            Boolean manglikGateEnabled
    ) {
        this.verdictThresholds = verdictThresholds == null ? VerdictThresholds.defaults() : verdictThresholds;
        this.nadiCancellationEnabled = nadiCancellationEnabled == null || nadiCancellationEnabled;
        this.nadiCancellationMinTotal = requireTotal(
                nadiCancellationMinTotal == null ? DEFAULT_NADI_CANCELLATION_MIN_TOTAL : nadiCancellationMinTotal,
                "nadiCancellationMinTotal");
        this.eligibilityMinTotal = requireTotal(
                eligibilityMinTotal == null ? DEFAULT_ELIGIBILITY_MIN_TOTAL : eligibilityMinTotal,
                "eligibilityMinTotal");
        this.manglikGateEnabled = manglikGateEnabled == null || manglikGateEnabled;
    }

    /**
     * Returns default thresholds with Nadi cancellation enabled and the Manglik gate on.
     * Unset builder fields take the same defaults.
     */
    public static AggregationPolicy defaults() {
        return AggregationPolicy.builder().build();
    }

    private static int requireTotal(int value, String field) {
        if (value < 0 || value > Koota.MAX_TOTAL) {
            throw new IllegalArgumentException(field + " must be in [0, " + Koota.MAX_TOTAL + "], got " + value);
        }
        return value;
    }
}
