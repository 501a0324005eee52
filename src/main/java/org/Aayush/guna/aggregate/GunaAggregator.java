package org.Aayush.guna.aggregate;

import org.Aayush.guna.core.TriState;
import org.Aayush.guna.koota.Koota;
import org.Aayush.guna.koota.KootaScoreVector;
import org.Aayush.guna.koota.YoniRelationship;
import org.Aayush.guna.tables.Nakshatra;
import org.Aayush.guna.tables.Rashi;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a koota score vector into a verdict, a Nadi assessment and an eligibility gate.
 *
 * <p>Immutable and safe for concurrent use.</p>
 */
public final class GunaAggregator {
    private final AggregationPolicy policy;

    public GunaAggregator(AggregationPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public AggregationPolicy policy() {
        return policy;
    }

    /**
     * Classifies a total guna score into its verdict band.
     *
     * @throws IllegalArgumentException when the total is outside {@code [0, 36]}.
     */
    public VerdictBand verdict(int totalGuna) {
        if (totalGuna < 0 || totalGuna > Koota.MAX_TOTAL) {
            throw new IllegalArgumentException("totalGuna must be in [0, " + Koota.MAX_TOTAL + "], got " + totalGuna);
        }
        return policy.getVerdictThresholds().classify(totalGuna);
    }

    /**
     * Returns whether the yonis are sworn enemies.
     */
    public static boolean sexualIncompatibility(YoniRelationship relationship) {
        return relationship == YoniRelationship.ENEMY;
    }

    /**
     * Evaluates Nadi dosha and, when enabled, its cancellation rules in order.
     *
     * @param scores scored pair.
     * @param nakshatraA moon nakshatra of side A.
     * @param rashiA moon sign of side A.
     * @param nakshatraB moon nakshatra of side B.
     * @param rashiB moon sign of side B.
     * @return assessment; identical charts are never cancelled by the chart rules.
     */
    public NadiAssessment assessNadi(
            KootaScoreVector scores,
            Nakshatra nakshatraA,
            Rashi rashiA,
            Nakshatra nakshatraB,
            Rashi rashiB
    ) {
        if (scores.getNadi() != 0) {
            return NadiAssessment.absent();
        }
        if (!policy.isNadiCancellationEnabled()) {
            return new NadiAssessment(true, NadiCancellation.NONE);
        }
        if (rashiA == rashiB && nakshatraA != nakshatraB) {
            return new NadiAssessment(true, NadiCancellation.SAME_RASHI_DIFFERENT_NAKSHATRA);
        }
        if (nakshatraA == nakshatraB && rashiA != rashiB) {
            return new NadiAssessment(true, NadiCancellation.SAME_NAKSHATRA_DIFFERENT_RASHI);
        }
        if (scores.getTotalGuna() >= policy.getNadiCancellationMinTotal()) {
            return new NadiAssessment(true, NadiCancellation.HIGH_TOTAL_GUNA);
        }
        if (scores.getGrahaMaitri() == Koota.GRAHA_MAITRI.maxScore() && rashiA != rashiB) {
            return new NadiAssessment(true, NadiCancellation.FRIENDLY_LORDS_DIFFERENT_RASHI);
        }
        return new NadiAssessment(true, NadiCancellation.NONE);
    }

    /**
     * Evaluates the eligibility gate.
     *
     * @param totalGuna total score.
     * @param nadi Nadi assessment of the pair.
     * @param manglikMismatch whether final Manglik statuses differ; unknown never blocks.
     * @return gate with every applying reason, in declaration order.
     */
    public EligibilityGate eligibility(int totalGuna, NadiAssessment nadi, TriState manglikMismatch) {
        List<EligibilityReason> reasons = new ArrayList<>(3);
        if (totalGuna < policy.getEligibilityMinTotal()) {
            reasons.add(EligibilityReason.BELOW_MINIMUM_SCORE);
        }
        if (nadi.isSevereNadiDosha()) {
            reasons.add(EligibilityReason.NADI_DOSHA_UNCANCELLED);
        }
        if (policy.isManglikGateEnabled() && manglikMismatch == TriState.TRUE) {
            reasons.add(EligibilityReason.MANGLIK_MISMATCH);
        }
        return new EligibilityGate(reasons);
    }
}
