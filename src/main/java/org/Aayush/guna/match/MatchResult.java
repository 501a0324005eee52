package org.Aayush.guna.match;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.guna.aggregate.EligibilityGate;
import org.Aayush.guna.aggregate.NadiAssessment;
import org.Aayush.guna.aggregate.VerdictBand;
import org.Aayush.guna.core.IncompleteInputWarning;
import org.Aayush.guna.dasha.DashaSync;
import org.Aayush.guna.dosha.ManglikMatch;
import org.Aayush.guna.koota.KootaDetails;
import org.Aayush.guna.koota.KootaScoreVector;

import java.util.List;

/**
 * Immutable outcome of one pair match.
 */
@Value
@Builder
public class MatchResult {
    /** Id of person A, may be null. */
    String personAId;
    /** Id of person B, may be null. */
    String personBId;
    KootaScoreVector scores;
    KootaDetails details;
    VerdictBand verdict;
    DoshaFlags doshaFlags;
    CompatibilityFlags compatibilityFlags;
    ManglikMatch manglik;
    NadiAssessment nadi;
    DashaSync dasha;
    EligibilityGate eligibility;
    /** Optional inputs that were missing, in evaluation order. */
    @Singular
    List<IncompleteInputWarning> warnings;

    /**
     * Returns the total guna, always the sum of {@link #getScores()}.
     */
    public int getTotalGuna() {
        return scores.getTotalGuna();
    }
}
