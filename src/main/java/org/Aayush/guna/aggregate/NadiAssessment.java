package org.Aayush.guna.aggregate;

import lombok.Value;

/**
 * Nadi dosha presence and cancellation outcome.
 */
@Value
public class NadiAssessment {
    /** Both sides share a nadi (Nadi koota scored 0). */
    boolean doshaPresent;
    /** First applying cancellation rule, {@link NadiCancellation#NONE} when none applied. */
    NadiCancellation cancellation;

    public static NadiAssessment absent() {
        return new NadiAssessment(false, NadiCancellation.NONE);
    }

    public boolean isCancelled() {
        return cancellation != NadiCancellation.NONE;
    }

    /**
     * Returns whether the dosha is present and no rule cancelled it.
     */
    public boolean isSevereNadiDosha() {
        return doshaPresent && !isCancelled();
    }
}
