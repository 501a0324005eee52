package org.Aayush.guna.dosha;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.guna.core.IncompleteInputWarning;

import java.util.List;
import java.util.Set;

/**
 * Manglik outcome for one chart.
 */
@Value
@Builder
public class ManglikAssessment {
    ManglikStatus status;
    /** References whose check flagged Mars; empty when the Mars house is unknown. */
    @Singular
    Set<ManglikReference> flaggedReferences;
    /** Applied cancellation, {@link ManglikCancellation#NONE} when none applied. */
    ManglikCancellation cancellation;
    @Singular
    List<IncompleteInputWarning> warnings;

    /**
     * Returns whether Mars occupies a Manglik house before cancellation.
     */
    public boolean isRawManglik() {
        return !flaggedReferences.isEmpty();
    }
}
