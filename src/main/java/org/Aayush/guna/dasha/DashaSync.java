package org.Aayush.guna.dasha;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.guna.core.IncompleteInputWarning;
import org.Aayush.guna.core.TriState;

import java.util.List;

/**
 * Period synchronisation of two charts.
 *
 * <p>Phases are null when the lords they need are absent.</p>
 */
@Value
@Builder
public class DashaSync {
    DashaPhase mahaPhase;
    DashaPhase subPhase;
    /** Alignment of the major periods, 0 to 2; null when a major lord is missing. */
    Integer alignmentScore;
    TriState growth;
    TriState conflict;
    @Singular
    List<IncompleteInputWarning> warnings;
}
