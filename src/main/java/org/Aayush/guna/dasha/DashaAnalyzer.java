package org.Aayush.guna.dasha;

import lombok.experimental.UtilityClass;
import org.Aayush.guna.core.IncompleteInputWarning;
import org.Aayush.guna.core.TriState;
import org.Aayush.guna.tables.Planet;
import org.Aayush.guna.tables.PlanetaryFriendship;
import org.Aayush.guna.tables.PlanetaryRelation;

import java.util.Objects;

/**
 * Compares the running maha (major) and sub period lords of two charts.
 *
 * <p>Growth needs a harmonious major period not undercut by a hostile sub period.
 * Conflict is a hostile major period, or a neutral one with a hostile sub period. Sub
 * lords are optional: without them the sub period is treated as non-conflicting.</p>
 */
@UtilityClass
public final class DashaAnalyzer {
    static final String FIELD_DASHA_LORD = "dasha_lord";
    static final String FIELD_SUB_DASHA_LORD = "sub_dasha_lord";

    /**
     * Returns the phase relation of two lords.
     */
    public static DashaPhase phase(Planet a, Planet b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        if (a == b) {
            return DashaPhase.SAME;
        }
        PlanetaryRelation forward = PlanetaryFriendship.relation(a, b);
        PlanetaryRelation backward = PlanetaryFriendship.relation(b, a);
        if (forward == PlanetaryRelation.ENEMY || backward == PlanetaryRelation.ENEMY) {
            return DashaPhase.CONFLICTING;
        }
        if (forward == PlanetaryRelation.FRIEND || backward == PlanetaryRelation.FRIEND) {
            return DashaPhase.SUPPORTIVE;
        }
        return DashaPhase.NEUTRAL;
    }

    /**
     * Synchronises two charts' periods.
     *
     * @param mahaA major period lord of side A, may be null.
     * @param subA sub period lord of side A, may be null.
     * @param mahaB major period lord of side B, may be null.
     * @param subB sub period lord of side B, may be null.
     * @return sync with unknown flags when a major lord is missing; warning fields carry the person role.
     */
    public static DashaSync sync(Planet mahaA, Planet subA, Planet mahaB, Planet subB) {
        DashaSync.DashaSyncBuilder result = DashaSync.builder();
        if (mahaA == null || mahaB == null) {
            if (mahaA == null) {
                result.warning(new IncompleteInputWarning("person_a." + FIELD_DASHA_LORD, "Dasha sync not computed"));
            }
            if (mahaB == null) {
                result.warning(new IncompleteInputWarning("person_b." + FIELD_DASHA_LORD, "Dasha sync not computed"));
            }
            return result.growth(TriState.UNKNOWN).conflict(TriState.UNKNOWN).build();
        }

        DashaPhase maha = phase(mahaA, mahaB);
        DashaPhase sub = null;
        if (subA != null && subB != null) {
            sub = phase(subA, subB);
        } else {
            if (subA == null) {
                result.warning(new IncompleteInputWarning("person_a." + FIELD_SUB_DASHA_LORD, "sub period refinement skipped"));
            }
            if (subB == null) {
                result.warning(new IncompleteInputWarning("person_b." + FIELD_SUB_DASHA_LORD, "sub period refinement skipped"));
            }
        }
        boolean subConflicting = sub == DashaPhase.CONFLICTING;
        boolean growth = (maha == DashaPhase.SAME || maha == DashaPhase.SUPPORTIVE) && !subConflicting;
        boolean conflict = maha == DashaPhase.CONFLICTING || (maha == DashaPhase.NEUTRAL && subConflicting);
        return result.mahaPhase(maha)
                .subPhase(sub)
                .alignmentScore(maha.alignmentScore())
                .growth(TriState.of(growth))
                .conflict(TriState.of(conflict))
                .build();
    }
}
