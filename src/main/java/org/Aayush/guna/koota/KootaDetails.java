package org.Aayush.guna.koota;

import lombok.Builder;
import lombok.Value;
import org.Aayush.guna.tables.Gana;
import org.Aayush.guna.tables.Nadi;
import org.Aayush.guna.tables.Planet;
import org.Aayush.guna.tables.Varna;
import org.Aayush.guna.tables.Yoni;

/**
 * Attributes and categories that explain a {@link KootaScoreVector}.
 */
@Value
@Builder
public class KootaDetails {
    Varna varnaA;
    Varna varnaB;
    /** Tara of side A counted from side B. */
    Tara tara;
    Yoni yoniA;
    Yoni yoniB;
    YoniRelationship yoniRelationship;
    Planet lordA;
    Planet lordB;
    MaitriCategory maitriCategory;
    Gana ganaA;
    Gana ganaB;
    BhakootDosha bhakootDosha;
    Nadi nadiA;
    Nadi nadiB;

    /**
     * Returns whether both sides share a nadi.
     */
    public boolean isSameNadi() {
        return nadiA == nadiB;
    }
}
