package org.Aayush.guna.koota;

import lombok.experimental.UtilityClass;
import org.Aayush.guna.tables.DomainTables;
import org.Aayush.guna.tables.Nakshatra;
import org.Aayush.guna.tables.Planet;
import org.Aayush.guna.tables.PlanetaryFriendship;
import org.Aayush.guna.tables.PlanetaryRelation;
import org.Aayush.guna.tables.Rashi;

import java.util.Objects;

/**
 * The eight Ashtakoota scorers.
 *
 * <p>Every scorer is a pure O(1) table lookup. Side {@code a} is the groom-analog role:
 * only {@link #varnaScore}, {@link #taraScore} and {@link #grahaMaitriScore} depend on
 * argument order, the others are symmetric.</p>
 */
@UtilityClass
public final class KootaScorers {

    /**
     * Varna koota (max 1).
     *
     * @return 1 when the varna rank of {@code a} is at least that of {@code b}.
     */
    public static int varnaScore(Rashi a, Rashi b) {
        return DomainTables.varna(a).rank() >= DomainTables.varna(b).rank() ? 1 : 0;
    }

    /**
     * Vashya koota (max 2), symmetric.
     */
    public static int vashyaScore(Rashi a, Rashi b) {
        return KootaTables.VASHYA[requireRashi(a, "a").ordinal()][requireRashi(b, "b").ordinal()];
    }

    /**
     * Returns the Tara category of {@code a} counted from {@code b}.
     */
    public static Tara tara(Nakshatra a, Nakshatra b) {
        return Tara.ofDistance(requireNakshatra(a, "a").distanceFrom(requireNakshatra(b, "b")));
    }

    /**
     * Tara koota (max 3): 3 for an auspicious category, else 0. Direction-sensitive.
     */
    public static int taraScore(Nakshatra a, Nakshatra b) {
        return tara(a, b).isAuspicious() ? Koota.TARA.maxScore() : 0;
    }

    /**
     * Returns the relationship class of the two yonis.
     */
    public static YoniRelationship yoniRelationship(Nakshatra a, Nakshatra b) {
        return YoniRelationship.ofScore(yoniScore(a, b));
    }

    /**
     * Yoni koota (max 4), symmetric.
     */
    public static int yoniScore(Nakshatra a, Nakshatra b) {
        return KootaTables.YONI[DomainTables.yoni(a).ordinal()][DomainTables.yoni(b).ordinal()];
    }

    /**
     * Combines the lords' directional relations into a mutual category.
     */
    public static MaitriCategory maitriCategory(Rashi a, Rashi b) {
        Planet lordA = DomainTables.lord(a);
        Planet lordB = DomainTables.lord(b);
        if (lordA == lordB) {
            return MaitriCategory.MUTUAL_FRIEND;
        }
        return combine(
                PlanetaryFriendship.relation(lordA, lordB),
                PlanetaryFriendship.relation(lordB, lordA)
        );
    }

    /**
     * Graha Maitri koota (max 5).
     */
    public static int grahaMaitriScore(Rashi a, Rashi b) {
        return maitriCategory(a, b).score();
    }

    /**
     * Gana koota (max 6), symmetric; Manushya with Rakshasa scores 1.
     */
    public static int ganaScore(Nakshatra a, Nakshatra b) {
        return KootaTables.GANA[DomainTables.gana(a).ordinal()][DomainTables.gana(b).ordinal()];
    }

    /**
     * Returns the Bhakoot affliction for {@code (a - b) mod 12}.
     */
    public static BhakootDosha bhakootDosha(Rashi a, Rashi b) {
        return BhakootDosha.ofDistance(requireRashi(a, "a").distanceFrom(requireRashi(b, "b")));
    }

    /**
     * Bhakoot koota (max 7): 0 for the 2/12, 5/9 and 6/8 placements, else 7.
     */
    public static int bhakootScore(Rashi a, Rashi b) {
        return bhakootDosha(a, b).isPresent() ? 0 : Koota.BHAKOOT.maxScore();
    }

    /**
     * Nadi koota (max 8): 0 when both nakshatras share a nadi.
     */
    public static int nadiScore(Nakshatra a, Nakshatra b) {
        return DomainTables.nadi(a) == DomainTables.nadi(b) ? 0 : Koota.NADI.maxScore();
    }

    /**
     * Scores all eight kootas for one pair.
     *
     * @param nakshatraA moon nakshatra of side A.
     * @param rashiA moon sign of side A.
     * @param nakshatraB moon nakshatra of side B.
     * @param rashiB moon sign of side B.
     * @return validated score vector.
     */
    public static KootaScoreVector scoreAll(Nakshatra nakshatraA, Rashi rashiA, Nakshatra nakshatraB, Rashi rashiB) {
        return KootaScoreVector.builder()
                .varna(varnaScore(rashiA, rashiB))
                .vashya(vashyaScore(rashiA, rashiB))
                .tara(taraScore(nakshatraA, nakshatraB))
                .yoni(yoniScore(nakshatraA, nakshatraB))
                .grahaMaitri(grahaMaitriScore(rashiA, rashiB))
                .gana(ganaScore(nakshatraA, nakshatraB))
                .bhakoot(bhakootScore(rashiA, rashiB))
                .nadi(nadiScore(nakshatraA, nakshatraB))
                .build();
    }

    /**
     * Builds the per-factor explanation backing {@link #scoreAll}.
     */
    public static KootaDetails explain(Nakshatra nakshatraA, Rashi rashiA, Nakshatra nakshatraB, Rashi rashiB) {
        return KootaDetails.builder()
                .varnaA(DomainTables.varna(rashiA))
                .varnaB(DomainTables.varna(rashiB))
                .tara(tara(nakshatraA, nakshatraB))
                .yoniA(DomainTables.yoni(nakshatraA))
                .yoniB(DomainTables.yoni(nakshatraB))
                .yoniRelationship(yoniRelationship(nakshatraA, nakshatraB))
                .lordA(DomainTables.lord(rashiA))
                .lordB(DomainTables.lord(rashiB))
                .maitriCategory(maitriCategory(rashiA, rashiB))
                .ganaA(DomainTables.gana(nakshatraA))
                .ganaB(DomainTables.gana(nakshatraB))
                .bhakootDosha(bhakootDosha(rashiA, rashiB))
                .nadiA(DomainTables.nadi(nakshatraA))
                .nadiB(DomainTables.nadi(nakshatraB))
                .build();
    }

    private static MaitriCategory combine(PlanetaryRelation forward, PlanetaryRelation backward) {
        int friends = count(forward, backward, PlanetaryRelation.FRIEND);
        int enemies = count(forward, backward, PlanetaryRelation.ENEMY);
        if (enemies == 2) {
            return MaitriCategory.MUTUAL_ENEMY;
        }
        if (enemies == 1) {
            return MaitriCategory.MIXED;
        }
        if (friends == 2) {
            return MaitriCategory.MUTUAL_FRIEND;
        }
        return friends == 1 ? MaitriCategory.ONE_SIDED : MaitriCategory.MUTUAL_NEUTRAL;
    }

    private static int count(PlanetaryRelation forward, PlanetaryRelation backward, PlanetaryRelation wanted) {
        return (forward == wanted ? 1 : 0) + (backward == wanted ? 1 : 0);
    }

    private static Rashi requireRashi(Rashi rashi, String side) {
        return Objects.requireNonNull(rashi, "rashi " + side);
    }

    private static Nakshatra requireNakshatra(Nakshatra nakshatra, String side) {
        return Objects.requireNonNull(nakshatra, "nakshatra " + side);
    }
}
