package org.Aayush.guna.dosha;

import org.Aayush.guna.core.IncompleteInputWarning;
import org.Aayush.guna.tables.House;
import org.Aayush.guna.tables.Rashi;

import java.util.Objects;

/**
 * Manglik (Kuja) dosha detection, cancellation and mutual matching.
 *
 * <p>Detection counts the Mars house from each configured reference; cancellation rules
 * run in {@link ManglikCancellation} declaration order and the first one that applies
 * wins. Immutable and safe for concurrent use.</p>
 */
public final class ManglikAnalyzer {
    /** Penalty applied by callers that opt in when final statuses differ. */
    public static final int MANGLIK_MISMATCH_PENALTY = 10;

    static final String FIELD_MARS_HOUSE = "mars_house";
    static final String FIELD_MARS_RASHI = "mars_rashi";
    static final String FIELD_VENUS_HOUSE = "venus_house";
    static final String FIELD_MOON_RASHI = "moon_rashi";

    private final ManglikPolicy policy;

    public ManglikAnalyzer(ManglikPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * Returns whether a house counted from the ascendant is a Manglik house (1, 2, 4, 7, 8, 12).
     */
    public static boolean isManglik(House house) {
        return switch (Objects.requireNonNull(house, "house")) {
            case FIRST, SECOND, FOURTH, SEVENTH, EIGHTH, TWELFTH -> true;
            default -> false;
        };
    }

    /**
     * Returns whether Mars is Manglik when its house is counted from {@code referenceHouse}.
     */
    public static boolean relativeManglik(House marsHouse, House referenceHouse) {
        return isManglik(marsHouse.countedFrom(referenceHouse));
    }

    /**
     * Sign-based cancellation rules.
     *
     * @param marsHouse Mars house from the ascendant.
     * @param marsRashi sign occupied by Mars.
     * @param lagnaRashi ascendant sign.
     * @return first applying rule, or {@link ManglikCancellation#NONE}.
     */
    public static ManglikCancellation cancellation(House marsHouse, Rashi marsRashi, Rashi lagnaRashi) {
        Objects.requireNonNull(marsRashi, "marsRashi");
        if (marsRashi == Rashi.ARIES || marsRashi == Rashi.SCORPIO) {
            return ManglikCancellation.OWN_SIGN;
        }
        if (marsRashi == Rashi.CAPRICORN) {
            return ManglikCancellation.EXALTED;
        }
        if (marsRashi == Rashi.CANCER) {
            return ManglikCancellation.DEBILITATED;
        }
        if (marsHouse == House.FIRST && marsRashi == lagnaRashi) {
            return ManglikCancellation.MARS_IN_LAGNA_SIGN;
        }
        return ManglikCancellation.NONE;
    }

    /**
     * Returns the fixed penalty when the final statuses differ, else 0. Never gates a match.
     */
    public static int manglikPenalty(boolean manglikA, boolean manglikB) {
        return manglikA != manglikB ? MANGLIK_MISMATCH_PENALTY : 0;
    }

    /**
     * Assesses one chart.
     *
     * @param chart chart positions; the ascendant is required.
     * @return assessment, {@link ManglikStatus#UNKNOWN} when the Mars house is absent.
     */
    public ManglikAssessment assess(ManglikChart chart) {
        Objects.requireNonNull(chart, "chart");
        Rashi ascendant = Objects.requireNonNull(chart.getAscendant(), "ascendant");
        ManglikAssessment.ManglikAssessmentBuilder result = ManglikAssessment.builder()
                .cancellation(ManglikCancellation.NONE);

        House marsHouse = chart.getMarsHouse();
        if (marsHouse == null) {
            return result.status(ManglikStatus.UNKNOWN)
                    .warning(new IncompleteInputWarning(FIELD_MARS_HOUSE, "Manglik status not computed"))
                    .build();
        }

        boolean raw = false;
        if (isManglik(marsHouse)) {
            result.flaggedReference(ManglikReference.LAGNA);
            raw = true;
        }
        if (policy.effectiveReferencePolicy() == ManglikReferencePolicy.ANY_REFERENCE) {
            if (chart.getMoonRashi() != null) {
                if (relativeManglik(marsHouse, House.ofSign(chart.getMoonRashi(), ascendant))) {
                    result.flaggedReference(ManglikReference.MOON);
                    raw = true;
                }
            } else {
                result.warning(new IncompleteInputWarning(FIELD_MOON_RASHI, "Moon-referenced Manglik check skipped"));
            }
            if (chart.getVenusHouse() != null) {
                if (relativeManglik(marsHouse, chart.getVenusHouse())) {
                    result.flaggedReference(ManglikReference.VENUS);
                    raw = true;
                }
            } else {
                result.warning(new IncompleteInputWarning(FIELD_VENUS_HOUSE, "Venus-referenced Manglik check skipped"));
            }
        }
        if (!raw) {
            return result.status(ManglikStatus.NONE).build();
        }

        ManglikCancellation applied = ManglikCancellation.NONE;
        if (chart.getMarsRashi() != null) {
            applied = cancellation(marsHouse, chart.getMarsRashi(), ascendant);
        } else {
            result.warning(new IncompleteInputWarning(FIELD_MARS_RASHI, "sign-based Manglik cancellation skipped"));
        }
        if (applied == ManglikCancellation.NONE
                && policy.isJupiterConjunctionCancels()
                && chart.getJupiterHouse() == marsHouse) {
            applied = ManglikCancellation.JUPITER_CONJUNCTION;
        }
        return result.cancellation(applied)
                .status(applied == ManglikCancellation.NONE ? ManglikStatus.ACTIVE : ManglikStatus.CANCELLED)
                .build();
    }

    /**
     * Assesses both charts and pairs their final statuses.
     */
    public ManglikMatch matchManglik(ManglikChart a, ManglikChart b) {
        return matchManglik(assess(a), assess(b));
    }

    /**
     * Pairs two existing assessments.
     */
    public static ManglikMatch matchManglik(ManglikAssessment a, ManglikAssessment b) {
        return new ManglikMatch(Objects.requireNonNull(a, "a"), Objects.requireNonNull(b, "b"));
    }
}
