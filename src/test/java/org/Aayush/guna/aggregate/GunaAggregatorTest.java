package org.Aayush.guna.aggregate;

import org.Aayush.guna.core.TriState;
import org.Aayush.guna.koota.KootaScoreVector;
import org.Aayush.guna.koota.KootaScorers;
import org.Aayush.guna.koota.YoniRelationship;
import org.Aayush.guna.tables.Nakshatra;
import org.Aayush.guna.tables.Rashi;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Guna aggregator")
class GunaAggregatorTest {

    private final GunaAggregator aggregator = new GunaAggregator(AggregationPolicy.defaults());

    @Test
    @DisplayName("Verdict rejects totals outside [0, 36]")
    void testVerdictRange() {
        assertEquals(VerdictBand.GOOD, aggregator.verdict(25));
        assertThrows(IllegalArgumentException.class, () -> aggregator.verdict(-1));
        assertThrows(IllegalArgumentException.class, () -> aggregator.verdict(37));
    }

    @Test
    @DisplayName("Sexual incompatibility only for enemy yonis")
    void testSexualIncompatibility() {
        for (YoniRelationship relationship : YoniRelationship.values()) {
            assertEquals(relationship == YoniRelationship.ENEMY, GunaAggregator.sexualIncompatibility(relationship));
        }
    }

    @Test
    @DisplayName("Identical charts keep a severe Nadi dosha")
    void testIdenticalChartsSevere() {
        NadiAssessment nadi = assess(Nakshatra.ASHWINI, Rashi.ARIES, Nakshatra.ASHWINI, Rashi.ARIES);
        assertTrue(nadi.isDoshaPresent());
        assertEquals(NadiCancellation.NONE, nadi.getCancellation());
        assertTrue(nadi.isSevereNadiDosha());
    }

    @Test
    @DisplayName("Same sign with different nakshatra cancels Nadi dosha")
    void testSameRashiCancellation() {
        NadiAssessment nadi = assess(Nakshatra.ARDRA, Rashi.GEMINI, Nakshatra.PUNARVASU, Rashi.GEMINI);
        assertTrue(nadi.isDoshaPresent());
        assertEquals(NadiCancellation.SAME_RASHI_DIFFERENT_NAKSHATRA, nadi.getCancellation());
        assertFalse(nadi.isSevereNadiDosha());
    }

    @Test
    @DisplayName("Same nakshatra across a sign boundary cancels Nadi dosha")
    void testSameNakshatraCancellation() {
        NadiAssessment nadi = assess(Nakshatra.KRITTIKA, Rashi.ARIES, Nakshatra.KRITTIKA, Rashi.TAURUS);
        assertEquals(NadiCancellation.SAME_NAKSHATRA_DIFFERENT_RASHI, nadi.getCancellation());
    }

    @Test
    @DisplayName("High total guna cancels Nadi dosha at the configured threshold")
    void testHighTotalCancellation() {
        KootaScoreVector high = KootaScoreVector.builder()
                .varna(1).vashya(2).tara(3).yoni(4).grahaMaitri(5).gana(6).bhakoot(7).nadi(0).build();
        NadiAssessment nadi = aggregator.assessNadi(high, Nakshatra.ASHWINI, Rashi.ARIES, Nakshatra.MULA, Rashi.SAGITTARIUS);
        assertEquals(NadiCancellation.HIGH_TOTAL_GUNA, nadi.getCancellation());

        KootaScoreVector highWithoutFriends = KootaScoreVector.builder()
                .varna(1).vashya(2).tara(3).yoni(4).grahaMaitri(4).gana(6).bhakoot(7).nadi(0).build();
        GunaAggregator strict = new GunaAggregator(AggregationPolicy.builder().nadiCancellationMinTotal(28).build());
        assertEquals(27, highWithoutFriends.getTotalGuna());
        assertTrue(strict.assessNadi(highWithoutFriends, Nakshatra.ASHWINI, Rashi.ARIES, Nakshatra.MULA,
                Rashi.SAGITTARIUS).isSevereNadiDosha());
    }

    @Test
    @DisplayName("Mutually friendly sign lords across different signs cancel Nadi dosha")
    void testFriendlyLordsCancellation() {
        KootaScoreVector scores = KootaScorers.scoreAll(Nakshatra.ASHWINI, Rashi.ARIES, Nakshatra.MULA, Rashi.SAGITTARIUS);
        assertEquals(5, scores.getGrahaMaitri());
        assertEquals(10, scores.getTotalGuna());

        NadiAssessment nadi = aggregator.assessNadi(scores, Nakshatra.ASHWINI, Rashi.ARIES, Nakshatra.MULA, Rashi.SAGITTARIUS);
        assertTrue(nadi.isDoshaPresent());
        assertEquals(NadiCancellation.FRIENDLY_LORDS_DIFFERENT_RASHI, nadi.getCancellation());
        assertFalse(nadi.isSevereNadiDosha());

        EligibilityGate gate = aggregator.eligibility(scores.getTotalGuna(), nadi, TriState.UNKNOWN);
        assertEquals(List.of(EligibilityReason.BELOW_MINIMUM_SCORE), gate.getReasons());
    }

    @Test
    @DisplayName("Friendly lords never cancel within a shared sign")
    void testFriendlyLordsNeedDifferentSigns() {
        NadiAssessment identical = assess(Nakshatra.ASHWINI, Rashi.ARIES, Nakshatra.ASHWINI, Rashi.ARIES);
        assertEquals(NadiCancellation.NONE, identical.getCancellation());

        NadiAssessment hostile = assess(Nakshatra.ASHWINI, Rashi.ARIES, Nakshatra.ARDRA, Rashi.GEMINI);
        assertTrue(hostile.isSevereNadiDosha());
    }

    @Test
    @DisplayName("Disabled cancellation leaves every Nadi dosha severe")
    void testCancellationDisabled() {
        GunaAggregator noCancel = new GunaAggregator(AggregationPolicy.builder().nadiCancellationEnabled(false).build());
        KootaScoreVector scores = KootaScorers.scoreAll(Nakshatra.ARDRA, Rashi.GEMINI, Nakshatra.PUNARVASU, Rashi.GEMINI);
        NadiAssessment nadi = noCancel.assessNadi(scores, Nakshatra.ARDRA, Rashi.GEMINI, Nakshatra.PUNARVASU, Rashi.GEMINI);
        assertTrue(nadi.isSevereNadiDosha());
    }

    @Test
    @DisplayName("Different nadis carry no dosha")
    void testNoDosha() {
        NadiAssessment nadi = assess(Nakshatra.ASHWINI, Rashi.ARIES, Nakshatra.BHARANI, Rashi.ARIES);
        assertFalse(nadi.isDoshaPresent());
        assertFalse(nadi.isSevereNadiDosha());
    }

    @Test
    @DisplayName("Eligibility gate lists every applying reason")
    void testEligibility() {
        NadiAssessment severe = new NadiAssessment(true, NadiCancellation.NONE);
        EligibilityGate blocked = aggregator.eligibility(10, severe, TriState.TRUE);
        assertFalse(blocked.isEligible());
        assertEquals(List.of(
                EligibilityReason.BELOW_MINIMUM_SCORE,
                EligibilityReason.NADI_DOSHA_UNCANCELLED,
                EligibilityReason.MANGLIK_MISMATCH), blocked.getReasons());

        assertTrue(aggregator.eligibility(18, NadiAssessment.absent(), TriState.FALSE).isEligible());
        assertTrue(aggregator.eligibility(30, NadiAssessment.absent(), TriState.UNKNOWN).isEligible());
    }

    @Test
    @DisplayName("Manglik gate can be switched off")
    void testManglikGateDisabled() {
        GunaAggregator lenient = new GunaAggregator(AggregationPolicy.builder().manglikGateEnabled(false).build());
        assertTrue(lenient.eligibility(30, NadiAssessment.absent(), TriState.TRUE).isEligible());
    }

    @Test
    @DisplayName("Policy totals are range-checked")
    void testPolicyValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> AggregationPolicy.builder().eligibilityMinTotal(40).build());
        assertThrows(IllegalArgumentException.class,
                () -> AggregationPolicy.builder().nadiCancellationMinTotal(-1).build());
        AggregationPolicy defaults = AggregationPolicy.defaults();
        assertTrue(defaults.isNadiCancellationEnabled());
        assertTrue(defaults.isManglikGateEnabled());
        assertEquals(28, defaults.getNadiCancellationMinTotal());
        assertEquals(18, defaults.getEligibilityMinTotal());
    }

    private NadiAssessment assess(Nakshatra nakA, Rashi rashiA, Nakshatra nakB, Rashi rashiB) {
        return aggregator.assessNadi(KootaScorers.scoreAll(nakA, rashiA, nakB, rashiB), nakA, rashiA, nakB, rashiB);
    }
}
