package org.Aayush.guna.dasha;

import org.Aayush.guna.core.IncompleteInputWarning;
import org.Aayush.guna.core.TriState;
import org.Aayush.guna.tables.Planet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Dasha synchronisation")
class DashaAnalyzerTest {

    @Test
    @DisplayName("Phase follows the lords' mutual friendship")
    void testPhase() {
        assertEquals(DashaPhase.SAME, DashaAnalyzer.phase(Planet.SUN, Planet.SUN));
        assertEquals(DashaPhase.SUPPORTIVE, DashaAnalyzer.phase(Planet.SUN, Planet.MOON));
        assertEquals(DashaPhase.SUPPORTIVE, DashaAnalyzer.phase(Planet.SUN, Planet.MERCURY));
        assertEquals(DashaPhase.NEUTRAL, DashaAnalyzer.phase(Planet.JUPITER, Planet.SATURN));
        assertEquals(DashaPhase.CONFLICTING, DashaAnalyzer.phase(Planet.SUN, Planet.SATURN));
        assertEquals(DashaPhase.CONFLICTING, DashaAnalyzer.phase(Planet.MOON, Planet.SATURN));
        assertEquals(DashaPhase.CONFLICTING, DashaAnalyzer.phase(Planet.RAHU, Planet.SUN));
    }

    @Test
    @DisplayName("Phase is symmetric")
    void testPhaseSymmetry() {
        for (Planet a : Planet.values()) {
            for (Planet b : Planet.values()) {
                assertEquals(DashaAnalyzer.phase(a, b), DashaAnalyzer.phase(b, a), a + "/" + b);
            }
        }
    }

    @Test
    @DisplayName("Alignment scores rank harmony above neutrality above conflict")
    void testAlignmentScores() {
        assertEquals(2, DashaPhase.SAME.alignmentScore());
        assertEquals(2, DashaPhase.SUPPORTIVE.alignmentScore());
        assertEquals(1, DashaPhase.NEUTRAL.alignmentScore());
        assertEquals(0, DashaPhase.CONFLICTING.alignmentScore());
    }

    @Test
    @DisplayName("Supportive major and sub periods signal growth")
    void testGrowth() {
        DashaSync sync = DashaAnalyzer.sync(Planet.SUN, Planet.MARS, Planet.JUPITER, Planet.MOON);
        assertEquals(DashaPhase.SUPPORTIVE, sync.getMahaPhase());
        assertEquals(DashaPhase.SUPPORTIVE, sync.getSubPhase());
        assertEquals(2, sync.getAlignmentScore().intValue());
        assertEquals(TriState.TRUE, sync.getGrowth());
        assertEquals(TriState.FALSE, sync.getConflict());
        assertTrue(sync.getWarnings().isEmpty());
    }

    @Test
    @DisplayName("A hostile sub period blocks growth without creating conflict")
    void testHostileSubPeriod() {
        DashaSync sync = DashaAnalyzer.sync(Planet.SUN, Planet.SUN, Planet.MOON, Planet.SATURN);
        assertEquals(TriState.FALSE, sync.getGrowth());
        assertEquals(TriState.FALSE, sync.getConflict());
    }

    @Test
    @DisplayName("Neutral major period with hostile sub period is a conflict")
    void testNeutralWithHostileSub() {
        DashaSync sync = DashaAnalyzer.sync(Planet.JUPITER, Planet.SUN, Planet.SATURN, Planet.SATURN);
        assertEquals(DashaPhase.NEUTRAL, sync.getMahaPhase());
        assertEquals(TriState.TRUE, sync.getConflict());
        assertEquals(TriState.FALSE, sync.getGrowth());
    }

    @Test
    @DisplayName("Hostile major period is a conflict")
    void testHostileMajor() {
        DashaSync sync = DashaAnalyzer.sync(Planet.VENUS, Planet.VENUS, Planet.SUN, Planet.VENUS);
        assertEquals(DashaPhase.CONFLICTING, sync.getMahaPhase());
        assertEquals(TriState.TRUE, sync.getConflict());
    }

    @Test
    @DisplayName("Missing major lords leave both flags unknown")
    void testMissingMajorLord() {
        DashaSync sync = DashaAnalyzer.sync(null, null, Planet.SUN, null);
        assertEquals(TriState.UNKNOWN, sync.getGrowth());
        assertEquals(TriState.UNKNOWN, sync.getConflict());
        assertNull(sync.getMahaPhase());
        assertNull(sync.getAlignmentScore());
        assertEquals("person_a.dasha_lord", sync.getWarnings().get(0).field());
    }

    @Test
    @DisplayName("Missing sub lords skip the sub period refinement")
    void testMissingSubLord() {
        DashaSync sync = DashaAnalyzer.sync(Planet.SUN, Planet.MARS, Planet.MOON, null);
        assertNull(sync.getSubPhase());
        assertEquals(TriState.TRUE, sync.getGrowth());
        assertEquals(TriState.FALSE, sync.getConflict());
        assertEquals("person_b.sub_dasha_lord", sync.getWarnings().get(0).field());
        assertEquals(1, sync.getWarnings().size());
        assertEquals(2, sync.getAlignmentScore().intValue());
    }

    @Test
    @DisplayName("Each missing sub lord gets its own warning")
    void testBothSubLordsMissing() {
        DashaSync sync = DashaAnalyzer.sync(Planet.SUN, null, Planet.SATURN, null);
        assertEquals(DashaPhase.CONFLICTING, sync.getMahaPhase());
        assertEquals(0, sync.getAlignmentScore().intValue());
        assertEquals(List.of("person_a.sub_dasha_lord", "person_b.sub_dasha_lord"),
                sync.getWarnings().stream().map(IncompleteInputWarning::field).collect(Collectors.toList()));
    }
}
