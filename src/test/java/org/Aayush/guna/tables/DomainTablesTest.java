package org.Aayush.guna.tables;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Domain attribute tables")
class DomainTablesTest {

    @Test
    @DisplayName("Totality: every nakshatra and rashi maps to a full attribute tuple")
    void testTotality() {
        for (Nakshatra nakshatra : Nakshatra.values()) {
            NakshatraAttributes attributes = DomainTables.nakshatraAttributes(nakshatra);
            assertNotNull(attributes.gana(), nakshatra.name());
            assertNotNull(attributes.nadi(), nakshatra.name());
            assertNotNull(attributes.yoni(), nakshatra.name());
        }
        for (Rashi rashi : Rashi.values()) {
            RashiAttributes attributes = DomainTables.rashiAttributes(rashi);
            assertNotNull(attributes.varna(), rashi.name());
            assertFalse(attributes.lord().isNode(), rashi.name());
        }
    }

    @Test
    @DisplayName("Gana and Nadi each split the nakshatras into three groups of nine")
    void testBalancedGroups() {
        Map<Gana, Integer> ganas = new EnumMap<>(Gana.class);
        Map<Nadi, Integer> nadis = new EnumMap<>(Nadi.class);
        for (Nakshatra nakshatra : Nakshatra.values()) {
            ganas.merge(DomainTables.gana(nakshatra), 1, Integer::sum);
            nadis.merge(DomainTables.nadi(nakshatra), 1, Integer::sum);
        }
        for (Gana gana : Gana.values()) {
            assertEquals(9, ganas.get(gana), gana.name());
        }
        for (Nadi nadi : Nadi.values()) {
            assertEquals(9, nadis.get(nadi), nadi.name());
        }
    }

    @Test
    @DisplayName("Every yoni pairs two nakshatras except the Mongoose")
    void testYoniCoverage() {
        Map<Yoni, Integer> yonis = new EnumMap<>(Yoni.class);
        for (Nakshatra nakshatra : Nakshatra.values()) {
            yonis.merge(DomainTables.yoni(nakshatra), 1, Integer::sum);
        }
        assertEquals(Yoni.COUNT, yonis.size());
        for (Yoni yoni : Yoni.values()) {
            assertEquals(yoni == Yoni.MONGOOSE ? 1 : 2, yonis.get(yoni), yoni.name());
        }
    }

    @Test
    @DisplayName("Spot checks against the classical assignments")
    void testClassicalAssignments() {
        assertEquals(new NakshatraAttributes(Gana.DEVA, Nadi.AADI, Yoni.HORSE),
                DomainTables.nakshatraAttributes(Nakshatra.ASHWINI));
        assertEquals(new NakshatraAttributes(Gana.MANUSHYA, Nadi.MADHYA, Yoni.ELEPHANT),
                DomainTables.nakshatraAttributes(Nakshatra.BHARANI));
        assertEquals(new NakshatraAttributes(Gana.RAKSHASA, Nadi.ANTYA, Yoni.RAT),
                DomainTables.nakshatraAttributes(Nakshatra.MAGHA));
        assertEquals(new NakshatraAttributes(Gana.RAKSHASA, Nadi.AADI, Yoni.DOG),
                DomainTables.nakshatraAttributes(Nakshatra.MULA));
        assertEquals(new NakshatraAttributes(Gana.DEVA, Nadi.ANTYA, Yoni.ELEPHANT),
                DomainTables.nakshatraAttributes(Nakshatra.REVATI));
        assertEquals(Yoni.MONGOOSE, DomainTables.yoni(Nakshatra.UTTARA_ASHADHA));

        assertEquals(new RashiAttributes(Varna.KSHATRIYA, Planet.MARS), DomainTables.rashiAttributes(Rashi.ARIES));
        assertEquals(new RashiAttributes(Varna.BRAHMIN, Planet.MOON), DomainTables.rashiAttributes(Rashi.CANCER));
        assertEquals(new RashiAttributes(Varna.SHUDRA, Planet.SATURN), DomainTables.rashiAttributes(Rashi.AQUARIUS));
        assertEquals(Planet.MERCURY, DomainTables.lord(Rashi.VIRGO));
        assertEquals(Varna.VAISHYA, DomainTables.varna(Rashi.CAPRICORN));
    }

    @Test
    @DisplayName("Null lookups are rejected")
    void testNullLookup() {
        assertThrows(NullPointerException.class, () -> DomainTables.nakshatraAttributes(null));
        assertThrows(NullPointerException.class, () -> DomainTables.rashiAttributes(null));
    }
}
