package org.Aayush.guna.match;

import lombok.Builder;
import lombok.Value;
import org.Aayush.guna.dosha.ManglikChart;
import org.Aayush.guna.tables.House;
import org.Aayush.guna.tables.Nakshatra;
import org.Aayush.guna.tables.Planet;
import org.Aayush.guna.tables.Rashi;

/**
 * Chart indices of one person, as produced by an external ephemeris adapter.
 *
 * <p>Moon nakshatra, moon sign and ascendant are mandatory for matching; every other
 * field is optional and only downgrades the flags that depend on it.</p>
 */
@Value
@Builder(toBuilder = true)
public class PersonVector {
    /** Caller id; required only in batches. */
    String id;
    Nakshatra moonNakshatra;
    Rashi moonRashi;
    /** Lagna sign. */
    Rashi ascendant;
    /** Mars house counted from the ascendant. */
    House marsHouse;
    /** Sign occupied by Mars, read by the sign-based Manglik cancellations. */
    Rashi marsRashi;
    House jupiterHouse;
    House venusHouse;
    House saturnHouse;
    /** Running major period lord. */
    Planet dashaLord;
    /** Running sub period lord. */
    Planet subDashaLord;

    ManglikChart manglikChart() {
        return ManglikChart.builder()
                .ascendant(ascendant)
                .moonRashi(moonRashi)
                .marsHouse(marsHouse)
                .marsRashi(marsRashi)
                .venusHouse(venusHouse)
                .jupiterHouse(jupiterHouse)
                .build();
    }
}
