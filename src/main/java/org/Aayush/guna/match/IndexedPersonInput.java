package org.Aayush.guna.match;

import lombok.Builder;
import lombok.Value;

/**
 * Raw index form of a person: nakshatra 0-26, rashi 0-11, house 1-12, planet 0-8.
 *
 * <p>Null means absent. Convert with {@link PersonVectorMapper}.</p>
 */
@Value
@Builder
public class IndexedPersonInput {
    String id;
    Integer moonNakshatra;
    Integer moonRashi;
    Integer ascendant;
    Integer marsHouse;
    Integer marsRashi;
    Integer jupiterHouse;
    Integer venusHouse;
    Integer saturnHouse;
    Integer dashaLord;
    Integer subDashaLord;
}
