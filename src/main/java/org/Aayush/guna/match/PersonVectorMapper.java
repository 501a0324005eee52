package org.Aayush.guna.match;

import lombok.experimental.UtilityClass;
import org.Aayush.guna.tables.House;
import org.Aayush.guna.tables.Nakshatra;
import org.Aayush.guna.tables.Planet;
import org.Aayush.guna.tables.Rashi;

import java.util.function.IntFunction;

/**
 * Converts raw index input into a typed {@link PersonVector}.
 *
 * <p>Absent fields stay absent; presence of mandatory fields is checked later by the
 * match engine. Any present index outside its domain fails with
 * {@link MatchValidationException#REASON_FIELD_OUT_OF_DOMAIN}.</p>
 */
@UtilityClass
public final class PersonVectorMapper {

    /**
     * Maps one person.
     *
     * @param input raw indices.
     * @param role field prefix used in errors, e.g. {@code person_a}.
     * @return typed person vector.
     */
    public static PersonVector toPersonVector(IndexedPersonInput input, String role) {
        if (input == null) {
            throw new MatchValidationException(
                    MatchValidationException.REASON_PERSON_REQUIRED, role, "person must be provided");
        }
        return PersonVector.builder()
                .id(input.getId())
                .moonNakshatra(map(input.getMoonNakshatra(), role, "moon_nakshatra", Nakshatra::fromIndex))
                .moonRashi(map(input.getMoonRashi(), role, "moon_rashi", Rashi::fromIndex))
                .ascendant(map(input.getAscendant(), role, "ascendant", Rashi::fromIndex))
                .marsHouse(map(input.getMarsHouse(), role, "mars_house", House::of))
                .marsRashi(map(input.getMarsRashi(), role, "mars_rashi", Rashi::fromIndex))
                .jupiterHouse(map(input.getJupiterHouse(), role, "jupiter_house", House::of))
                .venusHouse(map(input.getVenusHouse(), role, "venus_house", House::of))
                .saturnHouse(map(input.getSaturnHouse(), role, "saturn_house", House::of))
                .dashaLord(map(input.getDashaLord(), role, "dasha_lord", Planet::fromIndex))
                .subDashaLord(map(input.getSubDashaLord(), role, "sub_dasha_lord", Planet::fromIndex))
                .build();
    }

    private static <T> T map(Integer raw, String role, String field, IntFunction<T> resolver) {
        if (raw == null) {
            return null;
        }
        try {
            return resolver.apply(raw);
        } catch (IllegalArgumentException ex) {
            throw new MatchValidationException(
                    MatchValidationException.REASON_FIELD_OUT_OF_DOMAIN,
                    role + "." + field,
                    "index " + raw + " is outside its domain",
                    ex
            );
        }
    }
}
