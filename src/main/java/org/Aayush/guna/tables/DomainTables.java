package org.Aayush.guna.tables;

import lombok.experimental.UtilityClass;

import java.util.Objects;

/**
 * Frozen nakshatra and rashi attribute tables.
 *
 * <p>Tables are indexed by enum ordinal, verified for completeness once during class
 * initialization and never exposed as arrays. Both accessors are total over their
 * domains and safe for unsynchronized concurrent reads.</p>
 */
@UtilityClass
public final class DomainTables {

    // Ashwini .. Revati
    private static final Gana[] NAKSHATRA_GANA = TableChecks.requireComplete(new Gana[]{
            Gana.DEVA, Gana.MANUSHYA, Gana.RAKSHASA, Gana.MANUSHYA, Gana.DEVA,
            Gana.MANUSHYA, Gana.DEVA, Gana.DEVA, Gana.RAKSHASA,
            Gana.RAKSHASA, Gana.MANUSHYA, Gana.MANUSHYA, Gana.DEVA, Gana.RAKSHASA,
            Gana.DEVA, Gana.RAKSHASA, Gana.DEVA, Gana.RAKSHASA,
            Gana.RAKSHASA, Gana.MANUSHYA, Gana.MANUSHYA, Gana.DEVA, Gana.RAKSHASA,
            Gana.RAKSHASA, Gana.MANUSHYA, Gana.MANUSHYA, Gana.DEVA
    }, Nakshatra.COUNT, "NAKSHATRA_GANA");

    // Boustrophedon: runs forward, then backward, in blocks of three.
    private static final Nadi[] NAKSHATRA_NADI = TableChecks.requireComplete(new Nadi[]{
            Nadi.AADI, Nadi.MADHYA, Nadi.ANTYA, Nadi.ANTYA, Nadi.MADHYA,
            Nadi.AADI, Nadi.AADI, Nadi.MADHYA, Nadi.ANTYA,
            Nadi.ANTYA, Nadi.MADHYA, Nadi.AADI, Nadi.AADI, Nadi.MADHYA,
            Nadi.ANTYA, Nadi.ANTYA, Nadi.MADHYA, Nadi.AADI,
            Nadi.AADI, Nadi.MADHYA, Nadi.ANTYA, Nadi.ANTYA, Nadi.MADHYA,
            Nadi.AADI, Nadi.AADI, Nadi.MADHYA, Nadi.ANTYA
    }, Nakshatra.COUNT, "NAKSHATRA_NADI");

    private static final Yoni[] NAKSHATRA_YONI = TableChecks.requireComplete(new Yoni[]{
            Yoni.HORSE, Yoni.ELEPHANT, Yoni.SHEEP, Yoni.SERPENT, Yoni.SERPENT, Yoni.DOG,
            Yoni.CAT, Yoni.SHEEP, Yoni.CAT, Yoni.RAT, Yoni.RAT, Yoni.COW,
            Yoni.BUFFALO, Yoni.TIGER, Yoni.BUFFALO, Yoni.TIGER, Yoni.DEER, Yoni.DEER,
            Yoni.DOG, Yoni.MONKEY, Yoni.MONGOOSE, Yoni.MONKEY, Yoni.LION, Yoni.HORSE,
            Yoni.LION, Yoni.COW, Yoni.ELEPHANT
    }, Nakshatra.COUNT, "NAKSHATRA_YONI");

    // Fire signs Kshatriya, earth Vaishya, air Shudra, water Brahmin.
    private static final Varna[] RASHI_VARNA = TableChecks.requireComplete(new Varna[]{
            Varna.KSHATRIYA, Varna.VAISHYA, Varna.SHUDRA, Varna.BRAHMIN,
            Varna.KSHATRIYA, Varna.VAISHYA, Varna.SHUDRA, Varna.BRAHMIN,
            Varna.KSHATRIYA, Varna.VAISHYA, Varna.SHUDRA, Varna.BRAHMIN
    }, Rashi.COUNT, "RASHI_VARNA");

    private static final Planet[] RASHI_LORD = TableChecks.requireComplete(new Planet[]{
            Planet.MARS, Planet.VENUS, Planet.MERCURY, Planet.MOON,
            Planet.SUN, Planet.MERCURY, Planet.VENUS, Planet.MARS,
            Planet.JUPITER, Planet.SATURN, Planet.SATURN, Planet.JUPITER
    }, Rashi.COUNT, "RASHI_LORD");

    private static final NakshatraAttributes[] NAKSHATRA_ATTRIBUTES = buildNakshatraAttributes();
    private static final RashiAttributes[] RASHI_ATTRIBUTES = buildRashiAttributes();

    /**
     * Returns gana, nadi and yoni of a nakshatra.
     *
     * @param nakshatra moon nakshatra.
     * @return attribute tuple; never null.
     */
    public static NakshatraAttributes nakshatraAttributes(Nakshatra nakshatra) {
        return NAKSHATRA_ATTRIBUTES[Objects.requireNonNull(nakshatra, "nakshatra").ordinal()];
    }

    /**
     * Returns varna and ruling planet of a sign.
     *
     * @param rashi moon sign.
     * @return attribute tuple; never null.
     */
    public static RashiAttributes rashiAttributes(Rashi rashi) {
        return RASHI_ATTRIBUTES[Objects.requireNonNull(rashi, "rashi").ordinal()];
    }

    public static Gana gana(Nakshatra nakshatra) {
        return nakshatraAttributes(nakshatra).gana();
    }

    public static Nadi nadi(Nakshatra nakshatra) {
        return nakshatraAttributes(nakshatra).nadi();
    }

    public static Yoni yoni(Nakshatra nakshatra) {
        return nakshatraAttributes(nakshatra).yoni();
    }

    public static Varna varna(Rashi rashi) {
        return rashiAttributes(rashi).varna();
    }

    public static Planet lord(Rashi rashi) {
        return rashiAttributes(rashi).lord();
    }

    private static NakshatraAttributes[] buildNakshatraAttributes() {
        NakshatraAttributes[] attributes = new NakshatraAttributes[Nakshatra.COUNT];
        for (int i = 0; i < Nakshatra.COUNT; i++) {
            attributes[i] = new NakshatraAttributes(NAKSHATRA_GANA[i], NAKSHATRA_NADI[i], NAKSHATRA_YONI[i]);
        }
        return attributes;
    }

    private static RashiAttributes[] buildRashiAttributes() {
        RashiAttributes[] attributes = new RashiAttributes[Rashi.COUNT];
        for (int i = 0; i < Rashi.COUNT; i++) {
            if (RASHI_LORD[i].isNode()) {
                throw new TableConfigurationException(
                        TableConfigurationException.REASON_TABLE_VALUE_OUT_OF_RANGE,
                        "RASHI_LORD[" + i + "] must not be a lunar node"
                );
            }
            attributes[i] = new RashiAttributes(RASHI_VARNA[i], RASHI_LORD[i]);
        }
        return attributes;
    }
}
