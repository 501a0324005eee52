package org.Aayush.guna.tables;

/**
 * The 14 animal natures used by Yoni koota, index 0 (Horse) to 13 (Lion).
 */
public enum Yoni {
    HORSE,
    ELEPHANT,
    SHEEP,
    SERPENT,
    DOG,
    CAT,
    RAT,
    COW,
    BUFFALO,
    TIGER,
    DEER,
    MONKEY,
    MONGOOSE,
    LION;

    /** Number of yoni animals. */
    public static final int COUNT = 14;

    private static final Yoni[] VALUES = values();

    public int index() {
        return ordinal();
    }

    public static Yoni fromIndex(int index) {
        return VALUES[Names.requireIndex(index, COUNT, "yoni")];
    }
}
