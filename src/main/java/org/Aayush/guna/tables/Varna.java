package org.Aayush.guna.tables;

/**
 * Varna class of a moon sign, declared in ascending rank order.
 */
public enum Varna {
    SHUDRA,
    VAISHYA,
    KSHATRIYA,
    BRAHMIN;

    private static final Varna[] VALUES = values();

    /**
     * Returns the rank, {@code 0} (Shudra) to {@code 3} (Brahmin).
     */
    public int rank() {
        return ordinal();
    }

    public int index() {
        return ordinal();
    }

    public static Varna fromIndex(int index) {
        return VALUES[Names.requireIndex(index, VALUES.length, "varna")];
    }
}
