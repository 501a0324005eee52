package org.Aayush.guna.tables;

import lombok.experimental.UtilityClass;

import java.util.Locale;
import java.util.Map;

/**
 * Name normalization shared by the display-name lookups of the finite domains.
 */
@UtilityClass
final class Names {

    /**
     * Lower-cases and strips spaces, underscores, hyphens and apostrophes.
     */
    static String normalize(String name) {
        if (name == null) {
            return "";
        }
        StringBuilder builder = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == ' ' || c == '_' || c == '-' || c == '\'') {
                continue;
            }
            builder.append(c);
        }
        return builder.toString().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a normalized name against an alias index.
     *
     * @throws IllegalArgumentException when the name is unknown.
     */
    static <E extends Enum<E>> E resolve(Map<String, E> index, String name, String domain) {
        E value = index.get(normalize(name));
        if (value == null) {
            throw new IllegalArgumentException("unknown " + domain + " name: " + name);
        }
        return value;
    }

    /**
     * Validates a zero-based index against a domain size.
     *
     * @throws IllegalArgumentException when the index is out of domain.
     */
    static int requireIndex(int index, int size, String domain) {
        if (index < 0 || index >= size) {
            throw new IllegalArgumentException(
                    domain + " index must be in [0, " + (size - 1) + "], got " + index
            );
        }
        return index;
    }
}
