package org.Aayush.guna.koota;

import org.Aayush.guna.tables.Gana;
import org.Aayush.guna.tables.Rashi;
import org.Aayush.guna.tables.TableChecks;
import org.Aayush.guna.tables.TableConfigurationException;
import org.Aayush.guna.tables.Yoni;

/**
 * Symmetric pair matrices backing the table-driven kootas.
 *
 * <p>Each matrix is checked for shape, symmetry and value range when this class is
 * loaded. Arrays never leave the package.</p>
 */
final class KootaTables {

    // Aries .. Pisces
    static final int[][] VASHYA = verify(new int[][]{
            {2, 1, 0, 0, 0, 1, 0, 0, 1, 1, 0, 0},
            {1, 2, 1, 0, 1, 1, 0, 0, 0, 1, 0, 0},
            {0, 1, 2, 1, 0, 1, 1, 0, 0, 0, 1, 0},
            {0, 0, 1, 2, 0, 0, 1, 0, 0, 0, 0, 1},
            {0, 1, 0, 0, 2, 1, 0, 1, 0, 0, 0, 0},
            {1, 1, 1, 0, 1, 2, 1, 0, 0, 1, 0, 0},
            {0, 0, 1, 1, 0, 1, 2, 0, 0, 0, 1, 0},
            {0, 0, 0, 0, 1, 0, 0, 2, 1, 0, 0, 0},
            {1, 0, 0, 0, 0, 0, 0, 1, 2, 1, 0, 0},
            {1, 1, 0, 0, 0, 1, 0, 0, 1, 2, 0, 0},
            {0, 0, 1, 0, 0, 0, 1, 0, 0, 0, 2, 1},
            {0, 0, 0, 1, 0, 0, 0, 0, 0, 0, 1, 2}
    }, Rashi.COUNT, Koota.VASHYA.maxScore(), "VASHYA");

    // Horse, Elephant, Sheep, Serpent, Dog, Cat, Rat, Cow, Buffalo, Tiger, Deer, Monkey, Mongoose, Lion
    static final int[][] YONI = verify(new int[][]{
            {4, 2, 2, 3, 2, 2, 2, 1, 0, 1, 3, 3, 2, 1},
            {2, 4, 3, 3, 2, 2, 2, 2, 3, 1, 2, 3, 2, 0},
            {2, 3, 4, 2, 1, 2, 1, 3, 3, 1, 2, 0, 3, 1},
            {3, 3, 2, 4, 2, 1, 1, 1, 1, 2, 2, 2, 0, 2},
            {2, 2, 1, 2, 4, 2, 1, 2, 2, 1, 0, 2, 1, 1},
            {2, 2, 2, 1, 2, 4, 0, 2, 2, 1, 3, 3, 2, 1},
            {2, 2, 1, 1, 1, 0, 4, 2, 2, 2, 2, 2, 1, 2},
            {1, 2, 3, 1, 2, 2, 2, 4, 3, 0, 3, 2, 2, 1},
            {0, 3, 3, 1, 2, 2, 2, 3, 4, 1, 2, 2, 2, 1},
            {1, 1, 1, 2, 1, 1, 2, 0, 1, 4, 1, 1, 2, 1},
            {3, 2, 2, 2, 0, 3, 2, 3, 2, 1, 4, 2, 2, 1},
            {3, 3, 0, 2, 2, 3, 2, 2, 2, 1, 2, 4, 3, 2},
            {2, 2, 3, 0, 1, 2, 1, 2, 2, 2, 2, 3, 4, 2},
            {1, 0, 1, 2, 1, 1, 2, 1, 1, 1, 1, 2, 2, 4}
    }, Yoni.COUNT, Koota.YONI.maxScore(), "YONI");

    // Deva, Manushya, Rakshasa
    static final int[][] GANA = verify(new int[][]{
            {6, 5, 1},
            {5, 6, 1},
            {1, 1, 6}
    }, Gana.values().length, Koota.GANA.maxScore(), "GANA");

    static {
        for (int i = 0; i < Yoni.COUNT; i++) {
            for (int j = 0; j < Yoni.COUNT; j++) {
                if ((YONI[i][j] == Koota.YONI.maxScore()) != (i == j)) {
                    throw new TableConfigurationException(
                            TableConfigurationException.REASON_TABLE_VALUE_OUT_OF_RANGE,
                            "YONI[" + i + "][" + j + "]: only identical yonis may score "
                                    + Koota.YONI.maxScore()
                    );
                }
            }
        }
    }

    private KootaTables() {
    }

    private static int[][] verify(int[][] matrix, int size, int max, String name) {
        TableChecks.requireSquare(matrix, size, name);
        TableChecks.requireSymmetric(matrix, name);
        return TableChecks.requireRange(matrix, 0, max, name);
    }
}
