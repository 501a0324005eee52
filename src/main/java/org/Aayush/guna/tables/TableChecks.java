package org.Aayush.guna.tables;

import lombok.experimental.UtilityClass;

/**
 * Class-initialization checks for frozen lookup tables.
 *
 * <p>Every check throws {@link TableConfigurationException}; callers invoke them from
 * static initializers so a malformed table fails class loading instead of producing
 * a wrong score.</p>
 */
@UtilityClass
public final class TableChecks {

    /**
     * Requires a one-dimensional table with exactly {@code size} non-null entries.
     */
    public static <T> T[] requireComplete(T[] table, int size, String tableName) {
        if (table == null || table.length != size) {
            throw new TableConfigurationException(
                    TableConfigurationException.REASON_TABLE_INCOMPLETE,
                    tableName + " must have " + size + " entries, got "
                            + (table == null ? "null" : String.valueOf(table.length))
            );
        }
        for (int i = 0; i < size; i++) {
            if (table[i] == null) {
                throw new TableConfigurationException(
                        TableConfigurationException.REASON_TABLE_INCOMPLETE,
                        tableName + " has no entry for index " + i
                );
            }
        }
        return table;
    }

    /**
     * Requires a {@code size x size} matrix.
     */
    public static int[][] requireSquare(int[][] matrix, int size, String tableName) {
        if (matrix == null || matrix.length != size) {
            throw new TableConfigurationException(
                    TableConfigurationException.REASON_TABLE_INCOMPLETE,
                    tableName + " must have " + size + " rows"
            );
        }
        for (int row = 0; row < size; row++) {
            if (matrix[row] == null || matrix[row].length != size) {
                throw new TableConfigurationException(
                        TableConfigurationException.REASON_TABLE_INCOMPLETE,
                        tableName + " row " + row + " must have " + size + " columns"
                );
            }
        }
        return matrix;
    }

    /**
     * Requires {@code matrix[i][j] == matrix[j][i]} for every cell.
     */
    public static int[][] requireSymmetric(int[][] matrix, String tableName) {
        for (int row = 0; row < matrix.length; row++) {
            for (int col = row + 1; col < matrix.length; col++) {
                if (matrix[row][col] != matrix[col][row]) {
                    throw new TableConfigurationException(
                            TableConfigurationException.REASON_TABLE_ASYMMETRIC,
                            tableName + "[" + row + "][" + col + "]=" + matrix[row][col]
                                    + " differs from [" + col + "][" + row + "]=" + matrix[col][row]
                    );
                }
            }
        }
        return matrix;
    }

    /**
     * Requires every cell to lie in {@code [min, max]}.
     */
    public static int[][] requireRange(int[][] matrix, int min, int max, String tableName) {
        for (int row = 0; row < matrix.length; row++) {
            for (int col = 0; col < matrix[row].length; col++) {
                int value = matrix[row][col];
                if (value < min || value > max) {
                    throw new TableConfigurationException(
                            TableConfigurationException.REASON_TABLE_VALUE_OUT_OF_RANGE,
                            tableName + "[" + row + "][" + col + "]=" + value
                                    + " outside [" + min + ", " + max + "]"
                    );
                }
            }
        }
        return matrix;
    }
}
