package org.Aayush.guna.core.id;

import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.experimental.StandardException;

import java.util.List;

/**
 * Dense position index over unique, non-blank candidate ids.
 */
public interface CandidateIdIndex {

    /**
     * Returns the position of a candidate id.
     *
     * @param candidateId caller id.
     * @return dense position in {@code [0, size)}.
     * @throws UnknownIdException if the id is not indexed.
     */
    int positionOf(String candidateId) throws UnknownIdException;

    /**
     * Returns the id at a position.
     *
     * @throws IndexOutOfBoundsException if the position is invalid.
     */
    String idAt(int position);

    boolean contains(String candidateId);

    int size();

    /**
     * Thrown when a looked-up id is not indexed.
     */
    @StandardException
    class UnknownIdException extends RuntimeException {
    }

    /**
     * Thrown while building an index from a blank or repeated id.
     */
    @Getter
    @Accessors(fluent = true)
    final class InvalidIdException extends IllegalArgumentException {
        /** Why the id was rejected. */
        public enum Problem {
            BLANK,
            DUPLICATE
        }

        private final Problem problem;
        private final int position;

        public InvalidIdException(Problem problem, int position, String message) {
            super(message);
            this.problem = problem;
            this.position = position;
        }
    }

    /**
     * Builds the default immutable index; ids keep their list order as positions.
     *
     * @param candidateIds ids in candidate order.
     * @return immutable index.
     * @throws InvalidIdException on the first blank or duplicate id.
     */
    static CandidateIdIndex of(List<String> candidateIds) {
        return new FastUtilCandidateIdIndex(candidateIds);
    }
}
