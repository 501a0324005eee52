package org.Aayush.guna.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;

/**
 * {@link CandidateIdIndex} backed by a fastutil open hash map.
 *
 * <p>Immutable and thread-safe for concurrent reads.</p>
 */
public class FastUtilCandidateIdIndex implements CandidateIdIndex {

    // id -> position, without boxing
    private final Object2IntOpenHashMap<String> forward;
    // position -> id
    private final String[] reverse;

    /**
     * Indexes ids in list order.
     *
     * @throws IllegalArgumentException if the list is null.
     * @throws InvalidIdException on the first blank or duplicate id.
     */
    public FastUtilCandidateIdIndex(List<String> candidateIds) {
        if (candidateIds == null) {
            throw new IllegalArgumentException("candidateIds cannot be null");
        }
        int size = candidateIds.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(-1);
        this.reverse = new String[size];

        for (int position = 0; position < size; position++) {
            String id = candidateIds.get(position);
            if (id == null || id.isBlank()) {
                throw new InvalidIdException(
                        InvalidIdException.Problem.BLANK, position,
                        "candidate id at position " + position + " is blank");
            }
            int previous = forward.putIfAbsent(id, position);
            if (previous != -1) {
                throw new InvalidIdException(
                        InvalidIdException.Problem.DUPLICATE, position,
                        "candidate id '" + id + "' at position " + position
                                + " repeats position " + previous);
            }
            reverse[position] = id;
        }
        this.forward.trim();
    }

    @Override
    public int positionOf(String candidateId) throws UnknownIdException {
        int position = forward.getInt(candidateId);
        if (position == -1) {
            throw new UnknownIdException("candidate id not found: " + candidateId);
        }
        return position;
    }

    @Override
    public String idAt(int position) {
        try {
            return reverse[position];
        } catch (ArrayIndexOutOfBoundsException e) {
            throw new IndexOutOfBoundsException("position out of bounds: " + position);
        }
    }

    @Override
    public boolean contains(String candidateId) {
        return forward.containsKey(candidateId);
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
