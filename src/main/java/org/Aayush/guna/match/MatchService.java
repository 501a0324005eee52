package org.Aayush.guna.match;

import java.util.List;

/**
 * Public compatibility service contract.
 *
 * <p>Implementations validate input deterministically and throw
 * {@link MatchValidationException} for caller defects. Results never depend on call
 * history.</p>
 */
public interface MatchService {
    /**
     * Matches one pair. Side A is the groom-analog role for the direction-sensitive kootas.
     *
     * @param personA side A.
     * @param personB side B.
     * @return immutable match result.
     */
    MatchResult computeMatch(PersonVector personA, PersonVector personB);

    /**
     * Matches a subject, as side A, against every candidate and ranks the results.
     *
     * @param subject subject person.
     * @param candidates candidates with unique non-blank ids.
     * @param config batch configuration.
     * @return ranked batch result.
     */
    BatchResult computeBatch(PersonVector subject, List<PersonVector> candidates, BatchConfig config);
}
