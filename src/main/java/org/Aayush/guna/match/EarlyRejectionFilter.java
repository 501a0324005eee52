package org.Aayush.guna.match;

import org.Aayush.guna.koota.KootaScorers;
import org.Aayush.guna.tables.DomainTables;

/**
 * Cheap predicate evaluated before the full eight-factor computation.
 *
 * <p>Both persons have already passed mandatory-field validation.</p>
 */
@FunctionalInterface
public interface EarlyRejectionFilter {

    /**
     * Returns true to reject {@code candidate} for {@code subject}.
     */
    boolean reject(PersonVector subject, PersonVector candidate);

    /**
     * Rejects candidates sharing the subject's nadi.
     */
    static EarlyRejectionFilter sameNadi() {
        return (subject, candidate) ->
                DomainTables.nadi(subject.getMoonNakshatra()) == DomainTables.nadi(candidate.getMoonNakshatra());
    }

    /**
     * Rejects candidates whose moon sign forms a Bhakoot dosha with the subject's.
     */
    static EarlyRejectionFilter bhakootDosha() {
        return (subject, candidate) ->
                KootaScorers.bhakootDosha(subject.getMoonRashi(), candidate.getMoonRashi()).isPresent();
    }

    static EarlyRejectionFilter sameNadiOrBhakootDosha() {
        return sameNadi().or(bhakootDosha());
    }

    default EarlyRejectionFilter or(EarlyRejectionFilter other) {
        return (subject, candidate) -> reject(subject, candidate) || other.reject(subject, candidate);
    }
}
