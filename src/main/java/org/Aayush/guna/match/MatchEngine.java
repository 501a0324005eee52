package org.Aayush.guna.match;

import org.Aayush.guna.aggregate.AggregationPolicy;
import org.Aayush.guna.aggregate.EligibilityGate;
import org.Aayush.guna.aggregate.GunaAggregator;
import org.Aayush.guna.aggregate.NadiAssessment;
import org.Aayush.guna.core.IncompleteInputWarning;
import org.Aayush.guna.core.TriState;
import org.Aayush.guna.dasha.DashaAnalyzer;
import org.Aayush.guna.dasha.DashaSync;
import org.Aayush.guna.dosha.ManglikAnalyzer;
import org.Aayush.guna.dosha.ManglikAssessment;
import org.Aayush.guna.dosha.ManglikMatch;
import org.Aayush.guna.dosha.ManglikPolicy;
import org.Aayush.guna.koota.KootaDetails;
import org.Aayush.guna.koota.KootaScoreVector;
import org.Aayush.guna.koota.KootaScorers;

import java.util.List;
import java.util.Objects;

/**
 * Default {@link MatchService}.
 *
 * <p>Pair flow: validate mandatory fields (A before B), score the eight kootas,
 * aggregate, run Manglik and Dasha analysis, assemble the result. The pair path does
 * no logging and no I/O. Instances are immutable and safe for concurrent use.</p>
 */
public final class MatchEngine implements MatchService {
    public static final String ROLE_A = "person_a";
    public static final String ROLE_B = "person_b";

    private final MatchConfig config;
    private final GunaAggregator aggregator;
    private final ManglikAnalyzer manglikAnalyzer;
    private final BatchMatcher batchMatcher;

    public MatchEngine() {
        this(MatchConfig.defaults());
    }

    public MatchEngine(MatchConfig config) {
        Objects.requireNonNull(config, "config");
        AggregationPolicy aggregation = config.getAggregation() == null
                ? AggregationPolicy.defaults()
                : config.getAggregation();
        ManglikPolicy manglik = config.getManglik() == null ? ManglikPolicy.defaults() : config.getManglik();
        this.config = MatchConfig.builder().aggregation(aggregation).manglik(manglik).build();
        this.aggregator = new GunaAggregator(aggregation);
        this.manglikAnalyzer = new ManglikAnalyzer(manglik);
        this.batchMatcher = new BatchMatcher(this);
    }

    public MatchConfig config() {
        return config;
    }

    @Override
    public MatchResult computeMatch(PersonVector personA, PersonVector personB) {
        validatePerson(personA, ROLE_A);
        validatePerson(personB, ROLE_B);

        KootaScoreVector scores = KootaScorers.scoreAll(
                personA.getMoonNakshatra(), personA.getMoonRashi(),
                personB.getMoonNakshatra(), personB.getMoonRashi());
        KootaDetails details = KootaScorers.explain(
                personA.getMoonNakshatra(), personA.getMoonRashi(),
                personB.getMoonNakshatra(), personB.getMoonRashi());
        int total = scores.getTotalGuna();

        NadiAssessment nadi = aggregator.assessNadi(
                scores,
                personA.getMoonNakshatra(), personA.getMoonRashi(),
                personB.getMoonNakshatra(), personB.getMoonRashi());

        ManglikAssessment manglikA = manglikAnalyzer.assess(personA.manglikChart());
        ManglikAssessment manglikB = manglikAnalyzer.assess(personB.manglikChart());
        ManglikMatch manglik = ManglikAnalyzer.matchManglik(manglikA, manglikB);

        DashaSync dasha = DashaAnalyzer.sync(
                personA.getDashaLord(), personA.getSubDashaLord(),
                personB.getDashaLord(), personB.getSubDashaLord());

        TriState manglikMismatch = manglik.getMismatch();
        EligibilityGate eligibility = aggregator.eligibility(total, nadi, manglikMismatch);

        MatchResult.MatchResultBuilder result = MatchResult.builder()
                .personAId(personA.getId())
                .personBId(personB.getId())
                .scores(scores)
                .details(details)
                .verdict(aggregator.verdict(total))
                .doshaFlags(new DoshaFlags(
                        manglikMismatch,
                        TriState.of(nadi.isDoshaPresent()),
                        TriState.of(details.getBhakootDosha().isPresent())))
                .compatibilityFlags(new CompatibilityFlags(
                        GunaAggregator.sexualIncompatibility(details.getYoniRelationship()),
                        nadi.isSevereNadiDosha(),
                        dasha.getConflict(),
                        dasha.getGrowth()))
                .manglik(manglik)
                .nadi(nadi)
                .dasha(dasha)
                .eligibility(eligibility);
        addPrefixed(result, manglikA.getWarnings(), ROLE_A);
        addPrefixed(result, manglikB.getWarnings(), ROLE_B);
        result.warnings(dasha.getWarnings());
        return result.build();
    }

    @Override
    public BatchResult computeBatch(PersonVector subject, List<PersonVector> candidates, BatchConfig config) {
        return batchMatcher.computeBatch(subject, candidates, config);
    }

    /**
     * Checks presence of the mandatory fields in declaration order.
     *
     * @param person person to check.
     * @param role field prefix, e.g. {@code person_a} or {@code candidates[3]}.
     * @throws MatchValidationException naming the first offending field.
     */
    static void validatePerson(PersonVector person, String role) {
        if (person == null) {
            throw new MatchValidationException(
                    MatchValidationException.REASON_PERSON_REQUIRED, role, "person must be provided");
        }
        requireField(person.getMoonNakshatra(), role, "moon_nakshatra");
        requireField(person.getMoonRashi(), role, "moon_rashi");
        requireField(person.getAscendant(), role, "ascendant");
    }

    private static void requireField(Object value, String role, String field) {
        if (value == null) {
            throw new MatchValidationException(
                    MatchValidationException.REASON_FIELD_REQUIRED, role + "." + field, "field is required");
        }
    }

    private static void addPrefixed(
            MatchResult.MatchResultBuilder result,
            List<IncompleteInputWarning> warnings,
            String role
    ) {
        for (IncompleteInputWarning warning : warnings) {
            result.warning(warning.prefixed(role));
        }
    }
}
