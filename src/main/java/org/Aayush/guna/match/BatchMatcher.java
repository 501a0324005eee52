package org.Aayush.guna.match;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.guna.core.TriState;
import org.Aayush.guna.core.id.CandidateIdIndex;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Ranks many candidates against one subject.
 *
 * <p>All input is validated before any scoring. Scoring may fan out to a fixed pool; the
 * deterministic sort always runs afterwards on the calling thread.</p>
 */
@Slf4j
public final class BatchMatcher {

    /**
     * Batch order: accepted before rejected, total descending, no Manglik mismatch
     * first (false, unknown, true), no Nadi dosha first, candidate id ascending.
     */
    static final Comparator<RankedMatch> RANKING = Comparator
            .comparing(RankedMatch::isEarlyRejected)
            .thenComparing(Comparator.comparingInt((RankedMatch r) -> r.getResult().getTotalGuna()).reversed())
            .thenComparingInt(r -> mismatchRank(r.getResult().getDoshaFlags().getManglik()))
            .thenComparing(r -> r.getResult().getNadi().isDoshaPresent())
            .thenComparing(RankedMatch::getCandidateId);

    private final MatchService engine;

    public BatchMatcher(MatchService engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    /**
     * Scores, filters and ranks candidates.
     *
     * @param subject subject person, side A of every pair.
     * @param candidates candidates with unique non-blank ids.
     * @param config batch configuration.
     * @return ranked result.
     * @throws MatchValidationException on any invalid input, before scoring starts.
     */
    public BatchResult computeBatch(PersonVector subject, List<PersonVector> candidates, BatchConfig config) {
        if (config == null) {
            throw new MatchValidationException(
                    MatchValidationException.REASON_BATCH_CONFIG_INVALID, "config", "batch config must be provided");
        }
        MatchEngine.validatePerson(subject, "subject");
        validateCandidates(candidates, config);

        List<PersonVector> toScore = new ArrayList<>(candidates.size());
        List<Boolean> rejectedFlags = new ArrayList<>(candidates.size());
        int earlyRejections = 0;
        for (PersonVector candidate : candidates) {
            boolean rejected = config.getRejectionFilter() != null
                    && config.getRejectionFilter().reject(subject, candidate);
            if (rejected) {
                earlyRejections++;
                if (config.getRejectionMode() == EarlyRejectionMode.EXCLUDE) {
                    continue;
                }
            }
            toScore.add(candidate);
            rejectedFlags.add(rejected);
        }

        List<MatchResult> scored = config.getParallelism() > 1 && toScore.size() > 1
                ? scoreParallel(subject, toScore, config.getParallelism())
                : scoreSequential(subject, toScore);

        List<RankedMatch> ranked = new ArrayList<>(scored.size());
        for (int i = 0; i < scored.size(); i++) {
            MatchResult result = scored.get(i);
            boolean rejected = rejectedFlags.get(i);
            if (!rejected && config.getMinimumTotal() != null && result.getTotalGuna() < config.getMinimumTotal()) {
                continue;
            }
            if (!rejected && config.isEligibleOnly() && !result.getEligibility().isEligible()) {
                continue;
            }
            ranked.add(new RankedMatch(toScore.get(i).getId(), result, rejected));
        }
        ranked.sort(RANKING);
        if (config.getMaxResults() != null && ranked.size() > config.getMaxResults()) {
            ranked = ranked.subList(0, config.getMaxResults());
        }

        log.debug("[BatchMatcher] candidates={} scored={} earlyRejections={} returned={} parallelism={}",
                candidates.size(), scored.size(), earlyRejections, ranked.size(), config.getParallelism());
        return new BatchResult(ranked, candidates.size(), earlyRejections);
    }

    private static void validateCandidates(List<PersonVector> candidates, BatchConfig config) {
        if (candidates == null) {
            throw new MatchValidationException(
                    MatchValidationException.REASON_CANDIDATES_REQUIRED, "candidates", "candidates must be provided");
        }
        if (candidates.size() > config.getMaxCandidates()) {
            throw new MatchValidationException(
                    MatchValidationException.REASON_CANDIDATE_LIMIT_EXCEEDED,
                    "candidates",
                    candidates.size() + " candidates exceed the limit of " + config.getMaxCandidates());
        }
        List<String> ids = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            PersonVector candidate = candidates.get(i);
            MatchEngine.validatePerson(candidate, "candidates[" + i + "]");
            ids.add(candidate.getId());
        }
        try {
            CandidateIdIndex.of(ids);
        } catch (CandidateIdIndex.InvalidIdException ex) {
            String reason = ex.problem() == CandidateIdIndex.InvalidIdException.Problem.BLANK
                    ? MatchValidationException.REASON_CANDIDATE_ID_REQUIRED
                    : MatchValidationException.REASON_DUPLICATE_CANDIDATE_ID;
            throw new MatchValidationException(reason, "candidates[" + ex.position() + "].id", ex.getMessage(), ex);
        }
    }

    private List<MatchResult> scoreSequential(PersonVector subject, List<PersonVector> candidates) {
        List<MatchResult> results = new ArrayList<>(candidates.size());
        for (PersonVector candidate : candidates) {
            results.add(engine.computeMatch(subject, candidate));
        }
        return results;
    }

    private List<MatchResult> scoreParallel(PersonVector subject, List<PersonVector> candidates, int parallelism) {
        List<Callable<MatchResult>> tasks = new ArrayList<>(candidates.size());
        for (PersonVector candidate : candidates) {
            tasks.add(() -> engine.computeMatch(subject, candidate));
        }
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, candidates.size()));
        try {
            List<Future<MatchResult>> futures = pool.invokeAll(tasks);
            List<MatchResult> results = new ArrayList<>(futures.size());
            for (Future<MatchResult> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("[BatchMatcher] interrupted while scoring {} candidates", candidates.size());
            throw new IllegalStateException("batch scoring interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("batch scoring failed", cause);
        } finally {
            pool.shutdownNow();
        }
    }

    private static int mismatchRank(TriState mismatch) {
        return switch (mismatch) {
            case FALSE -> 0;
            case UNKNOWN -> 1;
            case TRUE -> 2;
        };
    }
}
