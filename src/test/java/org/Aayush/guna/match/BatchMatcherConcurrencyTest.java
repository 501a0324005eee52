package org.Aayush.guna.match;

import org.Aayush.guna.testutil.PersonFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class BatchMatcherConcurrencyTest {

    @Test
    @Timeout(value = 20, unit = TimeUnit.SECONDS)
    @DisplayName("Concurrency stress: a shared engine returns identical rankings")
    void testConcurrentDeterminism() throws InterruptedException {
        MatchEngine engine = new MatchEngine();
        List<PersonVector> candidates = BatchMatcherTest.allCandidates();
        PersonVector subject = PersonFixtures.ashwiniSubject();
        BatchConfig config = BatchConfig.builder()
                .rejectionFilter(EarlyRejectionFilter.sameNadi())
                .rejectionMode(EarlyRejectionMode.RANK_LAST)
                .parallelism(2)
                .build();

        BatchResult baseline = engine.computeBatch(subject, candidates, config);
        int threads = 6;
        int loops = 20;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch latch = new CountDownLatch(threads);
        AtomicBoolean failed = new AtomicBoolean(false);

        for (int t = 0; t < threads; t++) {
            executor.execute(() -> {
                try {
                    for (int i = 0; i < loops; i++) {
                        BatchResult current = engine.computeBatch(subject, candidates, config);
                        if (!current.getPairs().equals(baseline.getPairs())
                                || current.getEarlyRejections() != baseline.getEarlyRejections()) {
                            failed.set(true);
                            break;
                        }
                    }
                } finally {
                    latch.countDown();
                }
            });
        }

        latch.await();
        executor.shutdownNow();
        assertFalse(failed.get(), "concurrent batch results diverged");
        assertEquals(candidates.size(), baseline.getPairs().size());
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    @DisplayName("Concurrency stress: pair matching is deterministic across threads")
    void testConcurrentPairMatching() throws InterruptedException {
        MatchEngine engine = new MatchEngine();
        List<PersonVector> candidates = PersonFixtures.fiveCandidates();
        PersonVector subject = PersonFixtures.ashwiniSubject();
        MatchResult[] baseline = new MatchResult[candidates.size()];
        for (int i = 0; i < baseline.length; i++) {
            baseline[i] = engine.computeMatch(subject, candidates.get(i));
        }

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch latch = new CountDownLatch(threads);
        AtomicBoolean failed = new AtomicBoolean(false);
        for (int t = 0; t < threads; t++) {
            executor.execute(() -> {
                try {
                    for (int loop = 0; loop < 500; loop++) {
                        int i = loop % baseline.length;
                        if (!engine.computeMatch(subject, candidates.get(i)).equals(baseline[i])) {
                            failed.set(true);
                            break;
                        }
                    }
                } finally {
                    latch.countDown();
                }
            });
        }

        latch.await();
        executor.shutdownNow();
        assertFalse(failed.get(), "concurrent pair results diverged");
    }
}
