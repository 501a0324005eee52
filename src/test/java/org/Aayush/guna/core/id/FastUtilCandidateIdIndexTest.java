package org.Aayush.guna.core.id;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FastUtilCandidateIdIndexTest {

    @Test
    @DisplayName("Positions follow list order in both directions")
    void testBidirectionalLookup() {
        CandidateIdIndex index = CandidateIdIndex.of(List.of("asha", "bela", "chitra"));

        assertEquals(0, index.positionOf("asha"));
        assertEquals(2, index.positionOf("chitra"));
        assertEquals("bela", index.idAt(1));
        assertTrue(index.contains("asha"));
        assertFalse(index.contains("devi"));
        assertEquals(3, index.size());
    }

    @Test
    @DisplayName("Unicode ids are indexed as-is")
    void testUnicodeIds() {
        CandidateIdIndex index = new FastUtilCandidateIdIndex(List.of("अनन्या", "மீனா"));
        assertEquals(1, index.positionOf("மீனா"));
        assertEquals("अनन्या", index.idAt(0));
    }

    @Test
    @DisplayName("Unknown ids and bad positions throw")
    void testLookupFailures() {
        CandidateIdIndex index = CandidateIdIndex.of(List.of("asha"));
        CandidateIdIndex.UnknownIdException unknown = assertThrows(
                CandidateIdIndex.UnknownIdException.class, () -> index.positionOf("bela"));
        assertTrue(unknown.getMessage().contains("bela"));
        assertThrows(IndexOutOfBoundsException.class, () -> index.idAt(1));
        assertThrows(IndexOutOfBoundsException.class, () -> index.idAt(-1));
        assertFalse(index.contains(null));
    }

    @Test
    @DisplayName("Duplicate ids report the repeating position")
    void testDuplicate() {
        CandidateIdIndex.InvalidIdException ex = assertThrows(CandidateIdIndex.InvalidIdException.class,
                () -> CandidateIdIndex.of(List.of("asha", "bela", "asha")));
        assertEquals(CandidateIdIndex.InvalidIdException.Problem.DUPLICATE, ex.problem());
        assertEquals(2, ex.position());
        assertTrue(ex.getMessage().contains("repeats position 0"));
    }

    @Test
    @DisplayName("Null and blank ids are rejected")
    void testBlank() {
        CandidateIdIndex.InvalidIdException nullId = assertThrows(CandidateIdIndex.InvalidIdException.class,
                () -> CandidateIdIndex.of(Arrays.asList("asha", null)));
        assertEquals(CandidateIdIndex.InvalidIdException.Problem.BLANK, nullId.problem());
        assertEquals(1, nullId.position());

        CandidateIdIndex.InvalidIdException blank = assertThrows(CandidateIdIndex.InvalidIdException.class,
                () -> CandidateIdIndex.of(List.of(" \t")));
        assertEquals(0, blank.position());

        assertThrows(IllegalArgumentException.class, () -> new FastUtilCandidateIdIndex(null));
    }

    @Test
    @DisplayName("Empty index")
    void testEmpty() {
        CandidateIdIndex index = CandidateIdIndex.of(List.of());
        assertEquals(0, index.size());
        assertFalse(index.contains("asha"));
    }

    @Test
    @DisplayName("Concurrent reads see a consistent index")
    void testConcurrentReads() throws InterruptedException {
        int size = 10_000;
        List<String> ids = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            ids.add("candidate-" + i);
        }
        CandidateIdIndex index = CandidateIdIndex.of(ids);

        ExecutorService executor = Executors.newFixedThreadPool(8);
        AtomicInteger errors = new AtomicInteger();
        for (int t = 0; t < 8; t++) {
            executor.execute(() -> {
                for (int i = 0; i < size; i++) {
                    if (index.positionOf("candidate-" + i) != i || !index.idAt(i).equals("candidate-" + i)) {
                        errors.incrementAndGet();
                    }
                }
            });
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        assertEquals(0, errors.get());
    }
}
