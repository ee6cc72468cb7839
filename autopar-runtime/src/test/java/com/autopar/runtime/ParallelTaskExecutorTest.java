package com.autopar.runtime;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ParallelTaskExecutorTest {

    @Test
    void outcomesAreIndexedRegardlessOfSubmissionOrder() {
        List<Integer> started = Collections.synchronizedList(new ArrayList<>());
        try (ParallelTaskExecutor executor = new ParallelTaskExecutor(1, SubmissionOrder.reversed())) {
            List<UnitOutcome<Integer>> outcomes = executor.execute(5, 1, (k, partial) -> {
                started.add(k);
                return k * 10;
            });

            assertEquals(List.of(4, 3, 2, 1, 0), started);
            for (int k = 0; k < 5; k++) {
                assertEquals(k, outcomes.get(k).index());
                assertEquals(k * 10, outcomes.get(k).value());
            }
        }
    }

    @Test
    void shuffledOrderIsSeeded() {
        assertArrayEquals(SubmissionOrder.shuffled(7).permutation(20), SubmissionOrder.shuffled(7).permutation(20));
        int[] p = SubmissionOrder.shuffled(7).permutation(20);
        int[] sorted = p.clone();
        java.util.Arrays.sort(sorted);
        for (int k = 0; k < 20; k++) assertEquals(k, sorted[k]);
    }

    @Test
    void unitsRunConcurrently() throws InterruptedException {
        CountDownLatch bothStarted = new CountDownLatch(2);
        try (ParallelTaskExecutor executor = new ParallelTaskExecutor(2)) {
            List<UnitOutcome<Boolean>> outcomes = executor.execute(2, 2, (k, partial) -> {
                bothStarted.countDown();
                try {
                    return bothStarted.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            });
            assertTrue(outcomes.get(0).value());
            assertTrue(outcomes.get(1).value());
        }
    }

    @Test
    void lowestFailingUnitWinsAndLaterUnitsAreSkipped() {
        try (ParallelTaskExecutor executor = new ParallelTaskExecutor(1, SubmissionOrder.sequential())) {
            List<UnitOutcome<String>> outcomes = executor.execute(5, 1, (k, partial) -> {
                partial.set("partial-" + k);
                if (k == 2) throw new IllegalStateException("unit 2");
                return "done-" + k;
            });

            assertEquals("done-1", outcomes.get(1).value());
            assertTrue(outcomes.get(2).isFailure());
            assertEquals("partial-2", outcomes.get(2).value());
            assertTrue(outcomes.get(3).skipped());
            assertTrue(outcomes.get(4).skipped());
        }
    }

    @Test
    void reversedSubmissionStillRunsEveryUnitBelowTheFailure() {
        AtomicInteger runs = new AtomicInteger();
        try (ParallelTaskExecutor executor = new ParallelTaskExecutor(1, SubmissionOrder.reversed())) {
            List<UnitOutcome<Integer>> outcomes = executor.execute(4, 1, (k, partial) -> {
                runs.incrementAndGet();
                if (k == 3 || k == 1) throw new IllegalArgumentException("unit " + k);
                return k;
            });

            assertEquals(4, runs.get());
            assertEquals("unit 1", outcomes.get(1).failure().getMessage());
            assertEquals(0, outcomes.get(0).value());
            assertFalse(outcomes.get(0).isFailure());
        }
    }

    @Test
    void nestedTasksRunInlineOnWorkers() {
        try (ParallelTaskExecutor executor = new ParallelTaskExecutor(2)) {
            List<UnitOutcome<Integer>> outer = executor.execute(2, 2, (k, partial) -> {
                List<UnitOutcome<Integer>> inner = executor.execute(3, 2, (j, p) -> j + 1);
                return inner.stream().mapToInt(UnitOutcome::value).sum() + k;
            });
            assertEquals(6, outer.get(0).value());
            assertEquals(7, outer.get(1).value());
        }
    }

    @Test
    void rejectsNonPositiveWorkerCount() {
        assertThrows(IllegalArgumentException.class, () -> new ParallelTaskExecutor(0));
    }
}
