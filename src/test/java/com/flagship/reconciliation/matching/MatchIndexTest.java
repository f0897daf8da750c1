package com.flagship.reconciliation.matching;

import com.flagship.reconciliation.transaction.Provider;
import com.flagship.reconciliation.transaction.Transaction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.flagship.reconciliation.transaction.TransactionFixtures.pending;
import static com.flagship.reconciliation.transaction.TransactionFixtures.quickBooks;
import static com.flagship.reconciliation.transaction.TransactionFixtures.xero;
import static org.junit.jupiter.api.Assertions.*;

class MatchIndexTest {

    private MatchIndex index;

    @BeforeEach
    void setUp() {
        index = new MatchIndex(MatchingPolicy.DEFAULT_AMOUNT_TOLERANCE, MatchingPolicy.DEFAULT_DATE_WINDOW_DAYS);
    }

    private static List<UUID> toList(Iterable<UUID> candidates) {
        List<UUID> ids = new ArrayList<>();
        candidates.forEach(ids::add);
        return ids;
    }

    @Test
    @DisplayName("Query returns only the other provider's entries in the same currency")
    void testQuery_PartitionsByCurrencyAndProvider() {
        Transaction target = xero("100.00", "USD", "2024-01-15");
        Transaction sameProvider = xero("100.00", "USD", "2024-01-15");
        Transaction otherCurrency = quickBooks("100.00", "EUR", "2024-01-15");
        Transaction counterpart = quickBooks("100.00", "USD", "2024-01-15");

        index.insert(target);
        index.insert(sameProvider);
        index.insert(otherCurrency);
        index.insert(counterpart);

        assertEquals(List.of(counterpart.getId()), toList(index.query(target)));
    }

    @Test
    @DisplayName("Query is bounded by the date window, inclusive at both ends")
    void testQuery_DateWindow() {
        Transaction target = xero("100.00", "USD", "2024-01-15");
        Transaction threeBefore = quickBooks("100.00", "USD", "2024-01-12");
        Transaction threeAfter = quickBooks("100.00", "USD", "2024-01-18");
        Transaction fourBefore = quickBooks("100.00", "USD", "2024-01-11");
        Transaction fourAfter = quickBooks("100.00", "USD", "2024-01-19");

        index.insert(threeBefore);
        index.insert(threeAfter);
        index.insert(fourBefore);
        index.insert(fourAfter);

        List<UUID> candidates = toList(index.query(target));

        assertEquals(2, candidates.size());
        assertTrue(candidates.contains(threeBefore.getId()));
        assertTrue(candidates.contains(threeAfter.getId()));
    }

    @Test
    @DisplayName("Query is bounded by the amount tolerance, inclusive")
    void testQuery_AmountTolerance() {
        Transaction target = xero("100.00", "USD", "2024-01-15");
        Transaction centAbove = quickBooks("100.01", "USD", "2024-01-15");
        Transaction centBelow = quickBooks("99.99", "USD", "2024-01-15");
        Transaction twoCentsAbove = quickBooks("100.02", "USD", "2024-01-15");
        Transaction farOff = quickBooks("250.00", "USD", "2024-01-15");

        index.insert(centAbove);
        index.insert(centBelow);
        index.insert(twoCentsAbove);
        index.insert(farOff);

        List<UUID> candidates = toList(index.query(target));

        assertEquals(2, candidates.size());
        assertTrue(candidates.contains(centAbove.getId()));
        assertTrue(candidates.contains(centBelow.getId()));
        assertEquals(4, index.size(), "Filtered entries stay indexed");
    }

    @Test
    @DisplayName("Negative tolerance or window is rejected")
    void testInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class,
                () -> new MatchIndex(new BigDecimal("-0.01"), MatchingPolicy.DEFAULT_DATE_WINDOW_DAYS));
        assertThrows(IllegalArgumentException.class,
                () -> new MatchIndex(MatchingPolicy.DEFAULT_AMOUNT_TOLERANCE, -1));
    }

    @Test
    @DisplayName("Candidates are ordered by date distance, then amount distance, then createdAt")
    void testQuery_TieBreakOrder() {
        Transaction target = xero("100.00", "USD", "2024-01-15");
        Transaction twoDaysExact = quickBooks("100.00", "USD", "2024-01-13");
        Transaction sameDayOffByCent = quickBooks("100.01", "USD", "2024-01-15");
        Transaction sameDayExactFirst = quickBooks("100.00", "USD", "2024-01-15");
        Transaction sameDayExactSecond = quickBooks("100.00", "USD", "2024-01-15");

        // insertion order differs from expected order
        index.insert(twoDaysExact);
        index.insert(sameDayOffByCent);
        index.insert(sameDayExactSecond);
        index.insert(sameDayExactFirst);

        List<UUID> candidates = toList(index.query(target));

        assertEquals(List.of(
            sameDayExactFirst.getId(),
            sameDayExactSecond.getId(),
            sameDayOffByCent.getId(),
            twoDaysExact.getId()
        ), candidates);
        assertTrue(sameDayExactFirst.getCreatedAt().isBefore(sameDayExactSecond.getCreatedAt()));
    }

    @Test
    @DisplayName("Query excludes the transaction itself even if indexed")
    void testQuery_ExcludesSelf() {
        Transaction target = xero("100.00", "USD", "2024-01-15");
        index.insert(target);

        assertTrue(toList(index.query(target)).isEmpty());
    }

    @Test
    @DisplayName("Query is lazy and restartable")
    void testQuery_LazyAndRestartable() {
        Transaction target = xero("100.00", "USD", "2024-01-15");
        Iterable<UUID> candidates = index.query(target);

        Transaction counterpart = quickBooks("100.00", "USD", "2024-01-15");
        index.insert(counterpart);

        // inserted after query() was called but before iteration started
        assertEquals(List.of(counterpart.getId()), toList(candidates));

        Iterator<UUID> first = candidates.iterator();
        first.next();
        assertFalse(first.hasNext());
        assertEquals(List.of(counterpart.getId()), toList(candidates), "A new iteration starts over");
        assertEquals(1, index.size(), "Iterating must not mutate the index");
    }

    @Test
    @DisplayName("Insert is idempotent and rejects non-pending transactions")
    void testInsert() {
        Transaction transaction = xero("100.00", "USD", "2024-01-15");

        assertTrue(index.insert(transaction));
        assertFalse(index.insert(transaction));
        assertEquals(1, index.size());

        Transaction matched = quickBooks("100.00", "USD", "2024-01-15").matchWith(UUID.randomUUID());
        assertThrows(IllegalArgumentException.class, () -> index.insert(matched));
    }

    @Test
    @DisplayName("Remove takes an entry out of every future query and is a no-op when absent")
    void testRemove() {
        Transaction target = xero("100.00", "USD", "2024-01-15");
        Transaction counterpart = quickBooks("100.00", "USD", "2024-01-15");
        index.insert(counterpart);

        assertTrue(index.remove(counterpart));
        assertFalse(index.remove(counterpart.getId()));
        assertFalse(index.contains(counterpart.getId()));
        assertEquals(0, index.size());
        assertTrue(toList(index.query(target)).isEmpty());
    }

    @Test
    @DisplayName("Concurrent inserts and removes leave the index consistent")
    void testConcurrentInsertAndRemove() throws InterruptedException {
        int threadCount = 8;
        int perThread = 200;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        ConcurrentLinkedQueue<UUID> kept = new ConcurrentLinkedQueue<>();
        ConcurrentLinkedQueue<Throwable> failures = new ConcurrentLinkedQueue<>();
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);

        for (int i = 0; i < threadCount; i++) {
            Provider provider = i % 2 == 0 ? Provider.XERO : Provider.QUICKBOOKS;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int n = 0; n < perThread; n++) {
                        Transaction transaction = pending(provider, "10.00", "USD", "2024-03-10");
                        index.insert(transaction);
                        index.query(transaction).forEach(id -> { });
                        if (n % 2 == 0) {
                            index.remove(transaction.getId());
                        } else {
                            kept.add(transaction.getId());
                        }
                    }
                } catch (Throwable t) {
                    failures.add(t);
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        assertTrue(failures.isEmpty(), () -> "Unexpected failures: " + failures);
        assertEquals(kept.size(), index.size());
        kept.forEach(id -> assertTrue(index.contains(id)));
    }
}
