package io.syncstore.id;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class ChainedStreamIdAllocatorTest {

    @Test
    void pairsEachPositionWithParentCurrentToken() {
        final StreamIdAllocator events = new StreamIdAllocator("events", 99L);
        final ChainedStreamIdAllocator pushRules = new ChainedStreamIdAllocator(
                new StreamIdAllocator("push_rules_stream", 4L), events);

        assertEquals(new ChainedToken(4L, 99L), pushRules.currentToken());

        // An in-flight parent write must not be visible to the derived stream.
        final AllocationTicket pendingEvent = events.reserveOne();
        final ChainedTicket first = pushRules.reserveOne();
        assertEquals(5L, first.position());
        assertEquals(99L, first.parentPosition());

        events.markDone(pendingEvent);
        final ChainedTicket second = pushRules.reserveOne();
        assertEquals(6L, second.position());
        assertEquals(100L, second.parentPosition());
        assertEquals(new ChainedToken(6L, 100L), second.token());
    }

    @Test
    void idleTokenKeepsGreatestResolvedParentPosition() {
        final StreamIdAllocator events = new StreamIdAllocator("events", 10L);
        final ChainedStreamIdAllocator pushRules = new ChainedStreamIdAllocator(
                new StreamIdAllocator("push_rules_stream", -1L), events);

        pushRules.reserveOne().close();
        events.reserveOne().close();

        assertEquals(11L, events.currentToken());
        assertEquals(new ChainedToken(0L, 10L), pushRules.currentToken());
    }

    @Test
    void currentTokenFollowsFirstOutstandingTicket() {
        final StreamIdAllocator events = new StreamIdAllocator("events", 10L);
        final ChainedStreamIdAllocator chained = new ChainedStreamIdAllocator(
                new StreamIdAllocator("push_rules_stream", -1L), events);

        final ChainedTicket a = chained.reserveOne();
        events.markDone(events.reserveOne());
        final ChainedTicket b = chained.reserveOne();
        assertEquals(10L, a.parentPosition());
        assertEquals(11L, b.parentPosition());

        chained.markDone(b);
        assertEquals(new ChainedToken(-1L, 10L), chained.currentToken());

        chained.markDone(a);
        assertEquals(new ChainedToken(1L, 11L), chained.currentToken());
        assertEquals(1L, chained.maxToken());
    }

    @Test
    void closeReleasesOnceAndMarkDoneTwiceFails() {
        final ChainedStreamIdAllocator chained = new ChainedStreamIdAllocator(
                new StreamIdAllocator("push_rules_stream", -1L), new StreamIdAllocator("events", -1L));

        final ChainedTicket ticket = chained.reserveOne();
        ticket.close();
        ticket.close();
        assertTrue(ticket.isReleased());
        assertThrows(IllegalStateException.class, () -> chained.markDone(ticket));
        assertEquals(0L, chained.currentToken().position());
    }

    @Test
    void rejectsTicketFromAnotherChain() {
        final StreamIdAllocator parent = new StreamIdAllocator("events", -1L);
        final ChainedStreamIdAllocator a = new ChainedStreamIdAllocator(new StreamIdAllocator("a", -1L), parent);
        final ChainedStreamIdAllocator b = new ChainedStreamIdAllocator(new StreamIdAllocator("b", -1L), parent);
        assertThrows(IllegalArgumentException.class, () -> b.markDone(a.reserveOne()));
    }

    @Test
    void parentPositionsNeverDecreaseAndNeverOutrunParent() throws Exception {
        final StreamIdAllocator events = new StreamIdAllocator("events", -1L);
        final ChainedStreamIdAllocator chained = new ChainedStreamIdAllocator(
                new StreamIdAllocator("push_rules_stream", -1L), events);
        final ConcurrentLinkedQueue<String> violations = new ConcurrentLinkedQueue<>();
        final ConcurrentLinkedQueue<ChainedTicket> reserved = new ConcurrentLinkedQueue<>();

        final int rounds = 2_000;
        final ExecutorService exec = Executors.newFixedThreadPool(4);
        final CountDownLatch start = new CountDownLatch(1);

        for (int p = 0; p < 2; p++) {
            exec.submit(() -> {
                start.await();
                for (int i = 0; i < rounds; i++) {
                    events.markDone(events.reserveOne());
                }
                return null;
            });
        }
        for (int c = 0; c < 2; c++) {
            exec.submit(() -> {
                start.await();
                for (int i = 0; i < rounds; i++) {
                    final ChainedTicket t = chained.reserveOne();
                    if (t.parentPosition() > events.currentToken()) {
                        violations.add(t + " ahead of parent " + events.currentToken());
                    }
                    reserved.add(t);
                    chained.markDone(t);
                }
                return null;
            });
        }

        start.countDown();
        exec.shutdown();
        assertTrue(exec.awaitTermination(30, TimeUnit.SECONDS), "executor did not finish");
        assertTrue(violations.isEmpty(), () -> violations.toString());

        final List<ChainedTicket> ordered = new ArrayList<>(reserved);
        ordered.sort((x, y) -> Long.compare(x.position(), y.position()));
        for (int i = 1; i < ordered.size(); i++) {
            assertTrue(ordered.get(i).parentPosition() >= ordered.get(i - 1).parentPosition(),
                    "parent position regressed at " + ordered.get(i));
        }
        assertEquals(2L * rounds - 1, chained.currentToken().position());
        assertTrue(chained.currentToken().parentPosition() <= events.currentToken());
    }
}
