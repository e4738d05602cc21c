package com.memquest.stream;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryEventHubTest {

    @Test
    void sameKeyLandsOnSamePartition() throws Exception {
        var hub = new InMemoryEventHub("memory-events", 4);
        hub.sendBatch("tenant-a", List.of("1", "2"));
        hub.sendBatch("tenant-a", List.of("3"));
        int p = hub.partitionFor("tenant-a");
        assertEquals(3, hub.size(p));
    }

    @Test
    void deliversAndCheckpoints() throws Exception {
        var hub = new InMemoryEventHub("memory-events", 2);
        var received = new CopyOnWriteArrayList<String>();
        var latch = new CountDownLatch(3);

        try (var sub = hub.receive("grp", (ctx, event) -> {
            received.add(event.body());
            ctx.updateCheckpoint(event);
            latch.countDown();
        })) {
            hub.sendBatch("k", List.of("a", "b", "c"));
            assertTrue(latch.await(5, TimeUnit.SECONDS));
        }

        assertEquals(List.of("a", "b", "c"), received);
        assertEquals(3, hub.checkpoint("grp", hub.partitionFor("k")));
    }

    @Test
    void uncheckpointedEventsAreRedeliveredToNextSubscription() throws Exception {
        var hub = new InMemoryEventHub("memory-events", 1);
        hub.sendBatch("k", List.of("first", "second"));

        var firstPass = new CountDownLatch(2);
        try (var sub = hub.receive("grp", (ctx, event) -> {
            if (event.body().equals("first")) ctx.updateCheckpoint(event);
            firstPass.countDown();
        })) {
            assertTrue(firstPass.await(5, TimeUnit.SECONDS));
        }
        assertEquals(1, hub.checkpoint("grp", 0));

        var redelivered = new CopyOnWriteArrayList<String>();
        var secondPass = new CountDownLatch(1);
        try (var sub = hub.receive("grp", (ctx, event) -> {
            redelivered.add(event.body());
            ctx.updateCheckpoint(event);
            secondPass.countDown();
        })) {
            assertTrue(secondPass.await(5, TimeUnit.SECONDS));
        }
        assertEquals(List.of("second"), redelivered);
        assertEquals(2, hub.checkpoint("grp", 0));
    }

    @Test
    void handlerFailureDoesNotStopTheReader() throws Exception {
        var hub = new InMemoryEventHub("memory-events", 1);
        var latch = new CountDownLatch(2);
        try (var sub = hub.receive("grp", (ctx, event) -> {
            latch.countDown();
            if (event.body().equals("bad")) throw new IllegalStateException("cannot process");
            ctx.updateCheckpoint(event);
        })) {
            hub.sendBatch("k", List.of("bad", "good"));
            assertTrue(latch.await(5, TimeUnit.SECONDS));
        }
        assertEquals(2, hub.checkpoint("grp", 0));
    }

    @Test
    void groupsAreIndependent() throws Exception {
        var hub = new InMemoryEventHub("memory-events", 1);
        hub.sendBatch("k", List.of("x"));
        var latch = new CountDownLatch(1);
        try (var sub = hub.receive("a", (ctx, event) -> {
            ctx.updateCheckpoint(event);
            latch.countDown();
        })) {
            assertTrue(latch.await(5, TimeUnit.SECONDS));
        }
        assertEquals(1, hub.checkpoint("a", 0));
        assertEquals(0, hub.checkpoint("b", 0));
    }

    @Test
    void oneActiveSubscriptionPerGroup() {
        var hub = new InMemoryEventHub("memory-events", 1);
        try (var sub = hub.receive("grp", (ctx, event) -> { })) {
            assertThrows(IllegalStateException.class, () -> hub.receive("grp", (ctx, event) -> { }));
        }
    }

    @Test
    void checkpointedEventsAreReleased() throws Exception {
        var hub = new InMemoryEventHub("memory-events", 1);
        var latch = new CountDownLatch(3);
        try (var sub = hub.receive("grp", (ctx, event) -> {
            ctx.updateCheckpoint(event);
            latch.countDown();
        })) {
            hub.sendBatch("k", List.of("a", "b", "c"));
            assertTrue(latch.await(5, TimeUnit.SECONDS));
        }
        assertEquals(0, hub.retained(0));
        assertEquals(3, hub.size(0));

        hub.sendBatch("k", List.of("d"));
        var offsets = new CopyOnWriteArrayList<Long>();
        var next = new CountDownLatch(1);
        try (var sub = hub.receive("grp", (ctx, event) -> {
            offsets.add(event.offset());
            ctx.updateCheckpoint(event);
            next.countDown();
        })) {
            assertTrue(next.await(5, TimeUnit.SECONDS));
        }
        assertEquals(List.of(3L), offsets);
    }

    @Test
    void slowestGroupHoldsEvents() throws Exception {
        var hub = new InMemoryEventHub("memory-events", 1);
        var fast = new CountDownLatch(3);
        var slow = new CountDownLatch(3);
        try (var fastSub = hub.receive("fast", (ctx, event) -> {
                 ctx.updateCheckpoint(event);
                 fast.countDown();
             });
             var slowSub = hub.receive("slow", (ctx, event) -> {
                 if (event.body().equals("x1")) ctx.updateCheckpoint(event);
                 slow.countDown();
             })) {
            hub.sendBatch("k", List.of("x1", "x2", "x3"));
            assertTrue(fast.await(5, TimeUnit.SECONDS));
            assertTrue(slow.await(5, TimeUnit.SECONDS));
        }
        assertEquals(3, hub.checkpoint("fast", 0));
        assertEquals(1, hub.checkpoint("slow", 0));
        assertEquals(2, hub.retained(0));
    }

    @Test
    void retentionLimitDropsOldest() throws Exception {
        var hub = new InMemoryEventHub("memory-events", 1, 2);
        hub.sendBatch("k", List.of("1", "2", "3", "4", "5"));
        assertEquals(2, hub.retained(0));
        assertEquals(5, hub.size(0));

        var received = new CopyOnWriteArrayList<String>();
        var latch = new CountDownLatch(2);
        try (var sub = hub.receive("grp", (ctx, event) -> {
            received.add(event.offset() + ":" + event.body());
            ctx.updateCheckpoint(event);
            latch.countDown();
        })) {
            assertTrue(latch.await(5, TimeUnit.SECONDS));
        }
        assertEquals(List.of("3:4", "4:5"), received);
        assertThrows(IllegalArgumentException.class, () -> new InMemoryEventHub("memory-events", 1, 0));
    }
}
