package com.memquest.stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Partitioned, in-process event stream with per-consumer-group checkpoints.
 * An event is released once every known consumer group has checkpointed past
 * it, and each partition retains at most {@code maxRetained} events (oldest
 * dropped first). Offsets never shift: a partition remembers the offset of its
 * first retained event. A group has at most one active subscription; it runs
 * one reader thread per partition.
 */
public class InMemoryEventHub implements EventProducer, EventConsumer {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventHub.class);

    public static final int DEFAULT_MAX_RETAINED = 10_000;

    private final String name;
    private final int maxRetained;
    private final List<Partition> partitions;
    private final Map<String, long[]> checkpoints = new ConcurrentHashMap<>();
    private final Map<String, HubSubscription> active = new ConcurrentHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition appended = lock.newCondition();

    public InMemoryEventHub(String name, int partitionCount) {
        this(name, partitionCount, DEFAULT_MAX_RETAINED);
    }

    public InMemoryEventHub(String name, int partitionCount, int maxRetained) {
        if (partitionCount < 1) throw new IllegalArgumentException("partitionCount must be >= 1");
        if (maxRetained < 1) throw new IllegalArgumentException("maxRetained must be >= 1");
        this.name = name;
        this.maxRetained = maxRetained;
        this.partitions = new ArrayList<>(partitionCount);
        for (int i = 0; i < partitionCount; i++) partitions.add(new Partition());
    }

    public String name() { return name; }

    public int partitionCount() { return partitions.size(); }

    public int partitionFor(String partitionKey) {
        return Math.floorMod(partitionKey != null ? partitionKey.hashCode() : 0, partitions.size());
    }

    @Override
    public void sendBatch(String partitionKey, List<String> bodies) throws IOException {
        if (bodies.isEmpty()) return;
        int p = partitionFor(partitionKey);
        lock.lock();
        try {
            var partition = partitions.get(p);
            for (var body : bodies) {
                partition.events.add(new StreamEvent(p, partition.end(), partitionKey, body));
            }
            int overflow = partition.events.size() - maxRetained;
            if (overflow > 0) {
                partition.release(overflow);
                log.warn("{}[{}] over retention limit; dropped {} oldest events", name, p, overflow);
            }
            appended.signalAll();
        } finally {
            lock.unlock();
        }
        log.debug("Appended {} events to {}[{}]", bodies.size(), name, p);
    }

    /** Number of events ever appended to {@code partition}. */
    public long size(int partition) {
        lock.lock();
        try {
            return partitions.get(partition).end();
        } finally {
            lock.unlock();
        }
    }

    /** Number of events {@code partition} still holds in memory. */
    public int retained(int partition) {
        lock.lock();
        try {
            return partitions.get(partition).events.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long checkpoint(String consumerGroup, int partition) {
        var offsets = checkpoints.get(consumerGroup);
        return offsets != null ? offsets[partition] : 0;
    }

    @Override
    public Subscription receive(String consumerGroup, EventHandler handler) {
        var subscription = new HubSubscription(consumerGroup, handler);
        if (active.putIfAbsent(consumerGroup, subscription) != null) {
            throw new IllegalStateException("Consumer group " + consumerGroup + " already has an active subscription");
        }
        lock.lock();
        try {
            checkpoints.computeIfAbsent(consumerGroup, g -> new long[partitions.size()]);
        } finally {
            lock.unlock();
        }
        subscription.start();
        log.info("Consumer group {} subscribed to {} ({} partitions)", consumerGroup, name, partitions.size());
        return subscription;
    }

    private StreamEvent awaitEvent(int partition, long offset, AtomicBoolean running) throws InterruptedException {
        lock.lock();
        try {
            var p = partitions.get(partition);
            while (running.get() && p.end() <= offset) {
                appended.await(200, TimeUnit.MILLISECONDS);
            }
            if (!running.get()) return null;
            if (offset < p.base) {
                log.warn("{}[{}]: events {}..{} are no longer retained; resuming at {}",
                        name, partition, offset, p.base - 1, p.base);
                offset = p.base;
            }
            return p.events.get((int) (offset - p.base));
        } finally {
            lock.unlock();
        }
    }

    /** Drops events every known group has checkpointed past. Caller holds {@code lock}. */
    private void releaseConsumed(int partition) {
        long min = Long.MAX_VALUE;
        for (var offsets : checkpoints.values()) {
            min = Math.min(min, offsets[partition]);
        }
        var p = partitions.get(partition);
        long releasable = Math.min(min, p.end()) - p.base;
        if (releasable > 0) p.release((int) releasable);
    }

    private static final class Partition {

        private final List<StreamEvent> events = new ArrayList<>();
        private long base;

        long end() {
            return base + events.size();
        }

        void release(int count) {
            events.subList(0, count).clear();
            base += count;
        }
    }

    private final class HubSubscription implements Subscription {

        private final String group;
        private final EventHandler handler;
        private final AtomicBoolean running = new AtomicBoolean(true);
        private final List<Thread> readers = new ArrayList<>();

        HubSubscription(String group, EventHandler handler) {
            this.group = group;
            this.handler = handler;
        }

        void start() {
            for (int p = 0; p < partitions.size(); p++) {
                int partition = p;
                var t = new Thread(() -> read(partition), name + "-" + group + "-" + partition);
                t.setDaemon(true);
                readers.add(t);
                t.start();
            }
        }

        private void read(int partition) {
            var context = new Context(group, partition);
            long next = checkpoint(group, partition);
            while (running.get()) {
                StreamEvent event;
                try {
                    event = awaitEvent(partition, next, running);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                if (event == null) return;
                try {
                    handler.onEvent(context, event);
                } catch (Exception e) {
                    log.error("Handler failed on {}[{}]@{}", name, partition, event.offset(), e);
                }
                next = event.offset() + 1;
            }
        }

        @Override
        public void close() {
            if (!running.compareAndSet(true, false)) return;
            lock.lock();
            try {
                appended.signalAll();
            } finally {
                lock.unlock();
            }
            for (var t : readers) {
                try {
                    t.join(2_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            active.remove(group, this);
            log.info("Consumer group {} unsubscribed from {}", group, name);
        }
    }

    private final class Context implements PartitionContext {

        private final String group;
        private final int partition;

        Context(String group, int partition) {
            this.group = group;
            this.partition = partition;
        }

        @Override
        public int partitionId() { return partition; }

        @Override
        public String consumerGroup() { return group; }

        @Override
        public void updateCheckpoint(StreamEvent event) {
            lock.lock();
            try {
                var offsets = checkpoints.get(group);
                offsets[partition] = Math.max(offsets[partition], event.offset() + 1);
                releaseConsumed(partition);
            } finally {
                lock.unlock();
            }
        }
    }
}
