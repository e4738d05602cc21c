package com.memquest.stream;

/**
 * Consumer-group side of the event stream. Delivery resumes from the group's
 * last checkpoint, so events handled but not checkpointed are delivered again.
 */
public interface EventConsumer {

    Subscription receive(String consumerGroup, EventHandler handler);

    /** Next offset the group will read from {@code partition}. */
    long checkpoint(String consumerGroup, int partition);

    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
