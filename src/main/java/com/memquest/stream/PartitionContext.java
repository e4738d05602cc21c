package com.memquest.stream;

/**
 * Handle given to an {@link EventHandler} alongside each event, used to advance
 * the consumer group's position once the event has been dealt with.
 */
public interface PartitionContext {

    int partitionId();

    String consumerGroup();

    /** Marks {@code event} and everything before it in its partition as processed. */
    void updateCheckpoint(StreamEvent event);
}
