package com.memquest.ingestion;

import com.memquest.stream.EventConsumer;
import com.memquest.stream.PartitionContext;
import com.memquest.stream.StreamEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Continuous consume mode: feeds every stream event through the
 * {@link IngestionPipeline} and checkpoints only once the pipeline has returned.
 * An event whose processing throws is left un-checkpointed and is seen again
 * when the group next subscribes.
 */
public class IngestionConsumer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(IngestionConsumer.class);

    private final EventConsumer consumer;
    private final IngestionPipeline pipeline;
    private final String consumerGroup;
    private final boolean enabled;
    private EventConsumer.Subscription subscription;

    public IngestionConsumer(EventConsumer consumer, IngestionPipeline pipeline, String consumerGroup,
                             boolean enabled) {
        this.consumer = consumer;
        this.pipeline = pipeline;
        this.consumerGroup = consumerGroup;
        this.enabled = enabled;
    }

    public synchronized void start() {
        if (!enabled) {
            log.info("Cold ingestion disabled; not consuming memory events");
            return;
        }
        if (subscription != null) return;
        subscription = consumer.receive(consumerGroup, this::handle);
        log.info("Consuming memory events as group {}", consumerGroup);
    }

    public synchronized boolean running() {
        return subscription != null;
    }

    void handle(PartitionContext context, StreamEvent event) {
        var result = pipeline.processEvent(event.body());
        log.debug("Event {}[{}]@{} -> {}", context.consumerGroup(), context.partitionId(), event.offset(),
                result.status().code());
        context.updateCheckpoint(event);
    }

    public synchronized void stop() {
        if (subscription == null) return;
        subscription.close();
        subscription = null;
        log.info("Stopped consuming memory events");
    }

    @Override
    public void close() {
        stop();
    }
}
