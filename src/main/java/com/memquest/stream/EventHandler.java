package com.memquest.stream;

@FunctionalInterface
public interface EventHandler {
    void onEvent(PartitionContext context, StreamEvent event) throws Exception;
}
