package com.memquest.stream;

/** One message read from a partition of the memory event stream. */
public record StreamEvent(int partition, long offset, String partitionKey, String body) {}
