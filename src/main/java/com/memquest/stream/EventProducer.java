package com.memquest.stream;

import java.io.IOException;
import java.util.List;

public interface EventProducer {

    /** Sends the bodies as one batch; all events with the same key land on the same partition. */
    void sendBatch(String partitionKey, List<String> bodies) throws IOException;
}
