package com.memquest.deadletter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

public class LoggingDeadLetterHandler implements DeadLetterHandler {

    private static final Logger log = LoggerFactory.getLogger(LoggingDeadLetterHandler.class);

    @Override
    public void deadLetter(Map<String, Object> document, String reason) {
        log.error("DLQ: document {} ({})", document.getOrDefault("id", "unknown"), reason);
    }
}
