package com.memquest.ingestion;

import java.util.List;

public record RedactionResult(String text, boolean piiDetected, List<String> piiTypes) {

    public RedactionResult {
        piiTypes = List.copyOf(piiTypes);
    }
}
