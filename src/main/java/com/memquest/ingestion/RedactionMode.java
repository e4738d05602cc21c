package com.memquest.ingestion;

public enum RedactionMode {
    /** Replace each match with {@code [REDACTED:<TYPE>]}. */
    MASK,
    /** Remove each match. */
    DROP,
    /** Leave the text alone, only report the categories. */
    TAG;

    public static RedactionMode parse(String value) {
        if (value == null || value.isBlank()) return MASK;
        return switch (value.trim().toLowerCase()) {
            case "drop" -> DROP;
            case "tag" -> TAG;
            case "mask" -> MASK;
            default -> throw new IllegalArgumentException("Unknown redaction mode: " + value);
        };
    }
}
