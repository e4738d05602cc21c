package com.memquest.ingestion;

public enum DecisionReason {
    DUPLICATE("duplicate"),
    TOO_SHORT("too_short"),
    CHIT_CHAT("chit_chat"),
    HEURISTIC_PASS("heuristic_pass"),
    LLM_STORE("llm_store"),
    LLM_SKIP("llm_skip");

    private final String code;

    DecisionReason(String code) {
        this.code = code;
    }

    public String code() { return code; }
}
