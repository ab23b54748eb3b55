package com.example.FinSolve.model;

/**
 * Per-query pipeline states, in the order a successful query visits them.
 * REFUSED and FAILED are terminal early exits.
 */
public enum QueryStage {
    RECEIVED("received"),
    AUTHORIZED_DEPARTMENTS_RESOLVED("access"),
    RETRIEVED("rag"),
    CONTEXT_MERGED("memory"),
    GENERATED("generated"),
    COMPOSED("composed"),
    DELIVERED("answer_final"),
    REFUSED("refused"),
    FAILED("failed");

    private final String eventName;

    QueryStage(String eventName) {
        this.eventName = eventName;
    }

    /** SSE event name used by the streaming endpoint. */
    public String eventName() {
        return eventName;
    }
}
