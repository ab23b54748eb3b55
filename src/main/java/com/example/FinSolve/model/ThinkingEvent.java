package com.example.FinSolve.model;

/**
 * A single pipeline step event streamed to the client.
 *
 * stage   - SSE event name, e.g. "access", "rag", "memory", "answer_final"
 * message - human-readable description of the step
 * payload - step data for the UI, e.g.:
 *           - List of department labels after access resolution
 *           - List of source summaries after retrieval
 *           - ChatResponse for the terminal step
 */
public record ThinkingEvent(
        String stage,
        String message,
        Object payload
) {
}
