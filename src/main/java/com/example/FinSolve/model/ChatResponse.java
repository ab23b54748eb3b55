package com.example.FinSolve.model;

import java.time.Instant;
import java.util.List;

/**
 * Answer returned to the caller.
 * - userRole: label of the role the query was answered for
 * - timestamp: when the response was composed
 * - queryProcessed: the query text as processed
 */
public record ChatResponse(
        String answer,
        List<SourceCitation> sources,
        QueryOutcome outcome,
        String userRole,
        Instant timestamp,
        String queryProcessed
) {
    public ChatResponse {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
