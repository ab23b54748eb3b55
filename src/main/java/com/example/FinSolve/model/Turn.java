package com.example.FinSolve.model;

import java.time.Instant;
import java.util.List;

/**
 * One query/answer exchange kept in a user's session.
 */
public record Turn(
        String query,
        String answer,
        List<SourceCitation> sources,
        Instant timestamp
) {
    public Turn {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
