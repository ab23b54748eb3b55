package com.example.FinSolve.model;

import java.util.List;

/**
 * Everything sent to the generation service for one query.
 * - userPrompt: rendered history + retrieved context + question
 * - fragments: fragments supplied as context (the only ones that may be cited)
 * - history: prior turns, most recent last
 */
public record GenerationRequest(
        String query,
        String userPrompt,
        List<ScoredFragment> fragments,
        List<Turn> history
) {
    public GenerationRequest {
        fragments = fragments == null ? List.of() : List.copyOf(fragments);
        history = history == null ? List.of() : List.copyOf(history);
    }
}
