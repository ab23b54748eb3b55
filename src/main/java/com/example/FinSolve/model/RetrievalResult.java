package com.example.FinSolve.model;

import java.util.List;

/**
 * Ranked, already department-filtered fragments for one query:
 * - query: original user question
 * - fragments: best match first
 */
public record RetrievalResult(
        String query,
        List<ScoredFragment> fragments
) {
    public RetrievalResult {
        fragments = fragments == null ? List.of() : List.copyOf(fragments);
    }

    public static RetrievalResult empty(String query) {
        return new RetrievalResult(query, List.of());
    }

    public boolean isEmpty() {
        return fragments.isEmpty();
    }

    /**
     * The first {@code limit} fragments in rank order.
     */
    public List<ScoredFragment> top(int limit) {
        return fragments.subList(0, Math.min(Math.max(limit, 0), fragments.size()));
    }
}
