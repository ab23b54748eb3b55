package com.example.FinSolve.model;

/**
 * Request payload for a chat query.
 *
 * @param query      user question
 * @param priorTurns optional number of prior turns to feed back as context;
 *                   clamped to the configured window
 */
public record ChatRequest(
        String query,
        Integer priorTurns
) {
    public int resolvePriorTurns(int windowSize) {
        if (priorTurns == null) {
            return windowSize;
        }
        return Math.max(0, Math.min(priorTurns, windowSize));
    }
}
