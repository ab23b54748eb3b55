package com.example.FinSolve.service;

import com.example.FinSolve.model.QueryStage;

/**
 * Observer of pipeline transitions for one query. Terminal stages carry the
 * {@link com.example.FinSolve.model.ChatResponse} as payload.
 */
@FunctionalInterface
public interface QueryStageListener {

    QueryStageListener NONE = (stage, payload) -> { };

    void onStage(QueryStage stage, Object payload);
}
