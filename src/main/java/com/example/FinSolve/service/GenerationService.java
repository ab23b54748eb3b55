package com.example.FinSolve.service;

import com.example.FinSolve.model.GenerationRequest;

/**
 * External text-completion capability. Calls block; the orchestrator runs them off the caller thread.
 */
public interface GenerationService {

    /**
     * @throws com.example.FinSolve.exception.GenerationUnavailableException when the service errors
     */
    String complete(GenerationRequest request);
}
