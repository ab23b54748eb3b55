package com.example.FinSolve.model;

public enum QueryOutcome {
    /** Answer generated from accessible fragments. */
    DELIVERED,
    /** No fragment the role may see matched the query. */
    REFUSED,
    /** The generation service timed out or failed. */
    FAILED
}
