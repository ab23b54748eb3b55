package com.example.FinSolve.model;

public record ScoredFragment(
        Fragment fragment,
        double score
) {}
