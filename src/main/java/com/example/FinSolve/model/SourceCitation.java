package com.example.FinSolve.model;

import java.time.Instant;

public record SourceCitation(
        String file,
        DepartmentTag department,
        Instant updatedAt,
        double relevanceScore
) {}
