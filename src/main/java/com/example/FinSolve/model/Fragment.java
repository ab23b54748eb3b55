package com.example.FinSolve.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A retrievable unit of document text.
 *
 * @param id         stable identifier assigned at ingestion
 * @param content    fragment text
 * @param embedding  embedding vector of {@code content}
 * @param department department tag controlling visibility
 * @param sourceFile name of the document the fragment was cut from
 * @param updatedAt  last time the source document changed
 */
public record Fragment(
        String id,
        String content,
        float[] embedding,
        DepartmentTag department,
        String sourceFile,
        Instant updatedAt
) {
    public Fragment {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(department, "department");
        Objects.requireNonNull(sourceFile, "sourceFile");
        Objects.requireNonNull(updatedAt, "updatedAt");
        embedding = embedding == null ? new float[0] : embedding.clone();
    }

    @Override
    public float[] embedding() {
        return embedding.clone();
    }
}
