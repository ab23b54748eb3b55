package com.example.FinSolve.index;

import com.example.FinSolve.model.DepartmentTag;
import com.example.FinSolve.model.Fragment;
import com.example.FinSolve.model.RetrievalResult;
import com.example.FinSolve.model.ScoredFragment;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fragment index backed by a pgvector table.
 *
 * The department restriction is part of the WHERE clause, so LIMIT is applied to the
 * filtered candidates only. The similarity floor is applied to those candidates before LIMIT.
 */
@Repository
@ConditionalOnProperty(prefix = "finsolve.index", name = "store", havingValue = "pgvector")
@RequiredArgsConstructor
public class PgVectorDocumentIndex implements DocumentIndex {

    private static final Logger log = LoggerFactory.getLogger(PgVectorDocumentIndex.class);

    private final JdbcTemplate jdbcTemplate;
    private final EmbeddingModel embeddingModel;

    /**
     * Uses the pgvector cosine distance operator {@code <=>};
     * similarity score = 1 - distance.
     */
    @Override
    public RetrievalResult query(String text, int k, Set<DepartmentTag> allowedDepartments, double minScore) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive, got " + k);
        }
        if (allowedDepartments == null || allowedDepartments.isEmpty()) {
            return RetrievalResult.empty(text);
        }

        List<String> departments = departmentLabels(allowedDepartments);
        PGvector queryVector = new PGvector(embeddingModel.embed(text));
        String sql = buildQuery(departments.size());

        List<ScoredFragment> rows = jdbcTemplate.query(sql, ps -> {
            int idx = 1;
            ps.setObject(idx++, queryVector); // 1 - (embedding <=> ?)
            for (String department : departments) {
                ps.setString(idx++, department);
            }
            ps.setDouble(idx++, minScore);
            ps.setInt(idx, k);
        }, new ScoredFragmentRowMapper());

        log.debug("pgvector retrieval: {} fragments in {} for query='{}'", rows.size(), departments, text);
        return new RetrievalResult(text, rows);
    }

    /**
     * Departments in declaration order, so the same role always yields the same statement.
     */
    static List<String> departmentLabels(Set<DepartmentTag> allowedDepartments) {
        return EnumSet.copyOf(allowedDepartments).stream()
                .map(DepartmentTag::label)
                .toList();
    }

    static String buildQuery(int departmentCount) {
        if (departmentCount <= 0) {
            throw new IllegalArgumentException("At least one department is required");
        }
        String placeholders = Collections.nCopies(departmentCount, "?").stream()
                .collect(Collectors.joining(", "));
        return """
                SELECT id,
                       content,
                       department,
                       source_file,
                       updated_at,
                       score
                FROM (
                    SELECT id,
                           content,
                           department,
                           source_file,
                           updated_at,
                           1 - (embedding <=> ?) AS score
                    FROM kb_fragments
                    WHERE department IN (%s)
                ) candidates
                WHERE score >= ?
                ORDER BY score DESC, updated_at DESC, id ASC
                LIMIT ?
                """.formatted(placeholders);
    }

    private static class ScoredFragmentRowMapper implements RowMapper<ScoredFragment> {
        @Override
        public ScoredFragment mapRow(ResultSet rs, int rowNum) throws SQLException {
            // A row with an unknown department is a corrupt store; fromLabel fails fast
            Fragment fragment = new Fragment(
                    String.valueOf(rs.getLong("id")),
                    rs.getString("content"),
                    null,
                    DepartmentTag.fromLabel(rs.getString("department")),
                    rs.getString("source_file"),
                    rs.getTimestamp("updated_at").toInstant()
            );
            return new ScoredFragment(fragment, rs.getDouble("score"));
        }
    }
}
