package com.example.FinSolve.index;

import com.example.FinSolve.model.DepartmentTag;
import com.example.FinSolve.model.RetrievalResult;
import com.example.FinSolve.model.ScoredFragment;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementSetter;
import org.springframework.jdbc.core.RowMapper;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class PgVectorDocumentIndexTest {

    @Test
    void departmentFilterIsPartOfTheCandidateQuery() {
        String sql = PgVectorDocumentIndex.buildQuery(2);

        assertThat(sql).contains("WHERE department IN (?, ?)");
        assertThat(sql.indexOf("WHERE department IN")).isLessThan(sql.indexOf("LIMIT ?"));
        assertThat(sql).contains("ORDER BY score DESC, updated_at DESC, id ASC");
    }

    @Test
    void similarityFloorIsAppliedBeforeLimit() {
        String sql = PgVectorDocumentIndex.buildQuery(1);

        assertThat(sql).contains("WHERE score >= ?");
        assertThat(sql.indexOf("WHERE score >= ?")).isGreaterThan(sql.indexOf("WHERE department IN"));
        assertThat(sql.indexOf("WHERE score >= ?")).isLessThan(sql.indexOf("LIMIT ?"));
    }

    @Test
    void departmentLabelsFollowDeclarationOrder() {
        Set<DepartmentTag> allowed = EnumSet.of(DepartmentTag.GENERAL, DepartmentTag.FINANCE);

        assertThat(PgVectorDocumentIndex.departmentLabels(allowed)).containsExactly("finance", "general");
    }

    @Test
    void queryIssuesFilteredStatement() {
        JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);
        EmbeddingModel embeddingModel = mock(EmbeddingModel.class);
        when(embeddingModel.embed(anyString())).thenReturn(new float[]{0.1f, 0.2f});
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        when(jdbcTemplate.query(sql.capture(), any(PreparedStatementSetter.class),
                ArgumentMatchers.<RowMapper<ScoredFragment>>any()))
                .thenReturn(List.of());

        PgVectorDocumentIndex index = new PgVectorDocumentIndex(jdbcTemplate, embeddingModel);
        RetrievalResult result = index.query("headcount", 4, EnumSet.of(DepartmentTag.HR, DepartmentTag.GENERAL));

        assertThat(result.isEmpty()).isTrue();
        assertThat(sql.getValue()).contains("WHERE department IN (?, ?)");
    }

    @Test
    void emptyAllowedSetSkipsTheDatabase() {
        JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);
        EmbeddingModel embeddingModel = mock(EmbeddingModel.class);

        PgVectorDocumentIndex index = new PgVectorDocumentIndex(jdbcTemplate, embeddingModel);

        assertThat(index.query("q", 3, Set.of()).isEmpty()).isTrue();
        verifyNoInteractions(jdbcTemplate, embeddingModel);
    }
}
