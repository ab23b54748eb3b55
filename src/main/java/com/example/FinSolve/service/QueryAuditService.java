package com.example.FinSolve.service;

import com.example.FinSolve.model.ChatResponse;
import com.example.FinSolve.model.QueryAuditLog;
import com.example.FinSolve.model.Role;
import com.example.FinSolve.model.SourceCitation;
import com.example.FinSolve.repository.QueryAuditLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Records who asked what and which files were cited. Never affects the answer.
 */
@Service
@RequiredArgsConstructor
public class QueryAuditService {

    private static final Logger log = LoggerFactory.getLogger(QueryAuditService.class);

    private final QueryAuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;

    public void record(String userId, Role role, String query, ChatResponse response) {
        QueryAuditLog entry = new QueryAuditLog();
        entry.setUserId(userId);
        entry.setRole(role);
        entry.setQuery(query);
        entry.setOutcome(response.outcome());
        entry.setSourcesJson(serializeSources(response.sources()));

        try {
            auditLogRepository.save(entry);
        } catch (DataAccessException e) {
            log.warn("Failed to write audit entry for user={} outcome={}", userId, response.outcome(), e);
        }
    }

    private String serializeSources(List<SourceCitation> sources) {
        if (sources == null || sources.isEmpty()) {
            return "[]";
        }
        try {
            return objectMapper.writeValueAsString(sources);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize sources for audit log", e);
            return "[]";
        }
    }
}
