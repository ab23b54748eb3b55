package com.example.FinSolve.repository;

import com.example.FinSolve.model.QueryAuditLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface QueryAuditLogRepository extends JpaRepository<QueryAuditLog, Long> {
}
