package com.cosign.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for audit_logs.
 */
public interface AuditLogEntryRepository extends MongoRepository<AuditLogEntry, String> {

    List<AuditLogEntry> findByResourceIdOrderByCreatedAtDesc(String resourceId);
}
