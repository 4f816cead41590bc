package com.cosign.multisig.audit;

import com.cosign.domain.AuditLogEntry;
import com.cosign.domain.AuditLogEntryRepository;
import com.cosign.domain.MultiSigAuditEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashMap;

/**
 * Writes audit events to audit_logs.
 */
@Component
@RequiredArgsConstructor
public class MongoAuditRecorder implements AuditRecorder {

    private final AuditLogEntryRepository auditLogEntryRepository;

    @Override
    public void record(MultiSigAuditEvent event) {
        AuditLogEntry entry = new AuditLogEntry();
        entry.setAction(event.action());
        entry.setActor(event.actor());
        entry.setResource(event.resource());
        entry.setResourceId(event.resourceId());
        entry.setMetadata(new HashMap<>(event.metadata()));
        entry.setCreatedAt(event.occurredAt());
        auditLogEntryRepository.save(entry);
    }
}
