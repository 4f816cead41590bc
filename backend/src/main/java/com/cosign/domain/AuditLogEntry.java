package com.cosign.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Audit trail entry, one per state-changing multi-sig operation.
 */
@Document(collection = "audit_logs")
@CompoundIndex(name = "resource_created", def = "{'resourceId': 1, 'createdAt': -1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class AuditLogEntry {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String action;
    private String actor;
    private String resource;
    private String resourceId;
    private Map<String, Object> metadata = new HashMap<>();
    private Instant createdAt;
}
