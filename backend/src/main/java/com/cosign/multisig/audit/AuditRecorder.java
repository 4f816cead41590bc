package com.cosign.multisig.audit;

import com.cosign.domain.MultiSigAuditEvent;

/**
 * Audit collaborator. Best-effort: callers log and drop failures.
 */
public interface AuditRecorder {

    void record(MultiSigAuditEvent event);
}
