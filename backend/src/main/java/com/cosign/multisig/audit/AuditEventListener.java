package com.cosign.multisig.audit;

import com.cosign.config.AsyncConfig;
import com.cosign.domain.MultiSigAuditEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Forwards {@link MultiSigAuditEvent}s to the {@link AuditRecorder} off the request thread.
 * A failed write is logged and dropped; it never reaches the operation that produced the event.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuditEventListener {

    private final AuditRecorder auditRecorder;

    @EventListener
    @Async(AsyncConfig.AUDIT_EXECUTOR)
    public void onAuditEvent(MultiSigAuditEvent event) {
        try {
            auditRecorder.record(event);
        } catch (RuntimeException e) {
            log.warn("Audit write failed for {} on {} {}: {}", event.action(), event.resource(), event.resourceId(), e.getMessage());
        }
    }
}
