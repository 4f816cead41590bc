package com.cosign.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Application event: a state-changing multi-sig operation completed. Consumed asynchronously by the audit listener.
 *
 * @param action     e.g. "multisig_transaction_proposed"
 * @param actor      user id or signer address that triggered the change
 * @param resource   "multisig_wallet" or "multisig_transaction"
 * @param resourceId id of the wallet or pending transaction
 */
public record MultiSigAuditEvent(String action, String actor, String resource, String resourceId,
                                 Map<String, Object> metadata, Instant occurredAt) {

    public MultiSigAuditEvent {
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }
}
