package com.cosign.chain;

import java.util.List;

/**
 * Mined transaction receipt. {@code success} mirrors the receipt status field (0x1).
 */
public record ChainReceipt(String transactionHash, long blockNumber, boolean success, String from, String to,
                           List<ChainLog> logs) {

    public ChainReceipt {
        logs = logs != null ? List.copyOf(logs) : List.of();
    }
}
