package com.cosign.chain;

import java.util.List;

/**
 * Event log from a transaction receipt.
 */
public record ChainLog(String address, List<String> topics, String data) {

    public ChainLog {
        topics = topics != null ? List.copyOf(topics) : List.of();
    }
}
