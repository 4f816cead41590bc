package com.cosign.multisig.execution;

import com.cosign.domain.ChainId;

import java.util.List;

/**
 * @param owners normalized owner addresses
 */
public record DeploymentRequest(String walletId, ChainId chain, List<String> owners, int threshold) {

    public DeploymentRequest {
        owners = List.copyOf(owners);
    }
}
