package com.cosign.api.dto;

public record ExpireOverdueResponse(int expired) {
}
