package com.openfashion.ammservice.dto;

import java.util.UUID;

public record TransferResult(
        boolean success,
        UUID transferId,
        String failureReason
) {

    public static TransferResult success(UUID transferId) {
        return new TransferResult(true, transferId, null);
    }

    public static TransferResult failure(String reason) {
        return new TransferResult(false, null, reason);
    }

}
