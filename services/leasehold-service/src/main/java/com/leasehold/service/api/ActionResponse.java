package com.leasehold.service.api;

import com.leasehold.access.ExecutionReceipt;
import java.time.Instant;

public record ActionResponse(
        long entityId, String role, String instructionId, String returnData, Instant executedAt) {

    static ActionResponse from(ExecutionReceipt receipt) {
        return new ActionResponse(
                receipt.entityId(),
                receipt.role().name(),
                receipt.instructionId(),
                receipt.returnData(),
                receipt.executedAt());
    }
}
