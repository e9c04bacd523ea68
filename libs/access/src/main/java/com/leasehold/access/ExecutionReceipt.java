package com.leasehold.access;

import java.time.Instant;

/**
 * What the router reports back for an executed action.
 *
 * @param entityId      entity the action ran against
 * @param role          role the caller acted in
 * @param instructionId decoded selector, empty for plain value transfers
 * @param returnData    hex-encoded return data of the forwarded call
 * @param executedAt    execution time
 */
public record ExecutionReceipt(long entityId, CallerRole role, String instructionId, String returnData,
                               Instant executedAt) {
}
