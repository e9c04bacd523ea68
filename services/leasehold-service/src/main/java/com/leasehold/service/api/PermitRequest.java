package com.leasehold.service.api;

import com.leasehold.access.delegation.OperatorPermit;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Instant;
import org.web3j.utils.Numeric;

/**
 * Renter-signed operator permit, submitted by the operator or the renter.
 *
 * @param signature 65-byte r || s || v signature, hex encoded
 */
public record PermitRequest(
        @NotBlank String renter,
        @NotBlank String operator,
        @NotNull Instant expiry,
        @PositiveOrZero long nonce,
        @NotNull Instant deadline,
        @NotBlank String signature) {

    OperatorPermit toPermit(long entityId) {
        return new OperatorPermit(entityId, renter, operator, expiry, nonce, deadline);
    }

    byte[] signatureBytes() {
        return Numeric.hexStringToByteArray(signature);
    }
}
