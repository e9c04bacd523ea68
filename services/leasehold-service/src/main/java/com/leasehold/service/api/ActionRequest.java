package com.leasehold.service.api;

import com.leasehold.policy.Action;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigInteger;

/**
 * Body of an action submission or preview.
 *
 * @param destination contract or account the vault calls
 * @param value native value to send, in wei
 * @param payload hex call data, {@code 0x} prefix optional; absent or empty for a plain transfer
 */
public record ActionRequest(
        @NotBlank String destination, @NotNull @PositiveOrZero BigInteger value, String payload) {

    public Action toAction() {
        return Action.of(destination, value, payload == null ? "" : payload);
    }
}
