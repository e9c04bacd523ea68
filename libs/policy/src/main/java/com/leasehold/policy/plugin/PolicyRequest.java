package com.leasehold.policy.plugin;

import com.leasehold.policy.Action;
import com.leasehold.policy.decoder.DecodedCall;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Everything a plugin may look at when checking or committing an action.
 *
 * @param entityId the entity the action runs against
 * @param caller   normalized caller address
 * @param action   the submitted action
 * @param call     the payload, decoded once by the engine
 */
public record PolicyRequest(long entityId, String caller, Action action, DecodedCall call) {

    public PolicyRequest {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(call, "call");
    }

    public String destination() {
        return action.destination();
    }

    public BigInteger value() {
        return action.value();
    }

    public byte[] payload() {
        return action.payload();
    }

    public String instructionId() {
        return call.instructionId();
    }
}
