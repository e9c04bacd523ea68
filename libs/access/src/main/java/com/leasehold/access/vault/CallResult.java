package com.leasehold.access.vault;

import java.util.HexFormat;

/**
 * Outcome reported by an {@link ExternalCallPort}.
 *
 * @param success       whether the call took effect
 * @param returnData    raw return data, empty when none
 * @param failureReason why the call failed, {@code null} on success
 */
public record CallResult(boolean success, byte[] returnData, String failureReason) {

    public CallResult {
        returnData = returnData == null ? new byte[0] : returnData.clone();
    }

    public static CallResult ok() {
        return new CallResult(true, new byte[0], null);
    }

    public static CallResult ok(byte[] returnData) {
        return new CallResult(true, returnData, null);
    }

    public static CallResult failed(String reason) {
        return new CallResult(false, new byte[0], reason);
    }

    @Override
    public byte[] returnData() {
        return returnData.clone();
    }

    public String returnDataHex() {
        return "0x" + HexFormat.of().formatHex(returnData);
    }
}
