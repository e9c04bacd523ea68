package com.leasehold.policy;

import java.util.regex.Pattern;

/**
 * Normalization and comparison helpers for 20-byte account addresses.
 *
 * <p>Addresses travel through Leasehold as {@code 0x}-prefixed lower-case hex strings so that
 * plain {@link String#equals} is a correct identity comparison everywhere.
 */
public final class Addresses {

    /** The all-zero address, never a valid party. */
    public static final String ZERO = "0x0000000000000000000000000000000000000000";

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-f]{40}$");

    private Addresses() {
        // utility class
    }

    /**
     * Returns the canonical lower-case form of {@code address}.
     *
     * @throws IllegalArgumentException if the value is not a 20-byte hex address
     */
    public static String normalize(String address) {
        if (address == null) {
            throw new IllegalArgumentException("address must not be null");
        }
        String candidate = address.strip().toLowerCase();
        if (!candidate.startsWith("0x")) {
            candidate = "0x" + candidate;
        }
        if (!ADDRESS.matcher(candidate).matches()) {
            throw new IllegalArgumentException("not a 20-byte hex address: '" + address + "'");
        }
        return candidate;
    }

    /** Normalizes and additionally rejects the zero address. */
    public static String requireNonZero(String address, String field) {
        String normalized = normalize(address);
        if (ZERO.equals(normalized)) {
            throw new IllegalArgumentException(field + " must not be the zero address");
        }
        return normalized;
    }

    public static boolean isValid(String address) {
        return address != null && ADDRESS.matcher(address.strip().toLowerCase()).matches();
    }

    /** Null-safe equality on normalized addresses. */
    public static boolean same(String a, String b) {
        return a != null && b != null && normalize(a).equals(normalize(b));
    }
}
