package com.leasehold.access.vault;

import java.math.BigInteger;

/**
 * Performs a call from a vault to another address, moving {@code value} along with it.
 *
 * <p>Implementations either report failure through {@link CallResult#failed} or throw; both are
 * treated the same way and leave the vault balance untouched.
 */
@FunctionalInterface
public interface ExternalCallPort {

    CallResult call(String from, String to, BigInteger value, byte[] payload);
}
