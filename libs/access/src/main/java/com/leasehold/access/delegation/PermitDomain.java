package com.leasehold.access.delegation;

import com.leasehold.policy.Addresses;

import java.util.Objects;

/**
 * EIP-712 domain that operator permits are signed under.
 *
 * @param name              human-readable signing domain name
 * @param version           domain version
 * @param chainId           chain the permit is valid on
 * @param verifyingContract address of the access router
 */
public record PermitDomain(String name, String version, long chainId, String verifyingContract) {

    public PermitDomain {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
        if (chainId <= 0) {
            throw new IllegalArgumentException("chainId must be positive");
        }
        verifyingContract = Addresses.requireNonZero(verifyingContract, "verifyingContract");
    }
}
