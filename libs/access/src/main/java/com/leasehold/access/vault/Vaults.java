package com.leasehold.access.vault;

import com.leasehold.access.EntityNotFoundException;
import com.leasehold.policy.Addresses;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Opens and looks up the vault of every entity.
 */
public final class Vaults {

    private static final String ADDRESS_SEED = "leasehold.vault:";

    private final String router;
    private final ExternalCallPort port;
    private final Map<Long, Vault> vaults = new ConcurrentHashMap<>();

    public Vaults(String router, ExternalCallPort port) {
        this.router = Addresses.requireNonZero(router, "router");
        this.port = port;
    }

    /** Address of the vault for {@code entityId}: the low 20 bytes of a keccak-256 seed hash. */
    public static String deriveAddress(long entityId) {
        byte[] hash = Hash.sha3((ADDRESS_SEED + entityId).getBytes(StandardCharsets.UTF_8));
        return Numeric.toHexString(Arrays.copyOfRange(hash, 12, 32));
    }

    public Vault open(long entityId) {
        Vault vault = new Vault(entityId, deriveAddress(entityId), router, port);
        if (vaults.putIfAbsent(entityId, vault) != null) {
            throw new IllegalStateException("vault already open for entity " + entityId);
        }
        return vault;
    }

    public Optional<Vault> find(long entityId) {
        return Optional.ofNullable(vaults.get(entityId));
    }

    public Vault require(long entityId) {
        return find(entityId).orElseThrow(() -> new EntityNotFoundException(entityId));
    }
}
