package com.leasehold.access.vault;

import com.leasehold.access.ExecutionFailedException;
import com.leasehold.policy.Action;
import com.leasehold.policy.Addresses;
import com.leasehold.policy.AuthorizationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * Custodial account bound to one entity.
 *
 * <p>Anyone may deposit. Only the router may make the vault call out or pay out, and payouts
 * always go to the owner of record the router supplies. A failed call leaves the balance exactly
 * as it was.
 */
public final class Vault {

    private static final Logger log = LoggerFactory.getLogger(Vault.class);

    private final long entityId;
    private final String address;
    private final String router;
    private final ExternalCallPort port;
    private BigInteger balance = BigInteger.ZERO;

    Vault(long entityId, String address, String router, ExternalCallPort port) {
        this.entityId = entityId;
        this.address = address;
        this.router = router;
        this.port = port;
    }

    public long entityId() {
        return entityId;
    }

    public String address() {
        return address;
    }

    public synchronized BigInteger balance() {
        return balance;
    }

    public synchronized void deposit(String from, BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("deposit amount must be positive");
        }
        balance = balance.add(amount);
        log.info("Vault {} received {} from {}", address, amount, Addresses.normalize(from));
    }

    /**
     * Performs {@code action} on behalf of the entity. A call back into this vault is a
     * self-credit and moves nothing.
     *
     * @throws ExecutionFailedException if the balance is too low or the call fails
     */
    public synchronized CallResult forward(String invoker, Action action) {
        requireRouter(invoker);
        if (address.equals(action.destination())) {
            log.debug("Vault {} self-call ignored", address);
            return CallResult.ok();
        }
        debit(action.value());
        CallResult result;
        try {
            result = port.call(address, action.destination(), action.value(), action.payload());
        } catch (RuntimeException e) {
            balance = balance.add(action.value());
            throw new ExecutionFailedException("call to " + action.destination() + " failed: " + e.getMessage(), e);
        }
        if (result == null || !result.success()) {
            balance = balance.add(action.value());
            String reason = result == null ? "no result" : result.failureReason();
            throw new ExecutionFailedException("call to " + action.destination() + " failed: " + reason);
        }
        return result;
    }

    /**
     * Pays {@code amount} of the native balance to {@code owner}.
     */
    public synchronized void withdraw(String invoker, String owner, BigInteger amount) {
        requireRouter(invoker);
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("withdrawal amount must be positive");
        }
        forward(invoker, new Action(owner, amount, new byte[0]));
        log.info("Vault {} paid {} to owner {}", address, amount, owner);
    }

    private void debit(BigInteger amount) {
        if (balance.compareTo(amount) < 0) {
            throw new ExecutionFailedException("insufficient vault balance: have " + balance + ", need " + amount);
        }
        balance = balance.subtract(amount);
    }

    private void requireRouter(String invoker) {
        String who = Addresses.normalize(invoker);
        if (!router.equals(who)) {
            throw new AuthorizationException(who, "only the access router may operate vault " + address);
        }
    }
}
