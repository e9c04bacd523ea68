package com.leasehold.access.audit;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

/**
 * Payload records carried by Leasehold audit events. Field names become the JSON property names.
 */
public final class AuditPayloads {

    private AuditPayloads() {
    }

    public record EntityMinted(String owner, String vault, Long templateId, String initParamsHash) {
    }

    public record LeaseAssigned(String renter, Instant expiresAt) {
    }

    public record OwnershipTransferred(String previousOwner, String newOwner) {
    }

    public record TemplateRegistered(String owner, List<String> policies) {
    }

    public record StatusChanged(String actor, String status) {
    }

    public record OperatorSet(String renter, String operator, Instant expiresAt, boolean viaPermit,
                              long nonce) {
    }

    public record OperatorCleared(String clearedBy, String operator) {
    }

    public record ActionExecuted(String caller, String role, String destination, String instructionId,
                                 BigInteger value, boolean success) {
    }

    public record FundsWithdrawn(String caller, String recipient, BigInteger amount) {
    }

    public record PolicyCommitFailed(String policyType, String diagnostic) {
    }
}
