package com.leasehold.service.api;

import com.leasehold.access.EntityRecord;
import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

/**
 * Read view of an entity. {@code activeRenter} and {@code activeOperator} are null once expired,
 * while {@code renter} and {@code operator} show what was last recorded.
 */
public record EntityResponse(
        long id,
        String owner,
        String status,
        String renter,
        Instant leaseExpiry,
        String activeRenter,
        String operator,
        Instant operatorExpiry,
        String activeOperator,
        long operatorNonce,
        String vault,
        BigInteger balance,
        Long templateId,
        boolean template,
        String initParamsHash,
        List<String> policies,
        Instant mintedAt,
        Instant lastActionAt) {

    static EntityResponse of(EntityRecord record, Instant now, BigInteger balance, List<String> policies) {
        return new EntityResponse(
                record.id(),
                record.owner(),
                record.status().name(),
                record.renter(),
                record.leaseExpiry(),
                record.activeRenter(now).orElse(null),
                record.operator(),
                record.operatorExpiry(),
                record.activeOperator(now).orElse(null),
                record.operatorNonce(),
                record.vault(),
                balance,
                record.templateId(),
                record.template(),
                record.initParamsHash(),
                policies,
                record.mintedAt(),
                record.lastActionAt());
    }
}
