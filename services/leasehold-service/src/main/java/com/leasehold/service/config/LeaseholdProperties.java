package com.leasehold.service.config;

import com.leasehold.policy.engine.PolicyEngine;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for the Leasehold service, bound from the {@code leasehold.*} prefix.
 *
 * <pre>
 * leasehold:
 *   service-name: leasehold-service
 *   environment: production
 *   router: "0x..."
 *   governor: "0x..."
 *   registrar: "0x..."
 *   lease-issuer: "0x..."
 *   permit-domain-name: Leasehold
 *   permit-domain-version: "1"
 *   chain-id: 56
 *   max-policies-per-entity: 8
 *   approved-policies: [token-whitelist, dex-whitelist, spend-limit, cooldown, receiver-guard]
 * </pre>
 *
 * @param serviceName name used for logging, metrics and tracing
 * @param environment deployment environment (development, staging, production)
 * @param router address the access router acts as; also the permit verifying contract
 * @param governor address allowed to approve and revoke policy plugins
 * @param registrar address allowed to freeze templates and bind instances
 * @param leaseIssuer address allowed to mint entities and assign leases
 * @param permitDomainName EIP-712 domain name for operator permits
 * @param permitDomainVersion EIP-712 domain version for operator permits
 * @param chainId EIP-712 domain chain id
 * @param maxPoliciesPerEntity cap on the policy list of a single entity
 * @param approvedPolicies plugin types approved by the governor at startup
 */
@ConfigurationProperties(prefix = "leasehold")
@Validated
public record LeaseholdProperties(
        @NotBlank String serviceName,
        String environment,
        @NotBlank String router,
        @NotBlank String governor,
        @NotBlank String registrar,
        @NotBlank String leaseIssuer,
        String permitDomainName,
        String permitDomainVersion,
        @Positive long chainId,
        int maxPoliciesPerEntity,
        List<String> approvedPolicies) {

    public static final List<String> STANDARD_POLICIES =
            List.of("token-whitelist", "dex-whitelist", "spend-limit", "cooldown", "receiver-guard");

    /** Applies defaults for optional fields. Runs before Bean Validation. */
    public LeaseholdProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (permitDomainName == null || permitDomainName.isBlank()) {
            permitDomainName = "Leasehold";
        }
        if (permitDomainVersion == null || permitDomainVersion.isBlank()) {
            permitDomainVersion = "1";
        }
        if (maxPoliciesPerEntity <= 0) {
            maxPoliciesPerEntity = PolicyEngine.DEFAULT_MAX_POLICIES;
        }
        approvedPolicies = approvedPolicies == null ? STANDARD_POLICIES : List.copyOf(approvedPolicies);
    }
}
