package com.leasehold.access.delegation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.leasehold.access.DelegationException;
import com.leasehold.policy.Addresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.crypto.StructuredDataEncoder;

import java.io.IOException;
import java.math.BigInteger;
import java.security.SignatureException;
import java.util.Arrays;

/**
 * Hashes operator permits as EIP-712 typed data and recovers their signer.
 */
public final class PermitVerifier {

    private static final Logger log = LoggerFactory.getLogger(PermitVerifier.class);

    public static final String PRIMARY_TYPE = "OperatorPermit";
    public static final int SIGNATURE_LENGTH = 65;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PermitDomain domain;

    public PermitVerifier(PermitDomain domain) {
        this.domain = domain;
    }

    public PermitDomain domain() {
        return domain;
    }

    /** The EIP-712 typed-data document for {@code permit}. */
    public String typedData(OperatorPermit permit) {
        ObjectNode root = MAPPER.createObjectNode();
        ObjectNode types = root.putObject("types");
        ArrayNode domainType = types.putArray("EIP712Domain");
        field(domainType, "name", "string");
        field(domainType, "version", "string");
        field(domainType, "chainId", "uint256");
        field(domainType, "verifyingContract", "address");
        ArrayNode permitType = types.putArray(PRIMARY_TYPE);
        field(permitType, "entityId", "uint256");
        field(permitType, "renter", "address");
        field(permitType, "operator", "address");
        field(permitType, "expiry", "uint64");
        field(permitType, "nonce", "uint256");
        field(permitType, "deadline", "uint256");

        root.put("primaryType", PRIMARY_TYPE);

        ObjectNode domainNode = root.putObject("domain");
        domainNode.put("name", domain.name());
        domainNode.put("version", domain.version());
        domainNode.put("chainId", domain.chainId());
        domainNode.put("verifyingContract", domain.verifyingContract());

        ObjectNode message = root.putObject("message");
        message.put("entityId", permit.entityId());
        message.put("renter", permit.renter());
        message.put("operator", permit.operator());
        message.put("expiry", permit.expiry().getEpochSecond());
        message.put("nonce", permit.nonce());
        message.put("deadline", permit.deadline().getEpochSecond());
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot render typed data for permit", e);
        }
    }

    /** The 32-byte EIP-712 digest a renter signs. */
    public byte[] digest(OperatorPermit permit) {
        try {
            return new StructuredDataEncoder(typedData(permit)).hashStructuredData();
        } catch (IOException e) {
            throw new IllegalStateException("cannot hash typed data for permit", e);
        }
    }

    /**
     * Recovers the address that produced {@code signature} (r, s, v) over {@code permit}.
     *
     * @throws DelegationException with {@code INVALID_SIGNATURE} if the signature is malformed
     */
    public String recoverSigner(OperatorPermit permit, byte[] signature) {
        if (signature == null || signature.length != SIGNATURE_LENGTH) {
            throw invalid("signature must be " + SIGNATURE_LENGTH + " bytes");
        }
        byte v = signature[64];
        if (v < 27) {
            v += 27;
        }
        if (v != 27 && v != 28) {
            throw invalid("signature recovery id out of range");
        }
        Sign.SignatureData data = new Sign.SignatureData(v,
                Arrays.copyOfRange(signature, 0, 32),
                Arrays.copyOfRange(signature, 32, 64));
        try {
            BigInteger publicKey = Sign.signedMessageHashToKey(digest(permit), data);
            return Addresses.normalize(Keys.getAddress(publicKey));
        } catch (SignatureException | RuntimeException e) {
            log.debug("Permit signature for entity {} did not recover: {}", permit.entityId(), e.toString());
            throw invalid("signature does not recover");
        }
    }

    private static DelegationException invalid(String message) {
        return new DelegationException(DelegationException.Reason.INVALID_SIGNATURE, message);
    }

    private static void field(ArrayNode type, String name, String solidityType) {
        type.addObject().put("name", name).put("type", solidityType);
    }
}
