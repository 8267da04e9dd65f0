package com.demo.rent.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.Map;

/** Wire shapes of the external attestation service. */
public final class AttestorDtos {

    private AttestorDtos() {}

    @Data
    public static class AttestRequest {
        private String wallet;
        private long policyId;
        @JsonProperty("tlsn_proof")
        private Map<String, Object> tlsnProof;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AttestationPayload {
        private String wallet;
        private long policyId;
        private long expiry;
        private String nullifier;
        private int passBitmask;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AttestResponse {
        private AttestationPayload attestation;
        private String signature;
        private Map<String, Object> verification;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class HealthResponse {
        private String status;
        private String attestor;
        private Long chainId;
        private String eligibilityContract;
    }
}
