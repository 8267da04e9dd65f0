package com.demo.rent.controller.dto;

import com.demo.rent.service.dto.AttestorDtos;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

public final class EligibilityDtos {

    private EligibilityDtos() {}

    // -------- Requests ----------
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProofRequest {
        public long policyId;
        @NotBlank
        public String proof;                    // 0x hex
        @NotNull
        public List<BigInteger> publicInputs;   // [minAge, incomeMultiplier, rent, clean, policyId, hi, lo]
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AttestationBody {
        @NotBlank
        public String wallet;
        public long policyId;
        public long expiry;
        @NotBlank
        public String nullifier;
        public int passBitmask;

        public static AttestationBody from(AttestorDtos.AttestationPayload p) {
            AttestationBody b = new AttestationBody();
            b.wallet = p.getWallet(); b.policyId = p.getPolicyId(); b.expiry = p.getExpiry();
            b.nullifier = p.getNullifier(); b.passBitmask = p.getPassBitmask();
            return b;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AttestationRequest {
        @Valid
        @NotNull
        public AttestationBody attestation;
        @NotBlank
        public String signature;                // 65-byte r||s||v, 0x hex
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AttestProxyRequest {
        public long policyId;
        public Map<String, Object> tlsnProof;   // forwarded as tlsn_proof
    }

    // -------- Responses ----------
    public static class SubmitResponse {
        public boolean ok;
        public String gate;
        public String tenant;
        public long policyId;
        public String nullifier;
    }

    public static class EligibilityView {
        public String tenant;
        public long policyId;
        public boolean eligible;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class NullifierView {
        public String nullifier;
        public boolean used;
        public String gate;     // null while unused
        public String tenant;
        public Long policyId;
        public Long consumedAt;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class AttestProxyResponse {
        public AttestationBody attestation;
        public String signature;
        public Map<String, Object> verification;
        public boolean submitted;
        public String nullifier;  // set when submitted
    }
}
