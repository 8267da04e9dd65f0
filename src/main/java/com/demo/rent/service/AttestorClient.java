package com.demo.rent.service;

import com.demo.rent.service.dto.AttestorDtos.AttestRequest;
import com.demo.rent.service.dto.AttestorDtos.AttestResponse;
import com.demo.rent.service.dto.AttestorDtos.HealthResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.Map;

/**
 * Client of the off-chain attestation service. The service inspects real-world
 * evidence and returns a signed attestation; what it checks is its own business.
 */
@Slf4j
@Component
public class AttestorClient {

    private final RestTemplate rest;
    private final String base;

    public AttestorClient(RestTemplate rest, @Value("${attestor.base-url:}") String baseUrl) {
        this.rest = rest;
        this.base = baseUrl == null ? "" : (baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl);
    }

    /** POST /attest {wallet, policyId, tlsn_proof} */
    public AttestResponse requestAttestation(String wallet, long policyId, Map<String, Object> tlsnProof) {
        requireConfigured();
        AttestRequest body = new AttestRequest();
        body.setWallet(HashUtil.normalizeAddress(wallet));
        body.setPolicyId(policyId);
        body.setTlsnProof(tlsnProof == null ? Map.of() : tlsnProof);
        try {
            var req = RequestEntity.post(URI.create(base + "/attest"))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body);
            AttestResponse resp = rest.exchange(req, AttestResponse.class).getBody();
            if (resp == null || resp.getAttestation() == null || resp.getSignature() == null) {
                throw new IllegalStateException("Attestor returned an incomplete payload");
            }
            log.info("Attestation issued for {} on policy {} (nullifier {})",
                    body.getWallet(), policyId, resp.getAttestation().getNullifier());
            return resp;
        } catch (RestClientException ex) {
            throw new IllegalStateException("Attestor call failed: " + ex.getMessage(), ex);
        }
    }

    /** GET /health; null when the service cannot be reached. */
    public HealthResponse health() {
        if (base.isBlank()) {
            log.warn("Attestor base URL missing; skip health check");
            return null;
        }
        try {
            return rest.getForObject(base + "/health", HealthResponse.class);
        } catch (RestClientException ex) {
            log.warn("Attestor health check failed: {}", ex.toString());
            return null;
        }
    }

    private void requireConfigured() {
        if (base.isBlank()) {
            throw new IllegalStateException("attestor.base-url is not configured");
        }
    }
}
