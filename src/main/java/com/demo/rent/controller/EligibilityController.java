package com.demo.rent.controller;

import com.demo.rent.controller.dto.EligibilityDtos.AttestProxyRequest;
import com.demo.rent.controller.dto.EligibilityDtos.AttestProxyResponse;
import com.demo.rent.controller.dto.EligibilityDtos.AttestationBody;
import com.demo.rent.controller.dto.EligibilityDtos.AttestationRequest;
import com.demo.rent.controller.dto.EligibilityDtos.EligibilityView;
import com.demo.rent.controller.dto.EligibilityDtos.NullifierView;
import com.demo.rent.controller.dto.EligibilityDtos.ProofRequest;
import com.demo.rent.controller.dto.EligibilityDtos.SubmitResponse;
import com.demo.rent.service.AttestorClient;
import com.demo.rent.service.EligibilityService;
import com.demo.rent.service.HashUtil;
import com.demo.rent.service.dto.AttestorDtos.AttestResponse;
import com.demo.rent.service.dto.GateInfo;
import com.demo.rent.service.eligibility.Attestation;
import com.demo.rent.service.eligibility.AttestationEligibilityVerifier;
import com.demo.rent.service.eligibility.ProofEligibilityVerifier;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import static com.demo.rent.controller.PolicyController.CALLER_HEADER;

@RestController
@RequestMapping("/api/eligibility")
@RequiredArgsConstructor
public class EligibilityController {

    private final EligibilityService eligibilityService;
    private final AttestorClient attestorClient;

    @PostMapping(value = "/proofs", consumes = MediaType.APPLICATION_JSON_VALUE)
    public SubmitResponse submitProof(@RequestHeader(CALLER_HEADER) String caller,
                                      @Valid @RequestBody ProofRequest req) {
        String nullifier = eligibilityService.submitProof(caller, req.policyId,
                HashUtil.hexToBytes(req.proof), req.publicInputs);
        return submitted(ProofEligibilityVerifier.GATE, caller, req.policyId, nullifier);
    }

    @PostMapping(value = "/attestations", consumes = MediaType.APPLICATION_JSON_VALUE)
    public SubmitResponse submitAttestation(@RequestHeader(CALLER_HEADER) String caller,
                                            @Valid @RequestBody AttestationRequest req) {
        String nullifier = eligibilityService.submitAttestation(caller, toAttestation(req.attestation),
                HashUtil.hexToBytes(req.signature));
        return submitted(AttestationEligibilityVerifier.GATE, caller, req.attestation.policyId, nullifier);
    }

    /**
     * Forwards the caller's TLS evidence to the attestation service. With
     * {@code autoSubmit=true} the returned attestation goes straight to the gate.
     */
    @PostMapping(value = "/attestations/request", consumes = MediaType.APPLICATION_JSON_VALUE)
    public AttestProxyResponse requestAttestation(@RequestHeader(CALLER_HEADER) String caller,
                                                  @RequestBody AttestProxyRequest req,
                                                  @RequestParam(defaultValue = "false") boolean autoSubmit) {
        AttestResponse issued;
        try {
            issued = attestorClient.requestAttestation(caller, req.policyId, req.tlsnProof);
        } catch (IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, e.getMessage(), e);
        }

        AttestProxyResponse out = new AttestProxyResponse();
        out.attestation = AttestationBody.from(issued.getAttestation());
        out.signature = issued.getSignature();
        out.verification = issued.getVerification();
        if (autoSubmit) {
            out.nullifier = eligibilityService.submitAttestation(caller, toAttestation(out.attestation),
                    HashUtil.hexToBytes(out.signature));
            out.submitted = true;
        }
        return out;
    }

    @GetMapping("/{tenant}/{policyId}")
    public EligibilityView isEligible(@PathVariable String tenant, @PathVariable long policyId) {
        EligibilityView v = new EligibilityView();
        v.tenant = tenant;
        v.policyId = policyId;
        v.eligible = eligibilityService.isEligible(tenant, policyId);
        return v;
    }

    @GetMapping("/nullifiers/{nullifier}")
    public NullifierView nullifier(@PathVariable String nullifier) {
        NullifierView v = new NullifierView();
        v.nullifier = HashUtil.normalizeBytes32(nullifier);
        eligibilityService.findNullifier(v.nullifier).ifPresent(row -> {
            v.used = true;
            v.gate = row.gate();
            v.tenant = row.tenant();
            v.policyId = row.policyId();
            v.consumedAt = row.consumedAt();
        });
        return v;
    }

    @GetMapping("/gate")
    public GateInfo gate() {
        return eligibilityService.gateInfo();
    }

    private static Attestation toAttestation(AttestationBody b) {
        return new Attestation(b.wallet, b.policyId, b.expiry, b.nullifier, b.passBitmask);
    }

    private static SubmitResponse submitted(String gate, String caller, long policyId, String nullifier) {
        SubmitResponse r = new SubmitResponse();
        r.ok = true;
        r.gate = gate;
        r.tenant = HashUtil.normalizeAddress(caller);
        r.policyId = policyId;
        r.nullifier = nullifier;
        return r;
    }
}
