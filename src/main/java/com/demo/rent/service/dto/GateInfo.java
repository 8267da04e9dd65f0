package com.demo.rent.service.dto;

public record GateInfo(
        String proofVerifier,
        boolean proofVerifierProductionSafe,
        String trustedIssuer,
        long chainId,
        String verifyingContract,
        String domainSeparator
) {}
