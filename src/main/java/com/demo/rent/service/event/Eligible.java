package com.demo.rent.service.event;

public record Eligible(String tenant, long policyId, String nullifier) {}
