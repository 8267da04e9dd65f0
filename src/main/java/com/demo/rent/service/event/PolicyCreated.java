package com.demo.rent.service.event;

public record PolicyCreated(long policyId, String owner, String contentHash) {}
