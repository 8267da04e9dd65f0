package com.demo.rent.service.event;

import java.math.BigInteger;

public record LeaseStarted(long policyId, String tenant, BigInteger amount, long deadline) {}
