package com.demo.rent.service.event;

import java.math.BigInteger;

public record LeaseRefunded(long policyId, String tenant, BigInteger amount) {}
