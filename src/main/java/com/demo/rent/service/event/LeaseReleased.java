package com.demo.rent.service.event;

import java.math.BigInteger;

public record LeaseReleased(long policyId, String tenant, BigInteger amount) {}
