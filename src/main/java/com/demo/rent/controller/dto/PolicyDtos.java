package com.demo.rent.controller.dto;

import com.demo.rent.repository.Policy;
import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;

public final class PolicyDtos {

    private PolicyDtos() {}

    public static class CreateRequest {
        public int minAge;
        public int incomeMultiplier;
        @NotNull
        public BigInteger rentAmount;   // wei, decimal string or number
        public boolean requireCleanRecord;
        @NotNull
        public Long deadline;           // epoch seconds
    }

    public static class PolicyView {
        public long policyId;
        public int minAge;
        public int incomeMultiplier;
        public BigInteger rentAmount;
        public boolean requireCleanRecord;
        public long deadline;
        public String owner;
        public String contentHash;
        public long createdAt;

        public static PolicyView from(Policy p) {
            PolicyView v = new PolicyView();
            v.policyId = p.policyId(); v.minAge = p.minAge(); v.incomeMultiplier = p.incomeMultiplier();
            v.rentAmount = p.rentAmount(); v.requireCleanRecord = p.requireCleanRecord();
            v.deadline = p.deadline(); v.owner = p.owner(); v.contentHash = p.contentHash();
            v.createdAt = p.createdAt();
            return v;
        }
    }

    public static class OwnerCheck {
        public long policyId;
        public String address;
        public boolean owner;
    }

    public static class Stats {
        public long count;
        public long nextPolicyId;
    }
}
