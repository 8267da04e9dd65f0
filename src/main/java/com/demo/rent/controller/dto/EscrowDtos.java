package com.demo.rent.controller.dto;

import com.demo.rent.repository.Lease;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;

public final class EscrowDtos {

    private EscrowDtos() {}

    public static class StartRequest {
        @NotNull
        public BigInteger value;   // attached wei, must equal the policy rent
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class LeaseView {
        public boolean found;
        public long policyId;
        public String tenant;
        public BigInteger amount;
        public Long deadline;
        public String status;      // ACTIVE | RELEASED | REFUNDED
        public Boolean active;
        public Integer instance;
        public Long startedAt;
        public Long resolvedAt;

        public static LeaseView from(Lease l) {
            LeaseView v = new LeaseView();
            v.found = true;
            v.policyId = l.policyId(); v.tenant = l.tenant(); v.amount = l.amount();
            v.deadline = l.deadline(); v.status = l.status().name(); v.active = l.active();
            v.instance = l.instance(); v.startedAt = l.startedAt(); v.resolvedAt = l.resolvedAt();
            return v;
        }

        public static LeaseView none(long policyId, String tenant) {
            LeaseView v = new LeaseView();
            v.policyId = policyId;
            v.tenant = tenant;
            return v;
        }
    }

    public static class BalanceView {
        public String address;
        public BigInteger balance;

        public static BalanceView of(String address, BigInteger balance) {
            BalanceView v = new BalanceView();
            v.address = address;
            v.balance = balance;
            return v;
        }
    }
}
