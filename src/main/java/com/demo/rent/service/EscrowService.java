package com.demo.rent.service;

import com.demo.rent.repository.EligibilityRepository;
import com.demo.rent.repository.Lease;
import com.demo.rent.repository.LeaseRepository;
import com.demo.rent.repository.LeaseStatus;
import com.demo.rent.repository.Policy;
import com.demo.rent.service.error.AuthorizationException;
import com.demo.rent.service.error.ErrorCode;
import com.demo.rent.service.error.ExpiryException;
import com.demo.rent.service.error.IneligibleException;
import com.demo.rent.service.error.LeaseStateException;
import com.demo.rent.service.error.ReentrancyException;
import com.demo.rent.service.error.ValidationException;
import com.demo.rent.service.event.LeaseRefunded;
import com.demo.rent.service.event.LeaseReleased;
import com.demo.rent.service.event.LeaseStarted;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Rent custody per (policyId, tenant): NONE -> ACTIVE -> RELEASED | REFUNDED.
 *
 * <p>Every resolution marks the lease terminal before paying out, so a payout
 * recipient that calls back in finds nothing active. With the guard enabled,
 * such a nested call is refused outright instead.
 */
@Slf4j
@Service
public class EscrowService {

    private final PolicyService policyService;
    private final EligibilityRepository eligibilityRepository;
    private final LeaseRepository leaseRepository;
    private final FundsTransfer fundsTransfer;
    private final LedgerSequencer ledger;
    private final boolean reentrancyGuard;

    /** Only touched by the thread holding the ledger lock. */
    private boolean entered;

    public EscrowService(PolicyService policyService,
                         EligibilityRepository eligibilityRepository,
                         LeaseRepository leaseRepository,
                         FundsTransfer fundsTransfer,
                         LedgerSequencer ledger,
                         @Value("${escrow.reentrancy-guard:true}") boolean reentrancyGuard) {
        this.policyService = policyService;
        this.eligibilityRepository = eligibilityRepository;
        this.leaseRepository = leaseRepository;
        this.fundsTransfer = fundsTransfer;
        this.ledger = ledger;
        this.reentrancyGuard = reentrancyGuard;
    }

    /** Locks {@code value} for the caller's lease on the policy. */
    public Lease startLease(String caller, long policyId, BigInteger value) {
        String tenant = HashUtil.normalizeAddress(caller);
        return ledger.execute("startLease", () -> nonReentrant("startLease", () -> {
            Policy policy = policyService.getPolicy(policyId);
            if (!eligibilityRepository.isEligible(tenant, policyId)) {
                throw new IneligibleException(ErrorCode.NOT_ELIGIBLE,
                        tenant + " is not eligible for policy " + policyId);
            }
            long now = ledger.now();
            if (policy.isExpiredAt(now)) {
                throw new ExpiryException(ErrorCode.POLICY_EXPIRED,
                        "Policy " + policyId + " deadline passed at " + policy.deadline());
            }
            if (value == null || !value.equals(policy.rentAmount())) {
                throw new ValidationException(ErrorCode.AMOUNT_MISMATCH,
                        "Attached value " + value + " != rent " + policy.rentAmount());
            }

            Optional<Lease> existing = leaseRepository.find(policyId, tenant);
            if (existing.isPresent() && existing.get().active()) {
                throw new LeaseStateException(ErrorCode.ALREADY_ACTIVE,
                        "Lease already active for policy " + policyId + " and " + tenant);
            }
            Lease lease = new Lease(policyId, tenant, value, policy.deadline(), LeaseStatus.ACTIVE,
                    existing.map(l -> l.instance() + 1).orElse(1), now, null);
            if (existing.isPresent()) {
                leaseRepository.restart(lease);
            } else {
                leaseRepository.insert(lease);
            }

            ledger.emit(new LeaseStarted(policyId, tenant, value, policy.deadline()));
            log.info("Lease started: policy {} tenant {} amount {} (instance {})",
                    policyId, tenant, value, lease.instance());
            return lease;
        }));
    }

    /** Owner accepts the tenant; escrowed rent goes to the owner. */
    public Lease ownerConfirm(String caller, long policyId, String tenant) {
        String who = HashUtil.normalizeAddress(caller);
        String leaseTenant = HashUtil.normalizeAddress(tenant);
        return ledger.execute("ownerConfirm", () -> nonReentrant("ownerConfirm", () -> {
            Policy policy = policyService.getPolicy(policyId);
            if (!policy.owner().equals(who)) {
                throw new AuthorizationException("Not policy owner");
            }
            Lease lease = activeLease(policyId, leaseTenant);

            long now = ledger.now();
            deactivate(lease, LeaseStatus.RELEASED, now);
            fundsTransfer.transfer(policy.owner(), lease.amount());

            ledger.emit(new LeaseReleased(policyId, leaseTenant, lease.amount()));
            log.info("Lease released: policy {} tenant {} amount {} -> owner {}",
                    policyId, leaseTenant, lease.amount(), policy.owner());
            return leaseRepository.find(policyId, leaseTenant).orElseThrow();
        }));
    }

    /** Tenant reclaims escrowed rent once the deadline has been reached. */
    public Lease timeoutRefund(String caller, long policyId) {
        String tenant = HashUtil.normalizeAddress(caller);
        return ledger.execute("timeoutRefund", () -> nonReentrant("timeoutRefund", () -> {
            Lease lease = activeLease(policyId, tenant);
            if (!lease.tenant().equals(tenant)) {
                throw new AuthorizationException("Not the lease tenant");
            }
            long now = ledger.now();
            if (now < lease.deadline()) {
                throw new LeaseStateException(ErrorCode.TOO_EARLY,
                        "Refund available at " + lease.deadline() + ", now " + now);
            }

            deactivate(lease, LeaseStatus.REFUNDED, now);
            fundsTransfer.transfer(tenant, lease.amount());

            ledger.emit(new LeaseRefunded(policyId, tenant, lease.amount()));
            log.info("Lease refunded: policy {} tenant {} amount {}", policyId, tenant, lease.amount());
            return leaseRepository.find(policyId, tenant).orElseThrow();
        }));
    }

    public Optional<Lease> getLease(long policyId, String tenant) {
        if (!HashUtil.isAddress(tenant)) {
            return Optional.empty();
        }
        return leaseRepository.find(policyId, HashUtil.normalizeAddress(tenant));
    }

    public boolean isLeaseActive(long policyId, String tenant) {
        return getLease(policyId, tenant).map(Lease::active).orElse(false);
    }

    /** Total rent currently held in custody. */
    public BigInteger escrowBalance() {
        return leaseRepository.activeTotal();
    }

    public BigInteger balanceOf(String address) {
        return fundsTransfer.balanceOf(address);
    }

    private Lease activeLease(long policyId, String tenant) {
        return leaseRepository.find(policyId, tenant)
                .filter(Lease::active)
                .orElseThrow(() -> new LeaseStateException(ErrorCode.NOT_ACTIVE,
                        "No active lease for policy " + policyId + " and " + tenant));
    }

    private void deactivate(Lease lease, LeaseStatus terminal, long now) {
        if (!leaseRepository.resolve(lease.policyId(), lease.tenant(), terminal, now)) {
            throw new LeaseStateException(ErrorCode.NOT_ACTIVE, "Lease no longer active");
        }
    }

    private <T> T nonReentrant(String operation, Supplier<T> body) {
        if (!reentrancyGuard) {
            return body.get();
        }
        if (entered) {
            throw new ReentrancyException(operation);
        }
        entered = true;
        try {
            return body.get();
        } finally {
            entered = false;
        }
    }

    public boolean isReentrancyGuardEnabled() {
        return reentrancyGuard;
    }
}
