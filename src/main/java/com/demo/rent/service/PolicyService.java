package com.demo.rent.service;

import com.demo.rent.repository.Policy;
import com.demo.rent.repository.PolicyRepository;
import com.demo.rent.service.error.ErrorCode;
import com.demo.rent.service.error.NotFoundException;
import com.demo.rent.service.error.ValidationException;
import com.demo.rent.service.event.PolicyCreated;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

@Slf4j
@Service
@RequiredArgsConstructor
public class PolicyService {

    private final PolicyRepository policyRepository;
    private final LedgerSequencer ledger;

    /** Registers immutable terms owned by the caller; ids are 1, 2, 3, ... */
    public long createPolicy(String caller, int minAge, int incomeMultiplier, BigInteger rentAmount,
                             boolean requireCleanRecord, long deadline) {
        String owner = HashUtil.normalizeAddress(caller);
        return ledger.execute("createPolicy", () -> {
            if (minAge <= 0) {
                throw new ValidationException(ErrorCode.INVALID_TERMS, "minAge must be positive");
            }
            if (incomeMultiplier <= 0) {
                throw new ValidationException(ErrorCode.INVALID_TERMS, "incomeMultiplier must be positive");
            }
            if (!HashUtil.isUint256(rentAmount) || rentAmount.signum() == 0) {
                throw new ValidationException(ErrorCode.INVALID_TERMS, "rentAmount must be a positive uint256");
            }
            long now = ledger.now();
            if (deadline <= now) {
                throw new ValidationException(ErrorCode.INVALID_DEADLINE,
                        "Deadline " + deadline + " is not after current time " + now);
            }

            long policyId = policyRepository.nextId();
            String contentHash = HashUtil.policyHash(minAge, incomeMultiplier, rentAmount,
                    requireCleanRecord, deadline, owner);
            policyRepository.insert(new Policy(policyId, minAge, incomeMultiplier, rentAmount,
                    requireCleanRecord, deadline, owner, contentHash, now));

            ledger.emit(new PolicyCreated(policyId, owner, contentHash));
            log.info("Policy {} created by {} (hash {}, deadline {})", policyId, owner, contentHash, deadline);
            return policyId;
        });
    }

    public Policy getPolicy(long policyId) {
        return policyRepository.findById(policyId)
                .orElseThrow(() -> new NotFoundException("Policy " + policyId + " not found"));
    }

    public boolean isOwner(long policyId, String identity) {
        if (!HashUtil.isAddress(identity)) {
            return false;
        }
        String who = HashUtil.normalizeAddress(identity);
        return policyRepository.findById(policyId)
                .map(p -> p.owner().equals(who))
                .orElse(false);
    }

    public long nextPolicyId() {
        return policyRepository.nextId();
    }

    public long policyCount() {
        return policyRepository.count();
    }
}
