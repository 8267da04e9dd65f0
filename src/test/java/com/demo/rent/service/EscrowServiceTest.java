package com.demo.rent.service;

import com.demo.rent.repository.Lease;
import com.demo.rent.repository.LeaseStatus;
import com.demo.rent.service.error.AuthorizationException;
import com.demo.rent.service.error.ErrorCode;
import com.demo.rent.service.error.ExpiryException;
import com.demo.rent.service.error.IneligibleException;
import com.demo.rent.service.error.LeaseStateException;
import com.demo.rent.service.error.NotFoundException;
import com.demo.rent.service.error.ReentrancyException;
import com.demo.rent.service.error.TransferFailedException;
import com.demo.rent.service.error.ValidationException;
import com.demo.rent.service.eligibility.Attestation;
import com.demo.rent.service.eligibility.InsecureDemoProofVerifier;
import com.demo.rent.service.event.LeaseRefunded;
import com.demo.rent.service.event.LeaseReleased;
import com.demo.rent.service.event.LeaseStarted;
import com.demo.rent.support.LedgerFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.web3j.utils.Numeric;

import java.math.BigInteger;

import static com.demo.rent.support.LedgerFixture.ONE_ETH;
import static com.demo.rent.support.LedgerFixture.OTHER;
import static com.demo.rent.support.LedgerFixture.OWNER;
import static com.demo.rent.support.LedgerFixture.TENANT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EscrowServiceTest {

    private LedgerFixture fx;
    private EscrowService escrow;
    private long policyId;
    private long deadline;

    private void boot(boolean reentrancyGuard) {
        fx = new LedgerFixture(new InsecureDemoProofVerifier(), reentrancyGuard);
        escrow = fx.escrow;
        policyId = fx.createDefaultPolicy();
        deadline = fx.policy(policyId).deadline();
    }

    private void eligibleTenant() {
        fx.proveEligible(TENANT, policyId, 1, 1);
    }

    @AfterEach
    void tearDown() {
        fx.close();
    }

    @Nested
    @DisplayName("startLease")
    class Start {

        @Test
        void requiresEligibility() {
            boot(true);

            assertThatThrownBy(() -> escrow.startLease(TENANT, policyId, ONE_ETH))
                    .isInstanceOf(IneligibleException.class)
                    .extracting("code").isEqualTo(ErrorCode.NOT_ELIGIBLE);
        }

        @Test
        void unknownPolicyIsNotFoundBeforeEligibility() {
            boot(true);

            assertThatThrownBy(() -> escrow.startLease(TENANT, 99, ONE_ETH))
                    .isInstanceOf(NotFoundException.class)
                    .extracting("code").isEqualTo(ErrorCode.NOT_FOUND);
            assertThat(escrow.getLease(99, TENANT)).isEmpty();
        }

        @Test
        @DisplayName("a policy with the largest representable deadline holds its lease")
        void farFutureDeadline() {
            boot(true);
            long farPolicy = fx.policyService.createPolicy(OWNER, 18, 3, ONE_ETH, true, Long.MAX_VALUE);
            fx.proveEligible(TENANT, farPolicy, 7, 7);

            Lease lease = escrow.startLease(TENANT, farPolicy, ONE_ETH);

            assertThat(lease.deadline()).isEqualTo(Long.MAX_VALUE);
            assertThatThrownBy(() -> escrow.timeoutRefund(TENANT, farPolicy))
                    .extracting("code").isEqualTo(ErrorCode.TOO_EARLY);
        }

        @Test
        @DisplayName("accepts exactly the rent and nothing one wei off")
        void amountMustMatchExactly() {
            boot(true);
            eligibleTenant();

            assertThatThrownBy(() -> escrow.startLease(TENANT, policyId, ONE_ETH.subtract(BigInteger.ONE)))
                    .isInstanceOf(ValidationException.class)
                    .extracting("code").isEqualTo(ErrorCode.AMOUNT_MISMATCH);
            assertThatThrownBy(() -> escrow.startLease(TENANT, policyId, ONE_ETH.add(BigInteger.ONE)))
                    .extracting("code").isEqualTo(ErrorCode.AMOUNT_MISMATCH);
            assertThat(escrow.escrowBalance()).isZero();

            Lease lease = escrow.startLease(TENANT, policyId, ONE_ETH);

            assertThat(lease.status()).isEqualTo(LeaseStatus.ACTIVE);
            assertThat(lease.deadline()).isEqualTo(deadline);
            assertThat(lease.instance()).isEqualTo(1);
            assertThat(escrow.isLeaseActive(policyId, TENANT)).isTrue();
            assertThat(escrow.escrowBalance()).isEqualTo(ONE_ETH);
            assertThat(fx.eventsOf(LeaseStarted.class))
                    .containsExactly(new LeaseStarted(policyId, TENANT, ONE_ETH, deadline));
        }

        @Test
        void secondStartWhileActiveFails() {
            boot(true);
            eligibleTenant();
            escrow.startLease(TENANT, policyId, ONE_ETH);

            assertThatThrownBy(() -> escrow.startLease(TENANT, policyId, ONE_ETH))
                    .isInstanceOf(LeaseStateException.class)
                    .extracting("code").isEqualTo(ErrorCode.ALREADY_ACTIVE);
            assertThat(escrow.escrowBalance()).isEqualTo(ONE_ETH);
        }

        @Test
        void policyPastItsDeadlineTakesNoLeases() {
            boot(true);
            eligibleTenant();
            fx.clock.setSeconds(deadline);

            assertThatThrownBy(() -> escrow.startLease(TENANT, policyId, ONE_ETH))
                    .isInstanceOf(ExpiryException.class)
                    .extracting("code").isEqualTo(ErrorCode.POLICY_EXPIRED);
        }

        @Test
        @DisplayName("a released lease can be started again as a new instance")
        void restartAfterRelease() {
            boot(true);
            eligibleTenant();
            escrow.startLease(TENANT, policyId, ONE_ETH);
            escrow.ownerConfirm(OWNER, policyId, TENANT);

            Lease again = escrow.startLease(TENANT, policyId, ONE_ETH);

            assertThat(again.instance()).isEqualTo(2);
            assertThat(escrow.getLease(policyId, TENANT)).get()
                    .satisfies(l -> {
                        assertThat(l.status()).isEqualTo(LeaseStatus.ACTIVE);
                        assertThat(l.resolvedAt()).isNull();
                    });
        }
    }

    @Nested
    @DisplayName("ownerConfirm")
    class Confirm {

        @Test
        void paysTheOwnerExactlyOnce() {
            boot(true);
            eligibleTenant();
            escrow.startLease(TENANT, policyId, ONE_ETH);
            BigInteger before = escrow.balanceOf(OWNER);

            Lease released = escrow.ownerConfirm(OWNER, policyId, TENANT);

            assertThat(released.status()).isEqualTo(LeaseStatus.RELEASED);
            assertThat(released.resolvedAt()).isEqualTo(fx.now());
            assertThat(escrow.balanceOf(OWNER)).isEqualTo(before.add(ONE_ETH));
            assertThat(escrow.escrowBalance()).isZero();
            assertThat(fx.eventsOf(LeaseReleased.class))
                    .containsExactly(new LeaseReleased(policyId, TENANT, ONE_ETH));

            assertThatThrownBy(() -> escrow.ownerConfirm(OWNER, policyId, TENANT))
                    .isInstanceOf(LeaseStateException.class)
                    .extracting("code").isEqualTo(ErrorCode.NOT_ACTIVE);
            assertThat(fx.funds.payouts()).hasSize(1);
        }

        @Test
        void onlyTheOwnerMayConfirm() {
            boot(true);
            eligibleTenant();
            escrow.startLease(TENANT, policyId, ONE_ETH);

            assertThatThrownBy(() -> escrow.ownerConfirm(TENANT, policyId, TENANT))
                    .isInstanceOf(AuthorizationException.class);
            assertThat(escrow.isLeaseActive(policyId, TENANT)).isTrue();
        }

        @Test
        void nothingToConfirm() {
            boot(true);

            assertThatThrownBy(() -> escrow.ownerConfirm(OWNER, policyId, TENANT))
                    .extracting("code").isEqualTo(ErrorCode.NOT_ACTIVE);
        }

        @Test
        @DisplayName("a failed payout rolls the whole confirmation back")
        void failedTransferRollsBack() {
            boot(true);
            eligibleTenant();
            escrow.startLease(TENANT, policyId, ONE_ETH);
            fx.funds.onTransfer(() -> {
                throw new TransferFailedException("recipient rejected the payment");
            });

            assertThatThrownBy(() -> escrow.ownerConfirm(OWNER, policyId, TENANT))
                    .isInstanceOf(TransferFailedException.class);

            assertThat(escrow.isLeaseActive(policyId, TENANT)).isTrue();
            assertThat(escrow.balanceOf(OWNER)).isZero();
            assertThat(escrow.escrowBalance()).isEqualTo(ONE_ETH);
            assertThat(fx.eventsOf(LeaseReleased.class)).isEmpty();
        }
    }

    @Nested
    @DisplayName("timeoutRefund")
    class Refund {

        @Test
        @DisplayName("deadline-1 is too early, deadline refunds, a repeat finds nothing active")
        void deadlineBoundary() {
            boot(true);
            eligibleTenant();
            escrow.startLease(TENANT, policyId, ONE_ETH);

            fx.clock.setSeconds(deadline - 1);
            assertThatThrownBy(() -> escrow.timeoutRefund(TENANT, policyId))
                    .isInstanceOf(LeaseStateException.class)
                    .extracting("code").isEqualTo(ErrorCode.TOO_EARLY);

            fx.clock.setSeconds(deadline);
            Lease refunded = escrow.timeoutRefund(TENANT, policyId);
            assertThat(refunded.status()).isEqualTo(LeaseStatus.REFUNDED);
            assertThat(escrow.balanceOf(TENANT)).isEqualTo(ONE_ETH);
            assertThat(fx.eventsOf(LeaseRefunded.class))
                    .containsExactly(new LeaseRefunded(policyId, TENANT, ONE_ETH));

            assertThatThrownBy(() -> escrow.timeoutRefund(TENANT, policyId))
                    .extracting("code").isEqualTo(ErrorCode.NOT_ACTIVE);
        }

        @Test
        void othersHaveNoLeaseToRefund() {
            boot(true);
            eligibleTenant();
            escrow.startLease(TENANT, policyId, ONE_ETH);
            fx.clock.setSeconds(deadline);

            assertThatThrownBy(() -> escrow.timeoutRefund(OTHER, policyId))
                    .extracting("code").isEqualTo(ErrorCode.NOT_ACTIVE);
            assertThat(escrow.isLeaseActive(policyId, TENANT)).isTrue();
        }

        @Test
        void refundAfterConfirmIsNotActive() {
            boot(true);
            eligibleTenant();
            escrow.startLease(TENANT, policyId, ONE_ETH);
            escrow.ownerConfirm(OWNER, policyId, TENANT);
            fx.clock.setSeconds(deadline);

            assertThatThrownBy(() -> escrow.timeoutRefund(TENANT, policyId))
                    .extracting("code").isEqualTo(ErrorCode.NOT_ACTIVE);
            assertThat(escrow.balanceOf(TENANT)).isZero();
        }
    }

    @Nested
    @DisplayName("a payout recipient calling back in")
    class Reentrancy {

        @Test
        void isRefusedByTheGuard() {
            boot(true);
            eligibleTenant();
            escrow.startLease(TENANT, policyId, ONE_ETH);
            fx.funds.onTransfer(() -> assertThatThrownBy(() -> escrow.ownerConfirm(OWNER, policyId, TENANT))
                    .isInstanceOf(ReentrancyException.class)
                    .extracting("code").isEqualTo(ErrorCode.REENTRANT_CALL));

            escrow.ownerConfirm(OWNER, policyId, TENANT);

            assertThat(fx.funds.payouts()).hasSize(1);
            assertThat(escrow.balanceOf(OWNER)).isEqualTo(ONE_ETH);
            assertThat(fx.eventsOf(LeaseReleased.class)).hasSize(1);
        }

        @Test
        @DisplayName("finds nothing active without the guard, since state changes precede the payout")
        void findsNothingActiveWithoutTheGuard() {
            boot(false);
            eligibleTenant();
            escrow.startLease(TENANT, policyId, ONE_ETH);
            fx.clock.setSeconds(deadline);
            fx.funds.onTransfer(() -> {
                assertThatThrownBy(() -> escrow.ownerConfirm(OWNER, policyId, TENANT))
                        .extracting("code").isEqualTo(ErrorCode.NOT_ACTIVE);
                assertThatThrownBy(() -> escrow.timeoutRefund(TENANT, policyId))
                        .extracting("code").isEqualTo(ErrorCode.NOT_ACTIVE);
            });

            escrow.timeoutRefund(TENANT, policyId);

            assertThat(fx.funds.payouts()).hasSize(1);
            assertThat(escrow.balanceOf(TENANT)).isEqualTo(ONE_ETH);
            assertThat(escrow.balanceOf(OWNER)).isZero();
            assertThat(fx.eventsOf(LeaseRefunded.class)).hasSize(1);
            assertThat(fx.eventsOf(LeaseReleased.class)).isEmpty();
        }

        @Test
        void guardDoesNotBlockLaterCalls() {
            boot(true);
            eligibleTenant();
            escrow.startLease(TENANT, policyId, ONE_ETH);
            fx.funds.onTransfer(() -> assertThatThrownBy(() -> escrow.startLease(TENANT, policyId, ONE_ETH))
                    .isInstanceOf(ReentrancyException.class));
            escrow.ownerConfirm(OWNER, policyId, TENANT);

            assertThat(escrow.isReentrancyGuardEnabled()).isTrue();
            assertThat(escrow.startLease(TENANT, policyId, ONE_ETH).instance()).isEqualTo(2);
        }
    }

    @Test
    @DisplayName("attestation, lease, confirmation: the owner ends one ether richer")
    void attestationLeaseConfirmScenario() {
        boot(true);
        String session = Numeric.toHexString(HashUtil.keccakUtf8("bank-statement-session"));
        Attestation a = fx.attestation(TENANT, policyId, session, Attestation.ALL_CHECKS_PASSED);
        fx.eligibilityService.submitAttestation(TENANT, a, fx.sign(a));

        escrow.startLease(TENANT, policyId, ONE_ETH);
        escrow.ownerConfirm(OWNER, policyId, TENANT);

        assertThat(escrow.balanceOf(OWNER)).isEqualTo(ONE_ETH);
        assertThat(escrow.getLease(policyId, TENANT)).get()
                .extracting(Lease::status).isEqualTo(LeaseStatus.RELEASED);
    }
}
