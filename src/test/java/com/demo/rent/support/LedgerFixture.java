package com.demo.rent.support;

import com.demo.rent.repository.BalanceRepository;
import com.demo.rent.repository.EligibilityRepository;
import com.demo.rent.repository.LeaseRepository;
import com.demo.rent.repository.NullifierRepository;
import com.demo.rent.repository.Policy;
import com.demo.rent.repository.PolicyRepository;
import com.demo.rent.service.EligibilityService;
import com.demo.rent.service.EscrowService;
import com.demo.rent.service.LedgerFundsTransfer;
import com.demo.rent.service.LedgerSequencer;
import com.demo.rent.service.PolicyService;
import com.demo.rent.service.eligibility.Attestation;
import com.demo.rent.service.eligibility.AttestationEligibilityVerifier;
import com.demo.rent.service.eligibility.AttestationTypedData;
import com.demo.rent.service.eligibility.EligibilityGate;
import com.demo.rent.service.eligibility.InsecureDemoProofVerifier;
import com.demo.rent.service.eligibility.ProofClaim;
import com.demo.rent.service.eligibility.ProofEligibilityVerifier;
import com.demo.rent.service.eligibility.ProofVerifier;
import com.demo.rent.service.eligibility.SignedAttestation;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The whole ledger wired by hand over a private in-memory H2 database.
 * Published signals land in {@link #events}.
 */
public class LedgerFixture implements AutoCloseable {

    public static final String OWNER = "0x1111111111111111111111111111111111111111";
    public static final String TENANT = "0x2222222222222222222222222222222222222222";
    public static final String OTHER = "0x3333333333333333333333333333333333333333";

    public static final long T0 = 1_700_000_000L;
    public static final BigInteger ONE_ETH = BigInteger.TEN.pow(18);
    public static final long CHAIN_ID = 31337L;
    public static final String VERIFYING_CONTRACT = "0x5fbdb2315678afecb367f032d93f642f64180aa3";

    public final EmbeddedDatabase db;
    public final JdbcTemplate jdbc;
    public final MutableClock clock = new MutableClock(T0);
    public final List<Object> events = new ArrayList<>();
    public final LedgerSequencer ledger;

    public final PolicyRepository policies;
    public final NullifierRepository nullifiers;
    public final EligibilityRepository eligibility;
    public final LeaseRepository leases;
    public final BalanceRepository balances;

    public final PolicyService policyService;
    public final TestAttestor attestor = TestAttestor.devAccount0();
    public final AttestationTypedData typedData = new AttestationTypedData(CHAIN_ID, VERIFYING_CONTRACT);
    public final AttestationEligibilityVerifier attestationVerifier;
    public final ProofVerifier proofVerifier;
    public final EligibilityGate<ProofClaim> proofGate;
    public final EligibilityGate<SignedAttestation> attestationGate;
    public final EligibilityService eligibilityService;

    public final ReenteringFundsTransfer funds;
    public final EscrowService escrow;

    public LedgerFixture() {
        this(new InsecureDemoProofVerifier(), true);
    }

    public LedgerFixture(ProofVerifier proofVerifier, boolean reentrancyGuard) {
        this.db = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("classpath:schema.sql")
                .build();
        this.jdbc = new JdbcTemplate(db);
        this.ledger = new LedgerSequencer(new DataSourceTransactionManager(db), events::add, clock);

        this.policies = new PolicyRepository(jdbc);
        this.nullifiers = new NullifierRepository(jdbc);
        this.eligibility = new EligibilityRepository(jdbc);
        this.leases = new LeaseRepository(jdbc);
        this.balances = new BalanceRepository(jdbc);

        this.policyService = new PolicyService(policies, ledger);
        this.proofVerifier = proofVerifier;
        this.attestationVerifier = new AttestationEligibilityVerifier(typedData, attestor.address());
        this.proofGate = new EligibilityGate<>(policyService, new ProofEligibilityVerifier(proofVerifier),
                nullifiers, eligibility, ledger);
        this.attestationGate = new EligibilityGate<>(policyService, attestationVerifier,
                nullifiers, eligibility, ledger);
        this.eligibilityService = new EligibilityService(proofGate, attestationGate, eligibility, nullifiers,
                proofVerifier, attestationVerifier);

        this.funds = new ReenteringFundsTransfer(new LedgerFundsTransfer(balances));
        this.escrow = new EscrowService(policyService, eligibility, leases, funds, ledger, reentrancyGuard);
    }

    public long now() {
        return clock.seconds();
    }

    /** 18+, 3x income, 1 ETH rent, clean record, one hour to run. */
    public long createDefaultPolicy() {
        return policyService.createPolicy(OWNER, 18, 3, ONE_ETH, true, now() + 3600);
    }

    public Policy policy(long policyId) {
        return policyService.getPolicy(policyId);
    }

    public List<BigInteger> publicInputs(long policyId, long hi, long lo) {
        return ProofEligibilityVerifier.publicInputsFor(policy(policyId), BigInteger.valueOf(hi), BigInteger.valueOf(lo));
    }

    public String proveEligible(String tenant, long policyId, long hi, long lo) {
        return eligibilityService.submitProof(tenant, policyId, new byte[]{1, 2, 3}, publicInputs(policyId, hi, lo));
    }

    public Attestation attestation(String wallet, long policyId, String nullifier, int passBitmask) {
        return new Attestation(wallet, policyId, now() + 600, nullifier, passBitmask);
    }

    public byte[] sign(Attestation attestation) {
        return attestor.sign(typedData, attestation);
    }

    @SuppressWarnings("unchecked")
    public <T> List<T> eventsOf(Class<T> type) {
        return events.stream().filter(type::isInstance).map(e -> (T) e).collect(Collectors.toList());
    }

    @Override
    public void close() {
        db.shutdown();
    }
}
