package com.demo.rent.service;

import com.demo.rent.service.event.Eligible;
import com.demo.rent.service.event.LeaseRefunded;
import com.demo.rent.service.event.LeaseReleased;
import com.demo.rent.service.event.LeaseStarted;
import com.demo.rent.service.event.PolicyCreated;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Audit trail of committed signals. */
@Slf4j
@Component
public class LedgerEventLogger {

    @EventListener
    public void on(PolicyCreated e) {
        log.info("PolicyCreated policyId={} owner={} contentHash={}", e.policyId(), e.owner(), e.contentHash());
    }

    @EventListener
    public void on(Eligible e) {
        log.info("Eligible tenant={} policyId={} nullifier={}", e.tenant(), e.policyId(), e.nullifier());
    }

    @EventListener
    public void on(LeaseStarted e) {
        log.info("LeaseStarted policyId={} tenant={} amount={} deadline={}",
                e.policyId(), e.tenant(), e.amount(), e.deadline());
    }

    @EventListener
    public void on(LeaseReleased e) {
        log.info("LeaseReleased policyId={} tenant={} amount={}", e.policyId(), e.tenant(), e.amount());
    }

    @EventListener
    public void on(LeaseRefunded e) {
        log.info("LeaseRefunded policyId={} tenant={} amount={}", e.policyId(), e.tenant(), e.amount());
    }
}
