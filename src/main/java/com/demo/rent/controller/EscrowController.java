package com.demo.rent.controller;

import com.demo.rent.controller.dto.EscrowDtos.BalanceView;
import com.demo.rent.controller.dto.EscrowDtos.LeaseView;
import com.demo.rent.controller.dto.EscrowDtos.StartRequest;
import com.demo.rent.service.EscrowService;
import com.demo.rent.service.HashUtil;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import static com.demo.rent.controller.PolicyController.CALLER_HEADER;

@RestController
@RequiredArgsConstructor
public class EscrowController {

    private final EscrowService escrowService;

    /** Caller is the tenant; {@code value} plays the role of the attached payment. */
    @PostMapping("/api/leases/{policyId}")
    @ResponseStatus(HttpStatus.CREATED)
    public LeaseView start(@RequestHeader(CALLER_HEADER) String caller,
                           @PathVariable long policyId,
                           @Valid @RequestBody StartRequest req) {
        return LeaseView.from(escrowService.startLease(caller, policyId, req.value));
    }

    @PostMapping("/api/leases/{policyId}/{tenant}/confirm")
    public LeaseView confirm(@RequestHeader(CALLER_HEADER) String caller,
                             @PathVariable long policyId,
                             @PathVariable String tenant) {
        return LeaseView.from(escrowService.ownerConfirm(caller, policyId, tenant));
    }

    @PostMapping("/api/leases/{policyId}/refund")
    public LeaseView refund(@RequestHeader(CALLER_HEADER) String caller,
                            @PathVariable long policyId) {
        return LeaseView.from(escrowService.timeoutRefund(caller, policyId));
    }

    @GetMapping("/api/leases/{policyId}/{tenant}")
    public LeaseView get(@PathVariable long policyId, @PathVariable String tenant) {
        return escrowService.getLease(policyId, tenant)
                .map(LeaseView::from)
                .orElseGet(() -> LeaseView.none(policyId, tenant));
    }

    @GetMapping("/api/leases/balance")
    public BalanceView escrowBalance() {
        return BalanceView.of("escrow", escrowService.escrowBalance());
    }

    @GetMapping("/api/accounts/{address}/balance")
    public BalanceView balance(@PathVariable String address) {
        String a = HashUtil.normalizeAddress(address);
        return BalanceView.of(a, escrowService.balanceOf(a));
    }
}
