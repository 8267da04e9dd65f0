package com.demo.rent.controller;

import com.demo.rent.controller.dto.PolicyDtos.CreateRequest;
import com.demo.rent.controller.dto.PolicyDtos.OwnerCheck;
import com.demo.rent.controller.dto.PolicyDtos.PolicyView;
import com.demo.rent.controller.dto.PolicyDtos.Stats;
import com.demo.rent.service.PolicyService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/policies")
@RequiredArgsConstructor
public class PolicyController {

    public static final String CALLER_HEADER = "X-Caller-Address";

    private final PolicyService policyService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public PolicyView create(@RequestHeader(CALLER_HEADER) String caller,
                             @Valid @RequestBody CreateRequest req) {
        long id = policyService.createPolicy(caller, req.minAge, req.incomeMultiplier,
                req.rentAmount, req.requireCleanRecord, req.deadline);
        return PolicyView.from(policyService.getPolicy(id));
    }

    @GetMapping("/{policyId}")
    public PolicyView get(@PathVariable long policyId) {
        return PolicyView.from(policyService.getPolicy(policyId));
    }

    @GetMapping("/{policyId}/owner/{address}")
    public OwnerCheck isOwner(@PathVariable long policyId, @PathVariable String address) {
        OwnerCheck out = new OwnerCheck();
        out.policyId = policyId;
        out.address = address;
        out.owner = policyService.isOwner(policyId, address);
        return out;
    }

    @GetMapping("/stats")
    public Stats stats() {
        Stats s = new Stats();
        s.count = policyService.policyCount();
        s.nextPolicyId = policyService.nextPolicyId();
        return s;
    }
}
