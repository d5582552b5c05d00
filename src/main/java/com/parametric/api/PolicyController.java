package com.parametric.api;

import com.parametric.payout.Payout;
import com.parametric.payout.PayoutOrchestrator;
import com.parametric.policy.Policy;
import com.parametric.policy.PolicyApplication;
import com.parametric.policy.PolicyService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1/policies")
public class PolicyController {

    private final PolicyService policyService;
    private final PayoutOrchestrator payoutOrchestrator;

    public PolicyController(PolicyService policyService, PayoutOrchestrator payoutOrchestrator) {
        this.policyService = policyService;
        this.payoutOrchestrator = payoutOrchestrator;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Policy issue(@RequestBody PolicyApplication application) {
        return policyService.issuePolicy(application);
    }

    @PostMapping("/{policyId}/activate")
    public Policy activate(@PathVariable String policyId) {
        return policyService.activatePolicy(policyId);
    }

    @PostMapping("/{policyId}/cancel")
    public Policy cancel(@PathVariable String policyId, @RequestBody(required = false) ReasonRequest request) {
        return policyService.cancelPolicy(policyId, request == null ? null : request.reason());
    }

    @GetMapping("/{policyId}")
    public Policy get(@PathVariable String policyId) {
        return policyService.getPolicy(policyId);
    }

    @GetMapping("/{policyId}/payouts")
    public List<Payout> payouts(@PathVariable String policyId) {
        policyService.getPolicy(policyId);
        return payoutOrchestrator.payoutsForPolicy(policyId);
    }

    public record ReasonRequest(String reason) {}
}
