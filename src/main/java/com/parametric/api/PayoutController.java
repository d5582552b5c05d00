package com.parametric.api;

import com.parametric.payout.Payout;
import com.parametric.payout.PayoutOrchestrator;
import com.parametric.payout.PayoutTransaction;
import com.parametric.payout.TransactionStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1/payouts")
public class PayoutController {

    private final PayoutOrchestrator payoutOrchestrator;

    public PayoutController(PayoutOrchestrator payoutOrchestrator) {
        this.payoutOrchestrator = payoutOrchestrator;
    }

    @GetMapping("/{payoutId}")
    public Payout get(@PathVariable String payoutId) {
        return payoutOrchestrator.getPayout(payoutId);
    }

    @PostMapping("/{payoutId}/cancel")
    public Payout cancel(@PathVariable String payoutId) {
        return payoutOrchestrator.cancelPayout(payoutId);
    }

    @GetMapping("/transactions/{transactionId}")
    public PayoutTransaction transaction(@PathVariable String transactionId) {
        return payoutOrchestrator.getTransaction(transactionId);
    }

    @GetMapping("/transactions")
    public List<PayoutTransaction> transactionsByStatus(@RequestParam String status) {
        return payoutOrchestrator.transactionsByStatus(TransactionStatus.fromValue(status));
    }

    @PostMapping("/transactions/{transactionId}/dispute")
    public PayoutTransaction dispute(@PathVariable String transactionId,
                                     @RequestBody PolicyController.ReasonRequest request) {
        return payoutOrchestrator.disputeTransaction(transactionId, request.reason());
    }
}
