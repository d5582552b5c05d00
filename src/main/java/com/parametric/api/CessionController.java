package com.parametric.api;

import com.parametric.cession.CessionRecord;
import com.parametric.cession.CessionRequest;
import com.parametric.cession.CessionService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;

/**
 * Reinsurer-facing side of the cession channel. Funding notices arrive here and are
 * routed to the payout waterfall through the settlement bus.
 */
@RestController
@RequestMapping("/v1/cessions")
public class CessionController {

    private final CessionService cessionService;

    public CessionController(CessionService cessionService) {
        this.cessionService = cessionService;
    }

    @PostMapping("/requests")
    @ResponseStatus(HttpStatus.CREATED)
    public CessionRecord request(@RequestBody ManualCessionRequest request) {
        return cessionService.request(new CessionRequest(request.policyId(), null, request.excessAmount(),
            request.lossCum(), request.retention(), null, null));
    }

    @PostMapping("/fundings")
    public CessionRecord funded(@RequestBody FundingNotice notice) {
        return cessionService.funded(notice.policyId(), notice.amount(), notice.reinsurer(), notice.txId());
    }

    @GetMapping("/{cessionId}")
    public CessionRecord get(@PathVariable String cessionId) {
        return cessionService.getCession(cessionId);
    }

    @GetMapping
    public List<CessionRecord> forPolicy(@RequestParam String policyId) {
        return cessionService.cessionsForPolicy(policyId);
    }

    public record ManualCessionRequest(String policyId, BigDecimal excessAmount, BigDecimal lossCum,
                                       BigDecimal retention) {}

    public record FundingNotice(String policyId, BigDecimal amount, String reinsurer, String txId) {}
}
