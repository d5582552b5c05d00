package com.parametric.api;

import com.parametric.pool.LiquidityCheck;
import com.parametric.pool.LiquidityLedger;
import com.parametric.pool.LiquidityTier;
import com.parametric.pool.PremiumAllocation;
import com.parametric.pool.RiskPool;
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

@RestController
@RequestMapping("/v1/pools")
public class PoolController {

    private final LiquidityLedger liquidityLedger;

    public PoolController(LiquidityLedger liquidityLedger) {
        this.liquidityLedger = liquidityLedger;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public RiskPool create(@RequestBody PoolCreation request) {
        return liquidityLedger.createPool(request.name(), request.currency());
    }

    @PostMapping("/{poolId}/deposits")
    public RiskPool deposit(@PathVariable String poolId, @RequestBody DepositRequest request) {
        LiquidityTier tier = request.tier() == null ? LiquidityTier.TIER_1 : request.tier();
        return liquidityLedger.deposit(poolId, request.amount(), tier, request.reference());
    }

    @PostMapping("/{poolId}/premiums")
    public PremiumAllocation contributePremium(@PathVariable String poolId, @RequestBody PremiumRequest request) {
        return liquidityLedger.contributePremium(poolId, request.policyId(), request.amount());
    }

    @GetMapping("/{poolId}")
    public RiskPool get(@PathVariable String poolId) {
        return liquidityLedger.getPool(poolId);
    }

    @GetMapping("/{poolId}/liquidity")
    public LiquidityCheck liquidity(@PathVariable String poolId, @RequestParam BigDecimal amount) {
        return liquidityLedger.checkSufficiency(poolId, amount);
    }

    public record PoolCreation(String name, String currency) {}

    public record DepositRequest(BigDecimal amount, LiquidityTier tier, String reference) {}

    public record PremiumRequest(String policyId, BigDecimal amount) {}
}
