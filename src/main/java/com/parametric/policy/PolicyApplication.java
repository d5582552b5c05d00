package com.parametric.policy;

import java.time.Instant;
import java.util.List;

/**
 * Client input for issuing a policy.
 */
public record PolicyApplication(
    String beneficiaryAccountId,
    String poolId,
    String productType,
    List<TriggerCondition> triggerConditions,
    CoverageDetails coverageDetails,
    PremiumStructure premiumStructure,
    ReinsuranceDetails reinsuranceDetails,
    Instant coverageStart,
    Instant coverageEnd
) {}
