package com.parametric.oracle;

import java.time.Instant;

public record CommitteeHealth(
    long totalOracles,
    long activeOracles,
    double oracleUtilization,
    long recentAttestations,
    double consensusSuccessRate,
    double averageResponseMinutes,
    double healthScore,
    Instant timestamp
) {}
