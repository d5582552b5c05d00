package com.parametric.oracle;

import java.util.List;

public record DataSourceRegistration(
    String name,
    DataSourceType type,
    String provider,
    List<String> parameters,
    double qualityScore,
    double slaUptime
) {}
