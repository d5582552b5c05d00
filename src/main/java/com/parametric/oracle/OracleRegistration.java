package com.parametric.oracle;

import java.math.BigDecimal;
import java.util.List;

public record OracleRegistration(
    String name,
    String operator,
    String publicKey,
    List<String> supportedParameters,
    GeoLocation location,
    BigDecimal stakingAmount
) {}
