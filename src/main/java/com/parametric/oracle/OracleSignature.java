package com.parametric.oracle;

import java.time.Instant;

public record OracleSignature(
    String oracleId,
    String signature,
    double value,
    double weight,
    Instant timestamp
) {}
