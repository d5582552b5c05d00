package com.parametric.oracle;

import java.math.BigDecimal;
import java.time.Instant;

public record SlashingEvent(BigDecimal amount, String reason, Instant slashedAt) {}
