package com.parametric.policy;

import java.time.Instant;

public record StatusChange(PolicyStatus from, PolicyStatus to, String reason, Instant changedAt) {}
