package com.parametric.policy;

import com.parametric.oracle.GeoLocation;
import com.parametric.trigger.ComparisonOperator;

public record TriggerCondition(
    String parameter,
    ComparisonOperator operator,
    double threshold,
    String unit,
    GeoLocation location,
    String measurementPeriod
) {}
