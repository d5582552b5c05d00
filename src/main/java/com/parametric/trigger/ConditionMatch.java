package com.parametric.trigger;

public record ConditionMatch(
    int conditionIndex,
    double thresholdValue,
    double actualValue,
    ComparisonOperator operator
) {}
