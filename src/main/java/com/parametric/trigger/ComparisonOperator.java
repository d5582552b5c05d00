package com.parametric.trigger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.parametric.error.ValidationException;

import java.util.Arrays;

public enum ComparisonOperator {
    GT("gt") {
        @Override
        public boolean test(double actual, double threshold) {
            return actual > threshold;
        }
    },
    GTE("gte") {
        @Override
        public boolean test(double actual, double threshold) {
            return actual >= threshold;
        }
    },
    LT("lt") {
        @Override
        public boolean test(double actual, double threshold) {
            return actual < threshold;
        }
    },
    LTE("lte") {
        @Override
        public boolean test(double actual, double threshold) {
            return actual <= threshold;
        }
    },
    EQ("eq") {
        @Override
        public boolean test(double actual, double threshold) {
            return Double.compare(actual, threshold) == 0;
        }
    };

    private final String value;

    ComparisonOperator(String value) {
        this.value = value;
    }

    public abstract boolean test(double actual, double threshold);

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ComparisonOperator fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new ValidationException("Unknown operator: " + raw));
    }
}
