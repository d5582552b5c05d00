package com.parametric.oracle;

import java.time.Instant;

public record TimeWindow(Instant start, Instant end) {

    public String key() {
        return start + "/" + end;
    }
}
