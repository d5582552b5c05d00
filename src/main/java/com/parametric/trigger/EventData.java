package com.parametric.trigger;

import com.parametric.oracle.GeoLocation;
import com.parametric.oracle.TimeWindow;

public record EventData(
    String parameter,
    double value,
    String unit,
    GeoLocation location,
    TimeWindow window
) {}
