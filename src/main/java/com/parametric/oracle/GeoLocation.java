package com.parametric.oracle;

/**
 * A measurement point. {@code region} is a free-form label and is not used for matching.
 */
public record GeoLocation(double latitude, double longitude, String region) {

    /** True when both coordinates lie within {@code degrees} of {@code other}. */
    public boolean within(GeoLocation other, double degrees) {
        return other != null
            && Math.abs(latitude - other.latitude) <= degrees
            && Math.abs(longitude - other.longitude) <= degrees;
    }

    public String key() {
        return latitude + "," + longitude;
    }
}
