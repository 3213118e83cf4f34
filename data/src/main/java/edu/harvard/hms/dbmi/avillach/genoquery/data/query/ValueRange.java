package edu.harvard.hms.dbmi.avillach.genoquery.data.query;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Inclusive numeric range, either bound may be open.
 */
public record ValueRange(Double min, Double max) {

    public static ValueRange atMost(double max) {
        return new ValueRange(null, max);
    }

    public static ValueRange atLeast(double min) {
        return new ValueRange(min, null);
    }

    public static ValueRange between(double min, double max) {
        return new ValueRange(min, max);
    }

    @JsonIgnore
    public boolean isUnbounded() {
        return min == null && max == null;
    }
}
