package edu.harvard.hms.dbmi.avillach.genoquery.processing.runner;

import lombok.Builder;
import lombok.Value;

/**
 * Backpressure thresholds of a runner. A runner that fails to enqueue a row {@code maxOfferAttempts} times in a row
 * assumes its consumer is gone and closes itself.
 */
@Value
@Builder
public class RunnerSettings {

    public static final RunnerSettings DEFAULTS = RunnerSettings.builder().build();

    @Builder.Default
    long offerTimeoutMs = 100;
    @Builder.Default
    int warnEvery = 1000;
    @Builder.Default
    int maxOfferAttempts = 5000;
}
