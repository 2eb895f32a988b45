package io.horde.api.stats;

/**
 * Outcome of evaluating one threshold: the observed value and whether it passed.
 */
public record ThresholdResult(Threshold threshold, double observed, boolean passed) {}
