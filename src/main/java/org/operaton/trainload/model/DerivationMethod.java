package org.operaton.trainload.model;

/**
 * How the ground-truth value of a calibration data point was obtained.
 */
public enum DerivationMethod {
    /** Stress score read directly from the external source. */
    DIRECT,
    /** Implied from the day-over-day change in chronic load. */
    CTL_DERIVED,
    /** Implied from the day-over-day change in acute load. */
    ATL_DERIVED,
    /** Chronic and acute derivations agreeing with each other. */
    CROSS_VALIDATED
}
