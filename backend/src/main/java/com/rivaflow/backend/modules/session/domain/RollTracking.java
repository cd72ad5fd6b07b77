package com.rivaflow.backend.modules.session.domain;

/**
 * How a session records its sparring: totals only, or one entry per roll with the totals
 * derived from those entries.
 */
public sealed interface RollTracking permits SimpleRollTracking, DetailedRollTracking {

    TrackingMode mode();

    int rollCount();

    int submissionsFor();

    int submissionsAgainst();
}
