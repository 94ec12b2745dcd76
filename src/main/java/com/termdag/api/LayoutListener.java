package com.termdag.api;

/**
 * Observability hook for the layout pipeline.
 *
 * Implementations can be registered with the LayoutEngine to receive callbacks
 * as each phase runs. Nothing in the pipeline depends on a listener being
 * present; without one the engine skips every callback.
 *
 * Typical uses:
 *
 * - Profiling: timing each phase (see PhaseTimingListener).
 * - Debugging: seeing which layers fell back to bus routing and how tall the
 * routed region became.
 */
public interface LayoutListener {

    /**
     * Called immediately before a phase begins.
     *
     * @param phase The phase about to run.
     */
    void onPhaseStart(LayoutPhase phase);

    /**
     * Called when a phase has completed.
     *
     * @param phase         The phase that ran.
     * @param durationNanos Wall time spent in the phase.
     */
    void onPhaseEnd(LayoutPhase phase, long durationNanos);

    /**
     * Called after the bus below a layer has been routed.
     *
     * @param layer  Index of the layer that owns the bus.
     * @param height The accepted routing grid height.
     * @param forced true if the height ceiling was hit and the result was
     *               accepted without every connection routed.
     */
    void onBusSolved(int layer, int height, boolean forced);
}
