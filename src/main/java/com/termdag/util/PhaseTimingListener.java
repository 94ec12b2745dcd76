package com.termdag.util;

import com.termdag.api.LayoutListener;
import com.termdag.api.LayoutPhase;

import java.util.EnumMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Records how long each pipeline phase took and logs it at DEBUG.
 *
 * <p>
 * Durations accumulate across renders until {@link #reset()}, so one instance
 * can profile a batch.
 */
public final class PhaseTimingListener implements LayoutListener {
    private static final Logger log = LogManager.getLogger(PhaseTimingListener.class);

    private final Map<LayoutPhase, Long> totalNanos = new EnumMap<>(LayoutPhase.class);
    private final Map<LayoutPhase, Integer> runs = new EnumMap<>(LayoutPhase.class);
    private int busesSolved, busesForced;

    @Override
    public void onPhaseStart(LayoutPhase phase) {
        // Timing is measured by the engine
    }

    @Override
    public void onPhaseEnd(LayoutPhase phase, long durationNanos) {
        totalNanos.merge(phase, durationNanos, Long::sum);
        runs.merge(phase, 1, Integer::sum);
        log.debug("{} took {} us", phase, durationNanos / 1000);
    }

    @Override
    public void onBusSolved(int layer, int height, boolean forced) {
        busesSolved++;
        if (forced)
            busesForced++;
    }

    public long totalNanos(LayoutPhase phase) {
        return totalNanos.getOrDefault(phase, 0L);
    }

    public int runs(LayoutPhase phase) {
        return runs.getOrDefault(phase, 0);
    }

    public int busesSolved() {
        return busesSolved;
    }

    public int busesForced() {
        return busesForced;
    }

    public void reset() {
        totalNanos.clear();
        runs.clear();
        busesSolved = 0;
        busesForced = 0;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-12s | %6s | %12s%n", "Phase", "Runs", "Total (us)"));
        sb.append("----------------------------------\n");
        for (LayoutPhase phase : LayoutPhase.values()) {
            if (!runs.containsKey(phase))
                continue;
            sb.append(String.format("%-12s | %6d | %12.1f%n", phase, runs(phase), totalNanos(phase) / 1000.0));
        }
        return sb.toString();
    }
}
