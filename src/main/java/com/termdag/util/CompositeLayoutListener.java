package com.termdag.util;

import com.termdag.api.LayoutListener;
import com.termdag.api.LayoutPhase;

import java.util.Arrays;

/**
 * Fans every callback out to several {@link LayoutListener}s, in registration
 * order.
 */
public class CompositeLayoutListener implements LayoutListener {
    private LayoutListener[] listeners = new LayoutListener[0];

    public CompositeLayoutListener add(LayoutListener listener) {
        LayoutListener[] old = listeners;
        LayoutListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    @Override
    public void onPhaseStart(LayoutPhase phase) {
        for (LayoutListener l : listeners)
            l.onPhaseStart(phase);
    }

    @Override
    public void onPhaseEnd(LayoutPhase phase, long durationNanos) {
        for (LayoutListener l : listeners)
            l.onPhaseEnd(phase, durationNanos);
    }

    @Override
    public void onBusSolved(int layer, int height, boolean forced) {
        for (LayoutListener l : listeners)
            l.onBusSolved(layer, height, forced);
    }
}
