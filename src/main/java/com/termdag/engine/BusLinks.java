package com.termdag.engine;

import com.termdag.bus.Bus;

/**
 * Marks a layer whose connections to the next layer are bus-routed.
 *
 * <p>
 * The bus itself only exists once geometry is solved, since its width and
 * column sets depend on vertex positions.
 */
public final class BusLinks implements LayerLinks {
    Bus bus;

    /** The routed bus, or null before geometry solving. */
    public Bus bus() {
        return bus;
    }
}
