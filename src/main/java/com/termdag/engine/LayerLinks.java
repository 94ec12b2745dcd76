package com.termdag.engine;

/**
 * How a layer is connected to the layer below it: either straight vertical
 * strokes ({@link DirectLinks}) or a routed region ({@link BusLinks}), never
 * both.
 */
public interface LayerLinks {
}
