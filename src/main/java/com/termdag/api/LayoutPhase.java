package com.termdag.api;

/**
 * The pipeline stages, in execution order.
 */
public enum LayoutPhase {
    PARSE,
    LAYERING,
    COMPLETION,
    ORDERING,
    CROSSINGS,
    GEOMETRY,
    RASTER
}
