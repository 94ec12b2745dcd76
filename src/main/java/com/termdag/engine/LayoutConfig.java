package com.termdag.engine;

import com.termdag.api.GlyphStyle;

import lombok.Data;

/**
 * Tuning knobs for a layout run. The defaults produce the standard diagram.
 */
@Data
public final class LayoutConfig {
    /** Weight of the squared distance to the parents' mean row during ordering. */
    private double parentWeight = 15.0;

    /** Ceiling on geometry relaxation rounds; guarantees termination. */
    private int relaxationCeiling = 1000;

    /** Height of the first bus routing attempt (at least 3). */
    private int busMinHeight = 3;

    /** Above this height a bus accepts whatever it has routed. */
    private int busMaxHeight = 30;

    private GlyphStyle glyphStyle = GlyphStyle.UNICODE;

    public static LayoutConfig defaults() {
        return new LayoutConfig();
    }

    public LayoutConfig withGlyphStyle(GlyphStyle style) {
        LayoutConfig copy = copy();
        copy.setGlyphStyle(style);
        return copy;
    }

    public LayoutConfig copy() {
        LayoutConfig copy = new LayoutConfig();
        copy.setParentWeight(parentWeight);
        copy.setRelaxationCeiling(relaxationCeiling);
        copy.setBusMinHeight(busMinHeight);
        copy.setBusMaxHeight(busMaxHeight);
        copy.setGlyphStyle(glyphStyle);
        return copy;
    }
}
