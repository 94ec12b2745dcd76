package com.termdag.api;

/**
 * Character set used for the finished diagram.
 *
 * <p>
 * Layout always happens in box-drawing glyphs; the ASCII styles rewrite the
 * grid once rasterization is complete.
 */
public enum GlyphStyle {
    /** Unicode box-drawing characters. */
    UNICODE,
    /** Plain ASCII, junctions drawn as {@code -}. */
    ASCII,
    /** Plain ASCII, top junctions as {@code .} and bottom junctions as {@code '}. */
    ASCII_ROUNDED
}
