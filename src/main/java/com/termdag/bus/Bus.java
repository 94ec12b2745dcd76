package com.termdag.bus;

import com.termdag.screen.Screen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * The routed region between two layers whose direct edges would cross.
 *
 * <p>
 * For each column the bus knows which logical connections leave the vertex
 * above it ({@link #inputs(int)}) and which arrive at the vertex below it
 * ({@link #outputs(int)}). Connection ids are dense and start at 1. Once the
 * {@link BusRouter} has solved it, the bus carries its height and a raster of
 * stroke and turn glyphs; the raster's first row sits on the bottom border of
 * the upper layer and its second-to-last row on the top border of the lower
 * layer.
 */
public final class Bus {
    private final List<Set<Integer>> inputs;
    private final List<Set<Integer>> outputs;

    private int height;
    private int y;
    private char[][] raster = new char[0][];
    private boolean forced;

    public Bus(int width) {
        this.inputs = new ArrayList<>(width);
        this.outputs = new ArrayList<>(width);
        for (int x = 0; x < width; x++) {
            inputs.add(new TreeSet<>());
            outputs.add(new TreeSet<>());
        }
    }

    public int width() {
        return inputs.size();
    }

    public void addInput(int x, int connection) {
        inputs.get(x).add(connection);
    }

    public void addOutput(int x, int connection) {
        outputs.get(x).add(connection);
    }

    public Set<Integer> inputs(int x) {
        return Collections.unmodifiableSet(inputs.get(x));
    }

    public Set<Integer> outputs(int x) {
        return Collections.unmodifiableSet(outputs.get(x));
    }

    /** Highest connection id entering the bus; ids run from 1 to this value. */
    public int connectionCount() {
        int max = 0;
        for (Set<Integer> column : inputs)
            for (int c : column)
                max = Math.max(max, c);
        return max;
    }

    public int height() {
        return height;
    }

    public int y() {
        return y;
    }

    public void setY(int y) {
        this.y = y;
    }

    /** True if the router hit its height ceiling and kept a partial routing. */
    public boolean isForced() {
        return forced;
    }

    /** Glyph at a raster cell, {@code ' '} where nothing is routed. */
    public char glyph(int x, int row) {
        return raster[row][x];
    }

    void solved(int height, char[][] raster, boolean forced) {
        this.height = height;
        this.raster = raster;
        this.forced = forced;
    }

    /**
     * Overlays the raster at {@link #y()}. Horizontal border strokes under the
     * first row become {@code ┬} and those under the second-to-last row become
     * {@code ▽}, marking where routed strokes leave and enter vertex boxes.
     */
    public void render(Screen screen) {
        for (int dy = 0; dy < height - 1; dy++) {
            char[] row = raster[dy];
            for (int x = 0; x < row.length; x++) {
                char ch = row[x];
                if (ch == ' ')
                    continue;
                int existing = screen.pixel(x, y + dy);
                if (dy == 0 && existing == '─')
                    screen.drawPixel(x, y + dy, '┬');
                else if (dy == height - 2 && existing == '─')
                    screen.drawPixel(x, y + dy, '▽');
                else
                    screen.drawPixel(x, y + dy, ch);
            }
        }
    }
}
