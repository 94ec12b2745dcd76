package com.termdag.screen;

import com.termdag.api.GlyphStyle;

import java.util.Arrays;

/**
 * Mutable character grid the diagram is drawn onto.
 *
 * <p>
 * Cells hold Unicode code points so that labels outside the Basic Multilingual
 * Plane occupy a single column, matching how their width is measured during
 * layout. Drawing primitives write over whatever is already in a cell; the
 * caller decides the drawing order (boxes, then edges, then buses).
 *
 * <p>
 * Coordinates are {@code (x, y)} = (column, row), origin at the top left.
 */
public final class Screen {
    private static final int BLANK = ' ';

    private int width;
    private int height;
    private int[][] lines;

    public Screen(int width, int height) {
        this.lines = new int[0][];
        resize(width, height);
    }

    /** Grows or shrinks the grid, keeping existing content and blank-filling new cells. */
    public void resize(int newWidth, int newHeight) {
        int[][] next = new int[newHeight][];
        for (int y = 0; y < newHeight; y++) {
            int[] row = new int[newWidth];
            Arrays.fill(row, BLANK);
            if (y < lines.length)
                System.arraycopy(lines[y], 0, row, 0, Math.min(newWidth, lines[y].length));
            next[y] = row;
        }
        this.lines = next;
        this.width = newWidth;
        this.height = newHeight;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int pixel(int x, int y) {
        return lines[y][x];
    }

    public void drawPixel(int x, int y, int c) {
        lines[y][x] = c;
    }

    /** Writes text left to right, clipping at the right border. */
    public void drawText(int x, int y, String text) {
        int[] cps = text.codePoints().toArray();
        for (int i = 0; i < cps.length; i++) {
            if (x + i < width)
                lines[y][x + i] = cps[i];
        }
    }

    /**
     * Centers text on the middle row of a box whose top-left corner is at
     * {@code (x, y)}.
     */
    public void drawTextInBoxCenter(int x, int y, int boxWidth, String text) {
        int margin = (boxWidth - displayWidth(text)) / 2;
        drawText(x + margin, y + 1, text);
    }

    /** Draws a 3-row box sized to fit the text, with the text inside it. */
    public void drawBoxedText(int x, int y, String text) {
        drawText(x + 1, y + 1, text);
        drawBox(x, y, displayWidth(text) + 2, 3);
    }

    public void drawBox(int x, int y, int w, int h) {
        lines[y][x] = '┌';
        lines[y][x + w - 1] = '┐';
        lines[y + h - 1][x] = '└';
        lines[y + h - 1][x + w - 1] = '┘';

        for (int xx = 1; xx < w - 1; xx++) {
            lines[y][x + xx] = '─';
            lines[y + h - 1][x + xx] = '─';
        }
        for (int yy = 1; yy < h - 1; yy++) {
            lines[y + yy][x] = '│';
            lines[y + yy][x + w - 1] = '│';
        }
    }

    /** Inclusive on both ends. */
    public void drawHorizontalLine(int left, int right, int y, int c) {
        for (int x = left; x <= right; x++)
            lines[y][x] = c;
    }

    /** Inclusive on both ends. */
    public void drawVerticalLine(int top, int bottom, int x, int c) {
        for (int y = top; y <= bottom; y++)
            lines[y][x] = c;
    }

    /**
     * Draws a vertical stroke that joins the strokes it passes through.
     *
     * <p>
     * A horizontal stroke met at the top or bottom end becomes a corner or a
     * tee depending on which sides it continues to; corners and tees met along
     * the way gain the missing arm.
     */
    public void drawVerticalLineComplete(int top, int bottom, int x) {
        for (int y = top; y <= bottom; y++) {
            int ch = lines[y][x];
            int res;
            switch (ch) {
                case '─' -> {
                    boolean left = x > 0 && lines[y][x - 1] != BLANK;
                    boolean right = x + 1 < width && lines[y][x + 1] != BLANK;
                    boolean isTop = y == top, isBottom = y == bottom;
                    if (isTop && isBottom)
                        res = left && right ? '─' : '│';
                    else if (isTop && left && right)
                        res = '┬';
                    else if (isTop && left)
                        res = '┐';
                    else if (isTop && right)
                        res = '┌';
                    else if (isBottom && left && right)
                        res = '┴';
                    else if (isBottom && left)
                        res = '┘';
                    else if (isBottom && right)
                        res = '└';
                    else
                        res = '│';
                }
                case '┐', '┘' -> res = '┤';
                case '┌', '└' -> res = '├';
                case '┬', '┴' -> res = '┼';
                default -> res = '│';
            }
            lines[y][x] = res;
        }
    }

    /** Rewrites every box-drawing glyph into its ASCII counterpart. */
    public void asciify(GlyphStyle style) {
        if (style == GlyphStyle.UNICODE)
            return;
        boolean rounded = style == GlyphStyle.ASCII_ROUNDED;
        for (int[] row : lines) {
            for (int x = 0; x < row.length; x++) {
                row[x] = switch (row[x]) {
                    case '─' -> '-';
                    case '│' -> '|';
                    case '┐', '┌' -> '.';
                    case '┘', '└' -> '\'';
                    case '┬' -> rounded ? '.' : '-';
                    case '┴' -> rounded ? '\'' : '-';
                    case '├', '┤' -> '-';
                    case '△' -> '^';
                    case '▽' -> 'V';
                    default -> row[x];
                };
            }
        }
    }

    /** Copies another screen in at {@code (x, y)}, growing this one as needed. */
    public void append(Screen other, int x, int y) {
        resize(Math.max(width, x + other.width), Math.max(height, y + other.height));
        for (int dy = 0; dy < other.height; dy++)
            System.arraycopy(other.lines[dy], 0, lines[y + dy], x, other.width);
    }

    /** Flattens the grid row-major, one newline after every row. */
    public String stringify() {
        StringBuilder sb = new StringBuilder((width + 1) * height);
        for (int[] row : lines) {
            for (int cp : row)
                sb.appendCodePoint(cp);
            sb.append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return stringify();
    }

    /** Column count of a string, one per code point. */
    public static int displayWidth(String text) {
        return text.codePointCount(0, text.length());
    }
}
