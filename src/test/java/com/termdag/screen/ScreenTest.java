package com.termdag.screen;

import com.termdag.api.GlyphStyle;

import org.junit.Test;

import static org.junit.Assert.*;

public class ScreenTest {

    @Test
    public void testBlankScreen() {
        Screen screen = new Screen(3, 2);
        assertEquals("   \n   \n", screen.stringify());
    }

    @Test
    public void testBoxedText() {
        Screen screen = new Screen(5, 3);
        screen.drawBoxedText(0, 0, "abc");
        assertEquals("┌───┐\n│abc│\n└───┘\n", screen.toString());
    }

    @Test
    public void testTextCenteredInBox() {
        Screen screen = new Screen(7, 3);
        screen.drawBox(0, 0, 7, 3);
        screen.drawTextInBoxCenter(0, 0, 7, "C");
        assertEquals("│  C  │", screen.stringify().split("\n")[1]);
    }

    @Test
    public void testTextClipsAtRightBorder() {
        Screen screen = new Screen(3, 1);
        screen.drawText(1, 0, "xyz");
        assertEquals(" xy\n", screen.stringify());
    }

    @Test
    public void testSupplementaryCodePointTakesOneColumn() {
        String label = "a😀b";
        assertEquals(3, Screen.displayWidth(label));

        Screen screen = new Screen(5, 3);
        screen.drawBoxedText(0, 0, label);
        assertEquals("│" + label + "│", screen.stringify().split("\n")[1]);
    }

    @Test
    public void testVerticalLineCompleteAtTop() {
        Screen screen = new Screen(3, 3);
        screen.drawHorizontalLine(0, 2, 0, '─');
        screen.drawVerticalLineComplete(0, 2, 1);

        assertEquals('┬', screen.pixel(1, 0));
        assertEquals('│', screen.pixel(1, 1));
        assertEquals('│', screen.pixel(1, 2));
    }

    @Test
    public void testVerticalLineCompleteCorners() {
        Screen screen = new Screen(3, 3);
        screen.drawHorizontalLine(0, 1, 0, '─');
        screen.drawHorizontalLine(1, 2, 2, '─');
        screen.drawVerticalLineComplete(0, 2, 1);

        assertEquals('┐', screen.pixel(1, 0));
        assertEquals('└', screen.pixel(1, 2));
    }

    @Test
    public void testVerticalLineCompleteJoinsCorners() {
        Screen screen = new Screen(3, 3);
        screen.drawBox(0, 0, 3, 3);
        screen.drawVerticalLineComplete(0, 2, 0);

        assertEquals('├', screen.pixel(0, 0));
        assertEquals('│', screen.pixel(0, 1));
        assertEquals('├', screen.pixel(0, 2));
    }

    @Test
    public void testAsciify() {
        Screen screen = new Screen(5, 3);
        screen.drawBox(0, 0, 5, 3);
        screen.drawPixel(1, 2, '┬');
        screen.drawPixel(2, 0, '▽');

        Screen rounded = new Screen(5, 3);
        rounded.append(screen, 0, 0);

        screen.asciify(GlyphStyle.ASCII);
        assertEquals(".-V-.\n|   |\n'---'\n", screen.stringify());

        rounded.asciify(GlyphStyle.ASCII_ROUNDED);
        assertEquals(".-V-.\n|   |\n'.--'\n", rounded.stringify());
    }

    @Test
    public void testUnicodeStyleLeavesGlyphs() {
        Screen screen = new Screen(3, 3);
        screen.drawBox(0, 0, 3, 3);
        String before = screen.stringify();
        screen.asciify(GlyphStyle.UNICODE);
        assertEquals(before, screen.stringify());
    }

    @Test
    public void testAppendGrows() {
        Screen small = new Screen(2, 1);
        small.drawText(0, 0, "ab");
        Screen screen = new Screen(1, 1);
        screen.drawPixel(0, 0, 'x');

        screen.append(small, 2, 1);

        assertEquals(4, screen.width());
        assertEquals(2, screen.height());
        assertEquals("x   \n  ab\n", screen.stringify());
    }

    @Test
    public void testResizeKeepsContent() {
        Screen screen = new Screen(2, 2);
        screen.drawPixel(1, 1, '#');
        screen.resize(3, 1);
        assertEquals("   \n", screen.stringify());
        screen.resize(3, 3);
        screen.drawPixel(2, 2, '#');
        assertEquals("   \n   \n  #\n", screen.stringify());
    }
}
