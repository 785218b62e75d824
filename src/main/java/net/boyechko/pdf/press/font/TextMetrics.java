/*
 * PDF-Press - Pure Java PDF Generation
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.press.font;

/**
 * Approximate text widths for the standard fonts.
 *
 * <p>Every character is assumed to be as wide as the family's average glyph. This is good enough
 * for centering, right alignment and word wrapping; it is not a substitute for real AFM metrics.
 */
public final class TextMetrics {
    static final double COURIER_AVERAGE = 0.6;
    static final double TIMES_AVERAGE = 0.45;
    static final double DEFAULT_AVERAGE = 0.5;

    private TextMetrics() {}

    /** Estimated width in points of {@code text} set in {@code font} at {@code size}. */
    public static double width(StandardFont font, double size, String text) {
        if (text == null || text.isEmpty()) return 0;
        return text.codePointCount(0, text.length()) * averageGlyphWidth(font) * size;
    }

    /** Average glyph width as a fraction of the em square. */
    public static double averageGlyphWidth(StandardFont font) {
        return switch (font.family()) {
            case COURIER -> COURIER_AVERAGE;
            case TIMES -> TIMES_AVERAGE;
            case HELVETICA, SYMBOLIC -> DEFAULT_AVERAGE;
        };
    }
}
