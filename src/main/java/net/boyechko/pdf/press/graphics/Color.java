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
package net.boyechko.pdf.press.graphics;

import java.util.Locale;

/**
 * An RGB color with channels in the range 0.0 to 1.0, as used by the {@code RG} and {@code rg}
 * operators.
 */
public record Color(double r, double g, double b) {
    public static final Color BLACK = new Color(0, 0, 0);
    public static final Color WHITE = new Color(1, 1, 1);
    public static final Color RED = new Color(1, 0, 0);
    public static final Color GREEN = new Color(0, 1, 0);
    public static final Color BLUE = new Color(0, 0, 1);
    public static final Color GRAY = new Color(0.5, 0.5, 0.5);
    public static final Color YELLOW = new Color(1, 1, 0);
    public static final Color CYAN = new Color(0, 1, 1);
    public static final Color MAGENTA = new Color(1, 0, 1);

    /** Creates a color from 0-255 channel values. */
    public static Color rgb(int r, int g, int b) {
        return new Color(r / 255.0, g / 255.0, b / 255.0);
    }

    /**
     * Parses a hex color such as {@code "#FF5500"} or {@code "ff5500"}.
     *
     * <p>Anything that is not six hex digits yields {@link #BLACK}.
     */
    public static Color hex(String hex) {
        if (hex == null) return BLACK;
        String digits = hex.startsWith("#") ? hex.substring(1) : hex;
        if (digits.length() != 6) {
            return BLACK;
        }
        try {
            int value = Integer.parseInt(digits, 16);
            return rgb((value >> 16) & 0xFF, (value >> 8) & 0xFF, value & 0xFF);
        } catch (NumberFormatException e) {
            return BLACK;
        }
    }

    /** Returns the three channels formatted for a color operator, e.g. {@code "1.000 0.000 0.000"}. */
    public String toOperands() {
        return String.format(Locale.ROOT, "%.3f %.3f %.3f", r, g, b);
    }
}
