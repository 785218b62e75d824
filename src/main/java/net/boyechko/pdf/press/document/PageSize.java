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
package net.boyechko.pdf.press.document;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Page dimensions in points (1/72 inch), portrait. */
public record PageSize(double width, double height) {
    public static final PageSize LETTER = new PageSize(612, 792);
    public static final PageSize LEGAL = new PageSize(612, 1008);
    public static final PageSize TABLOID = new PageSize(792, 1224);
    public static final PageSize A3 = new PageSize(841.89, 1190.55);
    public static final PageSize A4 = new PageSize(595.28, 841.89);
    public static final PageSize A5 = new PageSize(419.53, 595.28);
    public static final PageSize B4 = new PageSize(708.66, 1000.63);
    public static final PageSize B5 = new PageSize(498.90, 708.66);

    private static final Map<String, PageSize> NAMED = new LinkedHashMap<>();

    static {
        NAMED.put("LETTER", LETTER);
        NAMED.put("LEGAL", LEGAL);
        NAMED.put("TABLOID", TABLOID);
        NAMED.put("A3", A3);
        NAMED.put("A4", A4);
        NAMED.put("A5", A5);
        NAMED.put("B4", B4);
        NAMED.put("B5", B5);
    }

    public PageSize {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(
                    "Page dimensions must be positive: " + width + " x " + height);
        }
    }

    /** Looks up a standard size by name, case-insensitively ({@code "a4"}, {@code "Letter"}). */
    public static Optional<PageSize> named(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(NAMED.get(name.trim().toUpperCase(Locale.ROOT)));
    }

    /** Returns this size with width and height swapped. */
    public PageSize rotated() {
        return new PageSize(height, width);
    }

    /** Returns this size laid out in the given orientation. */
    public PageSize oriented(Orientation orientation) {
        return orientation == Orientation.LANDSCAPE ? rotated() : this;
    }
}
