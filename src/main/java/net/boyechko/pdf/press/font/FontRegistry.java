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

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Static lookup over the {@link StandardFont} table.
 *
 * <p>Names resolve case-insensitively against the base font names ({@code "Helvetica-Bold"}),
 * plus the family shorthands {@code "Times"}, {@code "Sans"}, {@code "Serif"} and {@code
 * "Mono"}. Style changes ({@link #bold}, {@link #italic}, {@link #regular}) stay within the
 * family and leave Symbol and ZapfDingbats untouched.
 */
public final class FontRegistry {
    private static final Map<String, StandardFont> BY_NAME = new TreeMap<>();

    static {
        for (StandardFont font : StandardFont.values()) {
            BY_NAME.put(key(font.baseFont()), font);
        }
        BY_NAME.put(key("Times"), StandardFont.TIMES_ROMAN);
        BY_NAME.put(key("Serif"), StandardFont.TIMES_ROMAN);
        BY_NAME.put(key("Sans"), StandardFont.HELVETICA);
        BY_NAME.put(key("Mono"), StandardFont.COURIER);
    }

    private FontRegistry() {}

    /** Returns the standard font with the given name, or empty when there is none. */
    public static Optional<StandardFont> lookup(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        return Optional.ofNullable(BY_NAME.get(key(name.trim())));
    }

    public static boolean isKnown(String name) {
        return lookup(name).isPresent();
    }

    /** Returns the bold variant, keeping the italic flag. */
    public static StandardFont bold(StandardFont font) {
        return variant(font, true, font.isItalic());
    }

    /** Returns the italic (or oblique) variant, keeping the bold flag. */
    public static StandardFont italic(StandardFont font) {
        return variant(font, font.isBold(), true);
    }

    /** Returns the upright, non-bold member of the family. */
    public static StandardFont regular(StandardFont font) {
        return variant(font, false, false);
    }

    /** Returns the family member with the requested style flags. */
    public static StandardFont variant(StandardFont font, boolean bold, boolean italic) {
        if (font.family() == StandardFont.Family.SYMBOLIC) {
            return font;
        }
        for (StandardFont candidate : StandardFont.values()) {
            if (candidate.family() == font.family()
                    && candidate.isBold() == bold
                    && candidate.isItalic() == italic) {
                return candidate;
            }
        }
        return font;
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
