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
 * The 14 standard Type1 fonts every PDF reader provides. None of them is ever embedded.
 *
 * <p>The resource name used inside content streams is derived from the ordinal ({@code F1} to
 * {@code F14}), so it is stable across documents.
 */
public enum StandardFont {
    COURIER("Courier", Family.COURIER, false, false),
    COURIER_BOLD("Courier-Bold", Family.COURIER, true, false),
    COURIER_OBLIQUE("Courier-Oblique", Family.COURIER, false, true),
    COURIER_BOLD_OBLIQUE("Courier-BoldOblique", Family.COURIER, true, true),
    HELVETICA("Helvetica", Family.HELVETICA, false, false),
    HELVETICA_BOLD("Helvetica-Bold", Family.HELVETICA, true, false),
    HELVETICA_OBLIQUE("Helvetica-Oblique", Family.HELVETICA, false, true),
    HELVETICA_BOLD_OBLIQUE("Helvetica-BoldOblique", Family.HELVETICA, true, true),
    TIMES_ROMAN("Times-Roman", Family.TIMES, false, false),
    TIMES_BOLD("Times-Bold", Family.TIMES, true, false),
    TIMES_ITALIC("Times-Italic", Family.TIMES, false, true),
    TIMES_BOLD_ITALIC("Times-BoldItalic", Family.TIMES, true, true),
    SYMBOL("Symbol", Family.SYMBOLIC, false, false),
    ZAPF_DINGBATS("ZapfDingbats", Family.SYMBOLIC, false, false);

    /** Font families that have bold and italic variants, plus the two symbolic fonts. */
    public enum Family {
        COURIER,
        HELVETICA,
        TIMES,
        SYMBOLIC
    }

    private final String baseFont;
    private final Family family;
    private final boolean bold;
    private final boolean italic;

    StandardFont(String baseFont, Family family, boolean bold, boolean italic) {
        this.baseFont = baseFont;
        this.family = family;
        this.bold = bold;
        this.italic = italic;
    }

    /** The PostScript name written as {@code /BaseFont}. */
    public String baseFont() {
        return baseFont;
    }

    public String subtype() {
        return "Type1";
    }

    public Family family() {
        return family;
    }

    public boolean isBold() {
        return bold;
    }

    public boolean isItalic() {
        return italic;
    }

    /** Symbol and ZapfDingbats use their built-in encodings; all others are WinAnsi encoded. */
    public boolean usesWinAnsiEncoding() {
        return family != Family.SYMBOLIC;
    }

    /** Name under which a page's {@code /Resources /Font} dictionary refers to this font. */
    public String resourceName() {
        return "F" + (ordinal() + 1);
    }
}
