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
package net.boyechko.pdf.press.text;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Encoding and escaping of PDF literal strings.
 *
 * <p>Text is encoded as windows-1252, which matches {@code /WinAnsiEncoding} for the printable
 * range; unmappable characters become {@code ?}. The encoded bytes are then escaped so that the
 * result is plain ASCII suitable for a {@code (...)} literal.
 *
 * <p>Text strings outside content streams, such as document information entries, are read as
 * PDFDocEncoding or UTF-16BE rather than WinAnsi; {@link #textString} writes those.
 */
public final class PdfStrings {
    private static final Charset WIN_ANSI = Charset.forName("windows-1252");

    private PdfStrings() {}

    /** Encodes {@code text} as WinAnsi and escapes it for use between parentheses. */
    public static String escape(String text) {
        return escapeBytes(encodeWinAnsi(text));
    }

    /**
     * Returns a complete text string token: a literal {@code (...)} when {@code text} is ASCII,
     * otherwise a hex string of UTF-16BE with a {@code FEFF} byte order mark.
     */
    public static String textString(String text) {
        if (text == null || text.isEmpty()) return "()";
        if (StandardCharsets.US_ASCII.newEncoder().canEncode(text)) {
            return "(" + escapeBytes(text.getBytes(StandardCharsets.US_ASCII)) + ")";
        }
        StringBuilder sb = new StringBuilder("<FEFF");
        for (byte b : text.getBytes(StandardCharsets.UTF_16BE)) {
            sb.append(String.format("%02X", b & 0xFF));
        }
        return sb.append('>').toString();
    }

    /** Escapes raw bytes: backslash, parentheses, common controls, and octal for the rest. */
    public static String escapeBytes(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length + 8);
        for (byte b : bytes) {
            int c = b & 0xFF;
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '(' -> sb.append("\\(");
                case ')' -> sb.append("\\)");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c >= 32 && c < 127) {
                        sb.append((char) c);
                    } else {
                        sb.append('\\').append(String.format("%03o", c));
                    }
                }
            }
        }
        return sb.toString();
    }

    static byte[] encodeWinAnsi(String text) {
        if (text == null || text.isEmpty()) return new byte[0];
        CharsetEncoder encoder =
                WIN_ANSI.newEncoder()
                        .onMalformedInput(CodingErrorAction.REPLACE)
                        .onUnmappableCharacter(CodingErrorAction.REPLACE)
                        .replaceWith(new byte[] {'?'});
        try {
            ByteBuffer buffer = encoder.encode(CharBuffer.wrap(text));
            byte[] bytes = new byte[buffer.remaining()];
            buffer.get(bytes);
            return bytes;
        } catch (CharacterCodingException e) {
            // REPLACE actions never report coding errors
            throw new IllegalStateException("WinAnsi encoder rejected input", e);
        }
    }
}
