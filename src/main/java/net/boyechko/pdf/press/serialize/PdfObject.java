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
package net.boyechko.pdf.press.serialize;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * A numbered indirect object: a dictionary, optionally followed by a stream.
 *
 * <p>Generation numbers are always 0 since files are never updated incrementally. For stream
 * objects the dictionary's {@code /Length} is set from the stream itself and cannot drift.
 */
public final class PdfObject {
    public static final int GENERATION = 0;

    private final int number;
    private final PdfDictionary dictionary;
    private final byte[] stream;

    PdfObject(int number, PdfDictionary dictionary) {
        this(number, dictionary, null);
    }

    PdfObject(int number, PdfDictionary dictionary, byte[] stream) {
        if (number <= 0) {
            throw new IllegalArgumentException("Object number must be positive: " + number);
        }
        this.number = number;
        this.dictionary = dictionary;
        this.stream = stream;
        if (stream != null) {
            dictionary.put("Length", stream.length);
        }
    }

    public int number() {
        return number;
    }

    public PdfDictionary dictionary() {
        return dictionary;
    }

    public boolean isStream() {
        return stream != null;
    }

    public int streamLength() {
        return stream != null ? stream.length : 0;
    }

    /** Indirect reference to this object, e.g. {@code "7 0 R"}. */
    public String reference() {
        return number + " " + GENERATION + " R";
    }

    /** The complete {@code obj ... endobj} block. */
    public byte[] toBytes() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeAscii(out, number + " " + GENERATION + " obj\n");
        writeAscii(out, dictionary.toString());
        writeAscii(out, "\n");
        if (stream != null) {
            writeAscii(out, "stream\n");
            out.write(stream, 0, stream.length);
            writeAscii(out, "\nendstream\n");
        }
        writeAscii(out, "endobj\n");
        return out.toByteArray();
    }

    @Override
    public String toString() {
        return "obj. #" + number + (stream != null ? " (stream, " + stream.length + " bytes)" : "");
    }

    private static void writeAscii(ByteArrayOutputStream out, String text) {
        byte[] bytes = text.getBytes(StandardCharsets.ISO_8859_1);
        out.write(bytes, 0, bytes.length);
    }
}
