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

import java.util.Arrays;
import java.util.Locale;

/**
 * Byte offsets of the objects of one file, written as a classic {@code xref} section.
 *
 * <p>Entry 0 is the head of the free list; entries 1 to N hold the offsets of objects 1 to N.
 * Every entry line is exactly 20 bytes.
 */
public final class CrossReferenceTable {
    static final String FREE_HEAD = "0000000000 65535 f \n";

    private final long[] offsets;

    /** @param objectCount the number of in-use objects, numbered 1 to {@code objectCount} */
    public CrossReferenceTable(int objectCount) {
        this.offsets = new long[objectCount + 1];
        Arrays.fill(offsets, -1);
    }

    public void record(int objectNumber, long offset) {
        if (objectNumber < 1 || objectNumber >= offsets.length) {
            throw new IllegalArgumentException("No such object: " + objectNumber);
        }
        offsets[objectNumber] = offset;
    }

    /** Offset of the object, or -1 when it was never recorded. */
    public long offsetOf(int objectNumber) {
        return offsets[objectNumber];
    }

    /** Entry count including the free-list head, i.e. the trailer's {@code /Size}. */
    public int size() {
        return offsets.length;
    }

    /** The {@code xref} keyword, subsection header and all entries. */
    public String toSection() {
        StringBuilder sb = new StringBuilder();
        sb.append("xref\n");
        sb.append("0 ").append(offsets.length).append('\n');
        sb.append(FREE_HEAD);
        for (int i = 1; i < offsets.length; i++) {
            if (offsets[i] < 0) {
                throw new IllegalStateException("Offset of object " + i + " was never recorded");
            }
            sb.append(String.format(Locale.ROOT, "%010d %05d n \n", offsets[i], PdfObject.GENERATION));
        }
        return sb.toString();
    }
}
