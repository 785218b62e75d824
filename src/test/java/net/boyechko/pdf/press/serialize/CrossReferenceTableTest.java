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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class CrossReferenceTableTest {

    @Test
    void sectionListsFreeHeadThenOffsets() {
        CrossReferenceTable xref = new CrossReferenceTable(2);
        xref.record(1, 15);
        xref.record(2, 1234);

        assertEquals(3, xref.size());
        assertEquals(
                "xref\n0 3\n"
                        + "0000000000 65535 f \n"
                        + "0000000015 00000 n \n"
                        + "0000001234 00000 n \n",
                xref.toSection());
    }

    @Test
    void everyEntryIsTwentyBytes() {
        CrossReferenceTable xref = new CrossReferenceTable(1);
        xref.record(1, 9_999_999_999L);
        String[] lines = xref.toSection().split("(?<=\n)");
        assertEquals(20, lines[2].length());
        assertEquals(20, lines[3].length());
    }

    @Test
    void missingOffsetIsAnError() {
        CrossReferenceTable xref = new CrossReferenceTable(2);
        xref.record(1, 15);
        assertEquals(-1, xref.offsetOf(2));
        assertThrows(IllegalStateException.class, xref::toSection);
    }

    @Test
    void unknownObjectNumbersAreRejected() {
        CrossReferenceTable xref = new CrossReferenceTable(2);
        assertThrows(IllegalArgumentException.class, () -> xref.record(0, 10));
        assertThrows(IllegalArgumentException.class, () -> xref.record(3, 10));
    }
}
