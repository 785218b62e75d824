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
package net.boyechko.pdf.press.ui.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.pdf.press.document.Document;
import org.junit.jupiter.api.Test;

class TextLayoutTest {

    @Test
    void headingsAndParagraphs() {
        Document doc = new Document();
        TextLayout.renderText(
                doc, List.of("# Title", "one", "two", "", "", "three", "# Next", "four"));

        String content = doc.currentPage().content().toString();
        assertTrue(content.contains("/F6 16.00 Tf"));
        assertTrue(content.contains("(one two) Tj"), "consecutive lines join into one paragraph");
        assertTrue(content.contains("(three) Tj"));
        assertTrue(content.contains("(Next) Tj"));
        assertTrue(content.indexOf("(three) Tj") < content.indexOf("(Next) Tj"));
    }

    @Test
    void emptyInputProducesNoText() {
        Document doc = new Document();
        TextLayout.renderText(doc, List.of("", "   "));
        assertEquals(0, doc.pageCount());
    }

    @Test
    void csvHeaderAndRows() {
        Document doc = new Document();
        TextLayout.renderCsv(doc, List.of("a,b,c", "", "1,2,3", "4,5"));
        String content = doc.currentPage().content().toString();
        assertTrue(content.contains("(a) Tj"));
        assertTrue(content.contains("(5) Tj"));
        assertEquals(72 + 3 * 20, doc.getY());
    }

    @Test
    void emptyCsvStillHasAPage() {
        Document doc = new Document();
        TextLayout.renderCsv(doc, List.of());
        assertEquals(1, doc.pageCount());
    }

    @Test
    void parsesQuotedCsvFields() {
        assertEquals(List.of("a", "b, c", "say \"hi\""), TextLayout.parseCsvLine("a,\"b, c\",\"say \"\"hi\"\"\""));
        assertEquals(List.of("", "x", ""), TextLayout.parseCsvLine(",x,"));
        assertEquals(List.of("trimmed"), TextLayout.parseCsvLine("  trimmed  "));
    }
}
