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

import com.itextpdf.kernel.geom.Rectangle;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfPage;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.boyechko.pdf.press.PdfTestBase;
import net.boyechko.pdf.press.document.Document;
import net.boyechko.pdf.press.document.PageSize;
import org.junit.jupiter.api.Test;

class PdfSerializerTest extends PdfTestBase {

    private static Document oneLineDocument() {
        return new Document().addPage().writeLine("Hello, PDF");
    }

    private static int objectCount(String pdf) {
        return countMatches(pdf, "(?m)^\\d+ 0 obj$");
    }

    private static int startXref(String pdf) {
        Matcher m = Pattern.compile("startxref\n(\\d+)\n%%EOF\n$").matcher(pdf);
        assertTrue(m.find(), "startxref trailer missing");
        return Integer.parseInt(m.group(1));
    }

    /** Offsets of objects 1..N as listed in the xref table. */
    private static List<Integer> xrefOffsets(String pdf) {
        int xref = startXref(pdf);
        String[] lines = pdf.substring(xref).split("\n");
        int size = Integer.parseInt(lines[1].split(" ")[1]);
        List<Integer> offsets = new ArrayList<>();
        for (int i = 1; i < size; i++) {
            offsets.add(Integer.parseInt(lines[2 + i].substring(0, 10)));
        }
        return offsets;
    }

    // ── File structure ──────────────────────────────────────────────

    @Test
    void startsWithHeaderAndEndsWithEofMarker() {
        byte[] pdf = render(oneLineDocument());
        String text = raw(pdf);

        assertTrue(text.startsWith("%PDF-1.4\n%"));
        assertEquals((byte) 0xE2, pdf[10]);
        assertTrue(text.endsWith("%%EOF\n"));
    }

    @Test
    void xrefHasOneEntryMoreThanObjects() {
        String pdf = raw(render(oneLineDocument().addPage().circle(100, 100, 20)));
        int objects = objectCount(pdf);
        int xref = startXref(pdf);

        String subsection = "xref\n0 " + (objects + 1) + "\n";
        assertTrue(pdf.startsWith(subsection, xref));
        assertTrue(pdf.startsWith(CrossReferenceTable.FREE_HEAD, xref + subsection.length()));
        assertEquals("0000000000 65535 f \n", CrossReferenceTable.FREE_HEAD);
        assertEquals(20, CrossReferenceTable.FREE_HEAD.length());
        assertTrue(pdf.contains("/Size " + (objects + 1) + " "));
    }

    @Test
    void everyXrefOffsetPointsAtItsObject() {
        String pdf = raw(render(oneLineDocument()));
        List<Integer> offsets = xrefOffsets(pdf);
        for (int n = 1; n <= offsets.size(); n++) {
            assertTrue(
                    pdf.startsWith(n + " 0 obj\n", offsets.get(n - 1)),
                    "xref offset for object " + n + " does not point at it");
        }
    }

    @Test
    void everyReferenceResolvesToAnExistingObject() {
        Document doc = oneLineDocument();
        doc.addPage().setFont("Courier", 10).writeLine("second page");
        String pdf = raw(render(doc));
        int objects = objectCount(pdf);
        List<Integer> offsets = xrefOffsets(pdf);

        Matcher ref = Pattern.compile("(\\d+) 0 R").matcher(pdf);
        int seen = 0;
        while (ref.find()) {
            int n = Integer.parseInt(ref.group(1));
            assertTrue(n >= 1 && n <= objects, "Dangling reference " + ref.group());
            assertTrue(pdf.startsWith(n + " 0 obj\n", offsets.get(n - 1)));
            seen++;
        }
        assertTrue(seen > 0);
    }

    @Test
    void streamLengthMatchesStreamBytes() {
        String pdf = raw(render(oneLineDocument().rect(10, 10, 50, 50)));
        Matcher m = Pattern.compile("/Length (\\d+) >>\nstream\n").matcher(pdf);
        int streams = 0;
        while (m.find()) {
            int length = Integer.parseInt(m.group(1));
            assertTrue(pdf.startsWith("\nendstream\n", m.end() + length));
            streams++;
        }
        assertEquals(1, streams);
    }

    // ── Scenarios ───────────────────────────────────────────────────

    @Test
    void oneLineDocumentHasOneContentStreamAndOnePage() throws Exception {
        String pdf = raw(render(oneLineDocument()));

        assertEquals(1, countOccurrences(pdf, "endstream"));
        assertEquals(1, countMatches(pdf, "/Type /Page(?!s)"));
        assertEquals(1, countOccurrences(pdf, "/Type /Pages"));
        assertEquals(1, countOccurrences(pdf, "/Type /Catalog"));
        // font, content, page, pages, catalog, info
        assertEquals(6, objectCount(pdf));
    }

    @Test
    void repeatedSerializationIsByteIdentical() {
        Document doc = oneLineDocument();
        assertArrayEquals(doc.toBytes(), doc.toBytes());
    }

    @Test
    void documentsNumberObjectsIndependently() {
        Document a = oneLineDocument();
        Document b = new Document().addPage().addPage().text("b");
        byte[] first = a.toBytes();
        b.toBytes();
        byte[] again = a.toBytes();

        assertArrayEquals(first, again);
        assertTrue(raw(b.toBytes()).contains("\n1 0 obj\n"));
    }

    @Test
    void writeAndToBytesAgree() throws Exception {
        Document doc = oneLineDocument();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        doc.write(out);
        assertArrayEquals(doc.toBytes(), out.toByteArray());
    }

    @Test
    void savedFileMatchesBytes() throws Exception {
        Document doc = oneLineDocument();
        Path path = testOutputPath("saved.pdf");
        doc.save(path);
        assertArrayEquals(doc.toBytes(), Files.readAllBytes(path));
    }

    // ── Independent parser ──────────────────────────────────────────

    @Test
    void iTextReadsPagesAndMediaBox() throws Exception {
        Document doc = new Document().setPageSize(PageSize.A4).addPage().text("one");
        doc.addPage().text("two");
        doc.addPage();

        try (PdfDocument pdf = openWithIText(render(doc))) {
            assertEquals(3, pdf.getNumberOfPages());
            Rectangle box = pdf.getPage(1).getMediaBox();
            assertEquals(595.28f, box.getWidth(), 0.01f);
            assertEquals(841.89f, box.getHeight(), 0.01f);
            assertFalse(pdf.getReader().hasRebuiltXref(), "xref table should be usable as written");
        }
    }

    @Test
    void pageResourcesListOnlyFontsUsedOnThatPage() throws Exception {
        Document doc = new Document().addPage().text("helvetica");
        doc.addPage().setFont("Courier", 12).text("courier");

        try (PdfDocument pdf = openWithIText(render(doc))) {
            var first = pdf.getPage(1).getResources().getResource(PdfName.Font);
            var second = pdf.getPage(2).getResources().getResource(PdfName.Font);
            assertTrue(first.containsKey(new PdfName("F5")));
            assertFalse(first.containsKey(new PdfName("F1")));
            assertTrue(second.containsKey(new PdfName("F1")));
            assertEquals(
                    new PdfName("Helvetica"),
                    first.getAsDictionary(new PdfName("F5")).getAsName(PdfName.BaseFont));
            assertEquals(
                    PdfName.WinAnsiEncoding,
                    first.getAsDictionary(new PdfName("F5")).getAsName(PdfName.Encoding));
        }
    }

    @Test
    void symbolFontHasNoEncodingEntry() {
        String pdf = raw(render(new Document().setFont("Symbol", 12).text("abc")));
        assertTrue(pdf.contains("/BaseFont /Symbol >>"));
    }

    @Test
    void unusedFontsAreNotWritten() {
        String pdf = raw(render(new Document().addPage().rect(0, 0, 10, 10)));
        assertEquals(0, countOccurrences(pdf, "/Type /Font"));
        assertTrue(pdf.contains("/Resources << /Font << >> >>"));
    }

    @Test
    void iTextReadsInfoDictionary() throws Exception {
        Document doc = oneLineDocument().setTitle("Quarterly (Q3) Report").setAuthor("Ops");

        try (PdfDocument pdf = openWithIText(render(doc))) {
            assertEquals("Quarterly (Q3) Report", pdf.getDocumentInfo().getTitle());
            assertEquals("Ops", pdf.getDocumentInfo().getAuthor());
        }
    }

    @Test
    void nonAsciiInfoEntriesSurviveAsUnicode() throws Exception {
        String title = "Q3 \u2014 \u20ac5 \u201cdraft\u201d";
        String author = "\u0411\u043e\u0439\u0435\u0447\u043a\u043e";
        byte[] bytes = render(new Document().addPage().setTitle(title).setAuthor(author));

        assertTrue(raw(bytes).contains("/Author <FEFF0411043E0439043504470"));
        try (PdfDocument pdf = openWithIText(bytes)) {
            assertEquals(title, pdf.getDocumentInfo().getTitle());
            assertEquals(author, pdf.getDocumentInfo().getAuthor());
        }
    }

    @Test
    void iTextSeesPageParentAndContents() throws Exception {
        try (PdfDocument pdf = openWithIText(render(oneLineDocument()))) {
            PdfPage page = pdf.getPage(1);
            assertNotNull(page.getPdfObject().getAsDictionary(PdfName.Parent));
            String content = new String(page.getContentBytes(), StandardCharsets.ISO_8859_1);
            assertTrue(content.contains("(Hello, PDF) Tj"));
        }
    }
}
