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

import java.awt.image.BufferedImage;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import net.boyechko.pdf.press.document.Document;
import net.boyechko.pdf.press.document.Metadata;
import org.junit.jupiter.api.Test;

class ObjectGraphBuilderTest {

    private static Document textAndImageDocument() {
        return new Document()
                .addPage()
                .text("caption")
                .image(72, 100, 40, 30, new BufferedImage(4, 3, BufferedImage.TYPE_INT_RGB));
    }

    @Test
    void objectsAreNumberedFontsImagesPagesThenRoots() {
        ObjectGraphBuilder.ObjectGraph graph = new ObjectGraphBuilder().build(textAndImageDocument());
        List<PdfObject> objects = graph.objects();

        assertEquals(7, graph.size());
        for (int i = 0; i < objects.size(); i++) {
            assertEquals(i + 1, objects.get(i).number());
        }
        assertEquals("/Font", objects.get(0).dictionary().get("Type"));
        assertEquals("/Image", objects.get(1).dictionary().get("Subtype"));
        assertTrue(objects.get(2).isStream(), "content stream follows the resources");
        assertEquals("/Page", objects.get(3).dictionary().get("Type"));
        assertEquals("/Pages", objects.get(4).dictionary().get("Type"));
        assertEquals(6, graph.catalog().number());
        assertEquals(7, graph.info().number());
    }

    @Test
    void pageIsLinkedToContentsResourcesAndParent() {
        ObjectGraphBuilder.ObjectGraph graph = new ObjectGraphBuilder().build(textAndImageDocument());
        PdfDictionary page = graph.objects().get(3).dictionary();

        assertEquals("[0 0 612.00 792.00]", page.get("MediaBox"));
        assertEquals("3 0 R", page.get("Contents"));
        assertEquals("5 0 R", page.get("Parent"));
        assertEquals("<< /Font << /F5 1 0 R >> /XObject << /Im1 2 0 R >> >>", page.get("Resources"));
        assertEquals("[4 0 R]", graph.objects().get(4).dictionary().get("Kids"));
        assertEquals("1", graph.objects().get(4).dictionary().get("Count"));
    }

    @Test
    void imageXObjectDescribesJpegData() {
        ObjectGraphBuilder.ObjectGraph graph = new ObjectGraphBuilder().build(textAndImageDocument());
        PdfObject image = graph.objects().get(1);

        assertEquals("4", image.dictionary().get("Width"));
        assertEquals("3", image.dictionary().get("Height"));
        assertEquals("/DeviceRGB", image.dictionary().get("ColorSpace"));
        assertEquals("/DCTDecode", image.dictionary().get("Filter"));
        assertEquals(String.valueOf(image.streamLength()), image.dictionary().get("Length"));
    }

    @Test
    void numberingRestartsOnEveryBuild() {
        ObjectGraphBuilder builder = new ObjectGraphBuilder();
        Document doc = textAndImageDocument();
        builder.build(new Document().addPage().addPage());
        ObjectGraphBuilder.ObjectGraph graph = builder.build(doc);

        assertEquals(1, graph.objects().get(0).number());
        assertEquals(7, graph.size());
    }

    @Test
    void infoDictionaryOmitsUnsetFields() {
        Document doc = new Document().addPage().setTitle("Report");
        PdfDictionary info = new ObjectGraphBuilder().build(doc).info().dictionary();

        assertEquals("(Report)", info.get("Title"));
        assertEquals("(" + Metadata.DEFAULT_PRODUCER + ")", info.get("Producer"));
        assertFalse(info.containsKey("Author"));
        assertTrue(info.get("CreationDate").startsWith("(D:"));
    }

    @Test
    void pdfDatesCarryTheUtcOffset() {
        assertEquals(
                "D:20240305140709-05'30'",
                ObjectGraphBuilder.pdfDate(
                        OffsetDateTime.of(2024, 3, 5, 14, 7, 9, 0, ZoneOffset.ofHoursMinutes(-5, -30))));
        assertEquals(
                "D:20240305140709+02'00'",
                ObjectGraphBuilder.pdfDate(
                        OffsetDateTime.of(2024, 3, 5, 14, 7, 9, 0, ZoneOffset.ofHours(2))));
        assertEquals(
                "D:20241231235959Z",
                ObjectGraphBuilder.pdfDate(
                        OffsetDateTime.of(2024, 12, 31, 23, 59, 59, 0, ZoneOffset.UTC)));
    }

    @Test
    void objectBytesWrapDictionaryAndStream() {
        PdfObject object = new PdfObject(3, new PdfDictionary(), "q\nQ\n".getBytes());
        assertEquals(
                "3 0 obj\n<< /Length 4 >>\nstream\nq\nQ\n\nendstream\nendobj\n",
                new String(object.toBytes()));
        assertEquals("3 0 R", object.reference());
    }

    @Test
    void objectNumbersMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new PdfObject(0, new PdfDictionary()));
    }
}
