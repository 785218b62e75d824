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

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import net.boyechko.pdf.press.document.Document;
import net.boyechko.pdf.press.document.Metadata;
import net.boyechko.pdf.press.document.Page;
import net.boyechko.pdf.press.font.StandardFont;
import net.boyechko.pdf.press.image.EmbeddedImage;
import net.boyechko.pdf.press.text.PdfStrings;

/**
 * Turns a {@link Document} into numbered PDF objects.
 *
 * <p>Objects are numbered from 1 in this order: the fonts used anywhere, the image XObjects, then
 * for every page its content stream followed by its page object, then the page tree, the catalog
 * and the information dictionary. Numbering starts over on every call to {@link #build}.
 */
public final class ObjectGraphBuilder {
    private static final DateTimeFormatter PDF_DATE = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final List<PdfObject> objects = new ArrayList<>();
    private int nextNumber;

    /** Objects of one file in number order, plus the two the trailer points to. */
    public record ObjectGraph(List<PdfObject> objects, PdfObject catalog, PdfObject info) {
        public int size() {
            return objects.size();
        }
    }

    public ObjectGraph build(Document doc) {
        objects.clear();
        nextNumber = 1;

        Map<StandardFont, PdfObject> fonts = addFonts(doc.pages());
        Map<String, PdfObject> images = addImages(doc);

        List<PdfObject> pageObjects = new ArrayList<>();
        for (Page page : doc.pages()) {
            PdfObject content = add(new PdfDictionary(), page.content().toByteArray());
            PdfDictionary dict =
                    new PdfDictionary()
                            .putName("Type", "Page")
                            .put(
                                    "MediaBox",
                                    String.format(
                                            Locale.ROOT,
                                            "[0 0 %.2f %.2f]",
                                            page.width(),
                                            page.height()))
                            .putReference("Contents", content)
                            .put("Resources", resources(page, fonts, images));
            pageObjects.add(add(dict));
        }

        StringJoiner kids = new StringJoiner(" ", "[", "]");
        pageObjects.forEach(p -> kids.add(p.reference()));
        PdfObject pageTree =
                add(
                        new PdfDictionary()
                                .putName("Type", "Pages")
                                .put("Kids", kids.toString())
                                .put("Count", pageObjects.size()));
        for (PdfObject pageObject : pageObjects) {
            pageObject.dictionary().putReference("Parent", pageTree);
        }

        PdfObject catalog =
                add(new PdfDictionary().putName("Type", "Catalog").putReference("Pages", pageTree));
        PdfObject info = add(infoDictionary(doc.metadata()));

        return new ObjectGraph(List.copyOf(objects), catalog, info);
    }

    // ── Resources ───────────────────────────────────────────────────

    private Map<StandardFont, PdfObject> addFonts(List<Page> pages) {
        Set<StandardFont> used = EnumSet.noneOf(StandardFont.class);
        for (Page page : pages) {
            used.addAll(page.fonts());
        }
        Map<StandardFont, PdfObject> fonts = new EnumMap<>(StandardFont.class);
        for (StandardFont font : used) {
            PdfDictionary dict =
                    new PdfDictionary()
                            .putName("Type", "Font")
                            .putName("Subtype", font.subtype())
                            .putName("BaseFont", font.baseFont());
            if (font.usesWinAnsiEncoding()) {
                dict.putName("Encoding", "WinAnsiEncoding");
            }
            fonts.put(font, add(dict));
        }
        return fonts;
    }

    private Map<String, PdfObject> addImages(Document doc) {
        Map<String, PdfObject> images = new LinkedHashMap<>();
        for (EmbeddedImage image : doc.images()) {
            PdfDictionary dict =
                    new PdfDictionary()
                            .putName("Type", "XObject")
                            .putName("Subtype", "Image")
                            .put("Width", image.width())
                            .put("Height", image.height())
                            .putName("ColorSpace", "DeviceRGB")
                            .put("BitsPerComponent", 8)
                            .putName("Filter", "DCTDecode");
            images.put(image.name(), add(dict, image.jpegData()));
        }
        return images;
    }

    /** Resource dictionary naming only what this page draws with. */
    private static String resources(
            Page page, Map<StandardFont, PdfObject> fonts, Map<String, PdfObject> images) {
        PdfDictionary fontDict = new PdfDictionary();
        for (StandardFont font : page.fonts()) {
            fontDict.putReference(font.resourceName(), fonts.get(font));
        }
        PdfDictionary resources = new PdfDictionary().put("Font", fontDict.toString());
        if (!page.images().isEmpty()) {
            PdfDictionary xobjects = new PdfDictionary();
            for (String name : page.images()) {
                xobjects.putReference(name, images.get(name));
            }
            resources.put("XObject", xobjects.toString());
        }
        return resources.toString();
    }

    // ── Info ────────────────────────────────────────────────────────

    private static PdfDictionary infoDictionary(Metadata metadata) {
        PdfDictionary dict = new PdfDictionary();
        putText(dict, "Title", metadata.title());
        putText(dict, "Author", metadata.author());
        putText(dict, "Subject", metadata.subject());
        putText(dict, "Keywords", metadata.keywords());
        putText(dict, "Creator", metadata.creator());
        putText(dict, "Producer", metadata.producer());
        if (metadata.creationDate() != null) {
            dict.put("CreationDate", "(" + pdfDate(metadata.creationDate()) + ")");
        }
        if (metadata.modDate() != null) {
            dict.put("ModDate", "(" + pdfDate(metadata.modDate()) + ")");
        }
        return dict;
    }

    private static void putText(PdfDictionary dict, String key, String value) {
        if (value != null) {
            dict.put(key, PdfStrings.textString(value));
        }
    }

    /** Formats a date as {@code D:YYYYMMDDHHmmSSOHH'mm'}, with {@code Z} for UTC. */
    static String pdfDate(OffsetDateTime date) {
        StringBuilder sb = new StringBuilder("D:").append(PDF_DATE.format(date));
        ZoneOffset offset = date.getOffset();
        int totalMinutes = offset.getTotalSeconds() / 60;
        if (totalMinutes == 0) {
            return sb.append('Z').toString();
        }
        sb.append(totalMinutes < 0 ? '-' : '+');
        int abs = Math.abs(totalMinutes);
        return sb.append(String.format(Locale.ROOT, "%02d'%02d'", abs / 60, abs % 60)).toString();
    }

    // ── Numbering ───────────────────────────────────────────────────

    private PdfObject add(PdfDictionary dict) {
        return add(dict, null);
    }

    private PdfObject add(PdfDictionary dict, byte[] stream) {
        PdfObject object = new PdfObject(nextNumber++, dict, stream);
        objects.add(object);
        return object;
    }
}
