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

import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.press.document.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Lays plain text or CSV input out on a {@link Document}. */
public final class TextLayout {
    private static final Logger logger = LoggerFactory.getLogger(TextLayout.class);

    private static final String HEADING_PREFIX = "# ";

    private TextLayout() {}

    /**
     * Renders lines of plain text. A line starting with {@code "# "} becomes a heading; consecutive
     * non-blank lines are joined into one wrapped paragraph; blank lines end a paragraph.
     */
    public static void renderText(Document doc, List<String> lines) {
        StringBuilder paragraph = new StringBuilder();
        int paragraphs = 0;
        int headings = 0;

        for (String line : lines) {
            if (line.startsWith(HEADING_PREFIX)) {
                paragraphs += flushParagraph(doc, paragraph);
                doc.heading(line.substring(HEADING_PREFIX.length()).trim());
                headings++;
            } else if (line.isBlank()) {
                paragraphs += flushParagraph(doc, paragraph);
            } else {
                if (paragraph.length() > 0) {
                    paragraph.append(' ');
                }
                paragraph.append(line.trim());
            }
        }
        paragraphs += flushParagraph(doc, paragraph);

        logger.debug("Laid out {} heading(s) and {} paragraph(s)", headings, paragraphs);
    }

    private static int flushParagraph(Document doc, StringBuilder paragraph) {
        if (paragraph.length() == 0) {
            return 0;
        }
        doc.paragraph(paragraph.toString());
        doc.br();
        paragraph.setLength(0);
        return 1;
    }

    /**
     * Renders CSV input as a full-width table. The first non-blank record is the header; short
     * records are padded with empty cells.
     */
    public static void renderCsv(Document doc, List<String> lines) {
        List<List<String>> records = new ArrayList<>();
        for (String line : lines) {
            if (!line.isBlank()) {
                records.add(parseCsvLine(line));
            }
        }
        if (records.isEmpty()) {
            logger.warn("CSV input has no records; output will be blank");
            doc.currentPage();
            return;
        }

        List<String> header = records.get(0);
        List<List<String>> rows = records.subList(1, records.size());
        doc.simpleTable(header, rows);
        logger.debug("Laid out CSV table with {} column(s), {} row(s)", header.size(), rows.size());
    }

    /** Splits one CSV record; supports double-quoted fields with {@code ""} escapes. */
    static List<String> parseCsvLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"' && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    field.append('"');
                    i++;
                } else if (c == '"') {
                    quoted = false;
                } else {
                    field.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(field.toString().trim());
                field.setLength(0);
            } else {
                field.append(c);
            }
        }
        fields.add(field.toString().trim());
        return fields;
    }
}
