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
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import net.boyechko.pdf.press.document.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a {@link Document} as a complete PDF 1.4 file: header, body objects, cross-reference
 * table and trailer.
 *
 * <p>The file is assembled in memory so byte offsets can be recorded as objects are written, then
 * copied to the target stream in one write.
 */
public class PdfSerializer {
    private static final Logger logger = LoggerFactory.getLogger(PdfSerializer.class);

    static final byte[] HEADER = {
        '%', 'P', 'D', 'F', '-', '1', '.', '4', '\n',
        '%', (byte) 0xE2, (byte) 0xE3, (byte) 0xCF, (byte) 0xD3, '\n'
    };

    public void write(Document doc, OutputStream out) throws IOException {
        out.write(serialize(doc));
        out.flush();
    }

    public byte[] serialize(Document doc) {
        ObjectGraphBuilder.ObjectGraph graph = new ObjectGraphBuilder().build(doc);
        CrossReferenceTable xref = new CrossReferenceTable(graph.size());

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        buffer.write(HEADER, 0, HEADER.length);
        for (PdfObject object : graph.objects()) {
            xref.record(object.number(), buffer.size());
            byte[] bytes = object.toBytes();
            buffer.write(bytes, 0, bytes.length);
        }

        int startXref = buffer.size();
        StringBuilder tail = new StringBuilder(xref.toSection());
        tail.append("trailer\n");
        tail.append("<< /Size ")
                .append(xref.size())
                .append(" /Root ")
                .append(graph.catalog().reference())
                .append(" /Info ")
                .append(graph.info().reference())
                .append(" >>\n");
        tail.append("startxref\n").append(startXref).append('\n');
        tail.append("%%EOF\n");
        byte[] tailBytes = tail.toString().getBytes(StandardCharsets.US_ASCII);
        buffer.write(tailBytes, 0, tailBytes.length);

        logger.debug(
                "Serialized {} page(s) as {} objects, {} bytes",
                doc.pageCount(),
                graph.size(),
                buffer.size());
        return buffer.toByteArray();
    }
}
