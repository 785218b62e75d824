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
package net.boyechko.pdf.press.document;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import net.boyechko.pdf.press.config.DocumentDefaults;
import net.boyechko.pdf.press.font.FontRegistry;
import net.boyechko.pdf.press.font.StandardFont;
import net.boyechko.pdf.press.font.TextMetrics;
import net.boyechko.pdf.press.graphics.Color;
import net.boyechko.pdf.press.graphics.ContentStream;
import net.boyechko.pdf.press.graphics.Point;
import net.boyechko.pdf.press.image.EmbeddedImage;
import net.boyechko.pdf.press.image.ImageDecodeException;
import net.boyechko.pdf.press.image.ImageEmbedder;
import net.boyechko.pdf.press.serialize.PdfSerializer;
import net.boyechko.pdf.press.table.Table;
import net.boyechko.pdf.press.text.PdfStrings;
import net.boyechko.pdf.press.text.TextAlign;
import net.boyechko.pdf.press.text.WordWrapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A PDF document under construction.
 *
 * <p>Every drawing call appends operators to the current page and returns this document, so calls
 * chain. Coordinates are in points measured from the top-left corner of the page, with y growing
 * downwards; they are converted to PDF space as each operator is written. Drawing before the first
 * {@link #addPage()} creates a page implicitly.
 *
 * <p>Nothing is numbered or laid out as PDF objects until {@link #write}, {@link #save} or {@link
 * #toBytes()} is called; each of those rebuilds the whole file. Instances are not thread-safe.
 */
public class Document {
    private static final Logger logger = LoggerFactory.getLogger(Document.class);

    private static final String BULLET = "•";
    private static final double TITLE_SIZE = 24;
    private static final double HEADING_SIZE = 16;
    private static final double SUBHEADING_SIZE = 14;

    private final List<Page> pages = new ArrayList<>();
    private final Map<String, EmbeddedImage> images = new LinkedHashMap<>();
    private final ImageEmbedder imageEmbedder;
    private final String defaultProducer;
    private Page currentPage;
    private Metadata metadata;

    private PageSize pageSize;
    private Orientation orientation;
    private Margins margins;

    // Cursor, top-down page coordinates
    private double x;
    private double y;

    private StandardFont font;
    private double fontSize;
    private double lineHeight;

    /** Creates a document with the built-in defaults: Letter, portrait, 1in margins, 12pt Helvetica. */
    public Document() {
        this(DocumentDefaults.builtIn());
    }

    public Document(DocumentDefaults defaults) {
        this.pageSize = defaults.pageSize();
        this.orientation = defaults.pageOrientation();
        this.margins = defaults.pageMargins();
        this.font = defaults.standardFont();
        this.fontSize = defaults.fontSize();
        this.lineHeight = defaults.lineHeight();
        this.defaultProducer = defaults.producerName();
        this.imageEmbedder = new ImageEmbedder(defaults.jpegQuality());
        this.metadata = Metadata.empty().withDefaults(defaultProducer);
    }

    /** Creates a document configured from the bundled {@code pdfpress-defaults.yaml}. */
    public static Document create() {
        return new Document(DocumentDefaults.loadDefault());
    }

    // ── Page setup ──────────────────────────────────────────────────

    /** Sets the size of pages added from now on. */
    public Document setPageSize(PageSize size) {
        this.pageSize = size;
        return this;
    }

    /** Sets the orientation of pages added from now on. */
    public Document setOrientation(Orientation orientation) {
        this.orientation = orientation;
        return this;
    }

    public Document setMargins(double top, double right, double bottom, double left) {
        return setMargins(new Margins(top, right, bottom, left));
    }

    public Document setMargins(Margins margins) {
        this.margins = margins;
        return this;
    }

    public Margins margins() {
        return margins;
    }

    /** Appends a page, makes it current and moves the cursor to the top-left of its content area. */
    public Document addPage() {
        Page page = new Page(pages.size() + 1, pageSize.oriented(orientation), orientation);
        pages.add(page);
        currentPage = page;
        x = margins.left();
        y = margins.top();
        logger.debug(
                "Added page {} ({} x {} pt)", page.number(), page.width(), page.height());
        return this;
    }

    /** Returns the current page number (1-based), or 0 before any page exists. */
    public int pageNumber() {
        return currentPage != null ? currentPage.number() : 0;
    }

    public int pageCount() {
        return pages.size();
    }

    public List<Page> pages() {
        return Collections.unmodifiableList(pages);
    }

    /** Returns the page that drawing calls target, creating the first page if needed. */
    public Page currentPage() {
        if (currentPage == null) {
            addPage();
        }
        return currentPage;
    }

    public double contentWidth() {
        double width = currentPage != null ? currentPage.width() : pageSize.oriented(orientation).width();
        return width - margins.left() - margins.right();
    }

    public double contentHeight() {
        double height =
                currentPage != null ? currentPage.height() : pageSize.oriented(orientation).height();
        return height - margins.top() - margins.bottom();
    }

    /** The y coordinate of the bottom margin on the current page. */
    public double contentBottom() {
        return currentPage().height() - margins.bottom();
    }

    // ── Cursor ──────────────────────────────────────────────────────

    /** Sets the cursor in absolute page coordinates. */
    public Document setPos(double x, double y) {
        this.x = x;
        this.y = y;
        return this;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    /** Moves the cursor relative to the top-left corner of the content area. */
    public Document moveTo(double x, double y) {
        currentPage();
        this.x = margins.left() + x;
        this.y = margins.top() + y;
        return this;
    }

    // ── Metadata ────────────────────────────────────────────────────

    public Metadata metadata() {
        return metadata;
    }

    /** Replaces the metadata; a blank producer and missing dates are filled in. */
    public Document setMetadata(Metadata metadata) {
        this.metadata = metadata.withDefaults(defaultProducer);
        return this;
    }

    public Document setTitle(String title) {
        metadata = metadata.withTitle(title);
        return this;
    }

    public Document setAuthor(String author) {
        metadata = metadata.withAuthor(author);
        return this;
    }

    public Document setSubject(String subject) {
        metadata = metadata.withSubject(subject);
        return this;
    }

    public Document setKeywords(String keywords) {
        metadata = metadata.withKeywords(keywords);
        return this;
    }

    public Document setCreator(String creator) {
        metadata = metadata.withCreator(creator);
        return this;
    }

    // ── Graphics state ──────────────────────────────────────────────

    public Document setLineWidth(double width) {
        content().setLineWidth(width);
        return this;
    }

    public Document setStrokeColor(Color color) {
        content().setStrokeColor(color);
        return this;
    }

    public Document setFillColor(Color color) {
        content().setFillColor(color);
        return this;
    }

    /** Sets a dash pattern of alternating on/off lengths. */
    public Document setDash(double[] pattern, double phase) {
        content().setDash(pattern, phase);
        return this;
    }

    /** Switches back to solid lines. */
    public Document clearDash() {
        content().clearDash();
        return this;
    }

    public Document saveState() {
        content().saveState();
        return this;
    }

    public Document restoreState() {
        content().restoreState();
        return this;
    }

    /** Translates by {@code (tx, ty)}; a positive {@code ty} moves content down the page. */
    public Document translate(double tx, double ty) {
        content().translate(tx, -ty);
        return this;
    }

    public Document scale(double sx, double sy) {
        content().scale(sx, sy);
        return this;
    }

    /** Rotates counter-clockwise about the PDF origin (the bottom-left corner of the page). */
    public Document rotate(double degrees) {
        content().rotate(degrees);
        return this;
    }

    // ── Shapes ──────────────────────────────────────────────────────

    public Document line(double x1, double y1, double x2, double y2) {
        Page page = currentPage();
        page.content().line(x1, page.toPdfY(y1), x2, page.toPdfY(y2));
        return this;
    }

    /** Draws a horizontal line across the content width at the cursor. */
    public Document hLine() {
        return hLineAt(y);
    }

    /** Draws a horizontal line across the content width at {@code y}. */
    public Document hLineAt(double y) {
        Page page = currentPage();
        return line(margins.left(), y, page.width() - margins.right(), y);
    }

    /** Strokes a rectangle whose top-left corner is {@code (x, y)}. */
    public Document rect(double x, double y, double width, double height) {
        return rect(x, y, width, height, "S");
    }

    public Document rectFilled(double x, double y, double width, double height) {
        return rect(x, y, width, height, "f");
    }

    public Document rectFilledStroke(double x, double y, double width, double height) {
        return rect(x, y, width, height, "B");
    }

    private Document rect(double x, double y, double width, double height, String paint) {
        Page page = currentPage();
        page.content().rect(x, page.toPdfY(y) - height, width, height, paint);
        return this;
    }

    public Document circle(double cx, double cy, double radius) {
        return ellipse(cx, cy, radius, radius);
    }

    public Document circleFilled(double cx, double cy, double radius) {
        return ellipseFilled(cx, cy, radius, radius);
    }

    public Document ellipse(double cx, double cy, double rx, double ry) {
        return ellipse(cx, cy, rx, ry, "S");
    }

    public Document ellipseFilled(double cx, double cy, double rx, double ry) {
        return ellipse(cx, cy, rx, ry, "f");
    }

    private Document ellipse(double cx, double cy, double rx, double ry, String paint) {
        Page page = currentPage();
        page.content().ellipse(cx, page.toPdfY(cy), rx, ry, paint);
        return this;
    }

    /** Strokes a closed polygon. Fewer than three points draws nothing. */
    public Document polygon(List<Point> points) {
        return polygon(points, "S");
    }

    public Document polygonFilled(List<Point> points) {
        return polygon(points, "f");
    }

    private Document polygon(List<Point> points, String paint) {
        if (points == null || points.size() < 3) {
            return this;
        }
        Page page = currentPage();
        double[] xs = new double[points.size()];
        double[] ys = new double[points.size()];
        for (int i = 0; i < points.size(); i++) {
            xs[i] = points.get(i).x();
            ys[i] = page.toPdfY(points.get(i).y());
        }
        page.content().polygon(xs, ys, paint);
        return this;
    }

    // ── Images ──────────────────────────────────────────────────────

    /**
     * Draws {@code image} scaled into the box whose top-left corner is {@code (x, y)}. The pixels
     * are re-encoded as JPEG, so transparency is lost.
     */
    public Document image(double x, double y, double width, double height, BufferedImage image) {
        Page page = currentPage();
        String name = "Im" + (images.size() + 1);
        EmbeddedImage embedded;
        try {
            embedded = imageEmbedder.embed(name, image);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode image " + name + " as JPEG", e);
        }
        images.put(name, embedded);
        page.useImage(name);
        page.content().drawImage(name, x, page.toPdfY(y) - height, width, height);
        return this;
    }

    public Document imageFromBytes(double x, double y, double width, double height, byte[] data)
            throws ImageDecodeException {
        BufferedImage decoded = imageEmbedder.decode(data);
        return image(x, y, width, height, decoded);
    }

    public Document imageFromStream(
            double x, double y, double width, double height, InputStream input)
            throws ImageDecodeException {
        BufferedImage decoded = imageEmbedder.decode(input);
        return image(x, y, width, height, decoded);
    }

    public Document imageFromFile(double x, double y, double width, double height, Path path)
            throws ImageDecodeException {
        BufferedImage decoded = imageEmbedder.decode(path);
        return image(x, y, width, height, decoded);
    }

    public Document imageFromBase64(double x, double y, double width, double height, String base64)
            throws ImageDecodeException {
        BufferedImage decoded = imageEmbedder.decodeBase64(base64);
        return image(x, y, width, height, decoded);
    }

    /** Images embedded so far, in resource-name order. */
    public Collection<EmbeddedImage> images() {
        return Collections.unmodifiableCollection(images.values());
    }

    // ── Fonts ───────────────────────────────────────────────────────

    /**
     * Selects a standard font by name and sets the size. An unknown name leaves both the font and
     * the size unchanged.
     */
    public Document setFont(String name, double size) {
        var resolved = FontRegistry.lookup(name);
        if (resolved.isEmpty()) {
            logger.warn("Unknown font '{}'; keeping {}", name, font.baseFont());
            return this;
        }
        return setFont(resolved.get(), size);
    }

    public Document setFont(StandardFont font, double size) {
        this.font = font;
        this.fontSize = size;
        return this;
    }

    /** Selects a standard font by name, keeping the size. Unknown names are ignored. */
    public Document font(String name) {
        return setFont(name, fontSize);
    }

    public Document size(double size) {
        this.fontSize = size;
        return this;
    }

    public Document setFontSize(double size) {
        return size(size);
    }

    /** Sets the line height as a multiple of the font size. */
    public Document setLineHeight(double multiplier) {
        this.lineHeight = multiplier;
        return this;
    }

    public Document bold() {
        font = FontRegistry.bold(font);
        return this;
    }

    public Document italic() {
        font = FontRegistry.italic(font);
        return this;
    }

    public Document regular() {
        font = FontRegistry.regular(font);
        return this;
    }

    public StandardFont currentFont() {
        return font;
    }

    public double fontSize() {
        return fontSize;
    }

    public double lineHeight() {
        return lineHeight;
    }

    /** Estimated width of {@code text} in the current font and size. */
    public double textWidth(String text) {
        return TextMetrics.width(font, fontSize, text);
    }

    // ── Text ────────────────────────────────────────────────────────

    /** Writes text with its baseline at the cursor; the cursor does not move. */
    public Document text(String text) {
        currentPage();
        emitText(text, x, y);
        return this;
    }

    /** Writes text with its baseline at {@code (x, y)}. */
    public Document textAt(double x, double y, String text) {
        currentPage();
        emitText(text, x, y);
        return this;
    }

    /** Writes text at the cursor and advances the cursor past it. */
    public Document writeText(String text) {
        currentPage();
        emitText(text, x, y);
        x += textWidth(text);
        return this;
    }

    public Document writef(String format, Object... args) {
        return writeText(String.format(Locale.ROOT, format, args));
    }

    public Document writeLine(String text) {
        return text(text).ln();
    }

    public Document writeLinef(String format, Object... args) {
        return writeLine(String.format(Locale.ROOT, format, args));
    }

    /** Moves to the start of the next line, adding a page when it would pass the bottom margin. */
    public Document ln() {
        currentPage();
        x = margins.left();
        advanceLine();
        return this;
    }

    /** Moves down one line without returning to the left margin. */
    public Document br() {
        currentPage();
        advanceLine();
        return this;
    }

    private void advanceLine() {
        y += fontSize * lineHeight;
        if (y > contentBottom()) {
            addPage();
        }
    }

    /** Writes centered text on the cursor's line. */
    public Document centerText(String text) {
        currentPage();
        double tx = margins.left() + (contentWidth() - textWidth(text)) / 2;
        emitText(text, tx, y);
        return this;
    }

    /** Writes text flush with the right margin on the cursor's line. */
    public Document rightText(String text) {
        Page page = currentPage();
        double tx = page.width() - margins.right() - textWidth(text);
        emitText(text, tx, y);
        return this;
    }

    /** Word-wraps {@code text} to the content width, one {@link #writeLine} per line. */
    public Document paragraph(String text) {
        currentPage();
        for (String line : WordWrapper.wrap(text, contentWidth(), this::textWidth)) {
            text(line).ln();
        }
        return this;
    }

    /** Large, bold, centered text followed by a blank line. */
    public Document title(String text) {
        return styled(TITLE_SIZE, () -> centerText(text).ln().ln());
    }

    public Document heading(String text) {
        return styled(HEADING_SIZE, () -> text(text).ln());
    }

    public Document subheading(String text) {
        return styled(SUBHEADING_SIZE, () -> text(text).ln());
    }

    private Document styled(double size, Runnable body) {
        StandardFont savedFont = font;
        double savedSize = fontSize;
        bold().size(size);
        body.run();
        font = savedFont;
        fontSize = savedSize;
        return this;
    }

    /** Writes one line per item, each preceded by a bullet. */
    public Document bulletList(List<String> items) {
        currentPage();
        double indent = fontSize * 1.5;
        for (String item : items) {
            double left = x;
            emitText(BULLET, left, y);
            emitText(item, left + indent, y);
            ln();
        }
        return this;
    }

    /** Writes one line per item, numbered from 1. */
    public Document numberedList(List<String> items) {
        currentPage();
        double indent = fontSize * 2;
        for (int i = 0; i < items.size(); i++) {
            double left = x;
            emitText((i + 1) + ".", left, y);
            emitText(items.get(i), left + indent, y);
            ln();
        }
        return this;
    }

    private void emitText(String text, double tx, double ty) {
        Page page = currentPage();
        page.useFont(font);
        page.content()
                .showText(font.resourceName(), fontSize, tx, page.toPdfY(ty), PdfStrings.escape(text));
    }

    private ContentStream content() {
        return currentPage().content();
    }

    // ── Tables ──────────────────────────────────────────────────────

    /** Starts a table at the cursor with explicit column widths in points. */
    public Table newTable(double... columnWidths) {
        currentPage();
        return new Table(this, columnWidths);
    }

    /** Starts a table whose columns split the content width evenly. */
    public Table newTableAuto(int columns) {
        double[] widths = new double[Math.max(columns, 0)];
        Arrays.fill(widths, columns > 0 ? contentWidth() / columns : 0);
        return newTable(widths);
    }

    /** Draws a full-width table with a header row. */
    public Document simpleTable(List<String> headers, List<List<String>> rows) {
        return newTableAuto(headers.size()).header(headers).rows(rows).draw();
    }

    /** Draws a two-column Field/Value table, in the map's iteration order. */
    public Document dataTable(Map<String, String> data) {
        double half = contentWidth() / 2;
        Table table = newTable(half, half).header("Field", "Value");
        data.forEach((key, value) -> table.row(key, value));
        return table.draw();
    }

    /** Draws a headerless two-column table with right-aligned keys. */
    public Document keyValueTable(Map<String, String> pairs) {
        double half = contentWidth() / 2;
        Table table =
                newTable(half, half)
                        .columnAlign(0, TextAlign.RIGHT)
                        .columnAlign(1, TextAlign.LEFT);
        pairs.forEach((key, value) -> table.row(key + ":", value));
        return table.draw();
    }

    // ── Output ──────────────────────────────────────────────────────

    /** Serializes the document to {@code out}. A document without pages gets one blank page. */
    public void write(OutputStream out) throws IOException {
        if (pages.isEmpty()) {
            addPage();
        }
        new PdfSerializer().write(this, out);
    }

    public void save(Path path) throws IOException {
        try (OutputStream out = Files.newOutputStream(path)) {
            write(out);
        }
        logger.info("Saved {} page(s) to {}", pages.size(), path);
    }

    public void save(String path) throws IOException {
        save(Path.of(path));
    }

    /** Serializes the document to a new byte array. */
    public byte[] toBytes() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            write(buffer);
        } catch (IOException e) {
            throw new UncheckedIOException("In-memory serialization failed", e);
        }
        return buffer.toByteArray();
    }
}
