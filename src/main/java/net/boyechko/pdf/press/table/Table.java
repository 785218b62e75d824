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
package net.boyechko.pdf.press.table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import net.boyechko.pdf.press.document.Document;
import net.boyechko.pdf.press.font.FontRegistry;
import net.boyechko.pdf.press.font.StandardFont;
import net.boyechko.pdf.press.font.TextMetrics;
import net.boyechko.pdf.press.graphics.Color;
import net.boyechko.pdf.press.text.TextAlign;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A grid of text cells laid out from the document's cursor downwards.
 *
 * <p>Rows are collected first and laid out by {@link #draw()}. A row that would cross the bottom
 * margin starts a new page, and the header row (if any) is repeated at the top of that page
 * before the row is drawn. Each row is wrapped in its own graphics state so table colors and line
 * widths do not leak into the rest of the page.
 */
public class Table {
    private static final Logger logger = LoggerFactory.getLogger(Table.class);

    /** Baseline offset below the top padding, as a fraction of the font size. */
    private static final double ASCENT_RATIO = 0.8;

    private final Document doc;
    private final double x;
    private final double y;
    private final List<TableColumn> columns = new ArrayList<>();
    private final List<List<String>> rows = new ArrayList<>();
    private List<String> headerRow = List.of();

    private double cellPadding = 4;
    private double borderWidth = 0.5;
    private Color borderColor = Color.BLACK;
    private Color headerBackground = Color.rgb(220, 220, 220);
    private Color headerForeground = Color.BLACK;
    private Color textColor = Color.BLACK;
    private Color alternateRowBackground;
    private StandardFont font;
    private double fontSize;

    /** Creates a table at the document's cursor using its current font. */
    public Table(Document doc, double... columnWidths) {
        this.doc = doc;
        this.x = doc.getX();
        this.y = doc.getY();
        this.font = doc.currentFont();
        this.fontSize = doc.fontSize();
        for (double width : columnWidths) {
            columns.add(new TableColumn(width, TextAlign.LEFT));
        }
    }

    // ── Configuration ───────────────────────────────────────────────

    public Table cellPadding(double padding) {
        this.cellPadding = padding;
        return this;
    }

    public Table border(double width, Color color) {
        this.borderWidth = width;
        this.borderColor = color;
        return this;
    }

    public Table headerStyle(Color background, Color foreground) {
        this.headerBackground = background;
        this.headerForeground = foreground;
        return this;
    }

    /** Tints every second data row (the 2nd, 4th, ...). */
    public Table alternateRowColor(Color color) {
        this.alternateRowBackground = color;
        return this;
    }

    public Table textColor(Color color) {
        this.textColor = color;
        return this;
    }

    /** Sets the table font; an unknown name keeps the current one. */
    public Table font(String name, double size) {
        var resolved = FontRegistry.lookup(name);
        if (resolved.isEmpty()) {
            logger.warn("Unknown table font '{}'; keeping {}", name, font.baseFont());
            return this;
        }
        this.font = resolved.get();
        this.fontSize = size;
        return this;
    }

    /** Sets the alignment of one column; an out-of-range index is ignored. */
    public Table columnAlign(int column, TextAlign align) {
        if (column >= 0 && column < columns.size()) {
            columns.set(column, columns.get(column).withAlign(align));
        }
        return this;
    }

    public Table header(String... cells) {
        return header(Arrays.asList(cells));
    }

    public Table header(List<String> cells) {
        this.headerRow = List.copyOf(cells);
        return this;
    }

    public Table row(String... cells) {
        return row(Arrays.asList(cells));
    }

    public Table row(List<String> cells) {
        rows.add(new ArrayList<>(cells));
        return this;
    }

    public Table rows(List<List<String>> newRows) {
        for (List<String> row : newRows) {
            row(row);
        }
        return this;
    }

    // ── Accessors ───────────────────────────────────────────────────

    public List<TableColumn> columns() {
        return Collections.unmodifiableList(columns);
    }

    public double width() {
        return columns.stream().mapToDouble(TableColumn::width).sum();
    }

    public double rowHeight() {
        return fontSize + cellPadding * 2;
    }

    // ── Layout ──────────────────────────────────────────────────────

    /** Lays out the header and all rows, then leaves the cursor just below the table. */
    public Document draw() {
        StandardFont savedFont = doc.currentFont();
        double savedSize = doc.fontSize();
        doc.currentPage();

        double rowTop = y;
        boolean hasHeader = !headerRow.isEmpty();
        int pagesBefore = doc.pageCount();

        if (hasHeader) {
            rowTop = breakPageIfNeeded(rowTop, false);
            rowTop = drawRow(rowTop, headerRow, true, false);
        }

        for (int i = 0; i < rows.size(); i++) {
            double before = rowTop;
            rowTop = breakPageIfNeeded(rowTop, hasHeader);
            if (rowTop != before && hasHeader) {
                rowTop = drawRow(rowTop, headerRow, true, false);
            }
            boolean alternate = i % 2 == 1 && alternateRowBackground != null;
            rowTop = drawRow(rowTop, rows.get(i), false, alternate);
        }

        doc.setPos(x, rowTop);
        doc.setFont(savedFont, savedSize);

        logger.debug(
                "Drew table with {} column(s) and {} row(s) across {} page break(s)",
                columns.size(),
                rows.size(),
                doc.pageCount() - pagesBefore);
        return doc;
    }

    /**
     * Starts a new page when a row at {@code rowTop} would cross the bottom margin. A page that
     * has no table rows on it yet is never broken again, so oversize rows cannot loop.
     */
    private double breakPageIfNeeded(double rowTop, boolean willRepeatHeader) {
        double needed = rowHeight();
        if (rowTop + needed <= doc.contentBottom()) {
            return rowTop;
        }
        if (rowTop <= doc.margins().top()) {
            return rowTop;
        }
        doc.addPage();
        logger.debug(
                "Table continues on page {}{}",
                doc.pageNumber(),
                willRepeatHeader ? " with repeated header" : "");
        return doc.getY();
    }

    private double drawRow(double rowTop, List<String> cells, boolean isHeader, boolean alternate) {
        double height = rowHeight();
        StandardFont cellFont = isHeader ? FontRegistry.bold(font) : font;

        doc.saveState();
        if (isHeader) {
            doc.setFillColor(headerBackground).rectFilled(x, rowTop, width(), height);
        } else if (alternate) {
            doc.setFillColor(alternateRowBackground).rectFilled(x, rowTop, width(), height);
        }

        doc.setStrokeColor(borderColor).setLineWidth(borderWidth);
        doc.setFillColor(isHeader ? headerForeground : textColor);
        doc.setFont(cellFont, fontSize);

        double cellX = x;
        double baseline = rowTop + cellPadding + fontSize * ASCENT_RATIO;
        for (int i = 0; i < columns.size(); i++) {
            TableColumn column = columns.get(i);
            doc.rect(cellX, rowTop, column.width(), height);

            String text = i < cells.size() && cells.get(i) != null ? cells.get(i) : "";
            if (!text.isEmpty()) {
                doc.textAt(textX(cellX, column, cellFont, text), baseline, text);
            }
            cellX += column.width();
        }
        doc.restoreState();

        return rowTop + height;
    }

    private double textX(double cellX, TableColumn column, StandardFont cellFont, String text) {
        double textWidth = TextMetrics.width(cellFont, fontSize, text);
        return switch (column.align()) {
            case CENTER -> cellX + (column.width() - textWidth) / 2;
            case RIGHT -> cellX + column.width() - cellPadding - textWidth;
            case LEFT, JUSTIFY -> cellX + cellPadding;
        };
    }
}
