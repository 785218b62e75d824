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
package net.boyechko.pdf.press.graphics;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Growable buffer of content-stream operators for one page.
 *
 * <p>All coordinates given to this class are already in PDF space (origin at the bottom-left of
 * the page). Every operator is terminated by a newline. Text operands must be escaped with {@link
 * net.boyechko.pdf.press.text.PdfStrings} before they get here, which keeps the buffer pure ASCII.
 */
public class ContentStream {
    /** Control-point ratio for approximating a quarter ellipse with one cubic Bezier segment. */
    public static final double BEZIER_KAPPA = 0.5522848;

    private final StringBuilder ops = new StringBuilder();

    // ── Graphics state ──────────────────────────────────────────────

    public ContentStream setLineWidth(double width) {
        return op(fmt("%.2f w", width));
    }

    public ContentStream setStrokeColor(Color color) {
        return op(color.toOperands() + " RG");
    }

    public ContentStream setFillColor(Color color) {
        return op(color.toOperands() + " rg");
    }

    public ContentStream setDash(double[] pattern, double phase) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < pattern.length; i++) {
            if (i > 0) sb.append(' ');
            sb.append(fmt("%.2f", pattern[i]));
        }
        sb.append(fmt("] %.2f d", phase));
        return op(sb.toString());
    }

    public ContentStream clearDash() {
        return op("[] 0 d");
    }

    public ContentStream saveState() {
        return op("q");
    }

    public ContentStream restoreState() {
        return op("Q");
    }

    public ContentStream translate(double tx, double ty) {
        return op(fmt("1 0 0 1 %.2f %.2f cm", tx, ty));
    }

    public ContentStream scale(double sx, double sy) {
        return op(fmt("%.2f 0 0 %.2f 0 0 cm", sx, sy));
    }

    public ContentStream rotate(double degrees) {
        double[] m = Transform.rotation(degrees);
        return op(fmt("%.3f %.3f %.3f %.3f 0 0 cm", m[0], m[1], m[2], m[3]));
    }

    // ── Paths ───────────────────────────────────────────────────────

    public ContentStream line(double x1, double y1, double x2, double y2) {
        return op(fmt("%.2f %.2f m %.2f %.2f l S", x1, y1, x2, y2));
    }

    /**
     * Appends a rectangle whose lower-left corner is {@code (x, y)} and paints it with {@code
     * paint} ({@code S}, {@code f} or {@code B}).
     */
    public ContentStream rect(double x, double y, double width, double height, String paint) {
        return op(fmt("%.2f %.2f %.2f %.2f re ", x, y, width, height) + paint);
    }

    /** Appends an ellipse centered on {@code (cx, cy)} as four Bezier segments, then paints it. */
    public ContentStream ellipse(double cx, double cy, double rx, double ry, String paint) {
        double k = BEZIER_KAPPA;
        op(fmt("%.2f %.2f m", cx + rx, cy));
        curveTo(cx + rx, cy + ry * k, cx + rx * k, cy + ry, cx, cy + ry);
        curveTo(cx - rx * k, cy + ry, cx - rx, cy + ry * k, cx - rx, cy);
        curveTo(cx - rx, cy - ry * k, cx - rx * k, cy - ry, cx, cy - ry);
        curveTo(cx + rx * k, cy - ry, cx + rx, cy - ry * k, cx + rx, cy);
        return op(paint);
    }

    /** Appends a closed polygon through {@code xs[i], ys[i]}, then paints it. */
    public ContentStream polygon(double[] xs, double[] ys, String paint) {
        op(fmt("%.2f %.2f m", xs[0], ys[0]));
        for (int i = 1; i < xs.length; i++) {
            op(fmt("%.2f %.2f l", xs[i], ys[i]));
        }
        return op("h " + paint);
    }

    private void curveTo(double x1, double y1, double x2, double y2, double x3, double y3) {
        op(fmt("%.2f %.2f %.2f %.2f %.2f %.2f c", x1, y1, x2, y2, x3, y3));
    }

    // ── Text and XObjects ───────────────────────────────────────────

    /** Shows an already escaped string with its baseline starting at {@code (x, y)}. */
    public ContentStream showText(
            String fontResource, double size, double x, double y, String escaped) {
        return op(
                fmt("BT /%s %.2f Tf %.2f %.2f Td (", fontResource, size, x, y)
                        + escaped
                        + ") Tj ET");
    }

    /** Paints an image XObject scaled into the given box, isolated in its own graphics state. */
    public ContentStream drawImage(
            String imageResource, double x, double y, double width, double height) {
        saveState();
        op(fmt("%.2f 0 0 %.2f %.2f %.2f cm", width, height, x, y));
        op("/" + imageResource + " Do");
        return restoreState();
    }

    // ── Buffer access ───────────────────────────────────────────────

    public int length() {
        return ops.length();
    }

    public byte[] toByteArray() {
        return ops.toString().getBytes(StandardCharsets.ISO_8859_1);
    }

    @Override
    public String toString() {
        return ops.toString();
    }

    private ContentStream op(String operator) {
        ops.append(operator).append('\n');
        return this;
    }

    private static String fmt(String format, Object... args) {
        return String.format(Locale.ROOT, format, args);
    }
}
