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

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;
import net.boyechko.pdf.press.font.StandardFont;
import net.boyechko.pdf.press.graphics.ContentStream;

/**
 * One page of a {@link Document}: its size, its content buffer, and the font and image resources
 * its content refers to.
 */
public final class Page {
    private final int number;
    private final PageSize size;
    private final Orientation orientation;
    private final ContentStream content = new ContentStream();
    private final Set<StandardFont> fonts = EnumSet.noneOf(StandardFont.class);
    private final Set<String> images = new LinkedHashSet<>();

    Page(int number, PageSize size, Orientation orientation) {
        this.number = number;
        this.size = size;
        this.orientation = orientation;
    }

    /** 1-based position in the document. */
    public int number() {
        return number;
    }

    /** Size with the orientation already applied. */
    public PageSize size() {
        return size;
    }

    public double width() {
        return size.width();
    }

    public double height() {
        return size.height();
    }

    public Orientation orientation() {
        return orientation;
    }

    public ContentStream content() {
        return content;
    }

    /** Fonts used on this page, in {@link StandardFont} order. */
    public Set<StandardFont> fonts() {
        return Collections.unmodifiableSet(fonts);
    }

    /** Image XObject names drawn on this page, in first-use order. */
    public Set<String> images() {
        return Collections.unmodifiableSet(images);
    }

    /** Converts a top-down y coordinate to PDF space. */
    double toPdfY(double y) {
        return size.height() - y;
    }

    void useFont(StandardFont font) {
        fonts.add(font);
    }

    void useImage(String name) {
        images.add(name);
    }
}
