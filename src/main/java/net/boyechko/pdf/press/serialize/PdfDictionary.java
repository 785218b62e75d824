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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An ordered PDF dictionary whose values are already serialized tokens ({@code "/Font"}, {@code
 * "12 0 R"}, {@code "[0 0 612.00 792.00]"}). Keys are written in insertion order.
 */
public final class PdfDictionary {
    private final Map<String, String> entries = new LinkedHashMap<>();

    /** Sets {@code /key value}, replacing any previous value but keeping its position. */
    public PdfDictionary put(String key, String value) {
        entries.put(key, value);
        return this;
    }

    public PdfDictionary put(String key, int value) {
        return put(key, Integer.toString(value));
    }

    /** Sets {@code /key /name}. */
    public PdfDictionary putName(String key, String name) {
        return put(key, "/" + name);
    }

    public PdfDictionary putReference(String key, PdfObject target) {
        return put(key, target.reference());
    }

    public String get(String key) {
        return entries.get(key);
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("<<");
        for (Map.Entry<String, String> entry : entries.entrySet()) {
            sb.append(" /").append(entry.getKey()).append(' ').append(entry.getValue());
        }
        return sb.append(" >>").toString();
    }
}
