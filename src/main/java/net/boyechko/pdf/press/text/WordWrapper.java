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
package net.boyechko.pdf.press.text;

import java.util.ArrayList;
import java.util.List;
import java.util.function.ToDoubleFunction;

/** Greedy word wrap against an estimated text width. */
public final class WordWrapper {
    private WordWrapper() {}

    /**
     * Splits {@code text} on whitespace and packs words into lines no wider than {@code maxWidth}.
     * A single word wider than the limit gets a line of its own rather than being broken.
     */
    public static List<String> wrap(String text, double maxWidth, ToDoubleFunction<String> measure) {
        List<String> lines = new ArrayList<>();
        if (text == null || text.isBlank()) return lines;

        double spaceWidth = measure.applyAsDouble(" ");
        StringBuilder line = new StringBuilder();
        double lineWidth = 0;

        for (String word : text.trim().split("\\s+")) {
            double wordWidth = measure.applyAsDouble(word);
            double needed = line.length() > 0 ? lineWidth + spaceWidth + wordWidth : wordWidth;
            if (needed > maxWidth && line.length() > 0) {
                lines.add(line.toString());
                line.setLength(0);
                lineWidth = 0;
            }
            if (line.length() > 0) {
                line.append(' ');
                lineWidth += spaceWidth;
            }
            line.append(word);
            lineWidth += wordWidth;
        }

        if (line.length() > 0) {
            lines.add(line.toString());
        }
        return lines;
    }
}
