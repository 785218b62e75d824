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

/** Page margins in points. */
public record Margins(double top, double right, double bottom, double left) {
    /** One inch on every side. */
    public static final Margins DEFAULT = uniform(Units.PT_PER_INCH);

    public static Margins uniform(double margin) {
        return new Margins(margin, margin, margin, margin);
    }
}
