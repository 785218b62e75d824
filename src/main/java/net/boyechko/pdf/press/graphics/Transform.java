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

/** Coefficients for the {@code cm} operator. */
public final class Transform {
    private Transform() {}

    /**
     * Returns the rotation matrix {@code [cos sin -sin cos]} for a counter-clockwise angle in
     * degrees, each coefficient rounded to three decimals.
     */
    public static double[] rotation(double degrees) {
        double rad = Math.toRadians(degrees);
        double cos = round3(Math.cos(rad));
        double sin = round3(Math.sin(rad));
        return new double[] {cos, sin, positiveZero(-sin), cos};
    }

    /** Rounds to three decimals, mapping negative zero to zero. */
    public static double round3(double value) {
        return positiveZero(Math.round(value * 1000.0) / 1000.0);
    }

    private static double positiveZero(double value) {
        return value == 0.0 ? 0.0 : value;
    }
}
