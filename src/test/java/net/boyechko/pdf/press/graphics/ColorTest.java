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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ColorTest {

    @Test
    void pureRedHasUnitChannelOperands() {
        assertEquals("1.000 0.000 0.000", Color.rgb(255, 0, 0).toOperands());
    }

    @Test
    void midGrayRoundsToThreeDecimals() {
        assertEquals("0.502 0.502 0.502", Color.rgb(128, 128, 128).toOperands());
    }

    @Test
    void hexAcceptsOptionalHashAndLowerCase() {
        assertEquals(Color.rgb(255, 85, 0), Color.hex("#FF5500"));
        assertEquals(Color.rgb(255, 85, 0), Color.hex("ff5500"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "#FFF", "#GG0000", "12345678"})
    void malformedHexFallsBackToBlack(String hex) {
        assertEquals(Color.BLACK, Color.hex(hex));
    }

    @Test
    void nullHexFallsBackToBlack() {
        assertEquals(Color.BLACK, Color.hex(null));
    }
}
