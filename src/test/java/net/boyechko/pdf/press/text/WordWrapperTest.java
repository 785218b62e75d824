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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.function.ToDoubleFunction;
import org.junit.jupiter.api.Test;

class WordWrapperTest {
    // One unit per character, spaces included
    private static final ToDoubleFunction<String> LENGTH = String::length;

    @Test
    void packsWordsGreedily() {
        assertEquals(List.of("aaa bbb", "ccc"), WordWrapper.wrap("aaa bbb ccc", 7, LENGTH));
    }

    @Test
    void joiningSpaceCountsTowardsWidth() {
        assertEquals(List.of("ab cd"), WordWrapper.wrap("ab cd", 5, LENGTH));
        assertEquals(List.of("ab", "cd"), WordWrapper.wrap("ab cd", 4, LENGTH));
    }

    @Test
    void oversizeWordGetsItsOwnLine() {
        assertEquals(
                List.of("a", "verylongword", "b"),
                WordWrapper.wrap("a verylongword b", 5, LENGTH));
    }

    @Test
    void runsOfWhitespaceCollapse() {
        assertEquals(List.of("one two"), WordWrapper.wrap("  one \n\t two  ", 20, LENGTH));
    }

    @Test
    void blankInputHasNoLines() {
        assertTrue(WordWrapper.wrap("   ", 10, LENGTH).isEmpty());
        assertTrue(WordWrapper.wrap(null, 10, LENGTH).isEmpty());
    }
}
