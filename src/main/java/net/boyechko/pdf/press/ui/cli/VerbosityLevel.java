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
package net.boyechko.pdf.press.ui.cli;

import ch.qos.logback.classic.Level;

/**
 * Output verbosity of the command line tool, from least to most verbose.
 *
 * <ul>
 *   <li>QUIET - Only errors
 *   <li>NORMAL - Warnings and errors (default)
 *   <li>VERBOSE - Progress information
 *   <li>DEBUG - Everything, including layout and serialization details
 * </ul>
 */
public enum VerbosityLevel {
    QUIET(Level.ERROR),
    NORMAL(Level.WARN),
    VERBOSE(Level.INFO),
    DEBUG(Level.DEBUG);

    private final Level logLevel;

    VerbosityLevel(Level logLevel) {
        this.logLevel = logLevel;
    }

    /** The Logback level this verbosity maps to. */
    public Level logLevel() {
        return logLevel;
    }

    public boolean isAtLeast(VerbosityLevel other) {
        return ordinal() >= other.ordinal();
    }
}
