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
package net.boyechko.pdf.press.image;

/**
 * An image ready to be written as an XObject: resource name, pixel size and baseline JPEG data.
 *
 * <p>The JPEG bytes are always three-channel RGB, whatever the source format was.
 */
public record EmbeddedImage(String name, int width, int height, byte[] jpegData) {
    public EmbeddedImage {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Image resource name is required");
        }
        if (jpegData == null) {
            throw new IllegalArgumentException("JPEG data is required");
        }
    }
}
