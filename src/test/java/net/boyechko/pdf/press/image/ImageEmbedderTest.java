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

import static org.junit.jupiter.api.Assertions.*;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ImageEmbedderTest {
    @TempDir Path tempDir;

    private final ImageEmbedder embedder = new ImageEmbedder();

    static byte[] pngBytes(int width, int height) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                image.setRGB(x, y, (x + y) % 2 == 0 ? Color.RED.getRGB() : 0x00000000);
            }
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }

    // ── Decoding ────────────────────────────────────────────────────

    @Test
    void decodesPngBytes() throws Exception {
        BufferedImage image = embedder.decode(pngBytes(5, 3));
        assertEquals(5, image.getWidth());
        assertEquals(3, image.getHeight());
    }

    @Test
    void malformedBytesAreRejected() {
        ImageDecodeException e =
                assertThrows(
                        ImageDecodeException.class,
                        () -> embedder.decode(new byte[] {1, 2, 3, 4, 5}));
        assertTrue(e.getMessage().contains("Unrecognized"));
    }

    @Test
    void emptyInputIsRejected() {
        assertThrows(ImageDecodeException.class, () -> embedder.decode(new byte[0]));
        assertThrows(ImageDecodeException.class, () -> embedder.decode((byte[]) null));
        assertThrows(ImageDecodeException.class, () -> embedder.decodeBase64("  "));
    }

    @Test
    void decodesStream() throws Exception {
        BufferedImage image = embedder.decode(new ByteArrayInputStream(pngBytes(2, 2)));
        assertEquals(2, image.getWidth());
    }

    @Test
    void decodesFileAndNamesMissingFiles() throws Exception {
        Path png = tempDir.resolve("dot.png");
        Files.write(png, pngBytes(1, 1));
        assertEquals(1, embedder.decode(png).getWidth());

        Path missing = tempDir.resolve("missing.png");
        ImageDecodeException e =
                assertThrows(ImageDecodeException.class, () -> embedder.decode(missing));
        assertTrue(e.getMessage().contains("missing.png"));
    }

    @Test
    void decodesBase64WithAndWithoutDataUri() throws Exception {
        String encoded = Base64.getEncoder().encodeToString(pngBytes(3, 2));
        assertEquals(3, embedder.decodeBase64(encoded).getWidth());
        assertEquals(
                3, embedder.decodeBase64("data:image/png;base64," + encoded).getWidth());

        String wrapped = encoded.substring(0, 10) + "\n  " + encoded.substring(10);
        assertEquals(2, embedder.decodeBase64(wrapped).getHeight());
    }

    @Test
    void invalidBase64IsRejected() {
        assertThrows(ImageDecodeException.class, () -> embedder.decodeBase64("not*base64!"));
        assertThrows(ImageDecodeException.class, () -> embedder.decodeBase64("data:image/png"));
    }

    // ── Encoding ────────────────────────────────────────────────────

    @Test
    void embedsAsBaselineJpeg() throws Exception {
        EmbeddedImage embedded = embedder.embed("Im1", embedder.decode(pngBytes(8, 6)));

        assertEquals("Im1", embedded.name());
        assertEquals(8, embedded.width());
        assertEquals(6, embedded.height());
        byte[] jpeg = embedded.jpegData();
        assertEquals((byte) 0xFF, jpeg[0]);
        assertEquals((byte) 0xD8, jpeg[1]);

        BufferedImage roundTrip = ImageIO.read(new ByteArrayInputStream(jpeg));
        assertEquals(3, roundTrip.getColorModel().getNumComponents());
    }

    @Test
    void transparencyIsFlattenedOntoWhite() {
        BufferedImage clear = new BufferedImage(2, 2, BufferedImage.TYPE_INT_ARGB);
        BufferedImage flat = ImageEmbedder.toOpaqueRgb(clear);
        assertEquals(BufferedImage.TYPE_INT_RGB, flat.getType());
        assertEquals(0xFFFFFF, flat.getRGB(0, 0) & 0xFFFFFF);
    }

    @Test
    void qualityIsClamped() {
        assertEquals(1f, new ImageEmbedder(3f).quality());
        assertEquals(0f, new ImageEmbedder(-1f).quality());
        assertEquals(ImageEmbedder.DEFAULT_QUALITY, embedder.quality());
    }

    @Test
    void failureMessageFallsBackToExceptionType() {
        assertEquals("IOException", ImageEmbedder.describe(new IOException()));
        assertEquals("EOFException", ImageEmbedder.describe(new EOFException("")));
        assertEquals("truncated header", ImageEmbedder.describe(new IOException("truncated header")));
    }
}
