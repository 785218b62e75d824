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

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Iterator;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes image input and re-encodes it as JPEG for embedding.
 *
 * <p>Every source, PNG included, is flattened onto a white background and written as an RGB JPEG
 * at the configured quality. Transparency and lossless pixel data are therefore not preserved.
 */
public class ImageEmbedder {
    private static final Logger logger = LoggerFactory.getLogger(ImageEmbedder.class);

    public static final float DEFAULT_QUALITY = 0.9f;

    private final float quality;

    public ImageEmbedder() {
        this(DEFAULT_QUALITY);
    }

    /** @param quality JPEG quality from 0.0 to 1.0; out-of-range values are clamped */
    public ImageEmbedder(float quality) {
        this.quality = Math.max(0f, Math.min(1f, quality));
    }

    public float quality() {
        return quality;
    }

    // ── Decoding ────────────────────────────────────────────────────

    /** Decodes an encoded image (JPEG, PNG, or anything else ImageIO reads). */
    public BufferedImage decode(byte[] data) throws ImageDecodeException {
        if (data == null || data.length == 0) {
            throw new ImageDecodeException("Image data is empty");
        }
        try (ByteArrayInputStream input = new ByteArrayInputStream(data)) {
            return decode(input);
        } catch (ImageDecodeException e) {
            throw e;
        } catch (IOException e) {
            throw new ImageDecodeException("Failed to read image data: " + describe(e), e);
        }
    }

    /** Decodes an image from a stream; the stream is read but not closed. */
    public BufferedImage decode(InputStream input) throws ImageDecodeException {
        if (input == null) {
            throw new ImageDecodeException("Image stream is null");
        }
        BufferedImage image;
        try {
            image = ImageIO.read(input);
        } catch (IOException e) {
            logger.error("Failed to decode image", e);
            throw new ImageDecodeException("Failed to decode image: " + describe(e), e);
        }
        if (image == null) {
            logger.error("Image data is not in a recognized format");
            throw new ImageDecodeException("Unrecognized image format");
        }
        logger.debug("Decoded {}x{} image", image.getWidth(), image.getHeight());
        return image;
    }

    /** Decodes an image file. */
    public BufferedImage decode(Path path) throws ImageDecodeException {
        try (InputStream input = Files.newInputStream(path)) {
            return decode(input);
        } catch (ImageDecodeException e) {
            throw new ImageDecodeException(path + ": " + describe(e), e);
        } catch (IOException e) {
            logger.error("Failed to open image file {}", path, e);
            throw new ImageDecodeException("Cannot read image file " + path, e);
        }
    }

    /**
     * Decodes base64 text, optionally prefixed as a data URI ({@code data:image/png;base64,...}).
     * Whitespace inside the payload is ignored.
     */
    public BufferedImage decodeBase64(String base64) throws ImageDecodeException {
        if (base64 == null || base64.isBlank()) {
            throw new ImageDecodeException("Base64 image data is empty");
        }
        String payload = base64.trim();
        if (payload.startsWith("data:")) {
            int comma = payload.indexOf(',');
            if (comma < 0) {
                throw new ImageDecodeException("Malformed data URI");
            }
            payload = payload.substring(comma + 1);
        }
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(payload.replaceAll("\\s+", ""));
        } catch (IllegalArgumentException e) {
            throw new ImageDecodeException("Invalid base64 image data: " + describe(e), e);
        }
        return decode(bytes);
    }

    // ── Encoding ────────────────────────────────────────────────────

    /** Flattens and re-encodes {@code image} under the given XObject resource name. */
    public EmbeddedImage embed(String name, BufferedImage image) throws IOException {
        byte[] jpeg = toJpeg(image);
        logger.debug(
                "Embedded image {} ({}x{}, {} JPEG bytes)",
                name,
                image.getWidth(),
                image.getHeight(),
                jpeg.length);
        return new EmbeddedImage(name, image.getWidth(), image.getHeight(), jpeg);
    }

    /** Encodes {@code image} as an RGB JPEG at this embedder's quality. */
    public byte[] toJpeg(BufferedImage image) throws IOException {
        if (image == null) {
            throw new IllegalArgumentException("image must not be null");
        }
        BufferedImage rgb = toOpaqueRgb(image);
        ImageWriter writer = jpegWriter();
        try (ByteArrayOutputStream buffer = new ByteArrayOutputStream();
                ImageOutputStream ios = ImageIO.createImageOutputStream(buffer)) {
            writer.setOutput(ios);
            ImageWriteParam param = writer.getDefaultWriteParam();
            if (param.canWriteCompressed()) {
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                param.setCompressionQuality(quality);
            }
            writer.write(null, new IIOImage(rgb, null, null), param);
            ios.flush();
            return buffer.toByteArray();
        } finally {
            writer.dispose();
        }
    }

    /** Paints the image onto a white RGB canvas; alpha is composited away. */
    static BufferedImage toOpaqueRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgb =
                new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(java.awt.Color.WHITE);
            g.fillRect(0, 0, image.getWidth(), image.getHeight());
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    private static ImageWriter jpegWriter() throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("No JPEG ImageWriter available");
        }
        return writers.next();
    }

    /** The exception's message, or its simple class name when it carries none. */
    static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
