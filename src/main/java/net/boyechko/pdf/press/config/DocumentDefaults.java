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
package net.boyechko.pdf.press.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import net.boyechko.pdf.press.document.Margins;
import net.boyechko.pdf.press.document.Metadata;
import net.boyechko.pdf.press.document.Orientation;
import net.boyechko.pdf.press.document.PageSize;
import net.boyechko.pdf.press.font.FontRegistry;
import net.boyechko.pdf.press.font.StandardFont;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Initial settings for new documents, normally read from {@code /pdfpress-defaults.yaml}.
 *
 * <p>Field names mirror the YAML keys. Values that cannot be resolved (an unknown page size or
 * font) fall back to the built-in defaults and are reported by {@link #validate()}.
 */
public final class DocumentDefaults {
    private static final String DEFAULT_RESOURCE = "/pdfpress-defaults.yaml";
    private static final Logger logger = LoggerFactory.getLogger(DocumentDefaults.class);

    public String page_size = "Letter";
    public String orientation = "portrait";
    public MarginSettings margins = new MarginSettings();
    public String font = "Helvetica";
    public double font_size = 12;
    public double line_height = 1.2;
    public String producer = Metadata.DEFAULT_PRODUCER;
    public float jpeg_quality = 0.9f;

    /** Margins in points. */
    public static final class MarginSettings {
        public double top = 72;
        public double right = 72;
        public double bottom = 72;
        public double left = 72;
    }

    /** Settings defined in code only, without reading any resource. */
    public static DocumentDefaults builtIn() {
        return new DocumentDefaults();
    }

    /** Loads the defaults bundled with the library. */
    public static DocumentDefaults loadDefault() {
        return fromResource(DEFAULT_RESOURCE);
    }

    /**
     * Loads defaults from a classpath resource.
     *
     * @param resourcePath path starting with "/" for an absolute resource path
     */
    public static DocumentDefaults fromResource(String resourcePath) {
        try (var inputStream = DocumentDefaults.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }

            var yaml = new Yaml(new Constructor(DocumentDefaults.class, new LoaderOptions()));
            DocumentDefaults defaults = yaml.load(inputStream);
            if (defaults == null) {
                defaults = builtIn();
            }
            if (defaults.margins == null) {
                defaults.margins = new MarginSettings();
            }

            logger.debug(
                    "Loaded document defaults from {}: {} {}, {} {}pt",
                    resourcePath,
                    defaults.page_size,
                    defaults.orientation,
                    defaults.font,
                    defaults.font_size);

            var warnings = defaults.validate();
            if (!warnings.isEmpty()) {
                logger.warn(
                        "Defaults loaded from {} have {} problem(s):",
                        resourcePath,
                        warnings.size());
                for (String warning : warnings) {
                    logger.warn("  - {}", warning);
                }
            }
            return defaults;
        } catch (Exception e) {
            logger.error(
                    "Failed to load document defaults from {}: {}", resourcePath, e.getMessage());
            throw new IllegalStateException(
                    "Failed to load document defaults from " + resourcePath + ": " + e.getMessage(),
                    e);
        }
    }

    /** Returns descriptions of every setting that will be ignored or adjusted. */
    public List<String> validate() {
        List<String> warnings = new ArrayList<>();
        if (PageSize.named(page_size).isEmpty()) {
            warnings.add(String.format("Unknown page size '%s'; using Letter", page_size));
        }
        if (orientation != null
                && !orientation.equalsIgnoreCase("portrait")
                && !orientation.equalsIgnoreCase("landscape")) {
            warnings.add(String.format("Unknown orientation '%s'; using portrait", orientation));
        }
        if (!FontRegistry.isKnown(font)) {
            warnings.add(String.format("Unknown font '%s'; using Helvetica", font));
        }
        if (font_size <= 0) {
            warnings.add(String.format("Font size %.2f is not positive; using 12", font_size));
        }
        if (line_height <= 0) {
            warnings.add(String.format("Line height %.2f is not positive; using 1.2", line_height));
        }
        if (jpeg_quality < 0 || jpeg_quality > 1) {
            warnings.add(
                    String.format("JPEG quality %.2f is outside 0..1; clamping", jpeg_quality));
        }
        if (margins != null
                && (margins.top < 0 || margins.right < 0 || margins.bottom < 0 || margins.left < 0)) {
            warnings.add("Negative margins are treated as zero");
        }
        return warnings;
    }

    // ── Resolved values ─────────────────────────────────────────────

    public PageSize pageSize() {
        return PageSize.named(page_size).orElse(PageSize.LETTER);
    }

    public Orientation pageOrientation() {
        return orientation != null && orientation.trim().toLowerCase(Locale.ROOT).equals("landscape")
                ? Orientation.LANDSCAPE
                : Orientation.PORTRAIT;
    }

    public Margins pageMargins() {
        MarginSettings m = margins != null ? margins : new MarginSettings();
        return new Margins(
                Math.max(0, m.top), Math.max(0, m.right), Math.max(0, m.bottom), Math.max(0, m.left));
    }

    public StandardFont standardFont() {
        return FontRegistry.lookup(font).orElse(StandardFont.HELVETICA);
    }

    public double fontSize() {
        return font_size > 0 ? font_size : 12;
    }

    public double lineHeight() {
        return line_height > 0 ? line_height : 1.2;
    }

    public String producerName() {
        return producer == null || producer.isBlank() ? Metadata.DEFAULT_PRODUCER : producer;
    }

    public float jpegQuality() {
        return Math.max(0f, Math.min(1f, jpeg_quality));
    }
}
