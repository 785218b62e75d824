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

import ch.qos.logback.classic.LoggerContext;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import net.boyechko.pdf.press.config.DocumentDefaults;
import net.boyechko.pdf.press.document.Document;
import net.boyechko.pdf.press.document.Orientation;
import net.boyechko.pdf.press.document.PageSize;
import net.boyechko.pdf.press.font.FontRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PdfPressCLI {
    private static final String PDF_SUFFIX = ".pdf";

    private static Logger logger;

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            Path inputPath,
            Path outputPath,
            VerbosityLevel verbosity,
            PageSize pageSize,
            boolean landscape,
            String fontName,
            Double fontSize,
            String title,
            boolean csv) {
        public CLIConfig {
            if (inputPath == null) {
                throw new IllegalArgumentException("Input path is required");
            }
            if (outputPath == null) {
                throw new IllegalArgumentException("Output path is required");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
        }
    }

    // Custom exception for CLI errors
    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }

        public CLIException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /** Mutable builder that accumulates parsed CLI arguments and resolves the output path. */
    static class CLIConfigBuilder {
        Path inputPath;
        Path outputPath;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;
        PageSize pageSize;
        boolean landscape;
        String fontName;
        Double fontSize;
        String title;
        boolean csv;

        CLIConfig build() throws CLIException {
            if (inputPath == null) {
                throw new CLIException("No input file specified");
            }
            if (!Files.exists(inputPath)) {
                throw new CLIException("File not found: " + inputPath);
            }

            String baseName = inputPath.getFileName().toString().replaceFirst("[.][^.]+$", "");
            if (outputPath == null) {
                Path parent = inputPath.getParent();
                String outputFilename = baseName + PDF_SUFFIX;
                outputPath =
                        parent != null ? parent.resolve(outputFilename) : Paths.get(outputFilename);
            } else if (Files.isDirectory(outputPath)) {
                outputPath = outputPath.resolve(baseName + PDF_SUFFIX);
            }

            return new CLIConfig(
                    inputPath,
                    outputPath,
                    verbosity,
                    pageSize,
                    landscape,
                    fontName,
                    fontSize,
                    title,
                    csv);
        }
    }

    public static void main(String[] args) {
        try {
            if (isHelpRequested(args)) {
                System.out.println(usageMessage());
                return;
            }
            CLIConfig config = parseArguments(args);
            configureLogging(config.verbosity());
            logger().info("Rendering {} to {}", config.inputPath(), config.outputPath());
            render(config);
            if (config.verbosity() != VerbosityLevel.QUIET) {
                System.out.println("✓ Output saved to " + config.outputPath());
            }
        } catch (CLIException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    static CLIConfig parseArguments(String[] args) throws CLIException {
        if (args.length == 0) {
            throw new CLIException("No input file specified\n" + usageMessage());
        }

        CLIConfigBuilder b = new CLIConfigBuilder();

        for (String arg : args) {
            if (arg.startsWith("--page-size=")) {
                String name = arg.substring("--page-size=".length());
                b.pageSize =
                        PageSize.named(name)
                                .orElseThrow(() -> new CLIException("Unknown page size: " + name));
            } else if (arg.startsWith("--font=")) {
                String name = arg.substring("--font=".length());
                if (!FontRegistry.isKnown(name)) {
                    throw new CLIException("Unknown font: " + name);
                }
                b.fontName = name;
            } else if (arg.startsWith("--font-size=")) {
                b.fontSize = parseFontSize(arg.substring("--font-size=".length()));
            } else if (arg.startsWith("--title=")) {
                b.title = arg.substring("--title=".length());
            } else {
                switch (arg) {
                    case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                    case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                    case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                    case "-l", "--landscape" -> b.landscape = true;
                    case "--csv" -> b.csv = true;
                    default -> {
                        if (arg.startsWith("-") && arg.length() > 1) {
                            throw new CLIException("Unknown option: " + arg);
                        } else if (b.inputPath == null) {
                            b.inputPath = Paths.get(arg);
                        } else if (b.outputPath == null) {
                            b.outputPath = Paths.get(arg);
                        } else {
                            throw new CLIException("Multiple input files specified");
                        }
                    }
                }
            }
        }

        if (!b.csv && b.inputPath != null) {
            b.csv = b.inputPath.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv");
        }
        return b.build();
    }

    private static double parseFontSize(String value) throws CLIException {
        try {
            double size = Double.parseDouble(value);
            if (size <= 0) {
                throw new CLIException("Font size must be positive: " + value);
            }
            return size;
        } catch (NumberFormatException e) {
            throw new CLIException("Invalid font size: " + value, e);
        }
    }

    /** Builds the document described by {@code config} and saves it. */
    static Document render(CLIConfig config) throws CLIException {
        List<String> lines;
        try {
            lines = Files.readAllLines(config.inputPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CLIException("Cannot read " + config.inputPath() + ": " + e.getMessage(), e);
        }

        Document doc = createDocument(config);
        if (config.title() != null && !config.title().isBlank()) {
            doc.setTitle(config.title());
            doc.title(config.title());
        }
        if (config.csv()) {
            TextLayout.renderCsv(doc, lines);
        } else {
            TextLayout.renderText(doc, lines);
        }

        try {
            Path outputParent = config.outputPath().toAbsolutePath().getParent();
            if (outputParent != null) {
                Files.createDirectories(outputParent);
            }
            doc.save(config.outputPath());
        } catch (IOException e) {
            throw new CLIException(
                    "Cannot write " + config.outputPath() + ": " + e.getMessage(), e);
        }
        return doc;
    }

    private static Document createDocument(CLIConfig config) {
        DocumentDefaults defaults = DocumentDefaults.loadDefault();
        Document doc = new Document(defaults);
        if (config.pageSize() != null) {
            doc.setPageSize(config.pageSize());
        }
        if (config.landscape()) {
            doc.setOrientation(Orientation.LANDSCAPE);
        }
        double size = config.fontSize() != null ? config.fontSize() : defaults.fontSize();
        if (config.fontName() != null) {
            doc.setFont(config.fontName(), size);
        } else {
            doc.setFontSize(size);
        }
        return doc;
    }

    private static void configureLogging(VerbosityLevel verbosity) {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(verbosity.logLevel());
        ctx.getLogger("net.boyechko.pdf.press").setLevel(verbosity.logLevel());
    }

    private static Logger logger() {
        if (logger == null) {
            logger = LoggerFactory.getLogger(PdfPressCLI.class);
        }
        return logger;
    }

    static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    static String usageMessage() {
        return "Usage: java PdfPressCLI [-q|-v|-vv] [--page-size=NAME] [--landscape] [--font=NAME] [--font-size=N] [--title=TEXT] [--csv] <inputpath> [<outputpath>]\n"
                + "  -h, --help          Show this help message\n"
                + "  -q, --quiet         Only show errors\n"
                + "  -v, --verbose       Show progress information\n"
                + "  -vv, --debug        Show all debug information\n"
                + "  --page-size=NAME    Letter, Legal, Tabloid, A3, A4, A5, B4 or B5\n"
                + "  -l, --landscape     Use landscape pages\n"
                + "  --font=NAME         One of the 14 standard fonts, e.g. Times-Roman\n"
                + "  --font-size=N       Body font size in points\n"
                + "  --title=TEXT        Title printed on the first page and stored in the metadata\n"
                + "  --csv               Render the input as a table (implied by a .csv extension)\n"
                + "Text input: lines starting with '# ' are headings; blank lines separate paragraphs.\n"
                + "Examples:\n"
                + "  java PdfPressCLI notes.txt\n"
                + "  java PdfPressCLI --page-size=A4 --font=Times-Roman --title=Report notes.txt out.pdf\n"
                + "  java PdfPressCLI -v --landscape data.csv";
    }
}
