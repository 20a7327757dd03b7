/*
 * PDF-Auto-PDFA - Automated PDF/A Remediation
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
package net.boyechko.pdf.autopdfa.ui.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;
import net.boyechko.pdf.autopdfa.core.ProcessingListener;
import net.boyechko.pdf.autopdfa.core.ProcessingResult;
import net.boyechko.pdf.autopdfa.core.ProcessingService;
import net.boyechko.pdf.autopdfa.core.VerbosityLevel;
import net.boyechko.pdf.autopdfa.document.PdfCustodian;
import net.boyechko.pdf.autopdfa.ui.LoggingListener;
import net.boyechko.pdf.autopdfa.ui.ProcessingReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PdfAutoPdfaCLI {
    private static final String DEFAULT_OUTPUT_SUFFIX = "_pdfa";

    private static Logger logger;

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            Path inputPath,
            Path outputPath,
            String password,
            boolean forceSave,
            Path reportPath,
            boolean logOutput,
            VerbosityLevel verbosity,
            Set<String> skipSteps,
            Set<String> includeOnlySteps) {
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
    }

    /** Mutable builder that accumulates parsed CLI arguments and resolves derived paths. */
    static class CLIConfigBuilder {
        Path inputPath;
        Path outputPath;
        String password;
        boolean forceSave;
        boolean generateReport;
        Path reportPath;
        boolean logOutput;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;
        Set<String> skipSteps = Set.of();
        Set<String> includeOnlySteps = Set.of();

        CLIConfig build() throws CLIException {
            if (inputPath == null) {
                throw new CLIException("No input file specified");
            }
            if (!Files.exists(inputPath)) {
                throw new CLIException("File not found: " + inputPath);
            }
            if (!skipSteps.isEmpty() && !includeOnlySteps.isEmpty()) {
                throw new CLIException("--skip-steps and --include-steps cannot be combined");
            }

            String baseName =
                    inputPath.getFileName().toString().replaceFirst("(_pdfa)*[.][^.]+$", "");
            resolveOutputPath(baseName);
            resolveReportPath(baseName);

            return new CLIConfig(
                    inputPath,
                    outputPath,
                    password,
                    forceSave,
                    reportPath,
                    logOutput,
                    verbosity,
                    skipSteps,
                    includeOnlySteps);
        }

        private void resolveOutputPath(String baseName) {
            if (outputPath == null) {
                String outputFilename = baseName + DEFAULT_OUTPUT_SUFFIX + ".pdf";
                Path parent = inputPath.getParent();
                outputPath =
                        parent != null ? parent.resolve(outputFilename) : Paths.get(outputFilename);
            } else if (Files.isDirectory(outputPath)) {
                outputPath = outputPath.resolve(baseName + DEFAULT_OUTPUT_SUFFIX + ".pdf");
            }
        }

        private void resolveReportPath(String baseName) {
            String reportFilename = baseName + DEFAULT_OUTPUT_SUFFIX + ".txt";
            if (generateReport && reportPath == null) {
                reportPath = outputPath.resolveSibling(reportFilename);
            } else if (reportPath != null && Files.isDirectory(reportPath)) {
                reportPath = reportPath.resolve(reportFilename);
            }
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
            logger().info(
                            "Starting processing of {} with verbosity level {}",
                            config.inputPath(),
                            config.verbosity());
            if (!processFile(config)) {
                System.exit(2);
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

        for (int i = 0; i < args.length; i++) {
            if (args[i].startsWith("--report=")) {
                b.reportPath = Paths.get(args[i].substring("--report=".length()));
                b.generateReport = true;
            } else if (args[i].startsWith("-r=")) {
                b.reportPath = Paths.get(args[i].substring("-r=".length()));
                b.generateReport = true;
            } else if (args[i].startsWith("--skip-steps=")) {
                b.skipSteps = parseCommaSeparated(args[i].substring("--skip-steps=".length()));
            } else if (args[i].startsWith("--include-steps=")) {
                b.includeOnlySteps =
                        parseCommaSeparated(args[i].substring("--include-steps=".length()));
            } else {
                switch (args[i]) {
                    case "-p", "--password" -> {
                        if (i + 1 < args.length) {
                            b.password = args[++i];
                        } else {
                            throw new CLIException("Password not specified after -p");
                        }
                    }
                    case "--skip-steps" -> {
                        if (i + 1 < args.length) {
                            b.skipSteps = parseCommaSeparated(args[++i]);
                        } else {
                            throw new CLIException("Step names not specified after --skip-steps");
                        }
                    }
                    case "--include-steps" -> {
                        if (i + 1 < args.length) {
                            b.includeOnlySteps = parseCommaSeparated(args[++i]);
                        } else {
                            throw new CLIException(
                                    "Step names not specified after --include-steps");
                        }
                    }
                    case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                    case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                    case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                    case "-f", "--force" -> b.forceSave = true;
                    case "-r", "--report" -> b.generateReport = true;
                    case "-l", "--log" -> b.logOutput = true;
                    default -> {
                        if (args[i].startsWith("-")) {
                            throw new CLIException("Unknown option: " + args[i]);
                        } else if (b.inputPath == null) {
                            b.inputPath = Paths.get(args[i]);
                        } else if (b.outputPath == null) {
                            b.outputPath = Paths.get(args[i]);
                        } else {
                            throw new CLIException("Multiple input files specified");
                        }
                    }
                }
            }
        }

        return b.build();
    }

    /** Sets the Logback root level to match the verbosity. */
    static void configureLogging(VerbosityLevel verbosity) {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ctx.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(verbosity.logLevel()));
    }

    private static Logger logger() {
        if (logger == null) {
            logger = LoggerFactory.getLogger(PdfAutoPdfaCLI.class);
        }
        return logger;
    }

    /** Remediates the input and saves the result. Returns false if processing failed. */
    private static boolean processFile(CLIConfig config) throws CLIException {
        OutputStream reportFile = null;
        PrintStream output = System.out;

        try {
            reportFile = openReportStream(config);
            if (reportFile != null) {
                output = new PrintStream(new TeeOutputStream(System.out, reportFile));
            }

            ProcessingListener listener =
                    config.logOutput()
                            ? LoggingListener.withConsoleOutput()
                            : new ProcessingReporter(output, config.verbosity());
            PdfCustodian custodian = new PdfCustodian(config.inputPath(), config.password());

            ProcessingService service;
            try {
                service =
                        new ProcessingService.ProcessingServiceBuilder()
                                .withPdfCustodian(custodian)
                                .withListener(listener)
                                .skipSteps(config.skipSteps())
                                .includeOnlySteps(config.includeOnlySteps())
                                .build();
            } catch (IllegalArgumentException e) {
                throw new CLIException(e.getMessage());
            }

            logger().info("Remediating document");
            ProcessingResult result = service.remediate();
            saveRemediationResult(result, config, listener);
            return true;
        } catch (IOException | RuntimeException e) {
            System.err.println("✗ Processing failed due to an exception:");
            System.err.println();
            e.printStackTrace();
            return false;
        } finally {
            if (reportFile != null) {
                output.flush();
                try {
                    reportFile.close();
                } catch (IOException e) {
                    logger().warn("Failed to close report file", e);
                }
            }
        }
    }

    private static OutputStream openReportStream(CLIConfig config) throws IOException {
        if (config.reportPath() == null) {
            return null;
        }
        Path reportParent = config.reportPath().getParent();
        if (reportParent != null) {
            Files.createDirectories(reportParent);
        }
        logger().info("Saving report to {}", config.reportPath());
        return Files.newOutputStream(config.reportPath());
    }

    private static void saveRemediationResult(
            ProcessingResult result, CLIConfig config, ProcessingListener listener)
            throws IOException {
        if (!result.hasChanges() && !config.forceSave()) {
            listener.onInfo("No changes made; output file not created");
            return;
        }

        Path outputParent = config.outputPath().getParent();
        if (outputParent != null) {
            Files.createDirectories(outputParent);
        }

        logger().info(
                        "Copying temporary output file {} to {}",
                        result.tempOutputFile(),
                        config.outputPath());
        Files.copy(
                result.tempOutputFile(), config.outputPath(), StandardCopyOption.REPLACE_EXISTING);

        listener.onSuccess("Output saved to " + config.outputPath());
    }

    /** Writes to two output streams simultaneously, like the Unix tee command. */
    private static class TeeOutputStream extends OutputStream {
        private final OutputStream out1;
        private final OutputStream out2;

        TeeOutputStream(OutputStream out1, OutputStream out2) {
            this.out1 = out1;
            this.out2 = out2;
        }

        @Override
        public void write(int b) throws IOException {
            out1.write(b);
            out2.write(b);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out1.write(b, off, len);
            out2.write(b, off, len);
        }

        @Override
        public void flush() throws IOException {
            out1.flush();
            out2.flush();
        }
    }

    private static Set<String> parseCommaSeparated(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
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
        return "Usage: java PdfAutoPdfaCLI [-q|-v|-vv] [-f] [-l] [-p password] [-r[=report]] <inputpath> [<outputpath>]\n"
                + "  -h, --help        Show this help message\n"
                + "  -q, --quiet       Only show errors and final status\n"
                + "  -v, --verbose     Show detailed processing information\n"
                + "  -vv, --debug      Show every object changed\n"
                + "  -f, --force       Save the output even if nothing changed\n"
                + "  -l, --log         Report through the log instead of boxed output\n"
                + "  -p, --password    Password for encrypted PDFs\n"
                + "  -r, --report      Save output to report file (auto-named from input)\n"
                + "                    Use -r=<file> or --report=<file> for a custom path\n"
                + "  --skip-steps <names>     Skip specific steps (comma-separated class names)\n"
                + "  --include-steps <names>  Run only these steps (comma-separated class names)\n"
                + "Steps: ActionSanitizer, JavaScriptNameTreeRemoval, XfaFormRemoval,\n"
                + "       DestinationValidator\n"
                + "Examples:\n"
                + "  java PdfAutoPdfaCLI -v document.pdf\n"
                + "  java PdfAutoPdfaCLI --report=report.txt document.pdf output.pdf\n"
                + "  java PdfAutoPdfaCLI --include-steps=DestinationValidator document.pdf";
    }
}
