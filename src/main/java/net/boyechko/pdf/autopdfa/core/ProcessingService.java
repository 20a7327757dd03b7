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
package net.boyechko.pdf.autopdfa.core;

import com.itextpdf.kernel.pdf.PdfDocument;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import net.boyechko.pdf.autopdfa.document.DocContext;
import net.boyechko.pdf.autopdfa.document.PdfCustodian;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Orchestrates the processing of a PDF document. */
public class ProcessingService {
    private static final Logger logger = LoggerFactory.getLogger(ProcessingService.class);

    /** Set to true to keep all intermediate pipeline files for debugging. */
    private static final boolean KEEP_PIPELINE_TEMPS = false;

    private static final Path PIPELINE_TEMP_DIR = resolvePipelineTempDir();

    private final PdfCustodian custodian;
    private final ProcessingListener listener;
    private final List<ComplianceStep> steps;

    public static class ProcessingServiceBuilder {
        private PdfCustodian custodian;
        private ProcessingListener listener;
        private List<ComplianceStep> steps;
        private final Set<String> skipSteps = new HashSet<>();
        private final Set<String> includeOnlySteps = new HashSet<>();

        public ProcessingServiceBuilder withPdfCustodian(PdfCustodian custodian) {
            this.custodian = custodian;
            return this;
        }

        public ProcessingServiceBuilder withListener(ProcessingListener listener) {
            this.listener = listener;
            return this;
        }

        /** Replaces the default steps from {@link ProcessingDefaults}. */
        public ProcessingServiceBuilder withSteps(List<ComplianceStep> steps) {
            this.steps = new ArrayList<>(steps);
            return this;
        }

        public ProcessingServiceBuilder skipSteps(Set<String> stepClassNames) {
            skipSteps.addAll(stepClassNames);
            return this;
        }

        public ProcessingServiceBuilder includeOnlySteps(Set<String> stepClassNames) {
            includeOnlySteps.addAll(stepClassNames);
            return this;
        }

        public ProcessingService build() {
            if (custodian == null) {
                throw new IllegalStateException(
                        "PdfCustodian must be provided via withPdfCustodian(...) before building ProcessingService");
            }
            if (listener == null) {
                throw new IllegalStateException(
                        "ProcessingListener must be provided via withListener(...) before building ProcessingService");
            }
            return new ProcessingService(this);
        }
    }

    private ProcessingService(ProcessingServiceBuilder builder) {
        this.custodian = builder.custodian;
        this.listener = builder.listener;
        List<ComplianceStep> defaults =
                builder.steps != null ? builder.steps : ProcessingDefaults.steps();
        this.steps = filterSteps(defaults, builder.skipSteps, builder.includeOnlySteps);
    }

    /** Filters the steps by class name. Names that match no step are rejected. */
    private static List<ComplianceStep> filterSteps(
            List<ComplianceStep> defaults, Set<String> skip, Set<String> includeOnly) {
        Set<String> known =
                defaults.stream()
                        .map(step -> step.getClass().getSimpleName())
                        .collect(Collectors.toCollection(LinkedHashSet::new));
        List<String> unknown =
                Stream.concat(skip.stream(), includeOnly.stream())
                        .filter(name -> !known.contains(name))
                        .sorted()
                        .toList();
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException(
                    "Unknown step(s): "
                            + String.join(", ", unknown)
                            + ". Available steps: "
                            + String.join(", ", known));
        }

        List<ComplianceStep> filtered = new ArrayList<>();
        for (ComplianceStep step : defaults) {
            String className = step.getClass().getSimpleName();
            if (!includeOnly.isEmpty()) {
                if (includeOnly.contains(className)) {
                    filtered.add(step);
                }
            } else if (!skip.contains(className)) {
                filtered.add(step);
            }
        }
        return filtered;
    }

    public List<ComplianceStep> steps() {
        return List.copyOf(steps);
    }

    /**
     * Remediates the PDF using a sequential pipeline. Each step runs on its own copy, reading the
     * previous step's output file. The first step reads the original input and drops its
     * encryption.
     */
    public ProcessingResult remediate() throws IOException {
        Path pipelineDir = PIPELINE_TEMP_DIR.resolve(custodian.getInputPath().getFileName());
        preparePipelineDir(pipelineDir);
        List<Path> tempFiles = new ArrayList<>();
        Map<String, Integer> changesByStep = new LinkedHashMap<>();

        try {
            if (custodian.isEncrypted()) {
                listener.onInfo("Input is encrypted; output will be saved without encryption");
            }

            Path current = null;
            int stepNum = 0;
            for (ComplianceStep step : steps) {
                Path output =
                        pipelineDir.resolve(
                                String.format(
                                        "step%02d_%s.pdf",
                                        stepNum++,
                                        sanitizeForFilename(step.name())));
                tempFiles.add(output);

                listener.onPhaseStart(step.name());
                int changes;
                try (PdfDocument doc = openStep(current, output)) {
                    changes = step.apply(new DocContext(doc));
                }
                changesByStep.put(step.name(), changes);
                if (changes == 0) {
                    listener.onSuccess(step.passedMessage());
                } else {
                    listener.onChangesApplied(step.name(), changes);
                }

                if (!KEEP_PIPELINE_TEMPS && current != null) {
                    Files.deleteIfExists(current);
                }
                current = output;
            }

            // Finalize: copy result out of the step files
            Path finalOutput = pipelineDir.resolve("output.pdf");
            if (current == null) {
                try (PdfDocument doc = custodian.openForModification(finalOutput)) {
                    logger.debug(
                            "No steps selected; copying {} page(s) unchanged",
                            doc.getNumberOfPages());
                }
            } else {
                Files.copy(current, finalOutput, StandardCopyOption.REPLACE_EXISTING);
            }

            ProcessingResult result = new ProcessingResult(changesByStep, finalOutput);
            listener.onSummary(result);
            cleanupPipelineFiles(pipelineDir, tempFiles);
            return result;
        } catch (IOException | RuntimeException e) {
            cleanupPipelineFiles(pipelineDir, tempFiles);
            throw e;
        }
    }

    private PdfDocument openStep(Path previous, Path output) throws IOException {
        return previous == null
                ? custodian.openForModification(output)
                : PdfCustodian.openTempForModification(previous, output);
    }

    // == Pipeline helpers =============================================

    private static Path resolvePipelineTempDir() {
        // 1. Explicit JVM flag:  -Dautopdfa.pipeline.dir=/my/path
        String sysProp = System.getProperty("autopdfa.pipeline.dir");
        if (sysProp != null) return Path.of(sysProp);

        // 2. Environment variable: export AUTOPDFA_PIPELINE_DIR=/my/path
        String envVar = System.getenv("AUTOPDFA_PIPELINE_DIR");
        if (envVar != null) return Path.of(envVar);

        // 3. Default
        return Path.of("/tmp/pdf-autopdfa/pipeline");
    }

    /** Creates the pipeline directory, or empties it if a previous run left files behind. */
    private static void preparePipelineDir(Path pipelineDir) throws IOException {
        if (!Files.exists(pipelineDir)) {
            Files.createDirectories(pipelineDir);
            return;
        }
        try (Stream<Path> leftovers = Files.list(pipelineDir)) {
            for (Path path : leftovers.toList()) {
                Files.delete(path);
            }
        }
    }

    /**
     * Deletes the step files unless {@link #KEEP_PIPELINE_TEMPS} is set. The final output.pdf is
     * left for the caller to copy.
     */
    private static void cleanupPipelineFiles(Path pipelineDir, List<Path> tempFiles) {
        if (KEEP_PIPELINE_TEMPS) {
            logger.info("Pipeline temps kept at: {}", pipelineDir);
            return;
        }
        for (Path temp : tempFiles) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                logger.debug("Could not delete pipeline temp file {}: {}", temp, e.getMessage());
            }
        }
    }

    private static String sanitizeForFilename(String name) {
        return name.replaceAll("[^a-zA-Z0-9_-]", "_");
    }
}
