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

import static org.junit.jupiter.api.Assertions.*;

import com.itextpdf.kernel.pdf.EncryptionConstants;
import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfPage;
import com.itextpdf.kernel.pdf.PdfReader;
import com.itextpdf.kernel.pdf.PdfStream;
import com.itextpdf.kernel.pdf.PdfString;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.kernel.pdf.WriterProperties;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import net.boyechko.pdf.autopdfa.PdfTestBase;
import net.boyechko.pdf.autopdfa.document.PdfCustodian;
import org.junit.jupiter.api.Test;

/** Test suite for ProcessingService. */
public class ProcessingServiceTest extends PdfTestBase {

    /** Records the listener calls as short strings. */
    private static class RecordingListener extends NoOpProcessingListener {
        final List<String> events = new ArrayList<>();

        @Override
        public void onPhaseStart(String phaseName) {
            events.add("phase:" + phaseName);
        }

        @Override
        public void onSuccess(String message) {
            events.add("success:" + message);
        }

        @Override
        public void onChangesApplied(String stepName, int changes) {
            events.add("changes:" + stepName + "=" + changes);
        }

        @Override
        public void onInfo(String message) {
            events.add("info:" + message);
        }

        @Override
        public void onSummary(ProcessingResult result) {
            events.add("summary:" + result.totalChanges());
        }
    }

    @Test
    void nonCompliantDocumentIsRemediated() throws Exception {
        Path input = createTestPdf(ProcessingServiceTest::nonCompliantContent);

        ProcessingResult result = createProcessingService(input).remediate();
        saveRemediatedPdf(result);

        assertEquals(1, result.changesFor("Action sanitization"));
        assertEquals(1, result.changesFor("Named JavaScript removal"));
        assertEquals(1, result.changesFor("XFA form removal"));
        assertEquals(1, result.changesFor("Destination validation"));
        assertEquals(4, result.totalChanges());

        try (PdfDocument out = new PdfDocument(new PdfReader(result.tempOutputFile().toString()))) {
            PdfDictionary catalog = out.getCatalog().getPdfObject();
            assertFalse(catalog.containsKey(PdfName.OpenAction), "JavaScript open action");
            assertFalse(
                    catalog.getAsDictionary(PdfName.Names).containsKey(PdfName.JavaScript),
                    "Document-level JavaScript");
            assertFalse(
                    catalog.getAsDictionary(PdfName.AcroForm).containsKey(PdfName.XFA), "XFA form");
            PdfDictionary link =
                    out.getPage(1).getPdfObject().getAsArray(PdfName.Annots).getAsDictionary(0);
            assertFalse(link.containsKey(PdfName.Dest), "Link to a page outside the document");
        }
    }

    @Test
    void compliantDocumentNeedsNoChanges() throws Exception {
        Path input =
                createTestPdf(
                        pdfDoc -> {
                            PdfPage page = pdfDoc.addNewPage();
                            addAnnotation(page, PdfName.Link).put(PdfName.Dest, fitDest(page));
                        });

        RecordingListener listener = new RecordingListener();
        ProcessingResult result = createProcessingService(input, listener).remediate();

        assertFalse(result.hasChanges());
        assertEquals(4, result.changesByStep().size(), "Every step should report");
        assertTrue(Files.exists(result.tempOutputFile()));
        assertTrue(listener.events.contains("success:All actions are PDF/A compliant"));
        assertEquals("summary:0", listener.events.get(listener.events.size() - 1));
    }

    @Test
    void listenerSeesEachStepInOrder() throws Exception {
        Path input = createTestPdf(ProcessingServiceTest::nonCompliantContent);

        RecordingListener listener = new RecordingListener();
        createProcessingService(input, listener).remediate();

        assertEquals(
                List.of(
                        "phase:Action sanitization",
                        "changes:Action sanitization=1",
                        "phase:Named JavaScript removal",
                        "changes:Named JavaScript removal=1",
                        "phase:XFA form removal",
                        "changes:XFA form removal=1",
                        "phase:Destination validation",
                        "changes:Destination validation=1",
                        "summary:4"),
                listener.events);
    }

    @Test
    void skippedStepsDoNotRun() throws Exception {
        Path input = createTestPdf(ProcessingServiceTest::nonCompliantContent);

        ProcessingService service =
                new ProcessingService.ProcessingServiceBuilder()
                        .withPdfCustodian(new PdfCustodian(input))
                        .withListener(new NoOpProcessingListener())
                        .skipSteps(Set.of("DestinationValidator"))
                        .build();
        ProcessingResult result = service.remediate();

        assertEquals(3, service.steps().size());
        assertFalse(result.changesByStep().containsKey("Destination validation"));
        assertEquals(3, result.totalChanges());
    }

    @Test
    void includeOnlyRunsNamedSteps() throws Exception {
        Path input = createTestPdf(ProcessingServiceTest::nonCompliantContent);

        ProcessingService service =
                new ProcessingService.ProcessingServiceBuilder()
                        .withPdfCustodian(new PdfCustodian(input))
                        .withListener(new NoOpProcessingListener())
                        .includeOnlySteps(Set.of("JavaScriptNameTreeRemoval"))
                        .build();
        ProcessingResult result = service.remediate();

        assertEquals(1, result.changesByStep().size());
        assertEquals(1, result.changesFor("Named JavaScript removal"));
    }

    @Test
    void unknownStepNameIsRejected() throws Exception {
        Path input = createTestPdf(ProcessingServiceTest::nonCompliantContent);

        IllegalArgumentException e =
                assertThrows(
                        IllegalArgumentException.class,
                        () ->
                                new ProcessingService.ProcessingServiceBuilder()
                                        .withPdfCustodian(new PdfCustodian(input))
                                        .withListener(new NoOpProcessingListener())
                                        .skipSteps(Set.of("NoSuchStep"))
                                        .build());
        assertTrue(e.getMessage().contains("NoSuchStep"));
        assertTrue(e.getMessage().contains("ActionSanitizer"), "Should list available steps");
    }

    @Test
    void builderRequiresCustodianAndListener() {
        assertThrows(
                IllegalStateException.class,
                () ->
                        new ProcessingService.ProcessingServiceBuilder()
                                .withListener(new NoOpProcessingListener())
                                .build());
        assertThrows(
                IllegalStateException.class,
                () ->
                        new ProcessingService.ProcessingServiceBuilder()
                                .withPdfCustodian(new PdfCustodian(Path.of("any.pdf")))
                                .build());
    }

    @Test
    void noStepsCopiesInput() throws Exception {
        Path input = createTestPdf(ProcessingServiceTest::nonCompliantContent);

        ProcessingResult result =
                new ProcessingService.ProcessingServiceBuilder()
                        .withPdfCustodian(new PdfCustodian(input))
                        .withListener(new NoOpProcessingListener())
                        .withSteps(List.of())
                        .build()
                        .remediate();

        assertFalse(result.hasChanges());
        try (PdfDocument out = new PdfDocument(new PdfReader(result.tempOutputFile().toString()))) {
            assertTrue(out.getCatalog().getPdfObject().containsKey(PdfName.OpenAction));
        }
    }

    @Test
    void encryptedInputIsReportedAndDecrypted() throws Exception {
        Path input = testOutputPath("encrypted_input.pdf");
        WriterProperties props = new WriterProperties();
        props.setStandardEncryption(
                null,
                "owner".getBytes(),
                EncryptionConstants.ALLOW_PRINTING,
                EncryptionConstants.ENCRYPTION_AES_256);
        try (PdfDocument doc = new PdfDocument(new PdfWriter(input.toString(), props))) {
            doc.addNewPage();
        }

        RecordingListener listener = new RecordingListener();
        ProcessingResult result =
                new ProcessingService.ProcessingServiceBuilder()
                        .withPdfCustodian(new PdfCustodian(input, "owner"))
                        .withListener(listener)
                        .build()
                        .remediate();

        assertTrue(listener.events.stream().anyMatch(event -> event.startsWith("info:")));
        try (PdfReader reader = new PdfReader(result.tempOutputFile().toString());
                PdfDocument out = new PdfDocument(reader)) {
            assertFalse(reader.isEncrypted(), "PDF/A output must not be encrypted");
        }
    }

    private ProcessingService createProcessingService(Path inputPath) {
        return createProcessingService(inputPath, new NoOpProcessingListener());
    }

    private ProcessingService createProcessingService(
            Path inputPath, ProcessingListener listener) {
        return new ProcessingService.ProcessingServiceBuilder()
                .withPdfCustodian(new PdfCustodian(inputPath))
                .withListener(listener)
                .build();
    }

    /** One defect per step: JavaScript open action, named JavaScript, XFA and a lost link. */
    private static void nonCompliantContent(PdfDocument pdfDoc) {
        PdfPage page = pdfDoc.addNewPage();
        PdfDictionary catalog = pdfDoc.getCatalog().getPdfObject();
        catalog.put(PdfName.OpenAction, javaScript("app.alert('opened')"));

        PdfArray scripts = new PdfArray();
        scripts.add(new PdfString("init"));
        scripts.add(indirect(pdfDoc, javaScript("init()")));
        PdfDictionary tree = indirect(pdfDoc, new PdfDictionary());
        tree.put(PdfName.Names, scripts);
        namesDictionary(pdfDoc).put(PdfName.JavaScript, tree);

        PdfDictionary field = indirect(pdfDoc, new PdfDictionary());
        field.put(PdfName.T, new PdfString("name"));
        addField(pdfDoc, field);
        PdfDictionary acroForm = catalog.getAsDictionary(PdfName.AcroForm);
        acroForm.put(PdfName.XFA, indirect(pdfDoc, new PdfStream("<xdp/>".getBytes())));

        addAnnotation(page, PdfName.Link).put(PdfName.Dest, fitDest(orphanPage(pdfDoc)));
    }
}
