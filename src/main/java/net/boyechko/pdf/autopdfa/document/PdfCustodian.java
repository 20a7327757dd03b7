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
package net.boyechko.pdf.autopdfa.document;

import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfReader;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.kernel.pdf.ReaderProperties;
import com.itextpdf.kernel.pdf.StampingProperties;
import com.itextpdf.kernel.pdf.WriterProperties;
import java.io.IOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for opening PDF documents. PDF/A forbids encryption (ISO 19005-2 6.1.3), so documents
 * opened for modification are always written out unencrypted, whatever the input carried.
 */
public final class PdfCustodian {
    private static final Logger logger = LoggerFactory.getLogger(PdfCustodian.class);

    private final Path inputPath;
    private final ReaderProperties readerProps;
    private Boolean encrypted;

    public PdfCustodian(Path inputPath, String password) {
        this.inputPath = inputPath;
        this.readerProps = new ReaderProperties();
        if (password != null) {
            this.readerProps.setPassword(password.getBytes());
        }
    }

    public PdfCustodian(Path inputPath) {
        this(inputPath, null);
    }

    public Path getInputPath() {
        return inputPath;
    }

    public PdfDocument openForReading() throws IOException {
        PdfReader pdfReader = new PdfReader(inputPath.toString(), readerProps);
        return new PdfDocument(pdfReader);
    }

    /** Opens the (possibly encrypted) input and writes changes to {@code outputPath} in clear. */
    public PdfDocument openForModification(Path outputPath) throws IOException {
        PdfReader pdfReader = new PdfReader(inputPath.toString(), readerProps);
        PdfWriter pdfWriter = new PdfWriter(outputPath.toString(), new WriterProperties());
        PdfDocument doc = new PdfDocument(pdfReader, pdfWriter, new StampingProperties());
        encrypted = pdfReader.isEncrypted();
        if (encrypted) {
            logger.debug(
                    "Input {} is encrypted; output will be written without encryption",
                    inputPath);
        }
        return doc;
    }

    /** Opens an unencrypted pipeline file for modification and writes to a new one. */
    public static PdfDocument openTempForModification(Path inputPath, Path outputPath)
            throws IOException {
        PdfReader pdfReader = new PdfReader(inputPath.toString());
        PdfWriter pdfWriter = new PdfWriter(outputPath.toString(), new WriterProperties());
        return new PdfDocument(pdfReader, pdfWriter);
    }

    /** Returns whether the input is encrypted. Opens the input once if not yet known. */
    public boolean isEncrypted() throws IOException {
        if (encrypted == null) {
            try (PdfReader testReader = new PdfReader(inputPath.toString(), readerProps);
                    PdfDocument testDoc = new PdfDocument(testReader)) {
                encrypted = testReader.isEncrypted();
                logger.debug(
                        "Encrypted: {}, permissions: {}", encrypted, testReader.getPermissions());
            }
        }
        return encrypted;
    }
}
