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

import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;

/** Provides access to the document being remediated. */
public class DocContext {
    private final PdfDocument doc;

    public DocContext(PdfDocument doc) {
        this.doc = doc;
    }

    public PdfDocument doc() {
        return doc;
    }

    public PdfDictionary catalog() {
        return doc.getCatalog().getPdfObject();
    }

    /**
     * Returns the pages live right now. Recomputed on each call because page insertion and
     * removal happen independently of the sanitizers.
     */
    public PageSet pageSet() {
        return PageSet.of(doc);
    }
}
