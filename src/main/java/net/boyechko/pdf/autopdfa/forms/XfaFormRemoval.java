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
package net.boyechko.pdf.autopdfa.forms;

import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfName;
import net.boyechko.pdf.autopdfa.core.ComplianceStep;
import net.boyechko.pdf.autopdfa.document.DocContext;
import net.boyechko.pdf.autopdfa.document.PdfObjects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes XFA form data (/XFA) and the /NeedsRendering flag from the AcroForm dictionary. PDF/A
 * does not allow XFA (ISO 19005-2, 6.4.2). The AcroForm fields themselves are kept.
 */
public class XfaFormRemoval implements ComplianceStep {
    private static final Logger logger = LoggerFactory.getLogger(XfaFormRemoval.class);

    @Override
    public String name() {
        return "XFA form removal";
    }

    @Override
    public String passedMessage() {
        return "No XFA forms";
    }

    @Override
    public int apply(DocContext ctx) {
        PdfDictionary acroForm = PdfObjects.dictionary(ctx.catalog(), PdfName.AcroForm);
        if (acroForm == null) {
            return 0;
        }

        int removed = 0;
        if (acroForm.get(PdfName.XFA, false) != null) {
            PdfArray fields = acroForm.getAsArray(PdfName.Fields);
            if (fields == null || fields.isEmpty()) {
                logger.warn(
                        "XFA-only form: removing /XFA leaves the document without form content");
            }
            acroForm.remove(PdfName.XFA);
            removed++;
            logger.debug("Removed /XFA from AcroForm");
        }
        if (acroForm.get(PdfName.NeedsRendering, false) != null) {
            acroForm.remove(PdfName.NeedsRendering);
            removed++;
            logger.debug("Removed /NeedsRendering from AcroForm");
        }

        if (removed > 0) {
            acroForm.setModified();
            logger.info("{} XFA element(s) removed", removed);
        }
        return removed;
    }
}
