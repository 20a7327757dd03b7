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
package net.boyechko.pdf.autopdfa.actions;

import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfName;
import net.boyechko.pdf.autopdfa.core.ComplianceStep;
import net.boyechko.pdf.autopdfa.document.DocContext;
import net.boyechko.pdf.autopdfa.document.PdfObjects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes the document-level JavaScript name tree (/Names /JavaScript). Its scripts run when the
 * document is opened, which PDF/A forbids (ISO 19005-2, 6.6.1). JavaScript actions elsewhere are
 * removed by {@link ActionSanitizer}.
 */
public class JavaScriptNameTreeRemoval implements ComplianceStep {
    private static final Logger logger = LoggerFactory.getLogger(JavaScriptNameTreeRemoval.class);
    private static final PdfName JAVASCRIPT = ActionType.JAVASCRIPT.pdfName();

    @Override
    public String name() {
        return "Named JavaScript removal";
    }

    @Override
    public String passedMessage() {
        return "No document-level JavaScript";
    }

    @Override
    public int apply(DocContext ctx) {
        PdfDictionary names = PdfObjects.dictionary(ctx.catalog(), PdfName.Names);
        if (names == null || names.get(JAVASCRIPT, false) == null) {
            return 0;
        }
        names.remove(JAVASCRIPT);
        names.setModified();
        logger.info("Named JavaScript removed from Names dictionary");
        return 1;
    }
}
