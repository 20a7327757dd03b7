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

import static org.junit.jupiter.api.Assertions.*;

import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfIndirectReference;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfString;
import net.boyechko.pdf.autopdfa.PdfTestBase;
import org.junit.jupiter.api.Test;

public class PdfObjectsTest extends PdfTestBase {

    @Test
    void resolvesLiveReferenceToItsObject() {
        try (PdfDocument doc = newTestDocument()) {
            PdfDictionary action = indirect(doc, uri("https://example.org"));

            assertSame(action, PdfObjects.resolve(action.getIndirectReference()));
            assertSame(action, PdfObjects.dictionary(action.getIndirectReference()));
        }
    }

    @Test
    void freedReferenceResolvesToNull() {
        try (PdfDocument doc = newTestDocument()) {
            PdfDictionary action = indirect(doc, javaScript("gone()"));
            PdfIndirectReference ref = action.getIndirectReference();
            ref.setFree();

            assertNull(PdfObjects.resolve(ref), "A freed object must not be reachable");
            assertNull(PdfObjects.dictionary(ref));
        }
    }

    @Test
    void directObjectsResolveToThemselves() {
        PdfString name = new PdfString("chapter1");

        assertSame(name, PdfObjects.resolve(name));
        assertNull(PdfObjects.resolve(null));
        assertEquals("chapter1", PdfObjects.nameKey(name));
        assertEquals("Intro", PdfObjects.nameKey(new PdfName("Intro")));
    }
}
