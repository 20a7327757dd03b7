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
import com.itextpdf.kernel.pdf.PdfNumber;
import com.itextpdf.kernel.pdf.PdfPage;
import java.util.List;
import net.boyechko.pdf.autopdfa.PdfTestBase;
import org.junit.jupiter.api.Test;

public class PageSetTest extends PdfTestBase {

    @Test
    void numbersPagesInDocumentOrder() {
        try (PdfDocument doc = newTestDocument()) {
            PdfPage first = doc.addNewPage();
            PdfPage second = doc.addNewPage();

            PageSet pages = PageSet.of(doc);

            assertEquals(2, pages.size());
            assertEquals(1, pages.pageNumberOf(ObjKey.of(first.getPdfObject())));
            assertEquals(2, pages.pageNumberOf(ObjKey.of(second.getPdfObject())));
        }
    }

    @Test
    void recognizesPageByReferenceOrDictionary() {
        try (PdfDocument doc = newTestDocument()) {
            PdfPage page = doc.addNewPage();
            PageSet pages = PageSet.of(doc);

            assertTrue(pages.containsPage(page.getPdfObject()));
            assertTrue(pages.containsPage(page.getPdfObject().getIndirectReference()));
        }
    }

    @Test
    void rejectsNonPages() {
        try (PdfDocument doc = newTestDocument()) {
            doc.addNewPage();
            PageSet pages = PageSet.of(doc);

            assertFalse(pages.containsPage(orphanPage(doc)), "Page outside the page tree");
            assertFalse(pages.containsPage(new PdfNumber(0)), "Page index instead of reference");
            assertFalse(pages.containsPage(new PdfDictionary()), "Direct dictionary");
            assertFalse(pages.containsPage(null));
            assertEquals(0, pages.pageNumberOf(new ObjKey(9999, 0)));
        }
    }

    @Test
    void removedPageIsNoLongerLive() {
        try (PdfDocument doc = newTestDocument()) {
            doc.addNewPage();
            PdfPage doomed = doc.addNewPage();
            ObjKey doomedKey = ObjKey.of(doomed.getPdfObject());

            assertTrue(PageSet.of(doc).contains(doomedKey));
            doc.removePage(2);

            assertFalse(PageSet.of(doc).contains(doomedKey));
            assertEquals(1, PageSet.of(doc).size());
        }
    }

    @Test
    void buildsFromExplicitKeys() {
        PageSet pages = PageSet.of(List.of(new ObjKey(4, 0), new ObjKey(7, 0)));

        assertEquals(2, pages.pageNumberOf(new ObjKey(7, 0)));
        assertEquals(List.of(new ObjKey(4, 0), new ObjKey(7, 0)), pages.keys());
    }
}
