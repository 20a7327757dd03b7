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
import com.itextpdf.kernel.pdf.PdfObject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The ordered identities of the pages currently live in a document. A snapshot: take a new one
 * after pages are inserted or removed.
 */
public final class PageSet {
    private static final Logger logger = LoggerFactory.getLogger(PageSet.class);

    private final List<ObjKey> pages;
    private final Map<ObjKey, Integer> pageNumbers;

    private PageSet(List<ObjKey> pages) {
        this.pages = Collections.unmodifiableList(pages);
        this.pageNumbers = new HashMap<>();
        for (int i = 0; i < pages.size(); i++) {
            pageNumbers.putIfAbsent(pages.get(i), i + 1);
        }
    }

    /** Collects the identities of all pages reachable from the document's page tree. */
    public static PageSet of(PdfDocument doc) {
        List<ObjKey> keys = new ArrayList<>();
        int count = doc.getNumberOfPages();
        for (int pageNum = 1; pageNum <= count; pageNum++) {
            try {
                ObjKey key = ObjKey.of(doc.getPage(pageNum).getPdfObject());
                if (key != null) {
                    keys.add(key);
                }
            } catch (RuntimeException e) {
                logger.debug("Skipping unreadable page {}: {}", pageNum, e.getMessage());
            }
        }
        return new PageSet(keys);
    }

    public static PageSet of(List<ObjKey> pages) {
        return new PageSet(new ArrayList<>(pages));
    }

    public boolean contains(ObjKey key) {
        return key != null && pageNumbers.containsKey(key);
    }

    /**
     * Returns true if {@code pageRef} (an indirect reference or an indirect page dictionary)
     * names a live page. Direct objects and numbers are never pages.
     */
    public boolean containsPage(PdfObject pageRef) {
        return contains(ObjKey.of(pageRef));
    }

    /** Returns the 1-based page number of {@code key}, or 0 if it is not a live page. */
    public int pageNumberOf(ObjKey key) {
        return key != null ? pageNumbers.getOrDefault(key, 0) : 0;
    }

    public List<ObjKey> keys() {
        return pages;
    }

    public int size() {
        return pages.size();
    }
}
