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

import com.itextpdf.kernel.pdf.PdfObject;

/**
 * Formatting utilities for PDF entities in log messages and reports, e.g. {@code "obj. #23 (p.
 * 5)"}.
 */
public final class Format {
    private Format() {}

    /** Returns a short label for a PDF object number. */
    public static String obj(int objNum) {
        return "obj. #" + objNum;
    }

    /** Returns a short label for a PDF object number and page number. */
    public static String obj(int objNum, int pageNum) {
        return obj(objNum) + " (" + page(pageNum) + ")";
    }

    /** Returns a short label for a PDF object, or {@code "direct object"} if it has no number. */
    public static String obj(PdfObject obj) {
        int objNum = PdfObjects.objNum(obj);
        return objNum >= 0 ? obj(objNum) : "direct object";
    }

    /** Returns a label for a PDF object, adding the page when {@code pageNum > 0}. */
    public static String obj(PdfObject obj, int pageNum) {
        return pageNum > 0 ? obj(obj) + " (" + page(pageNum) + ")" : obj(obj);
    }

    /** Returns a short label for a page number. */
    public static String page(int pageNum) {
        return "p. " + pageNum;
    }
}
