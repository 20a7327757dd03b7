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

import com.itextpdf.kernel.pdf.PdfIndirectReference;
import com.itextpdf.kernel.pdf.PdfObject;
import java.util.Comparator;

/**
 * Identity of one physical PDF object: its object number and generation. Two parents holding a
 * reference to the same indirect object yield equal keys, which is what the traversal uses to
 * visit shared objects once.
 */
public record ObjKey(int objNumber, int genNumber) implements Comparable<ObjKey> {
    private static final Comparator<ObjKey> ORDER =
            Comparator.comparingInt(ObjKey::objNumber).thenComparingInt(ObjKey::genNumber);

    /** Returns the key for an indirect reference, or {@code null} if {@code ref} is null. */
    public static ObjKey of(PdfIndirectReference ref) {
        return ref != null ? new ObjKey(ref.getObjNumber(), ref.getGenNumber()) : null;
    }

    /**
     * Returns the key of {@code obj} if it is an indirect reference or an indirect object, or
     * {@code null} for direct objects (which have no identity of their own).
     */
    public static ObjKey of(PdfObject obj) {
        if (obj == null) {
            return null;
        }
        if (obj instanceof PdfIndirectReference ref) {
            return of(ref);
        }
        return of(obj.getIndirectReference());
    }

    @Override
    public int compareTo(ObjKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return objNumber + " " + genNumber + " R";
    }
}
