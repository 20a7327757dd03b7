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
import com.itextpdf.kernel.pdf.PdfIndirectReference;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfStream;
import com.itextpdf.kernel.pdf.PdfString;

/** Static helpers for reading the raw PDF object model. */
public final class PdfObjects {
    /** Upper bound on /Parent hops when looking up inherited page attributes. */
    private static final int MAX_INHERITANCE_HOPS = 64;

    private PdfObjects() {}

    /** Dereferences {@code obj}; returns {@code null} for dangling references. */
    public static PdfObject resolve(PdfObject obj) {
        if (obj instanceof PdfIndirectReference ref) {
            if (ref.isFree()) {
                return null;
            }
            PdfObject target = ref.getRefersTo(true);
            return target == null || target.isNull() ? null : target;
        }
        return obj;
    }

    /**
     * Returns {@code obj} as a dictionary, including streams, or {@code null}. Unlike {@link
     * PdfDictionary#getAsDictionary}, streams are accepted.
     */
    public static PdfDictionary dictionary(PdfObject obj) {
        return resolve(obj) instanceof PdfDictionary dict ? dict : null;
    }

    public static PdfStream stream(PdfObject obj) {
        return resolve(obj) instanceof PdfStream stream ? stream : null;
    }

    /** Returns the dictionary value of {@code key} in {@code dict}, streams included. */
    public static PdfDictionary dictionary(PdfDictionary dict, PdfName key) {
        return dict != null ? dictionary(dict.get(key)) : null;
    }

    /** Returns true if {@code dict} has a /Subtype equal to {@code subtype}. */
    public static boolean hasSubtype(PdfDictionary dict, PdfName subtype) {
        return dict != null && subtype.equals(dict.getAsName(PdfName.Subtype));
    }

    /**
     * Looks up {@code key} on {@code dict} or, failing that, on its /Parent chain. Used for
     * inheritable page attributes such as /Resources.
     */
    public static PdfObject inherited(PdfDictionary dict, PdfName key) {
        PdfDictionary current = dict;
        for (int hops = 0; current != null && hops < MAX_INHERITANCE_HOPS; hops++) {
            PdfObject value = current.get(key);
            if (value != null) {
                return value;
            }
            current = current.getAsDictionary(PdfName.Parent);
        }
        return null;
    }

    /**
     * Returns the text of a name or string, which is how names are written in name trees and
     * destination references. Returns {@code null} for other object types.
     */
    public static String nameKey(PdfObject obj) {
        PdfObject resolved = resolve(obj);
        if (resolved instanceof PdfString str) {
            return str.toUnicodeString();
        }
        if (resolved instanceof PdfName name) {
            return name.getValue();
        }
        return null;
    }

    /** Returns the object number of {@code obj}, or -1 for direct objects. */
    public static int objNum(PdfObject obj) {
        ObjKey key = ObjKey.of(obj);
        return key != null ? key.objNumber() : -1;
    }
}
