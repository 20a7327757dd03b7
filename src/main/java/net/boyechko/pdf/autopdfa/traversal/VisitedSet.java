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
package net.boyechko.pdf.autopdfa.traversal;

import com.itextpdf.kernel.pdf.PdfObject;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Set;
import net.boyechko.pdf.autopdfa.document.ObjKey;

/**
 * Tracks which objects have been visited during one pass. Indirect objects are keyed by {@link
 * ObjKey}, so every reference to the same object counts as the same visit; direct objects fall
 * back to Java identity.
 */
public final class VisitedSet {
    private final Set<ObjKey> indirect = new HashSet<>();
    private final Set<PdfObject> direct = Collections.newSetFromMap(new IdentityHashMap<>());

    /** Marks {@code obj} as visited. Returns false if it had already been visited. */
    public boolean markVisited(PdfObject obj) {
        if (obj == null) {
            return false;
        }
        ObjKey key = ObjKey.of(obj);
        return key != null ? indirect.add(key) : direct.add(obj);
    }

    public boolean isVisited(PdfObject obj) {
        if (obj == null) {
            return false;
        }
        ObjKey key = ObjKey.of(obj);
        return key != null ? indirect.contains(key) : direct.contains(obj);
    }

    public int size() {
        return indirect.size() + direct.size();
    }
}
