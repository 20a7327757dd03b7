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
package net.boyechko.pdf.autopdfa.destinations;

import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfObject;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import net.boyechko.pdf.autopdfa.document.PdfObjects;
import net.boyechko.pdf.autopdfa.traversal.NameTree;

/**
 * Snapshot of a document's named destinations: the /Dests name tree of the catalog's /Names
 * dictionary (PDF 1.2 and later) and the legacy /Dests dictionary of the catalog (PDF 1.1). When a
 * name is defined in both, the name tree wins.
 */
public final class NamedDestinations {
    private final Map<String, PdfObject> tree;
    private final Map<String, PdfObject> legacy;

    private NamedDestinations(Map<String, PdfObject> tree, Map<String, PdfObject> legacy) {
        this.tree = Collections.unmodifiableMap(tree);
        this.legacy = Collections.unmodifiableMap(legacy);
    }

    public static NamedDestinations load(PdfDictionary catalog, int maxDepth) {
        Map<String, PdfObject> tree = new LinkedHashMap<>();
        PdfDictionary names = PdfObjects.dictionary(catalog, PdfName.Names);
        PdfDictionary destsTree = PdfObjects.dictionary(names, PdfName.Dests);
        if (destsTree != null) {
            tree.putAll(NameTree.entries(destsTree, maxDepth));
        }

        Map<String, PdfObject> legacy = new LinkedHashMap<>();
        PdfDictionary destsDict = PdfObjects.dictionary(catalog, PdfName.Dests);
        if (destsDict != null) {
            for (PdfName key : destsDict.keySet()) {
                legacy.put(key.getValue(), destsDict.get(key, false));
            }
        }
        return new NamedDestinations(tree, legacy);
    }

    public boolean contains(String name) {
        return name != null && (tree.containsKey(name) || legacy.containsKey(name));
    }

    /**
     * Resolves a destination name (a string or a name object) to its explicit destination array,
     * or returns {@code null} if the name is undefined or its value is not a destination.
     */
    public PdfArray resolve(PdfObject name) {
        String key = PdfObjects.nameKey(name);
        if (key == null) {
            return null;
        }
        PdfObject value = tree.containsKey(key) ? tree.get(key) : legacy.get(key);
        return explicitArray(value);
    }

    /**
     * Returns the explicit destination held by a named-destination value, which is either the
     * array itself or a dictionary whose /D entry is the array (ISO 32000-1, 12.3.2.3).
     */
    public static PdfArray explicitArray(PdfObject value) {
        PdfObject resolved = PdfObjects.resolve(value);
        if (resolved instanceof PdfDictionary dict) {
            resolved = PdfObjects.resolve(dict.get(PdfName.D, false));
        }
        return resolved instanceof PdfArray array ? array : null;
    }

    public int size() {
        return tree.size() + legacy.size();
    }
}
