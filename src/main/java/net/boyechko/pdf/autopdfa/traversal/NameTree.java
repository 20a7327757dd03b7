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

import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfObject;
import java.util.LinkedHashMap;
import java.util.Map;
import net.boyechko.pdf.autopdfa.document.PdfObjects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads PDF name trees (ISO 32000-1 7.9.6). A node holds either a flat /Names array of
 * alternating keys and values or a /Kids array of further nodes. There is no formal depth limit,
 * so descent stops silently at {@code maxDepth}.
 */
public final class NameTree {
    private static final Logger logger = LoggerFactory.getLogger(NameTree.class);

    private NameTree() {}

    /**
     * Collects the key/value pairs of the tree rooted at {@code root}, in tree order. Values are
     * returned unresolved. When a key repeats, the first occurrence wins.
     */
    public static Map<String, PdfObject> entries(PdfDictionary root, int maxDepth) {
        Map<String, PdfObject> entries = new LinkedHashMap<>();
        collect(root, 0, maxDepth, new VisitedSet(), entries);
        return entries;
    }

    private static void collect(
            PdfDictionary node,
            int depth,
            int maxDepth,
            VisitedSet visited,
            Map<String, PdfObject> entries) {
        if (node == null) {
            return;
        }
        if (depth > maxDepth) {
            logger.debug("Name tree deeper than {} levels; ignoring the rest", maxDepth);
            return;
        }
        if (!visited.markVisited(node)) {
            return;
        }

        PdfArray names = node.getAsArray(PdfName.Names);
        if (names != null) {
            for (int i = 0; i + 1 < names.size(); i += 2) {
                String key = PdfObjects.nameKey(names.get(i));
                if (key != null) {
                    entries.putIfAbsent(key, names.get(i + 1, false));
                }
            }
        }

        PdfArray kids = node.getAsArray(PdfName.Kids);
        if (kids != null) {
            for (int i = 0; i < kids.size(); i++) {
                collect(PdfObjects.dictionary(kids.get(i)), depth + 1, maxDepth, visited, entries);
            }
        }
    }
}
