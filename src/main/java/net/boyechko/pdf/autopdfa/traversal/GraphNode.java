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

import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfName;
import net.boyechko.pdf.autopdfa.document.DocContext;
import net.boyechko.pdf.autopdfa.document.Format;
import net.boyechko.pdf.autopdfa.document.PdfObjects;

/**
 * Context passed to visitors for each node of the document graph.
 *
 * @param object the resolved node
 * @param role the structural role the node was reached under
 * @param depth nesting depth below its root (pages, fields and outline items at the top are 0)
 * @param pageNumber page the node was reached from, or 0 if not reached through a page
 * @param treeName for {@link NodeRole#NAME_TREE_NODE}, the key of the tree in the /Names
 *     dictionary (e.g. /Dests); otherwise {@code null}
 * @param docCtx the document being walked
 */
public record GraphNode(
        PdfDictionary object,
        NodeRole role,
        int depth,
        int pageNumber,
        PdfName treeName,
        DocContext docCtx) {

    public boolean hasRole(NodeRole other) {
        return role == other;
    }

    public boolean isWidget() {
        return PdfObjects.hasSubtype(object, PdfName.Widget);
    }

    public int objNum() {
        return PdfObjects.objNum(object);
    }

    /** Returns a label such as {@code "annotation obj. #12 (p. 3)"} for log messages. */
    public String describe() {
        return role.label() + " " + Format.obj(object, pageNumber);
    }
}
