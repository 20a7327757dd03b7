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
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfNumber;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfStream;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.autopdfa.document.DocContext;
import net.boyechko.pdf.autopdfa.document.PdfObjects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks the document object graph once, invoking every registered visitor at each node.
 *
 * <p>Roots are visited in this order: the catalog, the pages (with their resources and
 * annotations), the AcroForm field tree, the outline tree, and the name trees of the catalog's
 * /Names dictionary. Each object is presented at most once per walk, under the role of the first
 * path that reached it, so shared and cyclic structures terminate and are never fixed twice.
 *
 * <p>Corrupt input never aborts the walk: dangling references end their branch, branches deeper
 * than the depth cap are cut off, and a visitor that throws on one node is logged and skipped.
 */
public class DocumentGraphWalker {
    private static final Logger logger = LoggerFactory.getLogger(DocumentGraphWalker.class);

    public static final int DEFAULT_MAX_DEPTH = 32;

    private static final PdfName[] APPEARANCE_KEYS = {PdfName.N, PdfName.R, PdfName.D};
    private static final int TILING_PATTERN_TYPE = 1;

    private final int maxDepth;
    private final List<GraphVisitor> visitors = new ArrayList<>();

    private DocContext docCtx;
    private VisitedSet visited;
    private int nodesVisited;
    private int changes;

    /** Totals for one walk. */
    public record WalkSummary(int nodesVisited, int changes) {}

    public DocumentGraphWalker() {
        this(DEFAULT_MAX_DEPTH);
    }

    public DocumentGraphWalker(int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public DocumentGraphWalker addVisitor(GraphVisitor visitor) {
        visitors.add(visitor);
        return this;
    }

    public int maxDepth() {
        return maxDepth;
    }

    public WalkSummary walk(DocContext docCtx) {
        this.docCtx = docCtx;
        this.visited = new VisitedSet();
        this.nodesVisited = 0;
        this.changes = 0;

        for (GraphVisitor visitor : visitors) {
            visitor.beforeTraversal(docCtx);
        }

        PdfDictionary catalog = docCtx.catalog();
        enter(catalog, NodeRole.CATALOG, 0, 0, null);
        walkPages(docCtx.doc());
        walkFields(catalog);
        walkOutlines(catalog);
        walkNameTrees(catalog);

        for (GraphVisitor visitor : visitors) {
            visitor.afterTraversal();
        }

        logger.debug("Visited {} nodes, {} change(s)", nodesVisited, changes);
        return new WalkSummary(nodesVisited, changes);
    }

    // == Node dispatch ================================================

    /**
     * Presents {@code node} to all visitors unless it was already visited or lies below the depth
     * cap. Returns true if the node is new and its children should be walked.
     */
    private boolean enter(PdfDictionary node, NodeRole role, int depth, int pageNum, PdfName tree) {
        if (node == null || depth > maxDepth || !visited.markVisited(node)) {
            return false;
        }
        nodesVisited++;

        GraphNode ctx = new GraphNode(node, role, depth, pageNum, tree, docCtx);
        for (GraphVisitor visitor : visitors) {
            try {
                changes += visitor.visit(ctx);
            } catch (RuntimeException e) {
                logger.warn(
                        "Error in visitor {} at {}: {}",
                        visitor.name(),
                        ctx.describe(),
                        e.getMessage());
            }
        }
        return true;
    }

    // == Pages, resources and annotations =============================

    private void walkPages(PdfDocument doc) {
        int count = doc.getNumberOfPages();
        for (int pageNum = 1; pageNum <= count; pageNum++) {
            PdfDictionary pageDict;
            try {
                pageDict = doc.getPage(pageNum).getPdfObject();
            } catch (RuntimeException e) {
                logger.debug("Skipping unreadable page {}: {}", pageNum, e.getMessage());
                continue;
            }
            if (!enter(pageDict, NodeRole.PAGE, 0, pageNum, null)) {
                continue;
            }
            PdfObject resources = PdfObjects.inherited(pageDict, PdfName.Resources);
            walkResources(PdfObjects.dictionary(resources), 1, pageNum);
            walkAnnotations(pageDict, 1, pageNum);
        }
    }

    private void walkResources(PdfDictionary resources, int depth, int pageNum) {
        if (resources == null || depth > maxDepth) {
            return;
        }
        if (!enter(resources, NodeRole.RESOURCES, depth, pageNum, null)) {
            return;
        }

        PdfDictionary xobjects = resources.getAsDictionary(PdfName.XObject);
        if (xobjects != null) {
            for (PdfName name : new ArrayList<>(xobjects.keySet())) {
                PdfStream xobject = PdfObjects.stream(xobjects.get(name));
                if (PdfObjects.hasSubtype(xobject, PdfName.Form)
                        && enter(xobject, NodeRole.FORM_XOBJECT, depth + 1, pageNum, null)) {
                    walkResources(
                            PdfObjects.dictionary(xobject, PdfName.Resources), depth + 2, pageNum);
                }
            }
        }

        PdfDictionary patterns = resources.getAsDictionary(PdfName.Pattern);
        if (patterns != null) {
            for (PdfName name : new ArrayList<>(patterns.keySet())) {
                PdfDictionary pattern = PdfObjects.dictionary(patterns.get(name));
                if (isTilingPattern(pattern)
                        && enter(pattern, NodeRole.TILING_PATTERN, depth + 1, pageNum, null)) {
                    walkResources(
                            PdfObjects.dictionary(pattern, PdfName.Resources), depth + 2, pageNum);
                }
            }
        }

        PdfDictionary fonts = resources.getAsDictionary(PdfName.Font);
        if (fonts != null) {
            for (PdfName name : new ArrayList<>(fonts.keySet())) {
                PdfDictionary font = PdfObjects.dictionary(fonts.get(name));
                if (PdfObjects.hasSubtype(font, PdfName.Type3)
                        && enter(font, NodeRole.TYPE3_FONT, depth + 1, pageNum, null)) {
                    walkResources(
                            PdfObjects.dictionary(font, PdfName.Resources), depth + 2, pageNum);
                }
            }
        }
    }

    private static boolean isTilingPattern(PdfDictionary pattern) {
        if (pattern == null) {
            return false;
        }
        PdfNumber type = pattern.getAsNumber(PdfName.PatternType);
        return type != null && type.intValue() == TILING_PATTERN_TYPE;
    }

    private void walkAnnotations(PdfDictionary pageDict, int depth, int pageNum) {
        PdfArray annots = pageDict.getAsArray(PdfName.Annots);
        if (annots == null) {
            return;
        }
        for (int i = 0; i < annots.size(); i++) {
            PdfDictionary annot = PdfObjects.dictionary(annots.get(i));
            if (enter(annot, NodeRole.ANNOTATION, depth, pageNum, null)) {
                walkAppearances(annot, depth + 1, pageNum);
            }
        }
    }

    /**
     * Visits the /N, /R and /D appearances of an annotation. Each is either a single stream or a
     * dictionary of appearance-state streams (e.g. /On and /Off of a check box).
     */
    private void walkAppearances(PdfDictionary annot, int depth, int pageNum) {
        PdfDictionary ap = annot.getAsDictionary(PdfName.AP);
        if (ap == null || depth > maxDepth) {
            return;
        }
        for (PdfName key : APPEARANCE_KEYS) {
            PdfObject entry = PdfObjects.resolve(ap.get(key));
            if (entry instanceof PdfStream stream) {
                walkAppearanceStream(stream, depth, pageNum);
            } else if (entry instanceof PdfDictionary states) {
                for (PdfName state : new ArrayList<>(states.keySet())) {
                    PdfStream stream = PdfObjects.stream(states.get(state));
                    if (stream != null) {
                        walkAppearanceStream(stream, depth, pageNum);
                    }
                }
            }
        }
    }

    private void walkAppearanceStream(PdfStream stream, int depth, int pageNum) {
        if (enter(stream, NodeRole.APPEARANCE, depth, pageNum, null)) {
            walkResources(PdfObjects.dictionary(stream, PdfName.Resources), depth + 1, pageNum);
        }
    }

    // == Form fields ==================================================

    private void walkFields(PdfDictionary catalog) {
        PdfDictionary acroForm = catalog.getAsDictionary(PdfName.AcroForm);
        if (acroForm == null) {
            return;
        }
        walkFieldArray(acroForm.getAsArray(PdfName.Fields), 0);
    }

    /** Walks fields top-down through /Kids; /Parent is never followed. */
    private void walkFieldArray(PdfArray fields, int depth) {
        if (fields == null || depth > maxDepth) {
            return;
        }
        for (int i = 0; i < fields.size(); i++) {
            PdfDictionary field = PdfObjects.dictionary(fields.get(i));
            if (enter(field, NodeRole.FIELD, depth, 0, null)) {
                walkFieldArray(field.getAsArray(PdfName.Kids), depth + 1);
            }
        }
    }

    // == Outlines =====================================================

    private void walkOutlines(PdfDictionary catalog) {
        PdfDictionary outlines = catalog.getAsDictionary(PdfName.Outlines);
        if (enter(outlines, NodeRole.OUTLINE_ROOT, 0, 0, null)) {
            walkOutlineChildren(outlines, 0);
        }
    }

    /**
     * Walks /First and its /Next siblings, descending into each item's own /First. An item already
     * visited elsewhere is skipped, but the siblings after it are still followed.
     */
    private void walkOutlineChildren(PdfDictionary parent, int depth) {
        if (depth > maxDepth) {
            return;
        }
        VisitedSet siblings = new VisitedSet();
        PdfDictionary item = parent.getAsDictionary(PdfName.First);
        while (item != null && siblings.markVisited(item)) {
            if (enter(item, NodeRole.OUTLINE_ITEM, depth, 0, null)) {
                walkOutlineChildren(item, depth + 1);
            }
            item = item.getAsDictionary(PdfName.Next);
        }
    }

    // == Name trees ===================================================

    private void walkNameTrees(PdfDictionary catalog) {
        PdfDictionary names = catalog.getAsDictionary(PdfName.Names);
        if (names == null) {
            return;
        }
        for (PdfName treeName : new ArrayList<>(names.keySet())) {
            walkNameTreeNode(names.getAsDictionary(treeName), treeName, 0);
        }
    }

    private void walkNameTreeNode(PdfDictionary node, PdfName treeName, int depth) {
        if (node == null) {
            return;
        }
        if (depth > maxDepth) {
            logger.debug("{} name tree deeper than {} levels; not descending", treeName, maxDepth);
            return;
        }
        if (!enter(node, NodeRole.NAME_TREE_NODE, depth, 0, treeName)) {
            return;
        }
        PdfArray kids = node.getAsArray(PdfName.Kids);
        if (kids != null) {
            for (int i = 0; i < kids.size(); i++) {
                walkNameTreeNode(PdfObjects.dictionary(kids.get(i)), treeName, depth + 1);
            }
        }
    }
}
