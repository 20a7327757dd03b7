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
import com.itextpdf.kernel.pdf.PdfString;
import java.util.ArrayList;
import net.boyechko.pdf.autopdfa.actions.ActionType;
import net.boyechko.pdf.autopdfa.core.ComplianceStep;
import net.boyechko.pdf.autopdfa.document.DocContext;
import net.boyechko.pdf.autopdfa.document.PageSet;
import net.boyechko.pdf.autopdfa.document.PdfObjects;
import net.boyechko.pdf.autopdfa.traversal.DocumentGraphWalker;
import net.boyechko.pdf.autopdfa.traversal.GraphNode;
import net.boyechko.pdf.autopdfa.traversal.GraphVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes destinations that point at pages no longer in the document.
 *
 * <p>Checks the catalog's /OpenAction, the /Dest and GoTo /A entries of annotations and outline
 * items, and the named destinations themselves. GoToR and GoToE actions target other files and are
 * not checked. A destination is valid only if its page is one of the document's live pages.
 *
 * <p>Named destinations are resolved against a snapshot taken before the walk, so the order in
 * which the name tree is pruned does not affect which references are kept.
 */
public class DestinationValidator implements GraphVisitor, ComplianceStep {
    private static final Logger logger = LoggerFactory.getLogger(DestinationValidator.class);

    private static final PdfName GO_TO = ActionType.GO_TO.pdfName();

    private final int maxDepth;

    private PageSet pages;
    private NamedDestinations namedDests;

    public DestinationValidator() {
        this(DocumentGraphWalker.DEFAULT_MAX_DEPTH);
    }

    public DestinationValidator(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    @Override
    public String name() {
        return "Destination validation";
    }

    @Override
    public String passedMessage() {
        return "All destinations point to existing pages";
    }

    @Override
    public int apply(DocContext ctx) {
        return validateDestinations(ctx);
    }

    /** Walks the whole document and returns the number of invalid destinations removed. */
    public int validateDestinations(DocContext ctx) {
        DocumentGraphWalker walker = new DocumentGraphWalker(maxDepth).addVisitor(this);
        int removed = walker.walk(ctx).changes();
        if (removed > 0) {
            logger.info("{} invalid destination(s) removed", removed);
        }
        return removed;
    }

    @Override
    public void beforeTraversal(DocContext ctx) {
        pages = ctx.pageSet();
        namedDests = NamedDestinations.load(ctx.catalog(), maxDepth);
        logger.debug(
                "Validating destinations against {} page(s), {} named destination(s)",
                pages.size(),
                namedDests.size());
    }

    @Override
    public int visit(GraphNode node) {
        return switch (node.role()) {
            case CATALOG -> checkOpenAction(node) + pruneLegacyDests(node);
            case ANNOTATION, OUTLINE_ITEM -> checkDest(node) + checkGoToAction(node, PdfName.A);
            case NAME_TREE_NODE -> PdfName.Dests.equals(node.treeName()) ? pruneNames(node) : 0;
            default -> 0;
        };
    }

    // == Destination-bearing entries ==================================

    /** /OpenAction is either an explicit destination or an action. */
    private int checkOpenAction(GraphNode node) {
        PdfDictionary catalog = node.object();
        PdfObject raw = catalog.get(PdfName.OpenAction, false);
        if (raw == null) {
            return 0;
        }
        if (PdfObjects.resolve(raw) instanceof PdfArray dest) {
            if (isValidDestination(dest)) {
                return 0;
            }
            return remove(catalog, PdfName.OpenAction, node);
        }
        return checkGoToAction(node, PdfName.OpenAction);
    }

    private int checkDest(GraphNode node) {
        PdfDictionary host = node.object();
        PdfObject raw = host.get(PdfName.Dest, false);
        if (raw == null || isValidDestination(raw)) {
            return 0;
        }
        return remove(host, PdfName.Dest, node);
    }

    /** Removes a GoTo action under {@code key} whose /D is invalid. Other actions are ignored. */
    private int checkGoToAction(GraphNode node, PdfName key) {
        PdfDictionary host = node.object();
        PdfDictionary action = PdfObjects.dictionary(host.get(key, false));
        if (action == null || !GO_TO.equals(action.getAsName(PdfName.S))) {
            return 0;
        }
        PdfObject dest = action.get(PdfName.D, false);
        if (dest == null || isValidDestination(dest)) {
            return 0;
        }
        return remove(host, key, node);
    }

    /**
     * Returns true if {@code dest} (an explicit destination array, or a name or string naming one)
     * targets a live page. Dangling references and other object types are invalid.
     */
    private boolean isValidDestination(PdfObject dest) {
        PdfObject resolved = PdfObjects.resolve(dest);
        if (resolved instanceof PdfArray array) {
            return targetsLivePage(array);
        }
        if (resolved instanceof PdfString || resolved instanceof PdfName) {
            return targetsLivePage(namedDests.resolve(resolved));
        }
        return false;
    }

    /** The first element of an explicit destination is the target page. */
    private boolean targetsLivePage(PdfArray dest) {
        return dest != null && !dest.isEmpty() && pages.containsPage(dest.get(0, false));
    }

    private static int remove(PdfDictionary host, PdfName key, GraphNode node) {
        host.remove(key);
        host.setModified();
        logger.debug("Removed invalid {} destination from {}", key, node.describe());
        return 1;
    }

    // == Named destinations ===========================================

    /** Drops invalid key/value pairs from one node of the /Dests name tree. */
    private int pruneNames(GraphNode node) {
        PdfDictionary treeNode = node.object();
        PdfArray names = treeNode.getAsArray(PdfName.Names);
        if (names == null) {
            return 0;
        }

        int removed = 0;
        for (int i = names.size() - 2 - (names.size() % 2); i >= 0; i -= 2) {
            if (!targetsLivePage(NamedDestinations.explicitArray(names.get(i + 1, false)))) {
                logger.debug(
                        "Removed named destination '{}' from {}",
                        PdfObjects.nameKey(names.get(i)),
                        node.describe());
                names.remove(i + 1);
                names.remove(i);
                removed++;
            }
        }
        if (removed > 0) {
            if (names.isEmpty()) {
                treeNode.remove(PdfName.Names);
            }
            names.setModified();
            treeNode.setModified();
        }
        return removed;
    }

    /** Drops invalid entries from the catalog's legacy /Dests dictionary. */
    private int pruneLegacyDests(GraphNode node) {
        PdfDictionary catalog = node.object();
        PdfDictionary dests = PdfObjects.dictionary(catalog.get(PdfName.Dests, false));
        if (dests == null) {
            return 0;
        }

        int removed = 0;
        for (PdfName key : new ArrayList<>(dests.keySet())) {
            if (!targetsLivePage(NamedDestinations.explicitArray(dests.get(key, false)))) {
                dests.remove(key);
                logger.debug("Removed legacy named destination {}", key);
                removed++;
            }
        }
        if (removed > 0) {
            dests.setModified();
            if (dests.isEmpty()) {
                catalog.remove(PdfName.Dests);
                catalog.setModified();
            }
        }
        return removed;
    }
}
