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
package net.boyechko.pdf.autopdfa.actions;

import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfObject;
import java.util.ArrayList;
import net.boyechko.pdf.autopdfa.core.ComplianceStep;
import net.boyechko.pdf.autopdfa.document.DocContext;
import net.boyechko.pdf.autopdfa.document.PdfObjects;
import net.boyechko.pdf.autopdfa.traversal.DocumentGraphWalker;
import net.boyechko.pdf.autopdfa.traversal.GraphNode;
import net.boyechko.pdf.autopdfa.traversal.GraphVisitor;
import net.boyechko.pdf.autopdfa.traversal.VisitedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes actions PDF/A does not permit from every host that can carry them: the catalog, pages,
 * annotations, form fields and outline items (ISO 19005-2, 6.6.1 and 6.6.2). What happens on each
 * host is decided by its {@link HostPolicy}.
 */
public class ActionSanitizer implements GraphVisitor, ComplianceStep {
    private static final Logger logger = LoggerFactory.getLogger(ActionSanitizer.class);

    private final ActionClassifier classifier;
    private final NextChainSanitizer chainSanitizer;

    /** Action dictionaries already sanitized in this pass. */
    private VisitedSet sanitizedActions = new VisitedSet();

    public ActionSanitizer() {
        this(new ActionClassifier());
    }

    public ActionSanitizer(ActionClassifier classifier) {
        this.classifier = classifier;
        this.chainSanitizer = new NextChainSanitizer(classifier);
    }

    @Override
    public String name() {
        return "Action sanitization";
    }

    @Override
    public String passedMessage() {
        return "All actions are PDF/A compliant";
    }

    @Override
    public int apply(DocContext ctx) {
        return sanitizeActions(ctx);
    }

    /** Walks the whole document and returns the number of actions removed. */
    public int sanitizeActions(DocContext ctx) {
        DocumentGraphWalker walker =
                new DocumentGraphWalker(classifier.policy().maxDepth()).addVisitor(this);
        int removed = walker.walk(ctx).changes();
        if (removed > 0) {
            logger.info("{} non-compliant action(s) removed", removed);
        }
        return removed;
    }

    @Override
    public void beforeTraversal(DocContext ctx) {
        sanitizedActions = new VisitedSet();
    }

    @Override
    public int visit(GraphNode node) {
        HostPolicy policy = HostPolicy.of(node);
        if (policy == HostPolicy.INERT) {
            return 0;
        }
        PdfDictionary host = node.object();
        PdfName actionKey = policy == HostPolicy.CATALOG ? PdfName.OpenAction : PdfName.A;

        int removed = 0;
        removed +=
                switch (policy.action()) {
                    case CLASSIFY -> classifyEntry(host, actionKey, node);
                    case REMOVE -> removeEntry(host, actionKey, node);
                    case NONE -> 0;
                };
        removed +=
                switch (policy.additionalActions()) {
                    case CLASSIFY -> classifyAdditionalActions(host, node);
                    case REMOVE -> removeEntry(host, PdfName.AA, node);
                    case NONE -> 0;
                };
        return removed;
    }

    /**
     * Keeps the action under {@code key} if it is compliant, sanitizing its /Next chain, and
     * removes it otherwise. An /OpenAction array is a destination, not an action. Dangling
     * references are skipped.
     */
    private int classifyEntry(PdfDictionary owner, PdfName key, GraphNode node) {
        PdfObject raw = owner.get(key, false);
        if (raw == null) {
            return 0;
        }
        PdfObject action = PdfObjects.resolve(raw);
        if (action == null) {
            return 0;
        }
        if (action instanceof PdfArray && PdfName.OpenAction.equals(key)) {
            return 0;
        }

        ActionCompliance verdict = classifier.classify(action);
        if (!verdict.isCompliant()) {
            owner.remove(key);
            owner.setModified();
            logger.debug("Removed {} {} action from {}", verdict, key, node.describe());
            return 1;
        }
        return chainSanitizer.sanitize(PdfObjects.dictionary(action), sanitizedActions);
    }

    /**
     * Classifies each trigger of the host's /AA. An /AA left empty is deleted from the host without
     * being counted, which also covers a shared /AA already emptied through another host.
     */
    private int classifyAdditionalActions(PdfDictionary host, GraphNode node) {
        PdfObject raw = host.get(PdfName.AA, false);
        if (raw == null) {
            return 0;
        }
        PdfObject resolved = PdfObjects.resolve(raw);
        if (resolved == null) {
            return 0;
        }
        if (!(resolved instanceof PdfDictionary triggers)) {
            return removeEntry(host, PdfName.AA, node);
        }

        int removed = 0;
        for (PdfName trigger : new ArrayList<>(triggers.keySet())) {
            removed += classifyEntry(triggers, trigger, node);
        }
        if (triggers.isEmpty()) {
            host.remove(PdfName.AA);
            host.setModified();
            logger.debug("Removed empty /AA from {}", node.describe());
        }
        return removed;
    }

    private static int removeEntry(PdfDictionary host, PdfName key, GraphNode node) {
        if (host.get(key, false) == null) {
            return 0;
        }
        host.remove(key);
        host.setModified();
        logger.debug("Removed {} from {}", key, node.describe());
        return 1;
    }
}
