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
import java.util.List;
import net.boyechko.pdf.autopdfa.document.Format;
import net.boyechko.pdf.autopdfa.document.PdfObjects;
import net.boyechko.pdf.autopdfa.traversal.VisitedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes non-compliant actions from the /Next chain of an action (ISO 32000-1, 12.6.2), so a
 * forbidden action cannot hide behind a compliant one.
 *
 * <p>/Next holds one action or an array of them. After sanitizing it is absent, a single action,
 * or an array of at least two actions; a one-element array is never written back.
 */
public class NextChainSanitizer {
    private static final Logger logger = LoggerFactory.getLogger(NextChainSanitizer.class);

    private final ActionClassifier classifier;

    public NextChainSanitizer(ActionClassifier classifier) {
        this.classifier = classifier;
    }

    /** Sanitizes the chain below {@code action} with a fresh cycle guard. */
    public int sanitize(PdfDictionary action) {
        return sanitize(action, new VisitedSet());
    }

    /**
     * Sanitizes the chain below {@code action} in place and returns the number of actions
     * removed. A dropped action counts once, plus once for every action in its own /Next
     * sub-chain. Actions already in {@code visited} are left alone, which ends cycles and keeps a
     * shared chain from being counted twice in one pass.
     */
    public int sanitize(PdfDictionary action, VisitedSet visited) {
        if (action == null || !visited.markVisited(action)) {
            return 0;
        }
        PdfObject rawNext = action.get(PdfName.Next, false);
        if (rawNext == null) {
            return 0;
        }

        PdfArray nextArray =
                PdfObjects.resolve(rawNext) instanceof PdfArray array ? array : null;
        List<PdfObject> links = new ArrayList<>();
        if (nextArray != null) {
            for (int i = 0; i < nextArray.size(); i++) {
                links.add(nextArray.get(i, false));
            }
        } else {
            links.add(rawNext);
        }

        int removed = 0;
        List<PdfObject> survivors = new ArrayList<>();
        for (PdfObject link : links) {
            PdfObject target = PdfObjects.resolve(link);
            ActionCompliance verdict = classifier.classify(target);
            if (verdict.isCompliant()) {
                removed += sanitize(PdfObjects.dictionary(target), visited);
                survivors.add(link);
            } else {
                int dropped = 1 + countChain(PdfObjects.dictionary(target), new VisitedSet());
                logger.debug(
                        "Dropped {} /Next action {} ({} action(s) in total)",
                        verdict,
                        Format.obj(link),
                        dropped);
                removed += dropped;
            }
        }

        collapse(action, rawNext, nextArray, survivors);
        return removed;
    }

    /** Writes the surviving links back as nothing, a bare link, or an array. */
    private static void collapse(
            PdfDictionary action,
            PdfObject rawNext,
            PdfArray nextArray,
            List<PdfObject> survivors) {
        if (survivors.isEmpty()) {
            action.remove(PdfName.Next);
            action.setModified();
        } else if (survivors.size() == 1) {
            PdfObject link = survivors.get(0);
            if (nextArray != null || link != rawNext) {
                action.put(PdfName.Next, link);
                action.setModified();
            }
        } else if (survivors.size() < nextArray.size()) {
            nextArray.clear();
            for (PdfObject link : survivors) {
                nextArray.add(link);
            }
            nextArray.setModified();
        }
    }

    /** Counts the actions reachable through the /Next links of {@code action}. */
    private static int countChain(PdfDictionary action, VisitedSet counted) {
        if (action == null || !counted.markVisited(action)) {
            return 0;
        }
        PdfObject next = PdfObjects.resolve(action.get(PdfName.Next, false));
        if (next == null) {
            return 0;
        }
        List<PdfObject> links = new ArrayList<>();
        if (next instanceof PdfArray array) {
            for (int i = 0; i < array.size(); i++) {
                links.add(array.get(i, false));
            }
        } else {
            links.add(next);
        }

        int count = 0;
        for (PdfObject link : links) {
            PdfDictionary target = PdfObjects.dictionary(link);
            if (target != null && counted.isVisited(target)) {
                continue;
            }
            count += 1 + countChain(target, counted);
        }
        return count;
    }
}
