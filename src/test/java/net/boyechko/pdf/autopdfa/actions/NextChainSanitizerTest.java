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

import static org.junit.jupiter.api.Assertions.*;

import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfNumber;
import net.boyechko.pdf.autopdfa.traversal.VisitedSet;
import org.junit.jupiter.api.Test;

public class NextChainSanitizerTest {
    private final NextChainSanitizer sanitizer = new NextChainSanitizer(new ActionClassifier());

    @Test
    void keepsCompliantSingleLinkUntouched() {
        PdfDictionary head = action("GoTo");
        PdfDictionary uri = action("URI");
        head.put(PdfName.Next, uri);

        assertEquals(0, sanitizer.sanitize(head));
        assertSame(uri, head.get(PdfName.Next));
    }

    @Test
    void removesForbiddenSingleLink() {
        PdfDictionary head = action("GoTo");
        head.put(PdfName.Next, action("Launch"));

        assertEquals(1, sanitizer.sanitize(head));
        assertFalse(head.containsKey(PdfName.Next), "/Next should be removed entirely");
    }

    @Test
    void filtersArrayPreservingOrder() {
        PdfDictionary head = action("GoTo");
        PdfDictionary uri = action("URI");
        PdfDictionary goTo = action("GoTo");
        PdfArray next = new PdfArray();
        next.add(uri);
        next.add(action("Launch"));
        next.add(goTo);
        head.put(PdfName.Next, next);

        assertEquals(1, sanitizer.sanitize(head));

        PdfArray result = head.getAsArray(PdfName.Next);
        assertNotNull(result, "Two survivors should stay an array");
        assertEquals(2, result.size());
        assertSame(uri, result.get(0));
        assertSame(goTo, result.get(1));
    }

    @Test
    void collapsesSingleSurvivorToBareAction() {
        PdfDictionary head = action("GoTo");
        PdfDictionary uri = action("URI");
        PdfArray next = new PdfArray();
        next.add(action("JavaScript"));
        next.add(uri);
        head.put(PdfName.Next, next);

        assertEquals(1, sanitizer.sanitize(head));
        assertSame(uri, head.get(PdfName.Next), "One-element array should become a bare action");
    }

    @Test
    void collapsesOneElementArrayWithoutCountingIt() {
        PdfDictionary head = action("GoTo");
        PdfDictionary uri = action("URI");
        head.put(PdfName.Next, new PdfArray(uri));

        assertEquals(0, sanitizer.sanitize(head));
        assertSame(uri, head.get(PdfName.Next));
    }

    @Test
    void removesArrayWhenNothingSurvives() {
        PdfDictionary head = action("GoTo");
        PdfArray next = new PdfArray();
        next.add(action("JavaScript"));
        next.add(action("Launch"));
        head.put(PdfName.Next, next);

        assertEquals(2, sanitizer.sanitize(head));
        assertFalse(head.containsKey(PdfName.Next));
    }

    @Test
    void droppedLinkCountsItsWholeSubChain() {
        PdfDictionary head = action("GoTo");
        PdfDictionary launch = action("Launch");
        PdfDictionary uri = action("URI");
        PdfDictionary goTo = action("GoTo");
        head.put(PdfName.Next, launch);
        launch.put(PdfName.Next, uri);
        uri.put(PdfName.Next, goTo);

        assertEquals(3, sanitizer.sanitize(head), "Launch plus the two actions behind it");
        assertFalse(head.containsKey(PdfName.Next));
    }

    @Test
    void sanitizesDeeperLinksOfCompliantActions() {
        PdfDictionary head = action("GoTo");
        PdfDictionary uri = action("URI");
        head.put(PdfName.Next, uri);
        uri.put(PdfName.Next, action("JavaScript"));

        assertEquals(1, sanitizer.sanitize(head));
        assertSame(uri, head.get(PdfName.Next));
        assertFalse(uri.containsKey(PdfName.Next));
    }

    @Test
    void removesMalformedLinks() {
        PdfDictionary head = action("GoTo");
        PdfDictionary untyped = new PdfDictionary();
        PdfArray next = new PdfArray();
        next.add(new PdfNumber(7));
        next.add(untyped);
        next.add(action("URI"));
        head.put(PdfName.Next, next);

        assertEquals(2, sanitizer.sanitize(head));
        assertEquals(PdfName.URI, head.getAsDictionary(PdfName.Next).getAsName(PdfName.S));
    }

    @Test
    void terminatesOnCyclicChain() {
        PdfDictionary first = action("GoTo");
        PdfDictionary second = action("URI");
        first.put(PdfName.Next, second);
        second.put(PdfName.Next, first);

        assertEquals(0, sanitizer.sanitize(first));
        assertSame(second, first.get(PdfName.Next), "Compliant cycles are left in place");
        assertSame(first, second.get(PdfName.Next));
    }

    @Test
    void countingTerminatesOnCycleBehindDroppedLink() {
        PdfDictionary head = action("GoTo");
        PdfDictionary launch = action("Launch");
        PdfDictionary uri = action("URI");
        head.put(PdfName.Next, launch);
        launch.put(PdfName.Next, uri);
        uri.put(PdfName.Next, launch);

        assertEquals(2, sanitizer.sanitize(head));
    }

    @Test
    void sharedVisitedSetSkipsChainsAlreadySanitized() {
        PdfDictionary shared = action("URI");
        shared.put(PdfName.Next, action("JavaScript"));
        PdfDictionary first = action("GoTo");
        PdfDictionary second = action("GoTo");
        first.put(PdfName.Next, shared);
        second.put(PdfName.Next, shared);
        VisitedSet visited = new VisitedSet();

        assertEquals(1, sanitizer.sanitize(first, visited));
        assertEquals(0, sanitizer.sanitize(second, visited), "Shared tail is counted once");
    }

    @Test
    void isIdempotent() {
        PdfDictionary head = action("GoTo");
        PdfArray next = new PdfArray();
        next.add(action("URI"));
        next.add(action("Launch"));
        next.add(action("Named"));
        next.add(action("GoToR"));
        head.put(PdfName.Next, next);

        assertEquals(2, sanitizer.sanitize(head));
        assertEquals(0, sanitizer.sanitize(head), "A second pass should find nothing");
    }

    private static PdfDictionary action(String type) {
        PdfDictionary action = new PdfDictionary();
        action.put(PdfName.Type, PdfName.Action);
        action.put(PdfName.S, new PdfName(type));
        return action;
    }
}
