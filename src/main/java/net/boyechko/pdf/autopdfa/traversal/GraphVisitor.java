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

import net.boyechko.pdf.autopdfa.document.DocContext;

/**
 * Visitor interface for {@link DocumentGraphWalker}. A visitor may mutate the node it is given,
 * but not the structural links (/Kids, /First, /Next, /Annots, /Resources) the walker follows.
 */
public interface GraphVisitor {

    String name();

    /** Inspects {@code node} and returns the number of changes made to it. */
    int visit(GraphNode node);

    default void beforeTraversal(DocContext ctx) {}

    default void afterTraversal() {}
}
