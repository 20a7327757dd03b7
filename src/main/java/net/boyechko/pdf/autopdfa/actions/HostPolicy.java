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

import net.boyechko.pdf.autopdfa.traversal.GraphNode;

/**
 * What {@link ActionSanitizer} does with the actions of each kind of host object. The first
 * disposition applies to the host's action entry (/OpenAction on the catalog, /A elsewhere), the
 * second to its /AA additional-actions dictionary.
 */
public enum HostPolicy {
    CATALOG(Disposition.CLASSIFY, Disposition.CLASSIFY),
    /** ISO 19005-2, 6.6.2: a page dictionary shall not contain /AA. */
    PAGE(Disposition.NONE, Disposition.REMOVE),
    /** ISO 19005-2, 6.4.1 and 6.6.2: widgets shall not contain /A or /AA. */
    WIDGET(Disposition.REMOVE, Disposition.REMOVE),
    /** ISO 19005-2, 6.4.1: form fields shall not contain /A or /AA. */
    FIELD(Disposition.REMOVE, Disposition.REMOVE),
    ANNOTATION(Disposition.CLASSIFY, Disposition.CLASSIFY),
    OUTLINE_ITEM(Disposition.CLASSIFY, Disposition.NONE),
    INERT(Disposition.NONE, Disposition.NONE);

    public enum Disposition {
        /** Leave the entry alone. */
        NONE,
        /** Keep compliant actions, with their /Next chains sanitized; remove the rest. */
        CLASSIFY,
        /** Remove the entry whatever it holds. */
        REMOVE
    }

    private final Disposition action;
    private final Disposition additionalActions;

    HostPolicy(Disposition action, Disposition additionalActions) {
        this.action = action;
        this.additionalActions = additionalActions;
    }

    public Disposition action() {
        return action;
    }

    public Disposition additionalActions() {
        return additionalActions;
    }

    public static HostPolicy of(GraphNode node) {
        return switch (node.role()) {
            case CATALOG -> CATALOG;
            case PAGE -> PAGE;
            case ANNOTATION -> node.isWidget() ? WIDGET : ANNOTATION;
            case FIELD -> FIELD;
            case OUTLINE_ITEM -> OUTLINE_ITEM;
            default -> INERT;
        };
    }
}
