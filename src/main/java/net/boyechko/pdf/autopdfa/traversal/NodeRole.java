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

/** Structural role under which the walker presents a node to its visitors. */
public enum NodeRole {
    CATALOG("catalog"),
    PAGE("page"),
    RESOURCES("resource dictionary"),
    FORM_XOBJECT("Form XObject"),
    TILING_PATTERN("tiling pattern"),
    TYPE3_FONT("Type 3 font"),
    ANNOTATION("annotation"),
    APPEARANCE("appearance stream"),
    FIELD("form field"),
    OUTLINE_ROOT("outline root"),
    OUTLINE_ITEM("outline item"),
    NAME_TREE_NODE("name tree node");

    private final String label;

    NodeRole(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
