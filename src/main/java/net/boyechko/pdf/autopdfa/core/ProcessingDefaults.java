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
package net.boyechko.pdf.autopdfa.core;

import java.util.List;
import net.boyechko.pdf.autopdfa.actions.ActionClassifier;
import net.boyechko.pdf.autopdfa.actions.ActionPolicy;
import net.boyechko.pdf.autopdfa.actions.ActionSanitizer;
import net.boyechko.pdf.autopdfa.actions.JavaScriptNameTreeRemoval;
import net.boyechko.pdf.autopdfa.destinations.DestinationValidator;
import net.boyechko.pdf.autopdfa.forms.XfaFormRemoval;

public final class ProcessingDefaults {
    private ProcessingDefaults() {}

    /**
     * The steps of a full remediation, in order. Destinations are validated last so that
     * GoTo actions removed as non-compliant are not counted twice.
     */
    public static List<ComplianceStep> steps() {
        return steps(ActionPolicy.loadDefault());
    }

    public static List<ComplianceStep> steps(ActionPolicy policy) {
        return List.of(
                new ActionSanitizer(new ActionClassifier(policy)),
                new JavaScriptNameTreeRemoval(),
                new XfaFormRemoval(),
                new DestinationValidator(policy.maxDepth()));
    }
}
