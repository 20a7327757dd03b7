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

import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfNumber;
import com.itextpdf.kernel.pdf.PdfObject;
import net.boyechko.pdf.autopdfa.document.PdfObjects;

/**
 * Decides whether an action dictionary may stay in a PDF/A document (ISO 19005-2, 6.6.1).
 *
 * <p>Classification never throws: anything that is not a readable action dictionary is {@link
 * ActionCompliance#MALFORMED}, and malformed actions are treated as non-compliant by every caller.
 */
public class ActionClassifier {
    private static final PdfName FLAGS = new PdfName("Flags");

    private final ActionPolicy policy;

    public ActionClassifier() {
        this(ActionPolicy.loadDefault());
    }

    public ActionClassifier(ActionPolicy policy) {
        this.policy = policy;
    }

    public ActionPolicy policy() {
        return policy;
    }

    public ActionCompliance classify(PdfObject action) {
        PdfDictionary dict = PdfObjects.dictionary(action);
        if (dict == null) {
            return ActionCompliance.MALFORMED;
        }
        PdfName subtype = dict.getAsName(PdfName.S);
        if (subtype == null) {
            return ActionCompliance.MALFORMED;
        }

        ActionType type = ActionType.fromName(subtype);
        if (!policy.allows(type)) {
            return ActionCompliance.FORBIDDEN;
        }
        return switch (type) {
            case NAMED -> classifyNamed(dict);
            case SUBMIT_FORM -> classifySubmitForm(dict);
            default -> ActionCompliance.COMPLIANT;
        };
    }

    public boolean isCompliant(PdfObject action) {
        return classify(action).isCompliant();
    }

    /** Only page navigation is permitted; a Named action without /N is forbidden. */
    private ActionCompliance classifyNamed(PdfDictionary action) {
        PdfName name = action.getAsName(PdfName.N);
        if (name != null && policy.allowsNamedAction(name.getValue())) {
            return ActionCompliance.COMPLIANT;
        }
        return ActionCompliance.FORBIDDEN;
    }

    /** The submission format must be one the policy names, e.g. XFDF or PDF. */
    private ActionCompliance classifySubmitForm(PdfDictionary action) {
        int mask = policy.submitFormFlagMask();
        if (mask == 0) {
            return ActionCompliance.COMPLIANT;
        }
        PdfObject raw = action.get(FLAGS);
        int flags;
        if (raw == null) {
            flags = 0;
        } else if (raw instanceof PdfNumber number) {
            flags = number.intValue();
        } else {
            return ActionCompliance.FORBIDDEN;
        }
        return (flags & mask) != 0 ? ActionCompliance.COMPLIANT : ActionCompliance.FORBIDDEN;
    }
}
