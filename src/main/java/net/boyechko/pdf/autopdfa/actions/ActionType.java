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

import com.itextpdf.kernel.pdf.PdfName;
import java.util.HashMap;
import java.util.Map;

/** Action types defined by ISO 32000-2, Table 201, keyed by their /S value. */
public enum ActionType {
    GO_TO("GoTo"),
    GO_TO_R("GoToR"),
    GO_TO_E("GoToE"),
    GO_TO_DP("GoToDp"),
    LAUNCH("Launch"),
    THREAD("Thread"),
    URI("URI"),
    SOUND("Sound"),
    MOVIE("Movie"),
    HIDE("Hide"),
    NAMED("Named"),
    SUBMIT_FORM("SubmitForm"),
    RESET_FORM("ResetForm"),
    IMPORT_DATA("ImportData"),
    SET_OCG_STATE("SetOCGState"),
    RENDITION("Rendition"),
    TRANS("Trans"),
    GO_TO_3D_VIEW("GoTo3DView"),
    JAVASCRIPT("JavaScript"),
    RICH_MEDIA_EXECUTE("RichMediaExecute"),
    /** Any /S value not listed above. */
    UNKNOWN(null);

    private static final Map<String, ActionType> BY_NAME = new HashMap<>();

    static {
        for (ActionType type : values()) {
            if (type.pdfName != null) {
                BY_NAME.put(type.pdfName.getValue(), type);
            }
        }
    }

    private final PdfName pdfName;

    ActionType(String name) {
        this.pdfName = name != null ? new PdfName(name) : null;
    }

    /** The /S value of this type, or {@code null} for {@link #UNKNOWN}. */
    public PdfName pdfName() {
        return pdfName;
    }

    public static ActionType fromName(PdfName name) {
        return name != null ? fromName(name.getValue()) : UNKNOWN;
    }

    /** Looks up a type by its /S value without the leading slash, e.g. {@code "GoTo"}. */
    public static ActionType fromName(String name) {
        return name != null ? BY_NAME.getOrDefault(name, UNKNOWN) : UNKNOWN;
    }
}
