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

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summary of the processing of a PDF document.
 *
 * @param changesByStep Number of changes made by each step, in the order the steps ran.
 * @param tempOutputFile The path to the temporary output file.
 */
public record ProcessingResult(Map<String, Integer> changesByStep, Path tempOutputFile) {

    public ProcessingResult {
        changesByStep = Collections.unmodifiableMap(new LinkedHashMap<>(changesByStep));
    }

    public int totalChanges() {
        return changesByStep.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int changesFor(String stepName) {
        return changesByStep.getOrDefault(stepName, 0);
    }

    public boolean hasChanges() {
        return totalChanges() > 0;
    }
}
