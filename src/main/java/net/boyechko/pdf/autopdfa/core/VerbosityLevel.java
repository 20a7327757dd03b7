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

/**
 * How much the command line prints, from least to most: QUIET (errors and final status), NORMAL
 * (one box per step plus a summary), VERBOSE (also informational log messages), DEBUG (also
 * debug logs, which name every object changed).
 */
public enum VerbosityLevel {
    QUIET("ERROR"),
    NORMAL("WARN"),
    VERBOSE("INFO"),
    DEBUG("DEBUG");

    private final String logLevel;

    VerbosityLevel(String logLevel) {
        this.logLevel = logLevel;
    }

    /** Name of the lowest log level shown at this verbosity, e.g. {@code "INFO"}. */
    public String logLevel() {
        return logLevel;
    }

    /** Returns true if this level is at least as verbose as {@code other}. */
    public boolean isAtLeast(VerbosityLevel other) {
        return ordinal() >= other.ordinal();
    }
}
