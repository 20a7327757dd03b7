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

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Table of the action types PDF/A permits, loaded from YAML. The bundled table follows ISO
 * 19005-2, 6.6.1.
 */
public final class ActionPolicy {
    private static final String DEFAULT_POLICY_RESOURCE = "/pdfa-action-policy.yaml";
    private static final Logger logger = LoggerFactory.getLogger(ActionPolicy.class);

    private static final int DEFAULT_MAX_DEPTH = 32;
    private static final int MAX_FLAG_BIT = 32;

    public Set<String> allowed_actions;
    public Set<String> allowed_named_actions;

    /**
     * submit_form_required_flags: 1-based bit positions of the SubmitForm /Flags entry. A
     * SubmitForm action is allowed only if at least one of them is set. Empty means no check.
     */
    public List<Integer> submit_form_required_flags;

    public Integer max_depth;

    private transient Set<ActionType> allowedTypes;
    private transient int submitFormFlagMask;

    public ActionPolicy() {
        this.allowed_actions = new HashSet<>();
        this.allowed_named_actions = new HashSet<>();
        this.submit_form_required_flags = new ArrayList<>();
    }

    /**
     * Load an ActionPolicy from a classpath resource.
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static ActionPolicy fromResource(String resourcePath) {
        try (var inputStream = ActionPolicy.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }

            var yaml = new Yaml(new Constructor(ActionPolicy.class, new LoaderOptions()));
            ActionPolicy policy = yaml.load(inputStream);
            if (policy == null) {
                throw new IllegalArgumentException("Empty policy");
            }
            policy.compile();

            logger.debug(
                    "Loaded ActionPolicy with {} allowed action types from resource {}",
                    policy.allowedTypes.size(),
                    resourcePath);
            return policy;
        } catch (Exception e) {
            logger.error(
                    "Failed to load ActionPolicy from resource {}: {}",
                    resourcePath,
                    e.getMessage());
            throw new IllegalStateException(
                    "Failed to load action policy from resource "
                            + resourcePath
                            + ": "
                            + e.getMessage(),
                    e);
        }
    }

    /** Load the PDF/A-2 policy bundled with the application. */
    public static ActionPolicy loadDefault() {
        return fromResource(DEFAULT_POLICY_RESOURCE);
    }

    /** Resolves the raw YAML values; fails on values that cannot be interpreted. */
    private void compile() {
        if (allowed_actions == null) {
            allowed_actions = new HashSet<>();
        }
        if (allowed_named_actions == null) {
            allowed_named_actions = new HashSet<>();
        }
        if (submit_form_required_flags == null) {
            submit_form_required_flags = new ArrayList<>();
        }

        allowedTypes = EnumSet.noneOf(ActionType.class);
        for (String name : allowed_actions) {
            ActionType type = ActionType.fromName(name);
            if (type == ActionType.UNKNOWN) {
                logger.warn("Policy allows unrecognized action type '{}'; ignoring it", name);
            } else {
                allowedTypes.add(type);
            }
        }

        submitFormFlagMask = 0;
        for (Integer bit : submit_form_required_flags) {
            if (bit == null || bit < 1 || bit > MAX_FLAG_BIT) {
                throw new IllegalArgumentException(
                        "submit_form_required_flags: bit position out of range: " + bit);
            }
            submitFormFlagMask |= 1 << (bit - 1);
        }

        if (max_depth == null) {
            max_depth = DEFAULT_MAX_DEPTH;
        } else if (max_depth < 1) {
            throw new IllegalArgumentException("max_depth must be positive: " + max_depth);
        }
    }

    public boolean allows(ActionType type) {
        return allowedTypes.contains(type);
    }

    /** Returns true if a Named action with /N {@code name} (no leading slash) is permitted. */
    public boolean allowsNamedAction(String name) {
        return name != null && allowed_named_actions.contains(name);
    }

    /** Bit mask of the SubmitForm flags of which at least one must be set; 0 disables the check. */
    public int submitFormFlagMask() {
        return submitFormFlagMask;
    }

    public int maxDepth() {
        return max_depth;
    }
}
