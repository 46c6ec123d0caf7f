/*
 * XNAT Scan Curator
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.curator.engine;

import io.xnatworks.curator.model.Finding;
import io.xnatworks.curator.model.FindingType;
import io.xnatworks.curator.model.Scan;
import io.xnatworks.curator.rules.RenameRule;
import io.xnatworks.curator.rules.RuleContext;
import io.xnatworks.curator.rules.RuleTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Resolves the canonical type of a scan from the rule table.
 *
 * Only scans that are the single scan of their type and carry no unusable
 * marker are looked up. One distinct candidate resolves the rename; several
 * are reported as ambiguous and nothing is picked.
 */
public class RenameResolver {
    private static final Logger log = LoggerFactory.getLogger(RenameResolver.class);

    private final RuleTable ruleTable;

    public RenameResolver(RuleTable ruleTable) {
        this.ruleTable = ruleTable;
    }

    /**
     * @param model        the session snapshot
     * @param scan         scan to resolve
     * @param scanFindings classifier findings for this scan
     * @return a RESOLVED_RENAME or AMBIGUOUS_RENAME finding, or null when the
     *         scan is not eligible, nothing matched, or it already carries the
     *         canonical type
     */
    public Finding resolve(SessionModel model, Scan scan, List<Finding> scanFindings) {
        if (!isEligible(scanFindings)) {
            return null;
        }

        RuleContext context = new RuleContext(model.getProjectCode(), scan.getType(), scan.getModality());
        List<RenameRule> matches = ruleTable.lookup(scan.getSeriesDescription(), context);
        if (matches.isEmpty()) {
            log.debug("[{}] scan {}: no rename rule for '{}'",
                    model.getSubjectLabel(), scan.getId(), scan.getSeriesDescription());
            return null;
        }

        // sorted so the ambiguous candidate list does not depend on rule order
        Map<String, List<RenameRule>> byCandidate = new TreeMap<>();
        for (RenameRule rule : matches) {
            if (rule.getUpdatedScanType() == null) {
                log.warn("[{}] scan {}: ignoring rule without updated scan type: {}",
                        model.getSubjectLabel(), scan.getId(), rule);
                continue;
            }
            byCandidate.computeIfAbsent(rule.getUpdatedScanType(), k -> new ArrayList<>()).add(rule);
        }

        if (byCandidate.isEmpty()) {
            return null;
        }
        if (byCandidate.size() > 1) {
            List<String> candidates = new ArrayList<>(byCandidate.keySet());
            log.info("[{}] scan {}: {} competing rename candidates for '{}': {}",
                    model.getSubjectLabel(), scan.getId(), candidates.size(),
                    scan.getSeriesDescription(), candidates);
            return Finding.ambiguousRename(scan.getId(), candidates,
                    "Description '" + scan.getSeriesDescription() + "' matches rules for "
                            + String.join(", ", candidates));
        }

        Map.Entry<String, List<RenameRule>> only = byCandidate.entrySet().iterator().next();
        String candidate = only.getKey();
        if (candidate.equals(scan.getType())) {
            log.debug("[{}] scan {} already has canonical type '{}'",
                    model.getSubjectLabel(), scan.getId(), candidate);
            return null;
        }
        return Finding.resolvedRename(scan.getId(), candidate, "Matched " + only.getValue().get(0));
    }

    static boolean isEligible(List<Finding> scanFindings) {
        for (Finding finding : scanFindings) {
            if (finding.is(FindingType.DUPLICATE_TYPE) || finding.is(FindingType.UNUSABLE_MARKER)) {
                return false;
            }
        }
        return true;
    }
}
