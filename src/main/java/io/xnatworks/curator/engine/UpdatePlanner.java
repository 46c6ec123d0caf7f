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
import io.xnatworks.curator.model.ScanField;
import io.xnatworks.curator.model.UpdatePlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds the findings of a session into an {@link UpdatePlan}.
 *
 * Unusable markers go to the "unusable" bucket (quality field), resolved
 * renames without duplicate, marker or incompleteness findings go to the
 * "rename" bucket (type field) unless the target type would end up on more
 * than one scan; everything else is left for human review.
 * The fold walks scans in session order and has no other input, so equal
 * inputs give equal plans.
 */
public class UpdatePlanner {
    private static final Logger log = LoggerFactory.getLogger(UpdatePlanner.class);

    public static final String DEFAULT_UNUSABLE_QUALITY = "unusable";

    private final String usableQuality;
    private final String unusableQuality;

    public UpdatePlanner() {
        this(ScanClassifier.DEFAULT_USABLE_QUALITY, DEFAULT_UNUSABLE_QUALITY);
    }

    public UpdatePlanner(String usableQuality, String unusableQuality) {
        this.usableQuality = usableQuality;
        this.unusableQuality = unusableQuality;
    }

    public UpdatePlan plan(SessionModel model, Map<String, List<Finding>> findingsByScan) {
        List<UpdatePlan.Item> unusable = new ArrayList<>();
        List<UpdatePlan.Item> rename = new ArrayList<>();
        List<UpdatePlan.Unchanged> noAction = new ArrayList<>();
        boolean labelValid = model.isLabelValid();

        Map<String, String> renameTargets = labelValid
                ? renameTargets(model, findingsByScan)
                : Collections.emptyMap();
        Map<String, String> collisions = collisions(model, findingsByScan, renameTargets);

        for (Scan scan : model.getScans()) {
            List<Finding> findings = findingsByScan.getOrDefault(scan.getId(), Collections.emptyList());

            if (!labelValid) {
                List<String> reasons = new ArrayList<>();
                reasons.add("Subject label '" + model.getSubjectLabel() + "' failed validation");
                reasons.addAll(reasonsOf(findings));
                noAction.add(new UpdatePlan.Unchanged(scan.getId(), reasons));
                continue;
            }

            Finding marker = first(findings, FindingType.UNUSABLE_MARKER);
            if (marker != null) {
                unusable.add(new UpdatePlan.Item(UpdatePlan.Bucket.UNUSABLE, model.getSessionId(), scan,
                        ScanField.QUALITY, usableQuality, unusableQuality, marker.getReason()));
                continue;
            }

            String target = renameTargets.get(scan.getId());
            if (target != null && !collisions.containsKey(scan.getId())) {
                Finding renameFinding = first(findings, FindingType.RESOLVED_RENAME);
                rename.add(new UpdatePlan.Item(UpdatePlan.Bucket.RENAME, model.getSessionId(), scan,
                        ScanField.TYPE, scan.getSeriesDescription(), target, renameFinding.getReason()));
                continue;
            }

            List<String> reasons = reasonsOf(findings);
            if (collisions.containsKey(scan.getId())) {
                reasons.add(collisions.get(scan.getId()));
            }
            noAction.add(new UpdatePlan.Unchanged(scan.getId(), reasons));
        }

        UpdatePlan plan = new UpdatePlan(model.getSubjectLabel(), model.getSessionId(), unusable, rename, noAction);
        log.info("[{}] Plan for session {}: {} unusable, {} rename, {} no action",
                model.getSubjectLabel(), model.getSessionId(), unusable.size(), rename.size(), noAction.size());
        return plan;
    }

    /**
     * Renames the findings allow: a resolved rename on a scan without marker,
     * duplicate or incompleteness findings. Keyed by scan ID.
     */
    private static Map<String, String> renameTargets(SessionModel model, Map<String, List<Finding>> findingsByScan) {
        Map<String, String> targets = new LinkedHashMap<>();
        for (Scan scan : model.getScans()) {
            List<Finding> findings = findingsByScan.getOrDefault(scan.getId(), Collections.emptyList());
            Finding renameFinding = first(findings, FindingType.RESOLVED_RENAME);
            if (renameFinding != null
                    && first(findings, FindingType.UNUSABLE_MARKER) == null
                    && first(findings, FindingType.DUPLICATE_TYPE) == null
                    && first(findings, FindingType.INCOMPLETE_ACQUISITION) == null) {
                targets.put(scan.getId(), renameFinding.getCandidate());
            }
        }
        return targets;
    }

    /**
     * Renames whose target type would be shared with another usable scan once
     * the plan is applied, with the reason. Scans marked unusable do not hold
     * their type. Rejecting a rename leaves that scan on its current type,
     * which can collide with another target, so this repeats until no new
     * collision appears.
     */
    private static Map<String, String> collisions(SessionModel model, Map<String, List<Finding>> findingsByScan,
                                                  Map<String, String> renameTargets) {
        Map<String, String> rejected = new LinkedHashMap<>();
        boolean changed = true;
        while (changed) {
            changed = false;
            Map<String, List<String>> scansByFinalType = new LinkedHashMap<>();
            for (Scan scan : model.getScans()) {
                List<Finding> findings = findingsByScan.getOrDefault(scan.getId(), Collections.emptyList());
                if (first(findings, FindingType.UNUSABLE_MARKER) != null) {
                    continue;
                }
                String target = rejected.containsKey(scan.getId()) ? null : renameTargets.get(scan.getId());
                String finalType = target != null ? target : SessionModel.typeKey(scan);
                scansByFinalType.computeIfAbsent(finalType, k -> new ArrayList<>()).add(scan.getId());
            }
            for (Map.Entry<String, String> entry : renameTargets.entrySet()) {
                String scanId = entry.getKey();
                if (rejected.containsKey(scanId)) {
                    continue;
                }
                List<String> others = new ArrayList<>(scansByFinalType.get(entry.getValue()));
                others.remove(scanId);
                if (!others.isEmpty()) {
                    rejected.put(scanId, "Rename target '" + entry.getValue() + "' collides with scan(s) "
                            + String.join(", ", others));
                    changed = true;
                }
            }
        }
        if (!rejected.isEmpty()) {
            log.info("[{}] Holding back {} colliding rename(s): {}",
                    model.getSubjectLabel(), rejected.size(), rejected.keySet());
        }
        return rejected;
    }

    private static Finding first(List<Finding> findings, FindingType type) {
        for (Finding finding : findings) {
            if (finding.is(type)) {
                return finding;
            }
        }
        return null;
    }

    private static List<String> reasonsOf(List<Finding> findings) {
        List<String> reasons = new ArrayList<>(findings.size());
        for (Finding finding : findings) {
            reasons.add(finding.getType() + ": " + finding.getReason());
        }
        return reasons;
    }
}
