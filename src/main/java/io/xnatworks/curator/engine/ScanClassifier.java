/*
 * XNAT Scan Curator
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.curator.engine;

import io.xnatworks.curator.model.Finding;
import io.xnatworks.curator.model.Scan;
import io.xnatworks.curator.quality.QualityExpectations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Runs the per-scan checks of a session:
 * - unusable markers (INC, BAD) in the type or series description
 * - duplicate current types within the session
 * - frame count against the expected count for the modality
 * - recorded quality signals that disagree with expectation
 *
 * Only the duplicate check looks at sibling scans; the groups come from
 * {@link SessionModel}, which builds them from the whole scan set up front.
 */
public class ScanClassifier {
    private static final Logger log = LoggerFactory.getLogger(ScanClassifier.class);

    public static final List<String> DEFAULT_MARKERS = Collections.unmodifiableList(Arrays.asList("INC", "BAD"));
    public static final String DEFAULT_USABLE_QUALITY = "usable";

    private final QualityExpectations expectations;
    private final List<String> markers;
    private final String usableQuality;

    public ScanClassifier(QualityExpectations expectations) {
        this(expectations, DEFAULT_MARKERS, DEFAULT_USABLE_QUALITY);
    }

    public ScanClassifier(QualityExpectations expectations, Collection<String> markers, String usableQuality) {
        this.expectations = expectations;
        this.usableQuality = usableQuality;
        List<String> upper = new ArrayList<>();
        for (String marker : markers) {
            if (marker != null && !marker.trim().isEmpty()) {
                upper.add(marker.trim().toUpperCase(Locale.ROOT));
            }
        }
        this.markers = Collections.unmodifiableList(upper);
    }

    /**
     * Classify every scan of the session.
     *
     * @return findings per scan ID, in session scan order; scans without
     *         findings map to an empty list
     */
    public Map<String, List<Finding>> classify(SessionModel model) {
        Map<String, List<Finding>> result = new LinkedHashMap<>();
        for (Scan scan : model.getScans()) {
            List<Finding> findings = new ArrayList<>();

            Finding marker = checkUnusableMarker(scan);
            if (marker != null) {
                findings.add(marker);
            }
            Finding duplicate = checkDuplicate(model, scan);
            if (duplicate != null) {
                findings.add(duplicate);
            }
            Finding incomplete = checkIncomplete(scan);
            if (incomplete != null) {
                findings.add(incomplete);
            }
            findings.addAll(checkQuality(scan, marker != null));

            if (!findings.isEmpty()) {
                log.debug("[{}] scan {} ({}): {}", model.getSubjectLabel(), scan.getId(), scan.getType(), findings);
            }
            result.put(scan.getId(), Collections.unmodifiableList(findings));
        }
        return Collections.unmodifiableMap(result);
    }

    Finding checkUnusableMarker(Scan scan) {
        List<String> hits = new ArrayList<>();
        for (String marker : markers) {
            if (containsMarker(scan.getType(), marker)) {
                hits.add(marker + " in type '" + scan.getType() + "'");
            } else if (containsMarker(scan.getSeriesDescription(), marker)) {
                hits.add(marker + " in description '" + scan.getSeriesDescription() + "'");
            }
        }
        if (hits.isEmpty()) {
            return null;
        }
        return Finding.unusableMarker(scan.getId(), "Unusable marker " + String.join(", ", hits));
    }

    Finding checkDuplicate(SessionModel model, Scan scan) {
        List<Scan> siblings = model.siblingsOf(scan);
        if (siblings.size() < 2) {
            return null;
        }
        List<String> others = new ArrayList<>();
        for (Scan sibling : siblings) {
            if (!sibling.getId().equals(scan.getId())) {
                others.add(sibling.getId());
            }
        }
        return Finding.duplicateType(scan.getId(),
                "Type '" + SessionModel.typeKey(scan) + "' shared with scan(s) " + String.join(", ", others));
    }

    Finding checkIncomplete(Scan scan) {
        OptionalInt expected = expectations.expectedFor(scan.getModality());
        if (!expected.isPresent() || scan.getFrames() == null) {
            return null;
        }
        if (scan.getFrames() == expected.getAsInt()) {
            return null;
        }
        return Finding.incomplete(scan.getId(), String.format("%d frames, expected %d for %s",
                scan.getFrames(), expected.getAsInt(), scan.getModality()));
    }

    List<Finding> checkQuality(Scan scan, boolean markedUnusable) {
        List<Finding> findings = new ArrayList<>();
        String quality = scan.getQuality();
        if (!markedUnusable && quality != null && !quality.trim().isEmpty()
                && !quality.trim().equalsIgnoreCase(usableQuality)) {
            findings.add(Finding.qualityMismatch(scan.getId(),
                    "Recorded quality '" + quality.trim() + "' but no unusable marker in name"));
        }
        OptionalInt expected = expectations.expectedFor(scan.getModality());
        if (expected.isPresent() && scan.getFrames() == null) {
            findings.add(Finding.qualityMismatch(scan.getId(), String.format(
                    "Frame count unknown, expected %d for %s", expected.getAsInt(), scan.getModality())));
        }
        return findings;
    }

    private static boolean containsMarker(String value, String marker) {
        return value != null && value.toUpperCase(Locale.ROOT).contains(marker);
    }

    public List<String> getMarkers() {
        return markers;
    }
}
