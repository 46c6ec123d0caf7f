/*
 * XNAT Scan Curator
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.curator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A diagnostic result attached to one scan, or to the subject when
 * {@link #getScanId()} is null. Findings are produced fresh on every run.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class Finding {

    private final FindingType type;
    private final String scanId;
    private final String reason;
    private final List<String> candidates;

    private Finding(FindingType type, String scanId, String reason, List<String> candidates) {
        this.type = Objects.requireNonNull(type, "type");
        this.scanId = scanId;
        this.reason = reason;
        this.candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
    }

    public static Finding labelFailure(String subjectLabel) {
        return new Finding(FindingType.VALID_LABEL_FAILURE, null,
                "Subject label '" + subjectLabel + "' does not match the AA0000_vN convention",
                Collections.emptyList());
    }

    public static Finding unusableMarker(String scanId, String reason) {
        return new Finding(FindingType.UNUSABLE_MARKER, scanId, reason, Collections.emptyList());
    }

    public static Finding duplicateType(String scanId, String reason) {
        return new Finding(FindingType.DUPLICATE_TYPE, scanId, reason, Collections.emptyList());
    }

    public static Finding incomplete(String scanId, String reason) {
        return new Finding(FindingType.INCOMPLETE_ACQUISITION, scanId, reason, Collections.emptyList());
    }

    public static Finding qualityMismatch(String scanId, String reason) {
        return new Finding(FindingType.QUALITY_MISMATCH, scanId, reason, Collections.emptyList());
    }

    public static Finding resolvedRename(String scanId, String candidate, String reason) {
        return new Finding(FindingType.RESOLVED_RENAME, scanId, reason, Collections.singletonList(candidate));
    }

    public static Finding ambiguousRename(String scanId, List<String> candidates, String reason) {
        return new Finding(FindingType.AMBIGUOUS_RENAME, scanId, reason, candidates);
    }

    @JsonProperty("type")
    public FindingType getType() {
        return type;
    }

    @JsonProperty("scanId")
    public String getScanId() {
        return scanId;
    }

    @JsonProperty("reason")
    public String getReason() {
        return reason;
    }

    /**
     * Canonical type candidates; one entry for a resolved rename, two or more
     * for an ambiguous one, empty otherwise.
     */
    @JsonProperty("candidates")
    public List<String> getCandidates() {
        return candidates;
    }

    /**
     * The single canonical type of a resolved rename, otherwise null.
     */
    @JsonIgnore
    public String getCandidate() {
        return type == FindingType.RESOLVED_RENAME ? candidates.get(0) : null;
    }

    public boolean is(FindingType other) {
        return type == other;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Finding)) return false;
        Finding other = (Finding) o;
        return type == other.type
                && Objects.equals(scanId, other.scanId)
                && Objects.equals(reason, other.reason)
                && candidates.equals(other.candidates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, scanId, reason, candidates);
    }

    @Override
    public String toString() {
        return scanId == null
                ? String.format("%s: %s", type, reason)
                : String.format("%s[scan %s]: %s", type, scanId, reason);
    }
}
