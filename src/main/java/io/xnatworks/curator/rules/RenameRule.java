/*
 * XNAT Scan Curator
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.curator.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One row of the rename rule table: scans whose series description matches
 * (and whose project, type and modality match, where the rule pins them)
 * should carry {@link #getUpdatedScanType()} as their type.
 *
 * Blank project, scan type or modality match any value.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RenameRule {

    private final String project;
    private final String seriesDescription;
    private final String scanType;
    private final String modality;
    private final String updatedScanType;

    @JsonCreator
    public RenameRule(@JsonProperty("project") String project,
                      @JsonProperty("series_description") String seriesDescription,
                      @JsonProperty("scan_type") String scanType,
                      @JsonProperty("modality") String modality,
                      @JsonProperty("updated_scan_type") String updatedScanType) {
        this.project = blankToNull(project);
        this.seriesDescription = blankToNull(seriesDescription);
        this.scanType = blankToNull(scanType);
        this.modality = blankToNull(modality);
        this.updatedScanType = blankToNull(updatedScanType);
    }

    @JsonProperty("project")
    public String getProject() {
        return project;
    }

    @JsonProperty("series_description")
    public String getSeriesDescription() {
        return seriesDescription;
    }

    @JsonProperty("scan_type")
    public String getScanType() {
        return scanType;
    }

    @JsonProperty("modality")
    public String getModality() {
        return modality;
    }

    @JsonProperty("updated_scan_type")
    public String getUpdatedScanType() {
        return updatedScanType;
    }

    /**
     * True when this rule applies to a scan with the given description and context.
     */
    public boolean matches(String description, RuleContext context) {
        if (seriesDescription == null || description == null) {
            return false;
        }
        if (!seriesDescription.equals(description.trim())) {
            return false;
        }
        return pinnedMatches(project, context.getProjectCode())
                && pinnedMatches(scanType, context.getScanType())
                && pinnedMatchesIgnoreCase(modality, context.getModality());
    }

    /**
     * Number of context fields the rule pins. Higher is more specific.
     */
    public int specificity() {
        int pinned = 0;
        if (project != null) pinned++;
        if (scanType != null) pinned++;
        if (modality != null) pinned++;
        return pinned;
    }

    /**
     * Whether the row can be used at all.
     */
    public boolean isComplete() {
        return seriesDescription != null && updatedScanType != null;
    }

    private static boolean pinnedMatches(String pinned, String actual) {
        return pinned == null || (actual != null && pinned.equals(actual.trim()));
    }

    private static boolean pinnedMatchesIgnoreCase(String pinned, String actual) {
        return pinned == null || (actual != null && pinned.equalsIgnoreCase(actual.trim()));
    }

    private static String blankToNull(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RenameRule)) return false;
        RenameRule other = (RenameRule) o;
        return Objects.equals(project, other.project)
                && Objects.equals(seriesDescription, other.seriesDescription)
                && Objects.equals(scanType, other.scanType)
                && Objects.equals(modality, other.modality)
                && Objects.equals(updatedScanType, other.updatedScanType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(project, seriesDescription, scanType, modality, updatedScanType);
    }

    @Override
    public String toString() {
        return String.format("rule[project=%s, description='%s', type=%s, modality=%s] -> %s",
                project == null ? "*" : project,
                seriesDescription,
                scanType == null ? "*" : "'" + scanType + "'",
                modality == null ? "*" : modality,
                updatedScanType);
    }
}
