/*
 * XNAT Scan Curator
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.curator.rules;

/**
 * Context fields passed to a rule lookup alongside the series description.
 */
public final class RuleContext {

    private final String projectCode;
    private final String scanType;
    private final String modality;

    public RuleContext(String projectCode, String scanType, String modality) {
        this.projectCode = projectCode;
        this.scanType = scanType;
        this.modality = modality;
    }

    /**
     * Study code taken from the subject label, e.g. LD4 for LD4001_v1.
     */
    public String getProjectCode() {
        return projectCode;
    }

    public String getScanType() {
        return scanType;
    }

    public String getModality() {
        return modality;
    }

    @Override
    public String toString() {
        return String.format("RuleContext{project=%s, type=%s, modality=%s}", projectCode, scanType, modality);
    }
}
