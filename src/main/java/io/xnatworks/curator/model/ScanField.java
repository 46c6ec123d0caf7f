/*
 * XNAT Scan Curator
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.curator.model;

/**
 * Scan fields the curator is allowed to write back to XNAT.
 */
public enum ScanField {
    TYPE("type"),
    QUALITY("quality");

    private final String xnatName;

    ScanField(String xnatName) {
        this.xnatName = xnatName;
    }

    /**
     * Element name under the scan's xsiType, e.g. {@code xnat:mrScanData/type}.
     */
    public String getXnatName() {
        return xnatName;
    }
}
