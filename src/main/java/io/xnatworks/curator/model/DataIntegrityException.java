/*
 * XNAT Scan Curator
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.curator.model;

/**
 * Session or scan data from the archive is missing or malformed.
 * Fatal for the affected session; retrying does not change the data.
 */
public class DataIntegrityException extends Exception {

    public enum Kind {
        MISSING_METADATA,
        DUPLICATE_SCAN_ID,
        MULTIPLE_SESSIONS
    }

    private final Kind kind;
    private final String subjectLabel;

    public DataIntegrityException(Kind kind, String subjectLabel, String message) {
        super("[" + subjectLabel + "] " + message);
        this.kind = kind;
        this.subjectLabel = subjectLabel;
    }

    public Kind getKind() {
        return kind;
    }

    public String getSubjectLabel() {
        return subjectLabel;
    }
}
