/*
 * XNAT Scan Curator
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.curator.engine;

import io.xnatworks.curator.model.DataIntegrityException;
import io.xnatworks.curator.model.Scan;
import io.xnatworks.curator.model.Session;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated, read-only snapshot of one session used for a single engine run.
 * Scans are grouped by current type once, at construction.
 */
public final class SessionModel {

    private final Session session;
    private final Map<String, Scan> scansById;
    private final Map<String, List<Scan>> scansByType;

    private SessionModel(Session session, Map<String, Scan> scansById, Map<String, List<Scan>> scansByType) {
        this.session = session;
        this.scansById = scansById;
        this.scansByType = scansByType;
    }

    /**
     * Build a model from a fetched session.
     *
     * @throws DataIntegrityException if the session has no ID, no scans, a scan
     *                                without ID, or two scans with the same ID
     */
    public static SessionModel of(Session session) throws DataIntegrityException {
        String subject = session.getSubjectLabel();
        if (isBlank(session.getSessionId())) {
            throw new DataIntegrityException(DataIntegrityException.Kind.MISSING_METADATA, subject,
                    "Session has no identifier");
        }
        if (session.getScans().isEmpty()) {
            throw new DataIntegrityException(DataIntegrityException.Kind.MISSING_METADATA, subject,
                    "Session " + session.getSessionId() + " has no scans");
        }

        Map<String, Scan> byId = new LinkedHashMap<>();
        Map<String, List<Scan>> byType = new LinkedHashMap<>();
        int position = 0;
        for (Scan scan : session.getScans()) {
            position++;
            if (isBlank(scan.getId())) {
                throw new DataIntegrityException(DataIntegrityException.Kind.MISSING_METADATA, subject,
                        "Scan #" + position + " in session " + session.getSessionId() + " has no identifier");
            }
            if (byId.putIfAbsent(scan.getId(), scan) != null) {
                throw new DataIntegrityException(DataIntegrityException.Kind.DUPLICATE_SCAN_ID, subject,
                        "Scan ID " + scan.getId() + " appears more than once in session " + session.getSessionId());
            }
            byType.computeIfAbsent(typeKey(scan), k -> new ArrayList<>()).add(scan);
        }

        Map<String, List<Scan>> frozen = new LinkedHashMap<>();
        byType.forEach((type, scans) -> frozen.put(type, Collections.unmodifiableList(scans)));
        return new SessionModel(session,
                Collections.unmodifiableMap(byId),
                Collections.unmodifiableMap(frozen));
    }

    public Session getSession() {
        return session;
    }

    public String getSubjectLabel() {
        return session.getSubjectLabel();
    }

    public String getSessionId() {
        return session.getSessionId();
    }

    public List<Scan> getScans() {
        return session.getScans();
    }

    public Scan getScan(String scanId) {
        return scansById.get(scanId);
    }

    /**
     * Scans grouped by current type, in order of first appearance.
     * A missing type is grouped under the empty string.
     */
    public Map<String, List<Scan>> getScansByType() {
        return scansByType;
    }

    /**
     * Scans sharing the given scan's current type, including the scan itself.
     */
    public List<Scan> siblingsOf(Scan scan) {
        return scansByType.getOrDefault(typeKey(scan), Collections.emptyList());
    }

    public boolean isSingletonType(Scan scan) {
        return siblingsOf(scan).size() == 1;
    }

    public boolean isLabelValid() {
        return SubjectLabelValidator.validate(session.getSubjectLabel());
    }

    /**
     * Project code of the subject, or null when the label is invalid.
     */
    public String getProjectCode() {
        return isLabelValid() ? SubjectLabelValidator.projectCode(session.getSubjectLabel()) : null;
    }

    static String typeKey(Scan scan) {
        return scan.getType() == null ? "" : scan.getType();
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
