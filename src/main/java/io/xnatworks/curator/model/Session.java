/*
 * XNAT Scan Curator
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.curator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One imaging visit of one subject, with its scans in archive order.
 * The scan list is copied on construction and never changes afterwards.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Session {

    private final String subjectLabel;
    private final String sessionId;
    private final String sessionLabel;
    private final String project;
    private final String date;
    private final List<Scan> scans;

    public Session(String subjectLabel, String sessionId, String sessionLabel,
                   String project, String date, List<Scan> scans) {
        this.subjectLabel = subjectLabel;
        this.sessionId = sessionId;
        this.sessionLabel = sessionLabel;
        this.project = project;
        this.date = date;
        this.scans = scans != null
                ? Collections.unmodifiableList(new ArrayList<>(scans))
                : Collections.emptyList();
    }

    @JsonProperty("subjectLabel")
    public String getSubjectLabel() {
        return subjectLabel;
    }

    /**
     * XNAT experiment accession ID (e.g. XNAT_E00042).
     */
    @JsonProperty("sessionId")
    public String getSessionId() {
        return sessionId;
    }

    @JsonProperty("sessionLabel")
    public String getSessionLabel() {
        return sessionLabel;
    }

    @JsonProperty("project")
    public String getProject() {
        return project;
    }

    @JsonProperty("date")
    public String getDate() {
        return date;
    }

    @JsonProperty("scans")
    public List<Scan> getScans() {
        return scans;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Session)) return false;
        Session other = (Session) o;
        return Objects.equals(subjectLabel, other.subjectLabel)
                && Objects.equals(sessionId, other.sessionId)
                && Objects.equals(sessionLabel, other.sessionLabel)
                && Objects.equals(project, other.project)
                && Objects.equals(date, other.date)
                && scans.equals(other.scans);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subjectLabel, sessionId, sessionLabel, project, date, scans);
    }

    @Override
    public String toString() {
        return String.format("Session{subject=%s, id=%s, label=%s, scans=%d}",
                subjectLabel, sessionId, sessionLabel, scans.size());
    }
}
