/*
 * XNAT Scan Curator
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.curator.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.xnatworks.curator.model.ExecutionReport;
import io.xnatworks.curator.model.Finding;
import io.xnatworks.curator.model.FindingType;
import io.xnatworks.curator.model.Session;
import io.xnatworks.curator.model.UpdatePlan;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Everything an operator needs to review one subject: the session snapshot,
 * all findings, the proposed plan and, after apply, the execution outcomes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CurationReport {

    private final String subjectLabel;
    private final boolean labelValid;
    private final Session session;
    private final List<Finding> findings;
    private final UpdatePlan plan;
    private final ExecutionReport execution;
    private final LocalDateTime generatedAt;

    public CurationReport(String subjectLabel, boolean labelValid, Session session,
                          List<Finding> findings, UpdatePlan plan) {
        this(subjectLabel, labelValid, session, findings, plan, null, LocalDateTime.now());
    }

    private CurationReport(String subjectLabel, boolean labelValid, Session session, List<Finding> findings,
                           UpdatePlan plan, ExecutionReport execution, LocalDateTime generatedAt) {
        this.subjectLabel = subjectLabel;
        this.labelValid = labelValid;
        this.session = session;
        this.findings = Collections.unmodifiableList(new ArrayList<>(findings));
        this.plan = plan;
        this.execution = execution;
        this.generatedAt = generatedAt;
    }

    /**
     * Copy of this report with execution outcomes attached.
     */
    public CurationReport withExecution(ExecutionReport execution) {
        return new CurationReport(subjectLabel, labelValid, session, findings, plan, execution, generatedAt);
    }

    @JsonProperty("subjectLabel")
    public String getSubjectLabel() {
        return subjectLabel;
    }

    @JsonProperty("labelValid")
    public boolean isLabelValid() {
        return labelValid;
    }

    @JsonProperty("session")
    public Session getSession() {
        return session;
    }

    @JsonProperty("findings")
    public List<Finding> getFindings() {
        return findings;
    }

    @JsonProperty("plan")
    public UpdatePlan getPlan() {
        return plan;
    }

    @JsonProperty("execution")
    public ExecutionReport getExecution() {
        return execution;
    }

    @JsonProperty("generatedAt")
    public LocalDateTime getGeneratedAt() {
        return generatedAt;
    }

    public List<Finding> findingsOfType(FindingType type) {
        return findings.stream().filter(f -> f.is(type)).collect(Collectors.toList());
    }

    public List<Finding> findingsForScan(String scanId) {
        return findings.stream().filter(f -> scanId.equals(f.getScanId())).collect(Collectors.toList());
    }
}
