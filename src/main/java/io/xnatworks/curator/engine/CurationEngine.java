/*
 * XNAT Scan Curator
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.curator.engine;

import io.xnatworks.curator.model.DataIntegrityException;
import io.xnatworks.curator.model.Finding;
import io.xnatworks.curator.model.RemoteOperationException;
import io.xnatworks.curator.model.Scan;
import io.xnatworks.curator.model.Session;
import io.xnatworks.curator.model.UpdatePlan;
import io.xnatworks.curator.report.CurationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the decision pipeline for one subject:
 * session snapshot -> findings -> update plan.
 *
 * The engine keeps no state between calls; separate subjects may be
 * evaluated concurrently with separate repository clients.
 */
public class CurationEngine {
    private static final Logger log = LoggerFactory.getLogger(CurationEngine.class);

    private final RepositoryClient client;
    private final ScanClassifier classifier;
    private final RenameResolver resolver;
    private final UpdatePlanner planner;

    public CurationEngine(RepositoryClient client, ScanClassifier classifier,
                          RenameResolver resolver, UpdatePlanner planner) {
        this.client = client;
        this.classifier = classifier;
        this.resolver = resolver;
        this.planner = planner;
    }

    /**
     * Validate the label, fetch the subject's session and evaluate it.
     * An invalid label is reported without contacting the repository.
     */
    public CurationReport run(String subjectLabel) throws RemoteOperationException, DataIntegrityException {
        if (!SubjectLabelValidator.validate(subjectLabel)) {
            log.warn("Subject label '{}' does not follow the naming convention, not processing", subjectLabel);
            return new CurationReport(subjectLabel, false, null,
                    Collections.singletonList(Finding.labelFailure(subjectLabel)), null);
        }

        log.info("[{}] Fetching session", subjectLabel);
        Session session = client.fetchSession(subjectLabel);
        return evaluate(session);
    }

    /**
     * Evaluate an already fetched session. Pure: the same session and rule
     * table responses always give the same findings and plan.
     */
    public CurationReport evaluate(Session session) throws DataIntegrityException {
        SessionModel model = SessionModel.of(session);
        List<Finding> findings = new ArrayList<>();

        boolean labelValid = model.isLabelValid();
        if (!labelValid) {
            findings.add(Finding.labelFailure(model.getSubjectLabel()));
        }

        Map<String, List<Finding>> classified = classifier.classify(model);
        Map<String, List<Finding>> byScan = new LinkedHashMap<>();
        for (Scan scan : model.getScans()) {
            List<Finding> scanFindings = new ArrayList<>(classified.get(scan.getId()));
            if (labelValid) {
                Finding rename = resolver.resolve(model, scan, scanFindings);
                if (rename != null) {
                    scanFindings.add(rename);
                }
            }
            byScan.put(scan.getId(), scanFindings);
            findings.addAll(scanFindings);
        }

        UpdatePlan plan = planner.plan(model, byScan);
        return new CurationReport(model.getSubjectLabel(), labelValid, session, findings, plan);
    }
}
