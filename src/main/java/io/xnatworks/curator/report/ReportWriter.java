/*
 * XNAT Scan Curator
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.curator.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.xnatworks.curator.model.ExecutionReport;
import io.xnatworks.curator.model.Finding;
import io.xnatworks.curator.model.Scan;
import io.xnatworks.curator.model.UpdatePlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Writes curation reports as JSON files and prints plain-text summaries.
 *
 * JSON files are named {@code {subject}_curation.json}.
 */
public class ReportWriter {
    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private static final String REPORT_SUFFIX = "_curation.json";
    private static final Pattern UNSAFE_FILE_CHARS = Pattern.compile("[^A-Za-z0-9_.-]");

    private final ObjectMapper objectMapper;

    public ReportWriter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public String toJson(CurationReport report) throws IOException {
        return objectMapper.writeValueAsString(report);
    }

    /**
     * Write the report into the directory, creating it if needed.
     *
     * @return path of the written file
     */
    public Path writeJson(CurationReport report, Path directory) throws IOException {
        Files.createDirectories(directory);
        Path file = directory.resolve(reportFileName(report.getSubjectLabel()));
        objectMapper.writeValue(file.toFile(), report);
        log.info("[{}] Report written to {}", report.getSubjectLabel(), file);
        return file;
    }

    /**
     * File name for a subject's report; characters outside {@code [A-Za-z0-9_.-]}
     * are replaced so raw labels cannot escape the report directory.
     */
    static String reportFileName(String subjectLabel) {
        String safe = subjectLabel == null || subjectLabel.isEmpty()
                ? "unknown"
                : UNSAFE_FILE_CHARS.matcher(subjectLabel).replaceAll("_");
        if (safe.startsWith(".")) {
            safe = "_" + safe.substring(1);
        }
        return safe + REPORT_SUFFIX;
    }

    public void printSummary(CurationReport report, PrintStream out) {
        out.println();
        out.println("=========================================================");
        out.printf("  Subject %s%s%n", report.getSubjectLabel(), report.isLabelValid() ? "" : "  [INVALID LABEL]");
        out.println("=========================================================");

        if (report.getSession() != null) {
            out.printf("Session: %s (%s) %s%n",
                    report.getSession().getSessionLabel(), report.getSession().getSessionId(),
                    report.getSession().getDate() != null ? report.getSession().getDate() : "");
            out.println();
            out.println("Scans:");
            for (Scan scan : report.getSession().getScans()) {
                out.printf("  %-6s %-28s %-36s %s%n",
                        scan.getId(), quote(scan.getType()), quote(scan.getSeriesDescription()),
                        scan.getFrames() != null ? scan.getFrames() + " frames" : "");
            }
        }

        out.println();
        if (report.getFindings().isEmpty()) {
            out.println("Findings: none");
        } else {
            out.println("Findings:");
            for (Finding finding : report.getFindings()) {
                out.println("  " + finding);
            }
        }

        UpdatePlan plan = report.getPlan();
        if (plan != null) {
            out.println();
            out.printf("Plan: %d unusable, %d rename, %d no action%n",
                    plan.getUnusable().size(), plan.getRename().size(), plan.getNoAction().size());
            for (UpdatePlan.Item item : plan.items()) {
                out.println("  " + item);
            }
            for (UpdatePlan.Unchanged unchanged : plan.getNoAction()) {
                if (!unchanged.getReasons().isEmpty()) {
                    out.println("  REVIEW " + unchanged);
                }
            }
        }

        ExecutionReport execution = report.getExecution();
        if (execution != null) {
            out.println();
            out.printf("Applied (overwrite=%s): %d succeeded, %d skipped, %d failed%n",
                    execution.isOverwrite(),
                    execution.count(ExecutionReport.Status.SUCCESS),
                    execution.count(ExecutionReport.Status.SKIPPED),
                    execution.count(ExecutionReport.Status.FAILED));
            for (ExecutionReport.Outcome outcome : execution.getOutcomes()) {
                out.println("  " + outcome);
            }
        }
    }

    private static String quote(String value) {
        return value == null ? "-" : "'" + value + "'";
    }
}
