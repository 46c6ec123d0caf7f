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
 * Per-item outcome of applying an {@link UpdatePlan}. Not transactional:
 * a failed item sits next to items that were written.
 */
public final class ExecutionReport {

    public enum Status {
        SUCCESS,
        SKIPPED,
        FAILED
    }

    private final String subjectLabel;
    private final boolean overwrite;
    private final List<Outcome> outcomes;

    public ExecutionReport(String subjectLabel, boolean overwrite, List<Outcome> outcomes) {
        this.subjectLabel = subjectLabel;
        this.overwrite = overwrite;
        this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
    }

    @JsonProperty("subjectLabel")
    public String getSubjectLabel() {
        return subjectLabel;
    }

    @JsonProperty("overwrite")
    public boolean isOverwrite() {
        return overwrite;
    }

    @JsonProperty("outcomes")
    public List<Outcome> getOutcomes() {
        return outcomes;
    }

    public long count(Status status) {
        return outcomes.stream().filter(o -> o.getStatus() == status).count();
    }

    @JsonIgnore
    public boolean hasFailures() {
        return count(Status.FAILED) > 0;
    }

    @Override
    public String toString() {
        return String.format("ExecutionReport{subject=%s, success=%d, skipped=%d, failed=%d}",
                subjectLabel, count(Status.SUCCESS), count(Status.SKIPPED), count(Status.FAILED));
    }

    /**
     * Result of applying one plan item.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class Outcome {
        private final UpdatePlan.Item item;
        private final Status status;
        private final String reason;

        private Outcome(UpdatePlan.Item item, Status status, String reason) {
            this.item = Objects.requireNonNull(item, "item");
            this.status = status;
            this.reason = reason;
        }

        public static Outcome success(UpdatePlan.Item item) {
            return new Outcome(item, Status.SUCCESS, null);
        }

        public static Outcome skipped(UpdatePlan.Item item, String reason) {
            return new Outcome(item, Status.SKIPPED, reason);
        }

        public static Outcome failed(UpdatePlan.Item item, String reason) {
            return new Outcome(item, Status.FAILED, reason);
        }

        @JsonProperty("item")
        public UpdatePlan.Item getItem() { return item; }

        @JsonProperty("status")
        public Status getStatus() { return status; }

        @JsonProperty("reason")
        public String getReason() { return reason; }

        @Override
        public String toString() {
            return reason == null
                    ? String.format("%s scan %s", status, item.getScanId())
                    : String.format("%s scan %s: %s", status, item.getScanId(), reason);
        }
    }
}
