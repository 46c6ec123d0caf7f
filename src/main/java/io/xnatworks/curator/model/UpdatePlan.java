/*
 * XNAT Scan Curator
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.curator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Reviewable set of proposed scan field changes for one session.
 *
 * Every scan of the session appears exactly once: in the "unusable" bucket,
 * in the "rename" bucket, or in the "no action" list together with the
 * reasons that kept it out of the update buckets.
 */
public final class UpdatePlan {

    /**
     * Update bucket an item belongs to.
     */
    public enum Bucket {
        UNUSABLE,
        RENAME
    }

    private final String subjectLabel;
    private final String sessionId;
    private final List<Item> unusable;
    private final List<Item> rename;
    private final List<Unchanged> noAction;

    public UpdatePlan(String subjectLabel, String sessionId,
                      List<Item> unusable, List<Item> rename, List<Unchanged> noAction) {
        this.subjectLabel = subjectLabel;
        this.sessionId = sessionId;
        this.unusable = Collections.unmodifiableList(new ArrayList<>(unusable));
        this.rename = Collections.unmodifiableList(new ArrayList<>(rename));
        this.noAction = Collections.unmodifiableList(new ArrayList<>(noAction));
    }

    @JsonProperty("subjectLabel")
    public String getSubjectLabel() {
        return subjectLabel;
    }

    @JsonProperty("sessionId")
    public String getSessionId() {
        return sessionId;
    }

    @JsonProperty("unusable")
    public List<Item> getUnusable() {
        return unusable;
    }

    @JsonProperty("rename")
    public List<Item> getRename() {
        return rename;
    }

    @JsonProperty("noAction")
    public List<Unchanged> getNoAction() {
        return noAction;
    }

    /**
     * All update items in execution order: unusable first, then renames.
     */
    public List<Item> items() {
        List<Item> all = new ArrayList<>(unusable.size() + rename.size());
        all.addAll(unusable);
        all.addAll(rename);
        return all;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return unusable.isEmpty() && rename.isEmpty();
    }

    public int scanCount() {
        return unusable.size() + rename.size() + noAction.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UpdatePlan)) return false;
        UpdatePlan other = (UpdatePlan) o;
        return Objects.equals(subjectLabel, other.subjectLabel)
                && Objects.equals(sessionId, other.sessionId)
                && unusable.equals(other.unusable)
                && rename.equals(other.rename)
                && noAction.equals(other.noAction);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subjectLabel, sessionId, unusable, rename, noAction);
    }

    @Override
    public String toString() {
        return String.format("UpdatePlan{subject=%s, unusable=%d, rename=%d, noAction=%d}",
                subjectLabel, unusable.size(), rename.size(), noAction.size());
    }

    /**
     * One proposed field change. Carries the snapshot value and the field's
     * archive default so the executor can decide without re-reading XNAT.
     */
    public static final class Item {
        private final Bucket bucket;
        private final String sessionId;
        private final Scan scan;
        private final ScanField field;
        private final String currentValue;
        private final String defaultValue;
        private final String proposedValue;
        private final String reason;

        public Item(Bucket bucket, String sessionId, Scan scan, ScanField field,
                    String defaultValue, String proposedValue, String reason) {
            this.bucket = Objects.requireNonNull(bucket, "bucket");
            this.sessionId = sessionId;
            this.scan = Objects.requireNonNull(scan, "scan");
            this.field = Objects.requireNonNull(field, "field");
            this.currentValue = scan.valueOf(field);
            this.defaultValue = defaultValue;
            this.proposedValue = proposedValue;
            this.reason = reason;
        }

        @JsonProperty("bucket")
        public Bucket getBucket() { return bucket; }

        @JsonProperty("sessionId")
        public String getSessionId() { return sessionId; }

        @JsonProperty("scanId")
        public String getScanId() { return scan.getId(); }

        @JsonIgnore
        public Scan getScan() { return scan; }

        @JsonProperty("field")
        public ScanField getField() { return field; }

        @JsonProperty("currentValue")
        public String getCurrentValue() { return currentValue; }

        @JsonProperty("defaultValue")
        public String getDefaultValue() { return defaultValue; }

        @JsonProperty("proposedValue")
        public String getProposedValue() { return proposedValue; }

        @JsonProperty("reason")
        public String getReason() { return reason; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Item)) return false;
            Item other = (Item) o;
            return bucket == other.bucket
                    && Objects.equals(sessionId, other.sessionId)
                    && scan.equals(other.scan)
                    && field == other.field
                    && Objects.equals(defaultValue, other.defaultValue)
                    && Objects.equals(proposedValue, other.proposedValue)
                    && Objects.equals(reason, other.reason);
        }

        @Override
        public int hashCode() {
            return Objects.hash(bucket, sessionId, scan, field, defaultValue, proposedValue, reason);
        }

        @Override
        public String toString() {
            return String.format("%s scan %s: %s '%s' -> '%s' (%s)",
                    bucket, scan.getId(), field.getXnatName(), currentValue, proposedValue, reason);
        }
    }

    /**
     * A scan left untouched, with the findings that need human review.
     * An empty reason list means nothing was wrong with the scan.
     */
    public static final class Unchanged {
        private final String scanId;
        private final List<String> reasons;

        public Unchanged(String scanId, List<String> reasons) {
            this.scanId = scanId;
            this.reasons = Collections.unmodifiableList(new ArrayList<>(reasons));
        }

        @JsonProperty("scanId")
        public String getScanId() { return scanId; }

        @JsonProperty("reasons")
        public List<String> getReasons() { return reasons; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Unchanged)) return false;
            Unchanged other = (Unchanged) o;
            return Objects.equals(scanId, other.scanId) && reasons.equals(other.reasons);
        }

        @Override
        public int hashCode() {
            return Objects.hash(scanId, reasons);
        }

        @Override
        public String toString() {
            return "scan " + scanId + (reasons.isEmpty() ? "" : ": " + String.join("; ", reasons));
        }
    }
}
