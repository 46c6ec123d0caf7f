/*
 * XNAT Scan Curator
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.curator.engine;

import io.xnatworks.curator.model.ExecutionReport;
import io.xnatworks.curator.model.RemoteOperationException;
import io.xnatworks.curator.model.UpdatePlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes an {@link UpdatePlan} back through the repository client.
 *
 * Without overwrite, a field that already holds a non-default value (or the
 * proposed value) is skipped so manual corrections survive. With overwrite
 * every item is written. Items are independent: a failed write is recorded
 * and the remaining items are still attempted.
 */
public class UpdateExecutor {
    private static final Logger log = LoggerFactory.getLogger(UpdateExecutor.class);

    private final RepositoryClient client;

    public UpdateExecutor(RepositoryClient client) {
        this.client = client;
    }

    public ExecutionReport apply(UpdatePlan plan, boolean overwrite) {
        List<ExecutionReport.Outcome> outcomes = new ArrayList<>();
        for (UpdatePlan.Item item : plan.items()) {
            outcomes.add(apply(item, overwrite));
        }
        ExecutionReport report = new ExecutionReport(plan.getSubjectLabel(), overwrite, outcomes);
        log.info("[{}] Applied plan: {} succeeded, {} skipped, {} failed",
                plan.getSubjectLabel(),
                report.count(ExecutionReport.Status.SUCCESS),
                report.count(ExecutionReport.Status.SKIPPED),
                report.count(ExecutionReport.Status.FAILED));
        return report;
    }

    public ExecutionReport.Outcome apply(UpdatePlan.Item item, boolean overwrite) {
        if (!overwrite) {
            String current = item.getCurrentValue();
            if (current != null && current.equals(item.getProposedValue())) {
                log.debug("Scan {} {} already '{}'", item.getScanId(), item.getField().getXnatName(), current);
                return ExecutionReport.Outcome.skipped(item, "Already set to '" + current + "'");
            }
            if (!isDefault(current, item.getDefaultValue())) {
                log.info("Skipping scan {}: {} holds '{}' (use overwrite to replace)",
                        item.getScanId(), item.getField().getXnatName(), current);
                return ExecutionReport.Outcome.skipped(item,
                        item.getField().getXnatName() + " holds non-default value '" + current + "'");
            }
        }

        try {
            client.writeScanField(item.getSessionId(), item.getScan(), item.getField(), item.getProposedValue());
            log.info("Updated scan {} {}: '{}' -> '{}'", item.getScanId(),
                    item.getField().getXnatName(), item.getCurrentValue(), item.getProposedValue());
            return ExecutionReport.Outcome.success(item);
        } catch (RemoteOperationException e) {
            log.error("Failed to update scan {} {}: {}", item.getScanId(),
                    item.getField().getXnatName(), e.getMessage());
            return ExecutionReport.Outcome.failed(item, e.getKind() + ": " + e.getMessage());
        }
    }

    static boolean isDefault(String current, String defaultValue) {
        if (current == null || current.trim().isEmpty()) {
            return true;
        }
        return defaultValue != null && current.trim().equalsIgnoreCase(defaultValue.trim());
    }
}
