/*
 * XNAT Scan Curator
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.curator.rules;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Rule table backed by a CSV file with the columns
 * {@code project,series_description,scan_type,modality,updated_scan_type}.
 * The {@code modality} column is optional.
 *
 * A lookup returns only the matching rules of the highest specificity, so a
 * rule pinned to a project and scan type wins over a catch-all row for the
 * same description. Rules that tie at that level are all returned.
 */
public class RenameRuleTable implements RuleTable {
    private static final Logger log = LoggerFactory.getLogger(RenameRuleTable.class);

    private final List<RenameRule> rules;

    /**
     * @param rules rules in table order; rules without a description or an
     *              updated scan type are dropped
     */
    public RenameRuleTable(List<RenameRule> rules) {
        List<RenameRule> complete = new ArrayList<>(rules.size());
        for (RenameRule rule : rules) {
            if (rule != null && rule.isComplete()) {
                complete.add(rule);
            } else {
                log.warn("Dropping incomplete rename rule {}", rule);
            }
        }
        this.rules = Collections.unmodifiableList(complete);
    }

    public static RenameRuleTable load(File csvFile) throws IOException {
        log.info("Loading rename rules from: {}", csvFile.getAbsolutePath());
        CsvMapper mapper = new CsvMapper();
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<RenameRule> rows = mapper.readerFor(RenameRule.class).with(schema).readValues(csvFile)) {
            return fromRows(rows.readAll(), csvFile.getName());
        }
    }

    public static RenameRuleTable load(Reader reader, String sourceName) throws IOException {
        CsvMapper mapper = new CsvMapper();
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<RenameRule> rows = mapper.readerFor(RenameRule.class).with(schema).readValues(reader)) {
            return fromRows(rows.readAll(), sourceName);
        }
    }

    private static RenameRuleTable fromRows(List<RenameRule> rows, String sourceName) {
        List<RenameRule> usable = new ArrayList<>();
        int line = 1;
        for (RenameRule row : rows) {
            line++;
            if (row.isComplete()) {
                usable.add(row);
            } else {
                log.warn("Ignoring incomplete rename rule at {}:{} ({})", sourceName, line, row);
            }
        }
        log.info("Loaded {} rename rule(s) from {}", usable.size(), sourceName);
        return new RenameRuleTable(usable);
    }

    @Override
    public List<RenameRule> lookup(String description, RuleContext context) {
        List<RenameRule> matching = rules.stream()
                .filter(rule -> rule.matches(description, context))
                .collect(Collectors.toList());
        if (matching.size() <= 1) {
            return matching;
        }

        int best = matching.stream().mapToInt(RenameRule::specificity).max().getAsInt();
        return matching.stream()
                .filter(rule -> rule.specificity() == best)
                .collect(Collectors.toList());
    }

    public List<RenameRule> getRules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }
}
