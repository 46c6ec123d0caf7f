/*
 * XNAT Scan Curator
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.curator;

import io.xnatworks.curator.config.AppConfig;
import io.xnatworks.curator.engine.CurationEngine;
import io.xnatworks.curator.engine.RenameResolver;
import io.xnatworks.curator.engine.RepositoryClient;
import io.xnatworks.curator.engine.ScanClassifier;
import io.xnatworks.curator.engine.SubjectLabelValidator;
import io.xnatworks.curator.engine.UpdateExecutor;
import io.xnatworks.curator.engine.UpdatePlanner;
import io.xnatworks.curator.model.DataIntegrityException;
import io.xnatworks.curator.model.ExecutionReport;
import io.xnatworks.curator.model.RemoteOperationException;
import io.xnatworks.curator.quality.ConfiguredQualityExpectations;
import io.xnatworks.curator.report.CurationReport;
import io.xnatworks.curator.report.ReportWriter;
import io.xnatworks.curator.rules.RenameRuleTable;
import io.xnatworks.curator.xnat.XnatClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * XNAT Scan Curator - Main Application
 *
 * Checks subject labels and scan types of XNAT imaging sessions before
 * automated analysis runs:
 * - Validate subject labels against the lab naming convention
 * - Flag unusable, duplicate and incomplete scans
 * - Propose canonical scan types from the rename rule table
 * - Apply the reviewed plan back to XNAT
 */
@Command(name = "scan-curator",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "XNAT Scan Curator - Check and correct subject and scan naming",
        subcommands = {
                ScanCurator.CheckCommand.class,
                ScanCurator.PlanCommand.class,
                ScanCurator.ApplyCommand.class
        })
public class ScanCurator implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(ScanCurator.class);

    static final int EXIT_OK = 0;
    static final int EXIT_SUBJECT_ERROR = 1;
    static final int EXIT_WRITE_FAILED = 2;

    @Option(names = {"-c", "--config"}, description = "Config file path", defaultValue = "config.yaml")
    protected File configFile;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ScanCurator()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return EXIT_OK;
    }

    /**
     * Build an engine for the configured rule table and expectations.
     */
    static CurationEngine createEngine(AppConfig config, RepositoryClient client) throws IOException {
        RenameRuleTable rules = RenameRuleTable.load(config.resolveRulesFile());
        ScanClassifier classifier = new ScanClassifier(
                new ConfiguredQualityExpectations(config.getExpectedFrames()),
                config.getUnusableMarkers(),
                config.getUsableQuality());
        UpdatePlanner planner = new UpdatePlanner(config.getUsableQuality(), config.getUnusableQuality());
        return new CurationEngine(client, classifier, new RenameResolver(rules), planner);
    }

    // ========================================================================
    // CHECK COMMAND - Validate subject labels offline
    // ========================================================================

    @Command(name = "check", description = "Validate subject labels against the naming convention")
    static class CheckCommand implements Callable<Integer> {

        @Parameters(arity = "1..*", paramLabel = "SUBJECT", description = "Subject labels (e.g. LD4001_v1)")
        private List<String> subjects;

        @Override
        public Integer call() {
            int invalid = 0;
            for (String subject : subjects) {
                boolean valid = SubjectLabelValidator.validate(subject);
                System.out.printf("%-20s %s%n", subject, valid ? "OK" : "INVALID");
                if (!valid) {
                    invalid++;
                }
            }
            if (invalid > 0) {
                System.out.printf("%n%d of %d label(s) do not match AA0000_vN%n", invalid, subjects.size());
                return EXIT_SUBJECT_ERROR;
            }
            return EXIT_OK;
        }
    }

    // ========================================================================
    // PLAN COMMAND - Show proposed updates without writing
    // ========================================================================

    @Command(name = "plan", description = "Evaluate subjects and print the proposed updates")
    static class PlanCommand implements Callable<Integer> {

        @ParentCommand
        private ScanCurator parent;

        @Parameters(arity = "1..*", paramLabel = "SUBJECT", description = "Subject labels")
        private List<String> subjects;

        @Option(names = {"--json"}, description = "Write a JSON report per subject")
        private boolean json;

        @Option(names = {"--report-dir"}, description = "Report directory (overrides config file)")
        private Path reportDir;

        @Override
        public Integer call() throws Exception {
            AppConfig config = AppConfig.load(parent.configFile);
            ReportWriter writer = new ReportWriter();
            int exitCode = EXIT_OK;

            try (XnatClient client = new XnatClient(config.getXnat())) {
                CurationEngine engine = createEngine(config, client);
                for (String subject : subjects) {
                    CurationReport report = evaluate(engine, subject);
                    if (report == null || !report.isLabelValid()) {
                        exitCode = EXIT_SUBJECT_ERROR;
                    }
                    if (report != null) {
                        writer.printSummary(report, System.out);
                        if (json && !writeReport(writer, report, reportDirectory(config, reportDir))) {
                            exitCode = EXIT_SUBJECT_ERROR;
                        }
                    }
                }
            }
            return exitCode;
        }
    }

    // ========================================================================
    // APPLY COMMAND - Write the plan back to XNAT
    // ========================================================================

    @Command(name = "apply", description = "Evaluate subjects and apply the proposed updates to XNAT")
    static class ApplyCommand implements Callable<Integer> {

        @ParentCommand
        private ScanCurator parent;

        @Parameters(arity = "1..*", paramLabel = "SUBJECT", description = "Subject labels")
        private List<String> subjects;

        @Option(names = {"--overwrite"}, description = "Replace fields that already hold a non-default value")
        private boolean overwrite;

        @Option(names = {"--json"}, description = "Write a JSON report per subject")
        private boolean json;

        @Option(names = {"--report-dir"}, description = "Report directory (overrides config file)")
        private Path reportDir;

        @Override
        public Integer call() throws Exception {
            AppConfig config = AppConfig.load(parent.configFile);
            ReportWriter writer = new ReportWriter();
            int exitCode = EXIT_OK;

            try (XnatClient client = new XnatClient(config.getXnat())) {
                CurationEngine engine = createEngine(config, client);
                UpdateExecutor executor = new UpdateExecutor(client);

                for (String subject : subjects) {
                    CurationReport report = evaluate(engine, subject);
                    if (report == null) {
                        exitCode = Math.max(exitCode, EXIT_SUBJECT_ERROR);
                        continue;
                    }
                    if (report.isLabelValid() && report.getPlan() != null) {
                        ExecutionReport execution = executor.apply(report.getPlan(), overwrite);
                        report = report.withExecution(execution);
                        if (execution.hasFailures()) {
                            exitCode = EXIT_WRITE_FAILED;
                        }
                    } else {
                        exitCode = Math.max(exitCode, EXIT_SUBJECT_ERROR);
                    }

                    writer.printSummary(report, System.out);
                    if (json && !writeReport(writer, report, reportDirectory(config, reportDir))) {
                        exitCode = Math.max(exitCode, EXIT_SUBJECT_ERROR);
                    }
                }
            }
            return exitCode;
        }
    }

    /**
     * Run the engine for one subject; integrity and remote errors are logged
     * and the subject is skipped.
     */
    private static CurationReport evaluate(CurationEngine engine, String subject) {
        try {
            return engine.run(subject);
        } catch (DataIntegrityException e) {
            log.error("[{}] Data integrity error ({}): {}", subject, e.getKind(), e.getMessage());
        } catch (RemoteOperationException e) {
            log.error("[{}] XNAT request failed ({}): {}", subject, e.getKind(), e.getMessage());
        }
        return null;
    }

    /**
     * Write the JSON report; a failure is logged and the batch continues.
     */
    private static boolean writeReport(ReportWriter writer, CurationReport report, Path directory) {
        try {
            writer.writeJson(report, directory);
            return true;
        } catch (IOException e) {
            log.error("[{}] Failed to write report to {}: {}", report.getSubjectLabel(), directory, e.getMessage());
            return false;
        }
    }

    private static Path reportDirectory(AppConfig config, Path override) {
        return override != null ? override : Paths.get(config.getReportDirectory());
    }
}
