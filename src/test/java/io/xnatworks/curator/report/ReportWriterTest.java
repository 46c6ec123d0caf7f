/*
 * XNAT Scan Curator
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.curator.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.xnatworks.curator.model.ExecutionReport;
import io.xnatworks.curator.model.Finding;
import io.xnatworks.curator.model.Scan;
import io.xnatworks.curator.model.ScanField;
import io.xnatworks.curator.model.Session;
import io.xnatworks.curator.model.UpdatePlan;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ReportWriter.
 */
@DisplayName("ReportWriter Tests")
class ReportWriterTest {

    @TempDir
    Path tempDir;

    private ReportWriter writer;
    private CurationReport report;

    @BeforeEach
    void setUp() {
        writer = new ReportWriter();

        Scan bad = Scan.builder("4").type("T1").seriesDescription("T1_BAD_run")
                .modality("MR").quality("usable").xsiType("xnat:mrScanData").frames(176).build();
        Scan mprage = Scan.builder("2").type("MPRAGE").seriesDescription("MPRAGE_SAG_1mm")
                .modality("MR").xsiType("xnat:mrScanData").build();
        Scan dwi = Scan.builder("5").type("diffusion").seriesDescription("dwi_64dir").modality("MR").build();
        Session session = new Session("LD4001_v1", "XNAT_E00042", "LD4001_v1_MR", "CUTTING", "2019-03-14",
                Arrays.asList(bad, mprage, dwi));

        Finding marker = Finding.unusableMarker("4", "Unusable marker BAD in description 'T1_BAD_run'");
        Finding rename = Finding.resolvedRename("2", "T1", "Matched rule");
        Finding ambiguous = Finding.ambiguousRename("5", Arrays.asList("DTI", "DWI"),
                "Description 'dwi_64dir' matches rules for DTI, DWI");

        UpdatePlan plan = new UpdatePlan("LD4001_v1", "XNAT_E00042",
                Collections.singletonList(new UpdatePlan.Item(UpdatePlan.Bucket.UNUSABLE, "XNAT_E00042", bad,
                        ScanField.QUALITY, "usable", "unusable", marker.getReason())),
                Collections.singletonList(new UpdatePlan.Item(UpdatePlan.Bucket.RENAME, "XNAT_E00042", mprage,
                        ScanField.TYPE, "MPRAGE_SAG_1mm", "T1", rename.getReason())),
                Collections.singletonList(new UpdatePlan.Unchanged("5",
                        Collections.singletonList("AMBIGUOUS_RENAME: " + ambiguous.getReason()))));

        report = new CurationReport("LD4001_v1", true, session, Arrays.asList(marker, rename, ambiguous), plan);
    }

    @Nested
    @DisplayName("JSON Reports")
    class JsonTests {

        @Test
        @DisplayName("Should write report named after subject")
        void shouldWriteReportFile() throws Exception {
            Path file = writer.writeJson(report, tempDir.resolve("reports"));

            assertEquals("LD4001_v1_curation.json", file.getFileName().toString());
            assertTrue(Files.exists(file));
        }

        @Test
        @DisplayName("Should keep raw labels inside the report directory")
        void shouldSanitizeFileName() throws Exception {
            CurationReport rejected = new CurationReport("../AB/12", false, null,
                    Collections.singletonList(Finding.labelFailure("../AB/12")), null);

            Path file = writer.writeJson(rejected, tempDir);

            assertEquals(tempDir, file.getParent());
            assertEquals("_._AB_12_curation.json", file.getFileName().toString());
            assertEquals("LD4001_v1_curation.json", ReportWriter.reportFileName("LD4001_v1"));
            assertEquals("unknown_curation.json", ReportWriter.reportFileName(""));
        }

        @Test
        @DisplayName("Should serialize findings and plan")
        void shouldSerializeFindingsAndPlan() throws Exception {
            JsonNode root = new ObjectMapper().readTree(writer.toJson(report));

            assertEquals("LD4001_v1", root.get("subjectLabel").asText());
            assertTrue(root.get("labelValid").asBoolean());
            assertEquals(3, root.get("findings").size());
            assertEquals("UNUSABLE_MARKER", root.get("findings").get(0).get("type").asText());
            assertEquals("DWI", root.get("findings").get(2).get("candidates").get(1).asText());
            assertFalse(root.get("findings").get(0).has("candidates"));

            JsonNode unusable = root.get("plan").get("unusable").get(0);
            assertEquals("4", unusable.get("scanId").asText());
            assertEquals("QUALITY", unusable.get("field").asText());
            assertEquals("unusable", unusable.get("proposedValue").asText());
            assertFalse(unusable.has("scan"));
            assertEquals("T1", root.get("plan").get("rename").get(0).get("proposedValue").asText());
            assertFalse(root.has("execution"));
        }

        @Test
        @DisplayName("Should write timestamp as ISO text")
        void shouldWriteIsoTimestamp() throws Exception {
            JsonNode root = new ObjectMapper().readTree(writer.toJson(report));

            assertTrue(root.get("generatedAt").isTextual());
            assertTrue(root.get("generatedAt").asText().contains("T"));
        }

        @Test
        @DisplayName("Should omit session and plan for rejected label")
        void shouldOmitSessionForRejectedLabel() throws Exception {
            CurationReport rejected = new CurationReport("ld4001_v1", false, null,
                    Collections.singletonList(Finding.labelFailure("ld4001_v1")), null);

            JsonNode root = new ObjectMapper().readTree(writer.toJson(rejected));

            assertFalse(root.get("labelValid").asBoolean());
            assertFalse(root.has("session"));
            assertFalse(root.has("plan"));
            assertEquals("VALID_LABEL_FAILURE", root.get("findings").get(0).get("type").asText());
        }
    }

    @Nested
    @DisplayName("Text Summary")
    class SummaryTests {

        private String summary(CurationReport r) {
            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            writer.printSummary(r, new PrintStream(bytes, true, StandardCharsets.UTF_8));
            return bytes.toString(StandardCharsets.UTF_8);
        }

        @Test
        @DisplayName("Should list scans, findings and plan")
        void shouldListEverything() {
            String text = summary(report);

            assertTrue(text.contains("Subject LD4001_v1"));
            assertTrue(text.contains("Session: LD4001_v1_MR (XNAT_E00042)"));
            assertTrue(text.contains("'T1_BAD_run'"));
            assertTrue(text.contains("176 frames"));
            assertTrue(text.contains("Plan: 1 unusable, 1 rename, 1 no action"));
            assertTrue(text.contains("REVIEW scan 5: AMBIGUOUS_RENAME"));
            assertFalse(text.contains("Applied"));
        }

        @Test
        @DisplayName("Should include execution outcomes after apply")
        void shouldIncludeExecution() {
            UpdatePlan.Item item = report.getPlan().getRename().get(0);
            ExecutionReport execution = new ExecutionReport("LD4001_v1", false, Arrays.asList(
                    ExecutionReport.Outcome.success(item),
                    ExecutionReport.Outcome.failed(report.getPlan().getUnusable().get(0), "WRITE: HTTP 500")));

            String text = summary(report.withExecution(execution));

            assertTrue(text.contains("Applied (overwrite=false): 1 succeeded, 0 skipped, 1 failed"));
            assertTrue(text.contains("FAILED scan 4: WRITE: HTTP 500"));
        }

        @Test
        @DisplayName("Should flag invalid label")
        void shouldFlagInvalidLabel() {
            CurationReport rejected = new CurationReport("ld4001_v1", false, null,
                    Collections.singletonList(Finding.labelFailure("ld4001_v1")), null);

            String text = summary(rejected);

            assertTrue(text.contains("[INVALID LABEL]"));
            assertTrue(text.contains("AA0000_vN"));
            assertFalse(text.contains("Plan:"));
        }
    }
}
