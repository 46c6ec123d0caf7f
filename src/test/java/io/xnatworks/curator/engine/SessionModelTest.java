/*
 * XNAT Scan Curator
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.curator.engine;

import io.xnatworks.curator.model.DataIntegrityException;
import io.xnatworks.curator.model.Scan;
import io.xnatworks.curator.model.Session;
import org.junit.jupiter.api.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static io.xnatworks.curator.engine.SessionFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SessionModel.
 */
@DisplayName("SessionModel Tests")
class SessionModelTest {

    @Nested
    @DisplayName("Integrity Checks")
    class IntegrityTests {

        @Test
        @DisplayName("Should reject session without ID")
        void shouldRejectSessionWithoutId() {
            Session session = new Session(SUBJECT, " ", "LD4001_v1_MR", "CUTTING", null,
                    Collections.singletonList(mr("1", "T1", "T1_MPRAGE")));

            DataIntegrityException e = assertThrows(DataIntegrityException.class, () -> SessionModel.of(session));
            assertEquals(DataIntegrityException.Kind.MISSING_METADATA, e.getKind());
            assertTrue(e.getMessage().contains(SUBJECT));
        }

        @Test
        @DisplayName("Should reject session without scans")
        void shouldRejectEmptySession() {
            DataIntegrityException e = assertThrows(DataIntegrityException.class,
                    () -> SessionModel.of(session()));
            assertEquals(DataIntegrityException.Kind.MISSING_METADATA, e.getKind());
            assertTrue(e.getMessage().contains("no scans"));
        }

        @Test
        @DisplayName("Should reject scan without ID")
        void shouldRejectScanWithoutId() {
            Session session = session(mr("1", "T1", "T1_MPRAGE"), mr("", "T2", "T2_SPACE"));

            DataIntegrityException e = assertThrows(DataIntegrityException.class, () -> SessionModel.of(session));
            assertEquals(DataIntegrityException.Kind.MISSING_METADATA, e.getKind());
            assertTrue(e.getMessage().contains("Scan #2"));
        }

        @Test
        @DisplayName("Should reject duplicate scan IDs")
        void shouldRejectDuplicateScanIds() {
            Session session = session(mr("3", "T1", "T1_MPRAGE"), mr("3", "T2", "T2_SPACE"));

            DataIntegrityException e = assertThrows(DataIntegrityException.class, () -> SessionModel.of(session));
            assertEquals(DataIntegrityException.Kind.DUPLICATE_SCAN_ID, e.getKind());
            assertEquals(SUBJECT, e.getSubjectLabel());
        }
    }

    @Nested
    @DisplayName("Type Grouping")
    class GroupingTests {

        @Test
        @DisplayName("Should group scans by type in order of first appearance")
        void shouldGroupByType() throws Exception {
            SessionModel model = SessionModel.of(session(
                    mr("1", "localizer", "AAHead_Scout_32ch"),
                    mr("2", "T1", "MPRAGE_SAG_1mm"),
                    mr("3", "localizer", "AAHead_Scout_32ch_MPR")));

            Map<String, List<Scan>> byType = model.getScansByType();
            assertEquals(Arrays.asList("localizer", "T1"), Arrays.asList(byType.keySet().toArray()));
            assertEquals(2, byType.get("localizer").size());
            assertFalse(model.isSingletonType(model.getScan("1")));
            assertTrue(model.isSingletonType(model.getScan("2")));
        }

        @Test
        @DisplayName("Should group scans without type together")
        void shouldGroupMissingTypes() throws Exception {
            SessionModel model = SessionModel.of(session(
                    mr("1", null, "series_a"),
                    mr("2", null, "series_b")));

            assertEquals(2, model.siblingsOf(model.getScan("1")).size());
            assertTrue(model.getScansByType().containsKey(""));
        }

        @Test
        @DisplayName("Should expose scans by ID in session order")
        void shouldExposeScans() throws Exception {
            SessionModel model = SessionModel.of(session(
                    mr("7", "T2", "T2_SPACE_sag"),
                    mr("2", "T1", "MPRAGE_SAG_1mm")));

            assertEquals("7", model.getScans().get(0).getId());
            assertEquals("T1", model.getScan("2").getType());
            assertNull(model.getScan("99"));
            assertEquals(SESSION_ID, model.getSessionId());
        }

        @Test
        @DisplayName("Grouping should be read-only")
        void groupingShouldBeReadOnly() throws Exception {
            SessionModel model = SessionModel.of(session(mr("1", "T1", "MPRAGE_SAG_1mm")));

            assertThrows(UnsupportedOperationException.class, () -> model.getScansByType().clear());
            assertThrows(UnsupportedOperationException.class,
                    () -> model.getScansByType().get("T1").add(mr("2", "T1", "x")));
        }
    }

    @Nested
    @DisplayName("Subject Label")
    class LabelTests {

        @Test
        @DisplayName("Should derive project code for valid label")
        void shouldDeriveProjectCode() throws Exception {
            SessionModel model = SessionModel.of(session(mr("1", "T1", "MPRAGE_SAG_1mm")));

            assertTrue(model.isLabelValid());
            assertEquals("LD4", model.getProjectCode());
        }

        @Test
        @DisplayName("Should have no project code for invalid label")
        void shouldHaveNoProjectCodeForInvalidLabel() throws Exception {
            SessionModel model = SessionModel.of(session("ld4001_v1", mr("1", "T1", "MPRAGE_SAG_1mm")));

            assertFalse(model.isLabelValid());
            assertNull(model.getProjectCode());
        }
    }
}
