/*
 * XNAT Scan Curator
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.curator.engine;

import io.xnatworks.curator.model.Finding;
import io.xnatworks.curator.model.FindingType;
import io.xnatworks.curator.quality.ConfiguredQualityExpectations;
import io.xnatworks.curator.rules.RenameRule;
import io.xnatworks.curator.rules.RuleTable;
import org.junit.jupiter.api.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static io.xnatworks.curator.engine.SessionFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RenameResolver.
 */
@DisplayName("RenameResolver Tests")
class RenameResolverTest {

    private final ScanClassifier classifier = new ScanClassifier(ConfiguredQualityExpectations.none());

    private Finding resolve(RenameResolver resolver, SessionModel model, String scanId) {
        Map<String, List<Finding>> findings = classifier.classify(model);
        return resolver.resolve(model, model.getScan(scanId), findings.get(scanId));
    }

    @Test
    @DisplayName("Should resolve single candidate")
    void shouldResolveSingleCandidate() throws Exception {
        RenameResolver resolver = new RenameResolver(rules(rule("LD4", "MPRAGE_SAG_1mm", null, "T1")));
        SessionModel model = SessionModel.of(session(mr("2", "MPRAGE", "MPRAGE_SAG_1mm")));

        Finding finding = resolve(resolver, model, "2");

        assertNotNull(finding);
        assertEquals(FindingType.RESOLVED_RENAME, finding.getType());
        assertEquals("T1", finding.getCandidate());
        assertTrue(finding.getReason().startsWith("Matched rule[project=LD4"));
    }

    @Test
    @DisplayName("Should return nothing when no rule matches")
    void shouldReturnNullWithoutMatch() throws Exception {
        RenameResolver resolver = new RenameResolver(rules(rule(null, "T2_SPACE_sag", null, "T2")));
        SessionModel model = SessionModel.of(session(mr("2", "MPRAGE", "MPRAGE_SAG_1mm")));

        assertNull(resolve(resolver, model, "2"));
    }

    @Test
    @DisplayName("Should not match rule pinned to another project")
    void shouldRespectProjectPin() throws Exception {
        RenameResolver resolver = new RenameResolver(rules(rule("XY9", "MPRAGE_SAG_1mm", null, "T1")));
        SessionModel model = SessionModel.of(session(mr("2", "MPRAGE", "MPRAGE_SAG_1mm")));

        assertNull(resolve(resolver, model, "2"));
    }

    @Test
    @DisplayName("Should report competing candidates as ambiguous in sorted order")
    void shouldReportAmbiguity() throws Exception {
        RenameResolver resolver = new RenameResolver(rules(
                rule("LD4", "dwi_64dir", null, "DWI"),
                rule("LD4", "dwi_64dir", null, "DTI"),
                rule("LD4", "dwi_64dir", null, "DWI")));
        SessionModel model = SessionModel.of(session(mr("5", "diffusion", "dwi_64dir")));

        Finding finding = resolve(resolver, model, "5");

        assertNotNull(finding);
        assertEquals(FindingType.AMBIGUOUS_RENAME, finding.getType());
        assertEquals(Arrays.asList("DTI", "DWI"), finding.getCandidates());
        assertNull(finding.getCandidate());
        assertEquals("Description 'dwi_64dir' matches rules for DTI, DWI", finding.getReason());
    }

    @Test
    @DisplayName("Should collapse rules agreeing on the same candidate")
    void shouldCollapseAgreeingRules() throws Exception {
        RenameResolver resolver = new RenameResolver(rules(
                rule("LD4", "T2_SPACE_sag", null, "T2"),
                rule("LD4", "T2_SPACE_sag", null, "T2")));
        SessionModel model = SessionModel.of(session(mr("3", "t2_space", "T2_SPACE_sag")));

        Finding finding = resolve(resolver, model, "3");

        assertNotNull(finding);
        assertEquals(FindingType.RESOLVED_RENAME, finding.getType());
        assertEquals(Collections.singletonList("T2"), finding.getCandidates());
    }

    @Test
    @DisplayName("Should skip scan that already carries canonical type")
    void shouldSkipCanonicalType() throws Exception {
        RenameResolver resolver = new RenameResolver(rules(rule(null, "MPRAGE_SAG_1mm", null, "T1")));
        SessionModel model = SessionModel.of(session(mr("2", "T1", "MPRAGE_SAG_1mm")));

        assertNull(resolve(resolver, model, "2"));
    }

    @Test
    @DisplayName("Should not resolve scans sharing a type")
    void shouldSkipDuplicates() throws Exception {
        RenameResolver resolver = new RenameResolver(rules(rule(null, "AAHead_Scout_32ch", null, "localizer_fixed")));
        SessionModel model = SessionModel.of(session(
                mr("1", "localizer", "AAHead_Scout_32ch"),
                mr("2", "localizer", "AAHead_Scout_32ch")));

        assertNull(resolve(resolver, model, "1"));
        assertNull(resolve(resolver, model, "2"));
    }

    @Test
    @DisplayName("Should not resolve scans with unusable marker")
    void shouldSkipMarkedScans() throws Exception {
        RenameResolver resolver = new RenameResolver(rules(rule(null, "T1_BAD_run", null, "T1")));
        SessionModel model = SessionModel.of(session(mr("4", "MPRAGE", "T1_BAD_run")));

        assertNull(resolve(resolver, model, "4"));
    }

    @Test
    @DisplayName("Should ignore matched rules without updated scan type")
    void shouldIgnoreRuleWithoutTarget() throws Exception {
        RuleTable table = (description, context) ->
                Collections.singletonList(new RenameRule("LD4", "MPRAGE_SAG_1mm", null, null, null));
        SessionModel model = SessionModel.of(session(mr("2", "MPRAGE", "MPRAGE_SAG_1mm")));

        assertNull(resolve(new RenameResolver(table), model, "2"));
    }

    @Test
    @DisplayName("Should resolve the remaining candidate next to a rule without target")
    void shouldKeepCompleteRuleNextToIncompleteOne() throws Exception {
        RuleTable table = (description, context) -> Arrays.asList(
                new RenameRule("LD4", "MPRAGE_SAG_1mm", null, null, null),
                new RenameRule("LD4", "MPRAGE_SAG_1mm", null, null, "T1"));
        SessionModel model = SessionModel.of(session(mr("2", "MPRAGE", "MPRAGE_SAG_1mm")));

        Finding finding = resolve(new RenameResolver(table), model, "2");

        assertEquals(FindingType.RESOLVED_RENAME, finding.getType());
        assertEquals("T1", finding.getCandidate());
    }

    @Test
    @DisplayName("Eligibility should ignore quality and frame findings")
    void eligibilityShouldIgnoreOtherFindings() {
        assertTrue(RenameResolver.isEligible(Collections.emptyList()));
        assertTrue(RenameResolver.isEligible(Collections.singletonList(
                Finding.incomplete("1", "120 frames, expected 176 for MR"))));
        assertFalse(RenameResolver.isEligible(Collections.singletonList(
                Finding.duplicateType("1", "Type 'T1' shared with scan(s) 2"))));
    }
}
