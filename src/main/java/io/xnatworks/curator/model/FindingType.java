/*
 * XNAT Scan Curator
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.curator.model;

/**
 * Kinds of diagnostic results the engine attaches to a subject or scan.
 */
public enum FindingType {
    /** Subject label does not follow the naming convention. */
    VALID_LABEL_FAILURE,
    /** Scan type or description carries an unusable marker (INC, BAD). */
    UNUSABLE_MARKER,
    /** Another scan in the session has the same current type. */
    DUPLICATE_TYPE,
    /** Frame count differs from the expected count for the modality. */
    INCOMPLETE_ACQUISITION,
    /** Recorded quality signal disagrees with expectation. */
    QUALITY_MISMATCH,
    /** Rule table produced exactly one canonical type. */
    RESOLVED_RENAME,
    /** Rule table produced competing canonical types. */
    AMBIGUOUS_RENAME
}
