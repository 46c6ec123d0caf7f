/*
 * XNAT Scan Curator
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.curator.quality;

import java.util.OptionalInt;

/**
 * Source of expected acquisition sizes, used to spot incomplete scans.
 */
public interface QualityExpectations {

    /**
     * Expected frame count for a modality, or empty when nothing is known.
     */
    OptionalInt expectedFor(String modality);
}
