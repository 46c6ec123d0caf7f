/*
 * XNAT Scan Curator
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.curator.quality;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Frame count expectations from the {@code expected_frames} configuration map.
 * Modality keys are matched case-insensitively.
 */
public class ConfiguredQualityExpectations implements QualityExpectations {

    private final Map<String, Integer> expectedFrames = new HashMap<>();

    public ConfiguredQualityExpectations(Map<String, Integer> expectedFrames) {
        if (expectedFrames != null) {
            for (Map.Entry<String, Integer> entry : expectedFrames.entrySet()) {
                if (entry.getKey() != null && entry.getValue() != null) {
                    this.expectedFrames.put(normalize(entry.getKey()), entry.getValue());
                }
            }
        }
    }

    public static ConfiguredQualityExpectations none() {
        return new ConfiguredQualityExpectations(Collections.emptyMap());
    }

    @Override
    public OptionalInt expectedFor(String modality) {
        if (modality == null) {
            return OptionalInt.empty();
        }
        Integer expected = expectedFrames.get(normalize(modality));
        return expected != null ? OptionalInt.of(expected) : OptionalInt.empty();
    }

    private static String normalize(String modality) {
        return modality.trim().toUpperCase(Locale.ROOT);
    }
}
