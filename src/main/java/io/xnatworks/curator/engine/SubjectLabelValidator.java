/*
 * XNAT Scan Curator
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.curator.engine;

import java.util.regex.Pattern;

/**
 * Checks subject labels against the lab convention: two uppercase letters,
 * four digits, {@code _v} and a one-character visit code (e.g. LD4001_v1).
 * Failing labels are reported, never corrected.
 */
public final class SubjectLabelValidator {

    static final Pattern SUBJECT_LABEL_PATTERN = Pattern.compile("[A-Z]{2}[0-9]{4}_v[A-Z0-9]");

    private static final int PROJECT_CODE_LENGTH = 3;

    private SubjectLabelValidator() {
    }

    public static boolean validate(String label) {
        return label != null && SUBJECT_LABEL_PATTERN.matcher(label).matches();
    }

    /**
     * Study code of a valid label (LD4001_v1 -> LD4), used to scope rename rules.
     *
     * @throws IllegalArgumentException if the label is not valid
     */
    public static String projectCode(String label) {
        if (!validate(label)) {
            throw new IllegalArgumentException("Invalid subject label: " + label);
        }
        return label.substring(0, PROJECT_CODE_LENGTH);
    }
}
