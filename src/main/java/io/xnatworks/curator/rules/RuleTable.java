/*
 * XNAT Scan Curator
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.curator.rules;

import java.util.List;

/**
 * Lookup of canonical scan types by observed series description.
 */
public interface RuleTable {

    /**
     * Return the rules that apply to a scan. An empty list means no rule
     * matched; rules naming different canonical types are competing
     * candidates and are left for the caller to treat as ambiguous.
     *
     * @param description the scan's series description
     * @param context     project code, current type and modality of the scan
     * @return matching rules, never null
     */
    List<RenameRule> lookup(String description, RuleContext context);
}
