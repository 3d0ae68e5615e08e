package org.carball.pgdiag.model.plan;

import java.util.Locale;

public enum PlanFormat {
    TEXT,
    JSON,
    XML,
    YAML,
    /** Tree handed over already parsed by the data access layer. */
    TREE;

    public static PlanFormat fromName(String name) {
        if (name == null || name.isBlank()) {
            return TEXT;
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
