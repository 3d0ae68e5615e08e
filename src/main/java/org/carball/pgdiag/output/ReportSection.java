package org.carball.pgdiag.output;

import lombok.Getter;

@Getter
public enum ReportSection {
    PLAN("Execution Plan"),
    STATEMENTS("Slow Statements"),
    HEALTH("Server Health");

    private final String title;

    ReportSection(String title) {
        this.title = title;
    }
}
