package org.carball.pgdiag.model.finding;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Comparator;
import java.util.Objects;

/**
 * A single diagnostic observation. The message is a complete sentence that can be rendered verbatim.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Finding(
        Severity severity,
        FindingCategory category,
        String message,
        String remediation
) {

    /** Most severe first; insertion order is kept for equal severities by stable sorts. */
    public static final Comparator<Finding> MOST_SEVERE_FIRST =
            Comparator.comparing(Finding::severity).reversed();

    public Finding {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(message, "message");
    }

    public static Finding info(FindingCategory category, String message) {
        return new Finding(Severity.INFO, category, message, null);
    }

    public static Finding notice(FindingCategory category, String message, String remediation) {
        return new Finding(Severity.NOTICE, category, message, remediation);
    }

    public static Finding warning(FindingCategory category, String message, String remediation) {
        return new Finding(Severity.WARNING, category, message, remediation);
    }

    public static Finding critical(FindingCategory category, String message, String remediation) {
        return new Finding(Severity.CRITICAL, category, message, remediation);
    }

    public boolean hasRemediation() {
        return remediation != null && !remediation.isBlank();
    }
}
