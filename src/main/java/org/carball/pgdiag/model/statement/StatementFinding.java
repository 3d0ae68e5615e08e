package org.carball.pgdiag.model.statement;

import org.carball.pgdiag.model.finding.Finding;

import java.util.Comparator;
import java.util.List;

/**
 * A ranked slow statement together with the advisories raised for it.
 */
public record StatementFinding(
        int rank,
        StatementStat statement,
        List<Finding> findings
) {

    /** Total time descending, then mean time descending. */
    public static final Comparator<StatementStat> RANKING =
            Comparator.comparingDouble(StatementStat::totalTimeMs).reversed()
                    .thenComparing(Comparator.comparingDouble(StatementStat::meanTimeMs).reversed());

    public StatementFinding {
        findings = List.copyOf(findings);
    }
}
