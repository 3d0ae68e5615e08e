package org.carball.pgdiag.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.pgdiag.config.Thresholds;
import org.carball.pgdiag.model.finding.Finding;
import org.carball.pgdiag.model.finding.FindingCategory;
import org.carball.pgdiag.model.statement.StatementFinding;
import org.carball.pgdiag.model.statement.StatementStat;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Ranks slow statements from pg_stat_statements and flags latency and SQL anti-patterns.
 *
 * <p>The SQL checks are plain case-insensitive text matches on the normalized query. They do not
 * understand comments, string literals or the actual indexes, and are meant as coarse advisories.
 */
@Slf4j
public class StatementPatternDetector {

    private static final Pattern LEADING_WILDCARD_LIKE = Pattern.compile(
            "\\bI?LIKE\\s+'%", Pattern.CASE_INSENSITIVE);

    private static final Pattern NOT_IN_OR_EXISTS = Pattern.compile(
            "\\bNOT\\s+(?:IN|EXISTS)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern OR_KEYWORD = Pattern.compile("\\bOR\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern DISTINCT = Pattern.compile("\\bDISTINCT\\b", Pattern.CASE_INSENSITIVE);

    // The collector's own statements and EXPLAIN runs are noise in the ranking
    private static final Pattern MONITORING_NOISE = Pattern.compile(
            "^\\s*EXPLAIN\\b|pg_stat_statements", Pattern.CASE_INSENSITIVE);

    /**
     * Filters to statements at or above the minimum mean time, ranks them by total time
     * (mean time breaking ties) and returns at most {@code limit} entries with their findings.
     *
     * @throws org.carball.pgdiag.exception.ThresholdConfigException when the thresholds are invalid
     */
    public List<StatementFinding> detect(List<StatementStat> stats, Thresholds thresholds) {
        thresholds.validate();
        log.info("Scoring {} statements (min mean {} ms, limit {})",
                stats.size(), thresholds.getMinDurationMs(), thresholds.getLimit());

        List<StatementStat> ranked = stats.stream()
                .filter(stat -> stat.meanTimeMs() >= thresholds.getMinDurationMs())
                .filter(stat -> stat.query() == null || !MONITORING_NOISE.matcher(stat.query()).find())
                .sorted(StatementFinding.RANKING)
                .limit(thresholds.getLimit())
                .collect(Collectors.toList());

        List<StatementFinding> results = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            StatementStat stat = ranked.get(i);
            results.add(new StatementFinding(i + 1, stat, evaluate(stat, thresholds)));
        }

        log.info("Found {} slow statements", results.size());
        return results;
    }

    /**
     * Applies every statement rule independently. Rule order is fixed.
     */
    public List<Finding> evaluate(StatementStat stat, Thresholds thresholds) {
        List<Finding> findings = new ArrayList<>();
        String sql = stat.query() != null ? stat.query() : "";

        if (LEADING_WILDCARD_LIKE.matcher(sql).find()) {
            findings.add(Finding.warning(FindingCategory.WILDCARD_LIKE,
                    "LIKE pattern with a leading wildcard cannot use index.",
                    "Use a trigram (pg_trgm) index or full-text search for substring matching."));
        }
        if (NOT_IN_OR_EXISTS.matcher(sql).find()) {
            findings.add(Finding.notice(FindingCategory.NOT_IN_EXISTS,
                    "NOT IN / NOT EXISTS can be slow on large inputs.",
                    "Consider a LEFT JOIN with an IS NULL check."));
        }
        int predicates = countOrKeywords(sql) + 1;
        if (predicates >= thresholds.getMultiOrPredicates()) {
            findings.add(Finding.notice(FindingCategory.MULTI_OR,
                    String.format(Locale.ROOT, "Query joins %d predicates with OR, which may prevent index usage.",
                            predicates),
                    "Consider rewriting as UNION or using IN (...)."));
        }
        if (DISTINCT.matcher(sql).find()) {
            findings.add(Finding.notice(FindingCategory.UNINDEXED_DISTINCT,
                    "DISTINCT can be expensive; verify supporting index.",
                    "Make sure an index covers the DISTINCT columns, or remove DISTINCT if rows are already unique."));
        }
        if (stat.calls() > thresholds.getHighCallThreshold()) {
            findings.add(Finding.notice(FindingCategory.HIGH_CALL_COUNT,
                    String.format(Locale.ROOT, "Statement executed %,d times; a candidate for caching.", stat.calls()),
                    "Cache the result in the application or reduce how often it is issued."));
        }
        double cacheHit = stat.cacheHitRatio();
        if (cacheHit < thresholds.getCacheHitMin()) {
            findings.add(Finding.warning(FindingCategory.CACHE_POOR,
                    String.format(Locale.ROOT, "Low cache hit ratio (%.1f%%), below the %.1f%% target.",
                            cacheHit * 100, thresholds.getCacheHitMin() * 100),
                    "Consider increasing shared_buffers or reducing the data this statement touches."));
        }
        if (stat.meanTimeMs() > 0 && stat.stddevTimeMs() > stat.meanTimeMs() * thresholds.getHighVarianceRatio()) {
            findings.add(Finding.notice(FindingCategory.HIGH_VARIANCE,
                    String.format(Locale.ROOT, "Execution time varies widely (stddev %.2f ms against a mean of %.2f ms).",
                            stat.stddevTimeMs(), stat.meanTimeMs()),
                    "Investigate data distribution and parameter values that make some executions slow."));
        }
        if (stat.rowsPerCall() > thresholds.getRowsPerCallThreshold()) {
            findings.add(Finding.notice(FindingCategory.LARGE_RESULT_SET,
                    String.format(Locale.ROOT, "Statement returns %.1f rows per call.", stat.rowsPerCall()),
                    "Consider pagination or more selective filters."));
        }
        return findings;
    }

    private static int countOrKeywords(String sql) {
        Matcher matcher = OR_KEYWORD.matcher(sql);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
