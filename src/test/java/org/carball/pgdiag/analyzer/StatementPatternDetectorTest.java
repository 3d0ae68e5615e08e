package org.carball.pgdiag.analyzer;

import org.carball.pgdiag.config.Thresholds;
import org.carball.pgdiag.exception.ThresholdConfigException;
import org.carball.pgdiag.model.finding.Finding;
import org.carball.pgdiag.model.finding.FindingCategory;
import org.carball.pgdiag.model.finding.Severity;
import org.carball.pgdiag.model.statement.StatementFinding;
import org.carball.pgdiag.model.statement.StatementStat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class StatementPatternDetectorTest {

    private StatementPatternDetector detector;
    private Thresholds thresholds;

    @BeforeEach
    void setUp() {
        detector = new StatementPatternDetector();
        thresholds = Thresholds.defaults();
    }

    @Test
    void shouldFlagWildcardSearchWithPoorCacheAndHighCalls() {
        // Given
        StatementStat messages = StatementStat.builder()
                .query("SELECT * FROM messages WHERE body LIKE '%urgent%'")
                .calls(5234)
                .meanTimeMs(2345.67)
                .totalTimeMs(5234 * 2345.67)
                .rows(5234)
                .sharedBlocksHit(653)
                .sharedBlocksRead(347)
                .build();

        // When
        List<StatementFinding> results = detector.detect(List.of(messages), thresholds);

        // Then
        assertThat(results).hasSize(1);
        StatementFinding result = results.get(0);
        assertThat(result.rank()).isEqualTo(1);
        assertThat(result.findings()).extracting(Finding::category).containsExactly(
                FindingCategory.WILDCARD_LIKE,
                FindingCategory.HIGH_CALL_COUNT,
                FindingCategory.CACHE_POOR);
        assertThat(result.findings()).extracting(Finding::severity).containsExactly(
                Severity.WARNING, Severity.NOTICE, Severity.WARNING);
        assertThat(result.findings().get(0).message()).contains("cannot use index");
        assertThat(result.findings().get(1).message()).contains("candidate for caching");
        assertThat(result.findings().get(2).message()).isEqualTo("Low cache hit ratio (65.3%), below the 90.0% target.");
    }

    @Test
    void shouldNeverReturnMoreThanLimitOrFasterThanMinimum() {
        // Given
        List<StatementStat> stats = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            stats.add(stat("SELECT " + i, 10, 500.0 + i * 50));
        }
        Thresholds limited = thresholds.toBuilder().limit(5).build();

        // When
        List<StatementFinding> results = detector.detect(stats, limited);

        // Then
        assertThat(results).hasSize(5);
        assertThat(results).allSatisfy(r -> assertThat(r.statement().meanTimeMs()).isGreaterThanOrEqualTo(1000.0));
        assertThat(results).extracting(StatementFinding::rank).containsExactly(1, 2, 3, 4, 5);
        assertThat(results.get(0).statement().query()).isEqualTo("SELECT 49");
    }

    @Test
    void shouldKeepStatementsExactlyAtMinimumDuration() {
        // Given
        List<StatementStat> stats = List.of(stat("SELECT 1", 1, 1000.0), stat("SELECT 2", 1, 999.99));

        // When
        List<StatementFinding> results = detector.detect(stats, thresholds);

        // Then
        assertThat(results).extracting(r -> r.statement().query()).containsExactly("SELECT 1");
    }

    @Test
    void shouldBreakTotalTimeTiesByMeanTime() {
        // Given
        StatementStat frequent = stat("SELECT frequent", 10, 1500.0).toBuilder().totalTimeMs(15_000).build();
        StatementStat rare = stat("SELECT rare", 5, 3000.0).toBuilder().totalTimeMs(15_000).build();
        StatementStat top = stat("SELECT top", 20, 2000.0);

        // When
        List<StatementFinding> results = detector.detect(List.of(frequent, rare, top), thresholds);

        // Then
        assertThat(results).extracting(r -> r.statement().query())
                .containsExactly("SELECT top", "SELECT rare", "SELECT frequent");
    }

    @Test
    void shouldRejectNonPositiveLimit() {
        Thresholds invalid = thresholds.toBuilder().limit(0).build();

        assertThatThrownBy(() -> detector.detect(List.of(), invalid))
                .isInstanceOf(ThresholdConfigException.class);
    }

    @Test
    void shouldIgnoreMonitoringNoise() {
        // Given
        List<StatementStat> stats = List.of(
                stat("EXPLAIN ANALYZE SELECT * FROM orders", 1, 5000.0),
                stat("SELECT query, calls FROM pg_stat_statements ORDER BY total_exec_time DESC", 1, 4000.0),
                stat("SELECT * FROM orders", 1, 3000.0));

        // When
        List<StatementFinding> results = detector.detect(stats, thresholds);

        // Then
        assertThat(results).extracting(r -> r.statement().query()).containsExactly("SELECT * FROM orders");
    }

    @Test
    void shouldDetectNotInAndNotExists() {
        assertThat(categories("SELECT id FROM users WHERE id NOT IN (SELECT user_id FROM bans)"))
                .contains(FindingCategory.NOT_IN_EXISTS);
        assertThat(categories("select 1 from a where not exists (select 1 from b)"))
                .contains(FindingCategory.NOT_IN_EXISTS);
    }

    @Test
    void shouldFlagThreeOrMoreOrPredicates() {
        assertThat(categories("SELECT * FROM t WHERE a = 1 OR b = 2 OR c = 3"))
                .contains(FindingCategory.MULTI_OR);
        assertThat(categories("SELECT * FROM t WHERE a = 1 OR b = 2 ORDER BY a"))
                .doesNotContain(FindingCategory.MULTI_OR);
    }

    @Test
    void shouldFlagDistinctWithoutCheckingIndexes() {
        List<Finding> findings = detector.evaluate(stat("SELECT DISTINCT customer_id FROM orders", 1, 1200.0), thresholds);

        assertThat(findings).singleElement().satisfies(f -> {
            assertThat(f.category()).isEqualTo(FindingCategory.UNINDEXED_DISTINCT);
            assertThat(f.severity()).isEqualTo(Severity.NOTICE);
            assertThat(f.message()).contains("verify supporting index");
        });
    }

    @Test
    void shouldFlagHighVarianceAndLargeResultSets() {
        // Given
        StatementStat stat = stat("SELECT * FROM events", 10, 1200.0).toBuilder()
                .stddevTimeMs(900.0)
                .rows(50_000)
                .build();

        // When
        List<Finding> findings = detector.evaluate(stat, thresholds);

        // Then
        assertThat(findings).extracting(Finding::category)
                .containsExactly(FindingCategory.HIGH_VARIANCE, FindingCategory.LARGE_RESULT_SET);
    }

    @Test
    void shouldNotFlagCleanStatement() {
        assertThat(detector.evaluate(stat("SELECT * FROM users WHERE id = $1", 10, 1200.0), thresholds)).isEmpty();
    }

    private List<FindingCategory> categories(String sql) {
        return detector.evaluate(stat(sql, 1, 1200.0), thresholds).stream()
                .map(Finding::category)
                .toList();
    }

    private static StatementStat stat(String query, long calls, double meanTimeMs) {
        return StatementStat.builder()
                .query(query)
                .calls(calls)
                .meanTimeMs(meanTimeMs)
                .totalTimeMs(calls * meanTimeMs)
                .rows(calls)
                .build();
    }
}
