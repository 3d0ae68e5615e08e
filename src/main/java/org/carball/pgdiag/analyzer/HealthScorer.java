package org.carball.pgdiag.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.pgdiag.config.Thresholds;
import org.carball.pgdiag.model.finding.Finding;
import org.carball.pgdiag.model.finding.Severity;
import org.carball.pgdiag.model.health.ConnectionStats;
import org.carball.pgdiag.model.health.HealthBand;
import org.carball.pgdiag.model.health.HealthDomain;
import org.carball.pgdiag.model.health.HealthMetric;
import org.carball.pgdiag.model.health.HealthReport;
import org.carball.pgdiag.model.health.HealthSnapshot;
import org.carball.pgdiag.model.health.LongRunningQuery;
import org.carball.pgdiag.model.health.ReplicaStatus;
import org.carball.pgdiag.model.health.TableBloat;
import org.carball.pgdiag.model.health.TableDeadTuples;
import org.carball.pgdiag.model.health.TableSize;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Combines independent server health readings into one 0-100 score.
 *
 * <p>Every metric is scored on its own and contributes at most its weight, so a single bad metric
 * costs at most that weight. Each metric reports one finding for the tier it lands in, Critical when
 * it scores zero. Metrics without data are scored at full weight and marked as not applicable.
 */
@Slf4j
public class HealthScorer {

    private static final double CONNECTIONS_WARNING = 0.80;
    private static final double CONNECTIONS_CRITICAL = 0.95;

    private static final double CACHE_EXCELLENT = 0.99;
    private static final double CACHE_MINIMUM = 0.90;

    private static final double DEAD_TUPLES_WARNING = 0.10;
    private static final double DEAD_TUPLES_CRITICAL = 0.20;

    private static final Duration REPLICATION_LAG_CRITICAL = Duration.ofSeconds(60);

    private static final int BLOAT_CRITICAL_TABLES = 3;
    private static final int LARGEST_TABLES_SHOWN = 5;

    public HealthReport score(HealthSnapshot snapshot, Thresholds thresholds) {
        thresholds.validate();
        log.info("Scoring server health snapshot");

        List<HealthMetric> metrics = List.of(
                scoreConnections(snapshot.connections(), thresholds),
                scoreCacheHitRatio(snapshot.cacheHitRatio()),
                scoreVacuum(snapshot.deadTuples()),
                scoreReplication(snapshot.replicas(), snapshot.expectedReplicas()),
                scoreLongRunning(snapshot.longRunningQueries(), thresholds),
                scoreBloat(snapshot.tableBloat(), thresholds));

        double achieved = metrics.stream().mapToDouble(HealthMetric::achievedWeight).sum();
        int score = (int) Math.max(0, Math.min(100, Math.round(achieved)));
        // Banded on the exact sum; 89.5 is Good even though it displays as 90
        HealthBand band = HealthBand.fromScore(achieved);

        List<Finding> issues = metrics.stream()
                .flatMap(metric -> metric.findings().stream())
                .filter(finding -> finding.severity() != Severity.INFO)
                .sorted(Finding.MOST_SEVERE_FIRST)
                .collect(Collectors.toList());

        List<TableSize> largestTables = snapshot.largestTables() == null ? List.of()
                : snapshot.largestTables().stream()
                        .sorted(Comparator.comparingLong(TableSize::sizeBytes).reversed())
                        .limit(LARGEST_TABLES_SHOWN)
                        .collect(Collectors.toList());

        log.info("Health score {} ({}) with {} issues", score, band.getDisplayName(), issues.size());
        return new HealthReport(score, band, metrics, issues, largestTables);
    }

    HealthMetric scoreConnections(ConnectionStats connections, Thresholds thresholds) {
        HealthDomain domain = HealthDomain.CONNECTIONS;
        if (connections == null || connections.maxConnections() <= 0) {
            return notApplicable(domain, "connection statistics unavailable");
        }

        double utilization = connections.utilization();
        String observed = String.format(Locale.ROOT, "%d/%d connections (%.1f%% used), %d waiting",
                connections.total(), connections.maxConnections(), utilization * 100, connections.waiting());
        List<Finding> findings = new ArrayList<>();
        double share;

        if (connections.waiting() > 0) {
            share = 0.0;
            findings.add(Finding.critical(domain.getCategory(),
                    String.format(Locale.ROOT, "%d connection(s) are waiting; connection usage is %.1f%%.",
                            connections.waiting(), utilization * 100),
                    "Investigate lock waits and consider a connection pooler such as PgBouncer."));
        } else if (utilization >= CONNECTIONS_CRITICAL) {
            share = 0.0;
            findings.add(Finding.critical(domain.getCategory(),
                    String.format(Locale.ROOT, "Connection usage is %.1f%%, close to max_connections (%d).",
                            utilization * 100, connections.maxConnections()),
                    "Add a connection pooler or raise max_connections."));
        } else if (utilization >= CONNECTIONS_WARNING) {
            share = 0.5;
            findings.add(Finding.warning(domain.getCategory(),
                    String.format(Locale.ROOT, "Connection usage is above 80%% (%.1f%%).", utilization * 100),
                    "Review connection pooling before the limit is reached."));
        } else {
            share = 1.0;
            findings.add(Finding.info(domain.getCategory(),
                    String.format(Locale.ROOT, "Connection usage is %.1f%% (%d of %d).",
                            utilization * 100, connections.total(), connections.maxConnections())));
        }

        if (connections.idleInTransaction() > thresholds.getIdleInTransactionThreshold()) {
            findings.add(Finding.warning(domain.getCategory(),
                    String.format(Locale.ROOT, "%d connections are idle in transaction.", connections.idleInTransaction()),
                    "Check the application for uncommitted transactions."));
        }
        return metric(domain, observed, share, findings);
    }

    HealthMetric scoreCacheHitRatio(Double cacheHitRatio) {
        HealthDomain domain = HealthDomain.CACHE_HIT_RATIO;
        if (cacheHitRatio == null) {
            return notApplicable(domain, "cache statistics unavailable");
        }

        double ratio = cacheHitRatio;
        String percent = String.format(Locale.ROOT, "%.2f%%", ratio * 100);
        if (ratio >= CACHE_EXCELLENT) {
            return metric(domain, percent, 1.0, List.of(Finding.info(domain.getCategory(),
                    "Excellent cache performance: hit ratio is " + percent + ".")));
        }
        if (ratio >= CACHE_MINIMUM) {
            double share = 0.5 + 0.5 * (ratio - CACHE_MINIMUM) / (CACHE_EXCELLENT - CACHE_MINIMUM);
            return metric(domain, percent, share, List.of(Finding.notice(domain.getCategory(),
                    "Good cache performance: hit ratio is " + percent + ".",
                    "A larger shared_buffers could lift the hit ratio above 99%.")));
        }
        return metric(domain, percent, 0.0, List.of(Finding.critical(domain.getCategory(),
                "Cache hit ratio is " + percent + ", below 90%.",
                "Consider increasing shared_buffers.")));
    }

    HealthMetric scoreVacuum(List<TableDeadTuples> deadTuples) {
        HealthDomain domain = HealthDomain.VACUUM;
        if (deadTuples == null) {
            return notApplicable(domain, "dead tuple statistics unavailable");
        }
        if (deadTuples.isEmpty()) {
            return metric(domain, "no tables with dead tuples", 1.0, List.of(Finding.info(domain.getCategory(),
                    "No tables with significant dead tuples.")));
        }

        TableDeadTuples worst = deadTuples.stream()
                .max(Comparator.comparingDouble(TableDeadTuples::deadTupleRatio))
                .orElseThrow();
        double ratio = worst.deadTupleRatio();
        String observed = String.format(Locale.ROOT, "max dead tuple ratio %.1f%% (%s)", ratio * 100, worst.table());

        if (ratio < DEAD_TUPLES_WARNING) {
            return metric(domain, observed, 1.0, List.of(Finding.info(domain.getCategory(),
                    String.format(Locale.ROOT, "Dead tuples are under control; the highest ratio is %.1f%% on %s.",
                            ratio * 100, worst.table()))));
        }
        if (ratio <= DEAD_TUPLES_CRITICAL) {
            return metric(domain, observed, 0.5, List.of(Finding.warning(domain.getCategory(),
                    String.format(Locale.ROOT, "Table %s has %,d dead tuples (%.1f%% of live rows).",
                            worst.table(), worst.deadTuples(), ratio * 100),
                    "Check that autovacuum keeps up with this table.")));
        }
        return metric(domain, observed, 0.0, List.of(Finding.critical(domain.getCategory(),
                String.format(Locale.ROOT, "Table %s has %,d dead tuples (%.1f%% of live rows).",
                        worst.table(), worst.deadTuples(), ratio * 100),
                "Run VACUUM on " + worst.table() + " and tune autovacuum for it.")));
    }

    HealthMetric scoreReplication(List<ReplicaStatus> replicas, Integer expectedReplicas) {
        HealthDomain domain = HealthDomain.REPLICATION;
        int expected = expectedReplicas != null ? expectedReplicas : 0;
        if (replicas == null || (replicas.isEmpty() && expected == 0)) {
            return notApplicable(domain, "no replicas configured");
        }

        Duration maxLag = replicas.stream()
                .map(ReplicaStatus::effectiveLag)
                .max(Comparator.naturalOrder())
                .orElse(Duration.ZERO);
        String observed = String.format(Locale.ROOT, "%d replica(s), max lag %s",
                replicas.size(), formatDuration(maxLag));

        if (replicas.size() < expected) {
            return metric(domain, observed, 0.0, List.of(Finding.critical(domain.getCategory(),
                    String.format(Locale.ROOT, "Only %d of %d expected replicas are connected.",
                            replicas.size(), expected),
                    "Check the missing standbys and their replication slots.")));
        }
        if (maxLag.compareTo(REPLICATION_LAG_CRITICAL) >= 0) {
            return metric(domain, observed, 0.0, List.of(Finding.critical(domain.getCategory(),
                    "Replication lag is " + formatDuration(maxLag) + ", above one minute.",
                    "Check standby I/O, network throughput and long-running queries on the replicas.")));
        }
        if (!maxLag.isZero()) {
            return metric(domain, observed, 0.5, List.of(Finding.warning(domain.getCategory(),
                    "Replication lag is " + formatDuration(maxLag) + ".",
                    "Watch the lag trend; sustained lag means the standbys cannot keep up.")));
        }
        return metric(domain, observed, 1.0, List.of(Finding.info(domain.getCategory(),
                String.format(Locale.ROOT, "All %d replicas are in sync.", replicas.size()))));
    }

    HealthMetric scoreLongRunning(List<LongRunningQuery> queries, Thresholds thresholds) {
        HealthDomain domain = HealthDomain.LONG_RUNNING;
        if (queries == null) {
            return notApplicable(domain, "activity statistics unavailable");
        }

        Duration limit = Duration.ofSeconds(thresholds.getLongRunningSeconds());
        List<LongRunningQuery> offenders = queries.stream()
                .filter(query -> query.duration() != null && query.duration().compareTo(limit) > 0)
                .sorted(Comparator.comparing(LongRunningQuery::duration).reversed())
                .collect(Collectors.toList());

        if (offenders.isEmpty()) {
            return metric(domain, "none", 1.0, List.of(Finding.info(domain.getCategory(),
                    "No queries running longer than " + formatDuration(limit) + ".")));
        }

        LongRunningQuery longest = offenders.get(0);
        String observed = String.format(Locale.ROOT, "%d running, longest %s", offenders.size(),
                formatDuration(longest.duration()));
        return metric(domain, observed, 0.0, List.of(Finding.critical(domain.getCategory(),
                String.format(Locale.ROOT, "%d query(ies) running longer than %s; PID %d has been running for %s: %s",
                        offenders.size(), formatDuration(limit), longest.pid(), formatDuration(longest.duration()),
                        abbreviate(longest.query(), 100)),
                "Investigate these queries and cancel them with pg_cancel_backend if they are stuck.")));
    }

    HealthMetric scoreBloat(List<TableBloat> bloat, Thresholds thresholds) {
        HealthDomain domain = HealthDomain.BLOAT;
        if (bloat == null) {
            return notApplicable(domain, "bloat estimates unavailable");
        }

        List<TableBloat> bloated = bloat.stream()
                .filter(table -> table.bloatRatio() > thresholds.getBloatThreshold())
                .sorted(Comparator.comparingDouble(TableBloat::bloatRatio).reversed())
                .collect(Collectors.toList());
        String observed = bloated.size() + " table(s) above " + percent(thresholds.getBloatThreshold());

        if (bloated.isEmpty()) {
            return metric(domain, observed, 1.0, List.of(Finding.info(domain.getCategory(),
                    "No table exceeds the " + percent(thresholds.getBloatThreshold()) + " bloat threshold.")));
        }

        String tables = bloated.stream()
                .map(table -> table.table() + " (" + percent(table.bloatRatio()) + ")")
                .collect(Collectors.joining(", "));
        String message = String.format(Locale.ROOT, "%d table(s) exceed the %s bloat threshold: %s.",
                bloated.size(), percent(thresholds.getBloatThreshold()), tables);
        String remediation = "Reclaim space with VACUUM FULL or pg_repack, and REINDEX bloated indexes.";

        if (bloated.size() >= BLOAT_CRITICAL_TABLES) {
            return metric(domain, observed, 0.0, List.of(Finding.critical(domain.getCategory(), message, remediation)));
        }
        return metric(domain, observed, 0.5, List.of(Finding.warning(domain.getCategory(), message, remediation)));
    }

    private static HealthMetric metric(HealthDomain domain, String observed, double share, List<Finding> findings) {
        return new HealthMetric(domain, observed, share * 100, domain.getWeight(),
                share * domain.getWeight(), true, findings);
    }

    private static HealthMetric notApplicable(HealthDomain domain, String reason) {
        log.debug("{} not applicable: {}", domain.getDisplayName(), reason);
        return new HealthMetric(domain, reason, 100.0, domain.getWeight(), domain.getWeight(), false,
                List.of(Finding.info(domain.getCategory(),
                        domain.getDisplayName() + " check is not applicable: " + reason + ".")));
    }

    static String formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;
        if (hours > 0) {
            return String.format(Locale.ROOT, "%dh%02dm%02ds", hours, minutes, secs);
        } else if (minutes > 0) {
            return String.format(Locale.ROOT, "%dm%02ds", minutes, secs);
        }
        return secs + "s";
    }

    private static String percent(double ratio) {
        return String.format(Locale.ROOT, "%.1f%%", ratio * 100);
    }

    private static String abbreviate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        String singleLine = text.replaceAll("\\s+", " ").trim();
        return singleLine.length() > maxLength ? singleLine.substring(0, maxLength) + "..." : singleLine;
    }
}
