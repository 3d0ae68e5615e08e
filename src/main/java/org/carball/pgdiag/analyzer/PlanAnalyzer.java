package org.carball.pgdiag.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.pgdiag.config.Thresholds;
import org.carball.pgdiag.exception.PlanDepthExceededException;
import org.carball.pgdiag.exception.PlanParseException;
import org.carball.pgdiag.model.finding.Finding;
import org.carball.pgdiag.model.finding.FindingCategory;
import org.carball.pgdiag.model.plan.ExecutionPlan;
import org.carball.pgdiag.model.plan.NodeKind;
import org.carball.pgdiag.model.plan.PlanAnalysis;
import org.carball.pgdiag.model.plan.PlanNode;
import org.carball.pgdiag.model.plan.PlanSource;
import org.carball.pgdiag.model.plan.TimingSummary;
import org.carball.pgdiag.parser.PlanJsonParser;
import org.carball.pgdiag.parser.PlanTextParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Detects execution-time and cost anti-patterns in a single EXPLAIN plan.
 *
 * <p>Node rules run during a pre-order walk and each contributes at most one finding per node.
 * Plan level findings (index usage, absence of sequential scans, filter waste) follow the node
 * findings, and timing findings come last. The same plan always yields the same findings in the
 * same order.
 */
@Slf4j
public class PlanAnalyzer {

    private final PlanTextParser textParser;
    private final PlanJsonParser jsonParser;

    public PlanAnalyzer() {
        this(new PlanTextParser(), new PlanJsonParser());
    }

    public PlanAnalyzer(PlanTextParser textParser, PlanJsonParser jsonParser) {
        this.textParser = textParser;
        this.jsonParser = jsonParser;
    }

    /**
     * Parses the raw payload (unless it already is a tree) and analyses it.
     *
     * @throws PlanParseException         when the payload is malformed
     * @throws PlanDepthExceededException when the tree is deeper than {@code maxPlanDepth}
     */
    public PlanAnalysis analyze(PlanSource source, Thresholds thresholds) {
        thresholds.validate();
        return analyze(parse(source, thresholds), thresholds);
    }

    public ExecutionPlan parse(PlanSource source, Thresholds thresholds) {
        int maxDepth = thresholds.getMaxPlanDepth();
        ExecutionPlan parsed = switch (source.format()) {
            case TREE -> {
                if (source.tree() == null) {
                    throw new PlanParseException("Plan source declares a tree but carries none");
                }
                yield ExecutionPlan.of(source.tree());
            }
            case TEXT -> textParser.parse(source.payload(), maxDepth);
            case JSON, YAML -> jsonParser.parse(source.payload(), source.format(), maxDepth);
            case XML -> throw new PlanParseException("EXPLAIN XML output is not supported; use TEXT, JSON or YAML");
        };

        Double planning = source.planningTimeMs() != null ? source.planningTimeMs() : parsed.planningTimeMs();
        Double execution = source.executionTimeMs() != null ? source.executionTimeMs() : parsed.executionTimeMs();
        return new ExecutionPlan(parsed.root(), planning, execution, source.format(), source.rawLength());
    }

    public PlanAnalysis analyze(ExecutionPlan plan, Thresholds thresholds) {
        thresholds.validate();
        log.info("Analyzing {} execution plan rooted at '{}'", plan.sourceFormat(), plan.root().operation());

        WalkState state = new WalkState();
        List<Finding> findings = new ArrayList<>();
        walk(plan.root(), 1, thresholds, findings, state);

        if (state.indexScans + state.bitmapScans > 0) {
            findings.add(Finding.info(FindingCategory.INDEX_USAGE_GOOD, String.format(Locale.ROOT,
                    "Efficient index usage: the plan reads through %d index scan(s) and %d bitmap scan(s).",
                    state.indexScans, state.bitmapScans)));
        }
        if (state.seqScans == 0 && state.indexScans + state.bitmapScans > 0) {
            findings.add(Finding.info(FindingCategory.SEQ_SCAN, "No sequential scans detected."));
        }
        if (state.rowsRemovedByFilter > thresholds.getFilterRowsRemovedThreshold()) {
            findings.add(Finding.warning(FindingCategory.FILTER_ROWS_REMOVED,
                    String.format(Locale.ROOT, "Filters discarded %d rows after reading them.",
                            state.rowsRemovedByFilter),
                    "Use more selective conditions or index the filtered columns."));
        }

        TimingSummary timing = null;
        if (plan.hasExecutionTime()) {
            timing = TimingSummary.of(plan.planningTimeMs(), plan.executionTimeMs());
            addTimingFindings(timing, thresholds, findings);
        }

        log.info("Plan analysis complete: {} nodes, {} findings", state.nodeCount, findings.size());
        return new PlanAnalysis(timing, findings, state.nodeCount);
    }

    private void walk(PlanNode node, int depth, Thresholds thresholds, List<Finding> findings, WalkState state) {
        if (depth > thresholds.getMaxPlanDepth()) {
            throw new PlanDepthExceededException(thresholds.getMaxPlanDepth());
        }
        state.record(node);

        Optional<Finding> finding = switch (node.kind()) {
            case SEQ_SCAN -> checkSeqScan(node, thresholds);
            case NESTED_LOOP -> checkNestedLoop(node, thresholds);
            case SORT -> checkSort(node);
            case HASH_JOIN, HASH -> checkHashBatches(node);
            case INDEX_SCAN, BITMAP_SCAN, AGGREGATE, OTHER -> Optional.empty();
        };
        finding.ifPresent(f -> {
            log.debug("Rule hit on '{}': {}", node.operation(), f.message());
            findings.add(f);
        });

        for (PlanNode child : node.children()) {
            walk(child, depth + 1, thresholds, findings, state);
        }
    }

    private Optional<Finding> checkSeqScan(PlanNode node, Thresholds thresholds) {
        if (node.planRows() <= thresholds.getSeqScanRowThreshold()) {
            return Optional.empty();
        }
        String filter = node.extra("Filter");
        String remediation = filter != null
                ? "Consider an index on the column(s) used by the filter " + filter + "."
                : null;
        return Optional.of(Finding.warning(FindingCategory.SEQ_SCAN,
                String.format(Locale.ROOT, "Sequential scan on '%s' reads an estimated %d rows.",
                        relationName(node), node.planRows()),
                remediation));
    }

    private Optional<Finding> checkNestedLoop(PlanNode node, Thresholds thresholds) {
        if (node.children().size() < 2) {
            return Optional.empty();
        }
        long outer = node.children().get(0).planRows();
        long inner = node.children().get(1).planRows();
        double product = (double) outer * inner;
        if (product <= thresholds.getNestedLoopThreshold()) {
            return Optional.empty();
        }
        return Optional.of(Finding.warning(FindingCategory.NESTED_LOOP,
                String.format(Locale.ROOT, "Nested loop joins an estimated %d outer rows with %d inner rows (%.0f combinations).",
                        outer, inner, product),
                "Check the join condition and the indexes on the inner relation; a hash or merge join may be cheaper."));
    }

    private Optional<Finding> checkSort(PlanNode node) {
        String method = node.extra("Sort Method");
        if (method == null) {
            return Optional.empty();
        }
        if (method.toLowerCase(Locale.ROOT).startsWith("external")) {
            String disk = node.extra("Disk");
            String spill = disk != null ? " (" + method + ", Disk: " + disk + ")" : " (" + method + ")";
            return Optional.of(Finding.warning(FindingCategory.EXTERNAL_SORT,
                    "Sort spilled to disk" + spill + ".",
                    "Increase work_mem so the sort fits in memory."));
        }
        return Optional.of(Finding.info(FindingCategory.IN_MEMORY_SORT,
                "Sort completed in memory (" + method + ")."));
    }

    private Optional<Finding> checkHashBatches(PlanNode node) {
        OptionalLong batches = node.extraAsLong("Batches");
        if (batches.isEmpty()) {
            batches = node.extraAsLong("Hash Batches");
        }
        if (batches.isEmpty() || batches.getAsLong() <= 1) {
            return Optional.empty();
        }
        return Optional.of(Finding.notice(FindingCategory.HASH_BATCHES,
                String.format(Locale.ROOT, "Hash table was split into %d batches and spilled to disk.",
                        batches.getAsLong()),
                "Increase work_mem so the hash table fits in a single batch."));
    }

    private void addTimingFindings(TimingSummary timing, Thresholds thresholds, List<Finding> findings) {
        if (timing.executionMs() > thresholds.getSlowExecutionMs()) {
            findings.add(Finding.warning(FindingCategory.SLOW_EXECUTION,
                    String.format(Locale.ROOT, "Query execution took %.1f ms.", timing.executionMs()),
                    "Look at the nodes with the highest actual time and optimise those first."));
        }
        if (timing.planningMs() > thresholds.getHighPlanningMs()) {
            findings.add(Finding.notice(FindingCategory.HIGH_PLANNING_TIME,
                    String.format(Locale.ROOT, "Planning took %.1f ms, which points to a complex query structure.",
                            timing.planningMs()),
                    "Simplify the query or use prepared statements so the plan is reused."));
        }
    }

    private static String relationName(PlanNode node) {
        return node.relation() != null ? node.relation() : node.operation();
    }

    /**
     * Per-call counters gathered during the walk.
     */
    private static final class WalkState {
        private int nodeCount;
        private int seqScans;
        private int indexScans;
        private int bitmapScans;
        private long rowsRemovedByFilter;

        private void record(PlanNode node) {
            nodeCount++;
            if (node.kind() == NodeKind.SEQ_SCAN) {
                seqScans++;
            } else if (node.kind() == NodeKind.INDEX_SCAN) {
                indexScans++;
            } else if (node.kind() == NodeKind.BITMAP_SCAN) {
                bitmapScans++;
            }
            node.extraAsLong("Rows Removed by Filter").ifPresent(removed -> rowsRemovedByFilter += removed);
        }
    }
}
