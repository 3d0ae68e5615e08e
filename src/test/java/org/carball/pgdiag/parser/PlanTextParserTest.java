package org.carball.pgdiag.parser;

import org.carball.pgdiag.exception.PlanDepthExceededException;
import org.carball.pgdiag.exception.PlanParseException;
import org.carball.pgdiag.model.plan.ExecutionPlan;
import org.carball.pgdiag.model.plan.NodeKind;
import org.carball.pgdiag.model.plan.PlanNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PlanTextParserTest {

    private PlanTextParser parser;

    @BeforeEach
    void setUp() {
        parser = new PlanTextParser();
    }

    @Test
    void shouldParseSingleSeqScan() {
        // Given
        String explain = "Seq Scan on users  (cost=0.00..155.00 rows=5000 width=36)";

        // When
        ExecutionPlan plan = parser.parse(explain, 1000);

        // Then
        PlanNode root = plan.root();
        assertThat(root.kind()).isEqualTo(NodeKind.SEQ_SCAN);
        assertThat(root.operation()).isEqualTo("Seq Scan on users");
        assertThat(root.relation()).isEqualTo("users");
        assertThat(root.startupCost()).isEqualTo(0.0);
        assertThat(root.totalCost()).isEqualTo(155.0);
        assertThat(root.planRows()).isEqualTo(5000);
        assertThat(root.planWidth()).isEqualTo(36);
        assertThat(root.actual()).isNull();
        assertThat(root.children()).isEmpty();
        assertThat(plan.planningTimeMs()).isNull();
        assertThat(plan.executionTimeMs()).isNull();
    }

    @Test
    void shouldBuildNestedTreeWithAnnotations() {
        // Given
        String explain = """
                Hash Join  (cost=30.50..250.75 rows=1200 width=64)
                  Hash Cond: (o.user_id = u.id)
                  ->  Seq Scan on orders o  (cost=0.00..180.00 rows=12000 width=32)
                        Filter: (status = 'open'::text)
                  ->  Hash  (cost=18.00..18.00 rows=1000 width=32)
                        Buckets: 1024  Batches: 4  Memory Usage: 9kB
                        ->  Index Scan using users_pkey on users u  (cost=0.29..18.00 rows=1000 width=32)
                """;

        // When
        ExecutionPlan plan = parser.parse(explain, 1000);

        // Then
        PlanNode root = plan.root();
        assertThat(root.kind()).isEqualTo(NodeKind.HASH_JOIN);
        assertThat(root.extra("Hash Cond")).isEqualTo("(o.user_id = u.id)");
        assertThat(root.children()).hasSize(2);

        PlanNode orders = root.children().get(0);
        assertThat(orders.kind()).isEqualTo(NodeKind.SEQ_SCAN);
        assertThat(orders.relation()).isEqualTo("orders");
        assertThat(orders.extra("Filter")).isEqualTo("(status = 'open'::text)");

        PlanNode hash = root.children().get(1);
        assertThat(hash.kind()).isEqualTo(NodeKind.HASH);
        assertThat(hash.extra("Buckets")).isEqualTo("1024");
        assertThat(hash.extra("Batches")).isEqualTo("4");
        assertThat(hash.extra("Memory Usage")).isEqualTo("9kB");
        assertThat(hash.children()).hasSize(1);
        assertThat(hash.children().get(0).kind()).isEqualTo(NodeKind.INDEX_SCAN);
        assertThat(hash.children().get(0).relation()).isEqualTo("users");
    }

    @Test
    void shouldReadActualStatisticsAndTimings() {
        // Given
        String explain = """
                Sort  (cost=120.00..125.00 rows=2000 width=40) (actual time=12.500..14.250 rows=1990 loops=1)
                  Sort Key: created_at
                  Sort Method: external merge  Disk: 4096kB
                  ->  Seq Scan on events  (cost=0.00..80.00 rows=2000 width=40) (actual time=0.010..5.000 rows=1990 loops=1)
                        Filter: (kind = 'click'::text)
                        Rows Removed by Filter: 8010
                Planning Time: 0.215 ms
                Execution Time: 15.020 ms
                """;

        // When
        ExecutionPlan plan = parser.parse(explain, 1000);

        // Then
        PlanNode sort = plan.root();
        assertThat(sort.actual()).isNotNull();
        assertThat(sort.actual().startupTimeMs()).isEqualTo(12.5);
        assertThat(sort.actual().totalTimeMs()).isEqualTo(14.25);
        assertThat(sort.actual().rows()).isEqualTo(1990);
        assertThat(sort.actual().loops()).isEqualTo(1);
        assertThat(sort.extra("Sort Method")).isEqualTo("external merge");
        assertThat(sort.extra("Disk")).isEqualTo("4096kB");
        assertThat(sort.children().get(0).extraAsLong("Rows Removed by Filter")).hasValue(8010);
        assertThat(plan.planningTimeMs()).isEqualTo(0.215);
        assertThat(plan.executionTimeMs()).isEqualTo(15.020);
    }

    @Test
    void shouldSkipPsqlDecoration() {
        // Given
        String explain = """
                                          QUERY PLAN
                ---------------------------------------------------------------
                 Limit  (cost=0.00..0.50 rows=10 width=8)
                   ->  Seq Scan on tiny  (cost=0.00..1.10 rows=10 width=8)
                (2 rows)
                """;

        // When
        ExecutionPlan plan = parser.parse(explain, 1000);

        // Then
        assertThat(plan.root().operation()).isEqualTo("Limit");
        assertThat(plan.root().kind()).isEqualTo(NodeKind.OTHER);
        assertThat(plan.root().children()).hasSize(1);
        assertThat(plan.root().children().get(0).relation()).isEqualTo("tiny");
    }

    @Test
    void shouldMarkNeverExecutedNodes() {
        // Given
        String explain = """
                Nested Loop  (cost=0.29..16.34 rows=1 width=8) (actual time=0.020..0.021 rows=0 loops=1)
                  ->  Seq Scan on a  (cost=0.00..8.00 rows=1 width=4) (actual time=0.015..0.015 rows=0 loops=1)
                  ->  Index Scan using b_pkey on b  (cost=0.29..8.30 rows=1 width=4) (never executed)
                Execution Time: 0.050 ms
                """;

        // When
        ExecutionPlan plan = parser.parse(explain, 1000);

        // Then
        PlanNode inner = plan.root().children().get(1);
        assertThat(inner.actual()).isNotNull();
        assertThat(inner.actual().wasExecuted()).isFalse();
    }

    @Test
    void shouldRejectMissingCostAnnotation() {
        // Given
        String explain = """
                Seq Scan on users  (cost=0.00..155.00 rows=5000 width=36)
                  ->  Index Scan on broken
                """;

        // When/Then
        assertThatThrownBy(() -> parser.parse(explain, 1000))
                .isInstanceOf(PlanParseException.class)
                .hasMessageContaining("Missing cost annotation in plan node: Index Scan on broken")
                .hasMessageContaining("(line 2)");
    }

    @Test
    void shouldRejectChildWithoutParent() {
        // Given
        String explain = "  ->  Seq Scan on users  (cost=0.00..155.00 rows=5000 width=36)";

        // When/Then
        assertThatThrownBy(() -> parser.parse(explain, 1000))
                .isInstanceOf(PlanParseException.class)
                .hasMessageContaining("Plan starts with a child node instead of a root node");
    }

    @Test
    void shouldRejectUnbalancedIndentation() {
        // Given
        String explain = """
                    Limit  (cost=0.00..0.50 rows=10 width=8)
                  ->  Seq Scan on tiny  (cost=0.00..1.10 rows=10 width=8)
                """;

        // When/Then
        assertThatThrownBy(() -> parser.parse(explain, 1000))
                .isInstanceOf(PlanParseException.class)
                .hasMessageContaining("Unbalanced indentation");
    }

    @Test
    void shouldRejectEmptyOutput() {
        assertThatThrownBy(() -> parser.parse("   \n", 1000))
                .isInstanceOf(PlanParseException.class)
                .hasMessage("EXPLAIN output is empty");
    }

    @Test
    void shouldFailWhenTreeIsDeeperThanLimit() {
        // Given
        String explain = """
                Limit  (cost=0.00..3.00 rows=10 width=8)
                  ->  Sort  (cost=0.00..2.00 rows=10 width=8)
                        ->  Seq Scan on tiny  (cost=0.00..1.10 rows=10 width=8)
                """;

        // When/Then
        assertThat(parser.parse(explain, 3).root().children()).hasSize(1);
        assertThatThrownBy(() -> parser.parse(explain, 2))
                .isInstanceOf(PlanDepthExceededException.class)
                .hasMessage("Plan tree exceeds the maximum supported depth of 2");
    }
}
