package org.carball.pgdiag.model.plan;

import lombok.Builder;
import lombok.Singular;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * One operator of an execution plan. Children are owned exclusively by their parent.
 *
 * @param operation raw node label as PostgreSQL printed it, e.g. "Index Scan using users_pkey"
 * @param relation  target relation, null for operators that do not read a relation
 * @param actual    null unless the plan was produced with ANALYZE
 * @param extras    node specific annotations such as "Sort Method", "Batches" or "Filter"
 */
@Builder(toBuilder = true)
public record PlanNode(
        NodeKind kind,
        String operation,
        String relation,
        double startupCost,
        double totalCost,
        long planRows,
        int planWidth,
        ActualStats actual,
        @Singular("child") List<PlanNode> children,
        @Singular("extra") Map<String, String> extras
) {

    public PlanNode {
        kind = kind != null ? kind : NodeKind.fromNodeType(operation);
        children = children != null ? List.copyOf(children) : List.of();
        extras = extras != null ? Collections.unmodifiableMap(new LinkedHashMap<>(extras)) : Map.of();
    }

    public String extra(String key) {
        return extras.get(key);
    }

    /**
     * Reads the leading integer of an annotation value, e.g. "4 (originally 1)" yields 4.
     */
    public OptionalLong extraAsLong(String key) {
        String value = extras.get(key);
        if (value == null) {
            return OptionalLong.empty();
        }
        String digits = value.trim().replaceFirst("^(\\d+)(?:\\.\\d+)?.*$", "$1");
        try {
            return OptionalLong.of(Long.parseLong(digits));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    public boolean hasActual() {
        return actual != null;
    }
}
