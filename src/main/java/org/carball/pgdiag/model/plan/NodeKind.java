package org.carball.pgdiag.model.plan;

import java.util.Locale;

/**
 * Closed set of plan operators the rules care about. Everything else maps to {@link #OTHER}.
 */
public enum NodeKind {
    SEQ_SCAN,
    INDEX_SCAN,
    BITMAP_SCAN,
    HASH_JOIN,
    HASH,
    NESTED_LOOP,
    SORT,
    AGGREGATE,
    OTHER;

    /**
     * Maps a PostgreSQL node type label ("Seq Scan", "Index Only Scan", "Partial HashAggregate", ...)
     * to its kind. Leading "Parallel", "Partial" and "Finalize" qualifiers are ignored.
     */
    public static NodeKind fromNodeType(String nodeType) {
        if (nodeType == null) {
            return OTHER;
        }
        String type = nodeType.trim().toLowerCase(Locale.ROOT)
                .replaceFirst("^(parallel|partial|finalize)\\s+", "");

        if (type.startsWith("seq scan")) {
            return SEQ_SCAN;
        } else if (type.startsWith("index scan") || type.startsWith("index only scan")) {
            return INDEX_SCAN;
        } else if (type.startsWith("bitmap heap scan") || type.startsWith("bitmap index scan")) {
            return BITMAP_SCAN;
        } else if (type.startsWith("hash join") || type.startsWith("hash right join")
                || type.startsWith("hash left join") || type.startsWith("hash full join")
                || type.startsWith("hash anti join") || type.startsWith("hash semi join")) {
            return HASH_JOIN;
        } else if (type.equals("hash")) {
            return HASH;
        } else if (type.startsWith("nested loop")) {
            return NESTED_LOOP;
        } else if (type.equals("sort") || type.equals("incremental sort")) {
            return SORT;
        } else if (type.equals("aggregate") || type.equals("hashaggregate") || type.equals("groupaggregate")
                || type.equals("mixedaggregate")) {
            return AGGREGATE;
        }
        return OTHER;
    }

    public boolean isScan() {
        return this == SEQ_SCAN || this == INDEX_SCAN || this == BITMAP_SCAN;
    }
}
