package org.carball.pgdiag.parser;

import lombok.extern.slf4j.Slf4j;
import org.carball.pgdiag.exception.PlanDepthExceededException;
import org.carball.pgdiag.exception.PlanParseException;
import org.carball.pgdiag.model.plan.ActualStats;
import org.carball.pgdiag.model.plan.ExecutionPlan;
import org.carball.pgdiag.model.plan.NodeKind;
import org.carball.pgdiag.model.plan.PlanFormat;
import org.carball.pgdiag.model.plan.PlanNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rebuilds a plan tree from EXPLAIN output in TEXT format.
 *
 * <p>Operator lines are the first line and every line starting with {@code ->}; the column of the arrow
 * gives the nesting depth. Every other indented line is an annotation of the closest operator above it
 * ("Filter: ...", "Sort Method: ...", "Buckets: ...  Batches: ..."). Unindented lines after the tree are
 * plan level trailers, of which only the planning and execution times are kept.
 */
@Slf4j
public class PlanTextParser {

    private static final String NUMBER = "(\\d+(?:\\.\\d+)?)";

    private static final Pattern NODE_LINE = Pattern.compile("^(\\s*)->\\s+(.*)$");

    private static final Pattern COST_PATTERN = Pattern.compile(
            "\\(cost=" + NUMBER + "\\.\\." + NUMBER + " rows=(\\d+) width=(\\d+)\\)");

    private static final Pattern ACTUAL_PATTERN = Pattern.compile(
            "\\(actual (?:time=" + NUMBER + "\\.\\." + NUMBER + " )?rows=" + NUMBER + " loops=(\\d+)\\)");

    private static final String NEVER_EXECUTED = "(never executed)";

    private static final Pattern RELATION_PATTERN = Pattern.compile("\\son\\s+(\"[^\"]+\"|[\\w.$]+)");

    private static final Pattern TIMING_PATTERN = Pattern.compile(
            "^(Planning Time|Execution Time|Total runtime):\\s*" + NUMBER + "\\s*ms", Pattern.CASE_INSENSITIVE);

    // "Buckets: 1024  Batches: 4  Memory Usage: 9kB" carries several annotations on one line
    private static final Pattern ANNOTATION_SPLIT = Pattern.compile("\\s{2,}(?=[A-Z][A-Za-z ]*:)");

    private static final Pattern PSQL_DECORATION = Pattern.compile("^(QUERY PLAN|-+|\\(\\d+ rows?\\))$");

    public ExecutionPlan parse(String text, int maxDepth) {
        if (text == null || text.isBlank()) {
            throw new PlanParseException("EXPLAIN output is empty");
        }

        String[] lines = text.split("\\R");
        Deque<Frame> stack = new ArrayDeque<>();
        Draft root = null;
        int baseIndent = 0;
        boolean inTrailer = false;
        Double planningTime = null;
        Double executionTime = null;

        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String line = lines[i].stripTrailing();
            String trimmed = line.trim();
            if (trimmed.isEmpty() || PSQL_DECORATION.matcher(trimmed).matches()) {
                continue;
            }

            if (root == null) {
                if (NODE_LINE.matcher(line).matches()) {
                    throw new PlanParseException("Plan starts with a child node instead of a root node", lineNumber);
                }
                baseIndent = indentOf(line);
                root = parseNodeLabel(trimmed, lineNumber);
                stack.push(new Frame(0, root));
                continue;
            }

            int indent = Math.max(0, indentOf(line) - baseIndent);
            Matcher nodeMatcher = NODE_LINE.matcher(line);

            if (nodeMatcher.matches()) {
                if (inTrailer) {
                    throw new PlanParseException("Plan node found after the plan trailer", lineNumber);
                }
                int arrowIndent = Math.max(0, nodeMatcher.group(1).length() - baseIndent);
                while (!stack.isEmpty() && stack.peek().indent() >= arrowIndent) {
                    stack.pop();
                }
                if (stack.isEmpty()) {
                    throw new PlanParseException("Unbalanced indentation: child node is not nested under a parent",
                            lineNumber);
                }
                if (stack.size() >= maxDepth) {
                    throw new PlanDepthExceededException(maxDepth);
                }
                Draft node = parseNodeLabel(nodeMatcher.group(2).trim(), lineNumber);
                stack.peek().node().children.add(node);
                stack.push(new Frame(arrowIndent, node));
                continue;
            }

            Matcher timingMatcher = TIMING_PATTERN.matcher(trimmed);
            if (timingMatcher.find()) {
                double value = Double.parseDouble(timingMatcher.group(2));
                if (timingMatcher.group(1).toLowerCase(Locale.ROOT).startsWith("planning")) {
                    planningTime = value;
                } else {
                    executionTime = value;
                }
                inTrailer = true;
                continue;
            }

            if (indent == 0) {
                // "Planning:", "JIT:", "Trigger ...": plan level sections we do not analyse
                inTrailer = true;
                continue;
            }
            if (inTrailer) {
                continue;
            }

            while (stack.size() > 1 && stack.peek().indent() >= indent) {
                stack.pop();
            }
            addAnnotations(stack.peek().node(), trimmed);
        }

        if (root == null) {
            throw new PlanParseException("EXPLAIN output contains no plan nodes");
        }

        PlanNode tree = root.toNode();
        log.debug("Parsed text plan with root '{}' (planning={}, execution={})",
                tree.operation(), planningTime, executionTime);
        return new ExecutionPlan(tree, planningTime, executionTime, PlanFormat.TEXT, text.length());
    }

    private Draft parseNodeLabel(String label, int lineNumber) {
        Matcher costMatcher = COST_PATTERN.matcher(label);
        if (!costMatcher.find()) {
            throw new PlanParseException("Missing cost annotation in plan node: " + label, lineNumber);
        }

        Draft draft = new Draft();
        draft.operation = label.substring(0, costMatcher.start()).trim();
        if (draft.operation.isEmpty()) {
            throw new PlanParseException("Plan node has no operator name", lineNumber);
        }
        draft.startupCost = Double.parseDouble(costMatcher.group(1));
        draft.totalCost = Double.parseDouble(costMatcher.group(2));
        draft.planRows = Long.parseLong(costMatcher.group(3));
        draft.planWidth = Integer.parseInt(costMatcher.group(4));

        String rest = label.substring(costMatcher.end());
        Matcher actualMatcher = ACTUAL_PATTERN.matcher(rest);
        if (actualMatcher.find()) {
            Double startup = actualMatcher.group(1) != null ? Double.parseDouble(actualMatcher.group(1)) : null;
            Double total = actualMatcher.group(2) != null ? Double.parseDouble(actualMatcher.group(2)) : null;
            long rows = Math.round(Double.parseDouble(actualMatcher.group(3)));
            long loops = Long.parseLong(actualMatcher.group(4));
            draft.actual = new ActualStats(startup, total, rows, loops);
        } else if (rest.contains(NEVER_EXECUTED)) {
            draft.actual = ActualStats.neverExecuted();
        }

        Matcher relationMatcher = RELATION_PATTERN.matcher(draft.operation);
        if (relationMatcher.find()) {
            draft.relation = relationMatcher.group(1).replace("\"", "");
        }
        return draft;
    }

    private void addAnnotations(Draft node, String line) {
        for (String segment : ANNOTATION_SPLIT.split(line)) {
            int colon = segment.indexOf(": ");
            String key = colon > 0 ? segment.substring(0, colon).trim() : segment.trim();
            String value = colon > 0 ? segment.substring(colon + 2).trim() : "";
            node.extras.merge(key, value, (previous, next) -> previous + "; " + next);
        }
    }

    private static int indentOf(String line) {
        int count = 0;
        while (count < line.length() && Character.isWhitespace(line.charAt(count))) {
            count++;
        }
        return count;
    }

    private record Frame(int indent, Draft node) {
    }

    /**
     * Mutable node used while the tree is still being discovered line by line.
     */
    private static final class Draft {
        private String operation;
        private String relation;
        private double startupCost;
        private double totalCost;
        private long planRows;
        private int planWidth;
        private ActualStats actual;
        private final List<Draft> children = new ArrayList<>();
        private final Map<String, String> extras = new LinkedHashMap<>();

        private PlanNode toNode() {
            List<PlanNode> builtChildren = new ArrayList<>(children.size());
            for (Draft child : children) {
                builtChildren.add(child.toNode());
            }
            return new PlanNode(NodeKind.fromNodeType(operation), operation, relation, startupCost, totalCost,
                    planRows, planWidth, actual, builtChildren, extras);
        }
    }
}
