package org.carball.pgdiag.parser;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.exc.StreamConstraintsException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.pgdiag.exception.PlanDepthExceededException;
import org.carball.pgdiag.exception.PlanParseException;
import org.carball.pgdiag.model.plan.ActualStats;
import org.carball.pgdiag.model.plan.ExecutionPlan;
import org.carball.pgdiag.model.plan.NodeKind;
import org.carball.pgdiag.model.plan.PlanFormat;
import org.carball.pgdiag.model.plan.PlanNode;
import org.yaml.snakeyaml.LoaderOptions;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a plan tree from EXPLAIN (FORMAT JSON) or EXPLAIN (FORMAT YAML) output. Both formats share
 * the same document structure, so one reader serves both.
 */
@Slf4j
public class PlanJsonParser {

    // Keys mapped onto PlanNode fields; everything else scalar becomes an annotation
    private static final Set<String> STRUCTURAL_KEYS = Set.of(
            "Node Type", "Relation Name", "Index Name", "Plans",
            "Startup Cost", "Total Cost", "Plan Rows", "Plan Width",
            "Actual Startup Time", "Actual Total Time", "Actual Rows", "Actual Loops");

    // Every plan level nests an object and its "Plans" array, plus the wrapper array and "Plan" key
    private static final int NESTING_PER_LEVEL = 2;
    private static final int NESTING_HEADROOM = 16;

    public ExecutionPlan parse(String payload, PlanFormat format, int maxDepth) {
        if (payload == null || payload.isBlank()) {
            throw new PlanParseException("EXPLAIN output is empty");
        }

        JsonNode document = readDocument(payload, format, maxDepth);
        // PostgreSQL returns an array with a single element
        JsonNode top = document.isArray() ? document.path(0) : document;
        JsonNode plan = top.get("Plan");
        if (plan == null || !plan.isObject()) {
            throw new PlanParseException("EXPLAIN " + format + " output has no \"Plan\" object");
        }

        PlanNode root = toNode(plan, 1, maxDepth);
        Double planningTime = optionalDouble(top, "Planning Time");
        Double executionTime = optionalDouble(top, "Execution Time");

        log.debug("Parsed {} plan with root '{}' (planning={}, execution={})",
                format, root.operation(), planningTime, executionTime);
        return new ExecutionPlan(root, planningTime, executionTime, format, payload.length());
    }

    private JsonNode readDocument(String payload, PlanFormat format, int maxDepth) {
        ObjectMapper mapper = new ObjectMapper(documentFactory(format, maxDepth));
        try {
            return mapper.readTree(payload);
        } catch (StreamConstraintsException e) {
            if (String.valueOf(e.getOriginalMessage()).contains("nesting depth")) {
                throw new PlanDepthExceededException(maxDepth);
            }
            throw new PlanParseException("EXPLAIN " + format + " output exceeds reader limits: "
                    + e.getOriginalMessage(), e);
        } catch (JsonProcessingException e) {
            throw new PlanParseException("Malformed EXPLAIN " + format + " output: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * The reader's nesting limit has to sit above what {@code maxDepth} plan levels need, so the
     * plan depth check decides whether a deep plan is accepted.
     */
    private static JsonFactory documentFactory(PlanFormat format, int maxDepth) {
        int nestingLimit = NESTING_PER_LEVEL * maxDepth + NESTING_HEADROOM;
        StreamReadConstraints constraints = StreamReadConstraints.builder()
                .maxNestingDepth(nestingLimit)
                .build();
        return switch (format) {
            case JSON -> JsonFactory.builder().streamReadConstraints(constraints).build();
            case YAML -> {
                LoaderOptions loaderOptions = new LoaderOptions();
                loaderOptions.setNestingDepthLimit(nestingLimit);
                yield YAMLFactory.builder()
                        .loaderOptions(loaderOptions)
                        .streamReadConstraints(constraints)
                        .build();
            }
            case TEXT, XML, TREE -> throw new PlanParseException(
                    "EXPLAIN " + format + " output is not supported by the structured plan reader");
        };
    }

    private PlanNode toNode(JsonNode json, int depth, int maxDepth) {
        if (depth > maxDepth) {
            throw new PlanDepthExceededException(maxDepth);
        }
        JsonNode nodeType = json.get("Node Type");
        if (nodeType == null || nodeType.asText().isBlank()) {
            throw new PlanParseException("Plan node without \"Node Type\"");
        }
        if (!json.has("Total Cost")) {
            throw new PlanParseException("Missing cost annotation in plan node: " + nodeType.asText());
        }

        String operation = nodeType.asText();
        String relation = json.hasNonNull("Relation Name")
                ? json.get("Relation Name").asText()
                : json.hasNonNull("Index Name") ? json.get("Index Name").asText() : null;

        ActualStats actual = null;
        if (json.has("Actual Loops")) {
            actual = new ActualStats(
                    optionalDouble(json, "Actual Startup Time"),
                    optionalDouble(json, "Actual Total Time"),
                    Math.round(json.path("Actual Rows").asDouble(0)),
                    json.path("Actual Loops").asLong(0));
        }

        List<PlanNode> children = new ArrayList<>();
        JsonNode plans = json.get("Plans");
        if (plans != null && plans.isArray()) {
            for (JsonNode child : plans) {
                children.add(toNode(child, depth + 1, maxDepth));
            }
        }

        Map<String, String> extras = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (STRUCTURAL_KEYS.contains(field.getKey())) {
                continue;
            }
            JsonNode value = field.getValue();
            extras.put(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
        }

        return new PlanNode(NodeKind.fromNodeType(operation), operation, relation,
                json.path("Startup Cost").asDouble(0), json.path("Total Cost").asDouble(0),
                json.path("Plan Rows").asLong(0), json.path("Plan Width").asInt(0),
                actual, children, extras);
    }

    private static Double optionalDouble(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asDouble() : null;
    }
}
