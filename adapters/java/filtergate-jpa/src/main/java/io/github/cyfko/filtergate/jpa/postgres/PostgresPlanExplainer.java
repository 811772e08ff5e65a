package io.github.cyfko.filtergate.jpa.postgres;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.cyfko.filtergate.core.complexity.PlanEstimate;
import io.github.cyfko.filtergate.jpa.JsonValues;
import io.github.cyfko.filtergate.jpa.SqlDialect;
import io.github.cyfko.filtergate.jpa.SqlPlanExplainer;
import jakarta.persistence.EntityManagerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads {@code EXPLAIN (FORMAT JSON)} output: total cost and rows from the root node,
 * then every node of the tree for scans, joins and sorts.
 *
 * @since 1.0.0
 */
public class PostgresPlanExplainer extends SqlPlanExplainer {

    private static final Set<String> JOINS = Set.of("Nested Loop", "Hash Join", "Merge Join");
    private static final Set<String> INDEX_SCANS = Set.of("Index Scan", "Index Only Scan", "Bitmap Index Scan");

    public PostgresPlanExplainer(EntityManagerFactory entityManagerFactory) {
        super(entityManagerFactory, SqlDialect.POSTGRESQL);
    }

    @Override
    protected PlanEstimate parse(String plan) {
        return parsePlan(plan);
    }

    public static PlanEstimate parsePlan(String plan) {
        JsonNode root = JsonValues.read(plan);
        if (root.isArray()) {
            root = root.path(0);
        }
        JsonNode top = root.path("Plan");
        if (top.isMissingNode()) {
            throw new IllegalStateException("EXPLAIN output has no Plan node");
        }
        Walk walk = new Walk();
        walk.visit(top);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("nodeType", top.path("Node Type").asText());
        details.put("planWidth", top.path("Plan Width").asInt());
        return new PlanEstimate(top.path("Total Cost").asDouble(), top.path("Plan Rows").asLong(),
                walk.nodes, walk.joins, walk.sequentialScans, walk.indexScans, walk.sorts, false, details);
    }

    private static final class Walk {
        int nodes;
        int joins;
        int indexScans;
        boolean sorts;
        final List<String> sequentialScans = new ArrayList<>();

        void visit(JsonNode node) {
            nodes++;
            String type = node.path("Node Type").asText();
            if ("Seq Scan".equals(type)) {
                sequentialScans.add(node.path("Relation Name").asText());
            } else if (INDEX_SCANS.contains(type)) {
                indexScans++;
            } else if (JOINS.contains(type)) {
                joins++;
            } else if ("Sort".equals(type)) {
                sorts = true;
            }
            for (JsonNode child : node.path("Plans")) {
                visit(child);
            }
        }
    }
}
