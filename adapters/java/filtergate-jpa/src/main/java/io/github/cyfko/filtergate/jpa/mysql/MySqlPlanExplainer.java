package io.github.cyfko.filtergate.jpa.mysql;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.cyfko.filtergate.core.complexity.PlanEstimate;
import io.github.cyfko.filtergate.jpa.JsonValues;
import io.github.cyfko.filtergate.jpa.SqlDialect;
import io.github.cyfko.filtergate.jpa.SqlPlanExplainer;
import jakarta.persistence.EntityManagerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads {@code EXPLAIN FORMAT=JSON} output. The cost is
 * {@code query_block.cost_info.query_cost}; tables with access type {@code ALL} are full
 * scans, other access types count as index access.
 *
 * @since 1.0.0
 */
public class MySqlPlanExplainer extends SqlPlanExplainer {

    public MySqlPlanExplainer(EntityManagerFactory entityManagerFactory) {
        super(entityManagerFactory, SqlDialect.MYSQL);
    }

    @Override
    protected PlanEstimate parse(String plan) {
        return parsePlan(plan);
    }

    public static PlanEstimate parsePlan(String plan) {
        JsonNode block = JsonValues.read(plan).path("query_block");
        if (block.isMissingNode()) {
            throw new IllegalStateException("EXPLAIN output has no query_block");
        }
        Walk walk = new Walk();
        walk.visit(block);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("selectId", block.path("select_id").asInt());
        return new PlanEstimate(block.path("cost_info").path("query_cost").asDouble(), walk.rows, walk.tables,
                walk.joins, walk.sequentialScans, walk.indexScans, walk.filesort, walk.temporary, details);
    }

    private static final class Walk {
        long rows;
        int tables;
        int joins;
        int indexScans;
        boolean filesort;
        boolean temporary;
        final List<String> sequentialScans = new ArrayList<>();

        void visit(JsonNode node) {
            if (node.isArray()) {
                for (JsonNode item : node) {
                    visit(item);
                }
                return;
            }
            if (!node.isObject()) {
                return;
            }
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                switch (field.getKey()) {
                    case "table" -> table(value);
                    case "nested_loop" -> joins += Math.max(0, value.size() - 1);
                    case "using_filesort" -> filesort |= value.asBoolean();
                    case "using_temporary_table" -> temporary |= value.asBoolean();
                    default -> {
                    }
                }
                visit(value);
            }
        }

        private void table(JsonNode table) {
            tables++;
            rows += table.path("rows_examined_per_scan").asLong();
            String access = table.path("access_type").asText("");
            if ("ALL".equals(access)) {
                sequentialScans.add(table.path("table_name").asText());
            } else if (!access.isEmpty()) {
                indexScans++;
            }
        }
    }
}
