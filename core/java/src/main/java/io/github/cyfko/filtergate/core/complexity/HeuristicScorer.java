package io.github.cyfko.filtergate.core.complexity;

import io.github.cyfko.filtergate.core.api.FilterExpression;
import io.github.cyfko.filtergate.core.api.Operator;
import io.github.cyfko.filtergate.core.model.FieldDescriptor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static complexity estimate for backends without plan introspection.
 *
 * <h2>Weights</h2>
 * <ul>
 *   <li>5 per comparison condition (each operator of each leaf)</li>
 *   <li>+3 per membership condition (list-valued operators)</li>
 *   <li>+5 per {@code Or} node, +2 per {@code And} node</li>
 *   <li>10 per distinct association traversed</li>
 *   <li>10 per custom filter fragment, whose cost cannot be estimated</li>
 *   <li>20 without a limit; 20 plus 5 per sort field when sorting without a limit</li>
 *   <li>offset above the threshold: 15 with a limit, 30 without</li>
 * </ul>
 * <p>
 * The score is clamped to 100 and the reported cost is {@code score * 100}.
 * </p>
 *
 * @since 1.0.0
 */
public final class HeuristicScorer {

    static final int CONDITION = 5;
    static final int MEMBERSHIP = 3;
    static final int OR_NODE = 5;
    static final int AND_NODE = 2;
    static final int ASSOCIATION = 10;
    static final int CUSTOM_FRAGMENT = 10;
    static final int NO_LIMIT = 20;
    static final int SORT_WITHOUT_LIMIT = 20;
    static final int PER_SORT_FIELD = 5;
    static final int LARGE_OFFSET_WITH_LIMIT = 15;
    static final int LARGE_OFFSET_WITHOUT_LIMIT = 30;

    private final int largeOffsetThreshold;

    public HeuristicScorer(int largeOffsetThreshold) {
        this.largeOffsetThreshold = largeOffsetThreshold;
    }

    public ComplexityAnalysis score(AnalysisOptions options) {
        Tally tally = new Tally();
        walk(options.expression(), options, tally);

        QueryWindow window = options.window();
        int score = tally.conditions * CONDITION
                + tally.memberships * MEMBERSHIP
                + tally.orNodes * OR_NODE
                + tally.andNodes * AND_NODE
                + tally.associations.size() * ASSOCIATION
                + tally.customFragments * CUSTOM_FRAGMENT;

        List<String> suggestions = new ArrayList<>();
        if (!window.hasLimit()) {
            score += NO_LIMIT;
            suggestions.add("Add a LIMIT clause to bound the result size");
            if (!window.sort().isEmpty()) {
                score += SORT_WITHOUT_LIMIT + PER_SORT_FIELD * window.sort().size();
                suggestions.add("Sorting without a limit orders the whole result; add a limit");
            }
        }
        boolean largeOffset = window.offset() > largeOffsetThreshold;
        if (largeOffset) {
            score += window.hasLimit() ? LARGE_OFFSET_WITH_LIMIT : LARGE_OFFSET_WITHOUT_LIMIT;
            suggestions.add("Offset " + window.offset() + " is large; use keyset pagination instead");
        }
        if (tally.associations.size() > 2) {
            suggestions.add("Filtering through " + tally.associations.size()
                    + " associations; consider denormalizing or a materialized view");
        }
        if (tally.customFragments > 0) {
            suggestions.add("Custom filter fragments cannot be estimated; prefer storage-backed fields");
        }
        if (tally.conditions > 10) {
            suggestions.add("Simplify the filter: " + tally.conditions + " conditions");
        }

        int clamped = Math.min(100, score);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("conditions", tally.conditions);
        details.put("membershipConditions", tally.memberships);
        details.put("orNodes", tally.orNodes);
        details.put("andNodes", tally.andNodes);
        details.put("associations", List.copyOf(tally.associations));
        details.put("customFragments", tally.customFragments);
        details.put("limit", window.limit());
        details.put("offset", window.offset());
        details.put("sortFields", window.sort().size());
        return new ComplexityAnalysis(clamped * 100.0, clamped, AnalysisMethod.HEURISTIC, suggestions, details);
    }

    private void walk(FilterExpression node, AnalysisOptions options, Tally tally) {
        if (node instanceof FilterExpression.And and) {
            if (and.children().size() > 1) {
                tally.andNodes++;
            }
            and.children().forEach(child -> walk(child, options, tally));
        } else if (node instanceof FilterExpression.Or or) {
            tally.orNodes++;
            or.children().forEach(child -> walk(child, options, tally));
        } else if (node instanceof FilterExpression.Not not) {
            walk(not.child(), options, tally);
        } else if (node instanceof FilterExpression.Leaf leaf) {
            Optional<FieldDescriptor> field = options.catalog().field(leaf.field());
            if (field.isPresent() && field.get().custom()) {
                tally.customFragments += leaf.operators().size();
                return;
            }
            field.filter(FieldDescriptor::isAssociated).ifPresent(f -> tally.associations.add(f.association()));
            for (Operator operator : leaf.operators().keySet()) {
                tally.conditions++;
                if (operator.valueShape() == Operator.ValueShape.LIST) {
                    tally.memberships++;
                }
            }
        }
    }

    private static final class Tally {
        int conditions;
        int memberships;
        int orNodes;
        int andNodes;
        int customFragments;
        final Set<String> associations = new LinkedHashSet<>();
    }
}
