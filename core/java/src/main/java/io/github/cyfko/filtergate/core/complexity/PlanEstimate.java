package io.github.cyfko.filtergate.core.complexity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cost signals extracted from a backend's query plan.
 *
 * @param totalCost          estimated total cost in backend units
 * @param planRows           estimated number of rows produced
 * @param nodeCount          number of plan nodes
 * @param joinCount          number of join nodes
 * @param sequentialScans    relations read by a full scan
 * @param indexScans         number of index-driven scans
 * @param usesFilesort       the plan sorts without an index
 * @param usesTemporaryTable the plan materializes an intermediate table
 * @param rawDetails         backend specific details kept for diagnostics
 * @since 1.0.0
 */
public record PlanEstimate(
        double totalCost,
        long planRows,
        int nodeCount,
        int joinCount,
        List<String> sequentialScans,
        int indexScans,
        boolean usesFilesort,
        boolean usesTemporaryTable,
        Map<String, Object> rawDetails
) {

    public PlanEstimate {
        sequentialScans = sequentialScans == null ? List.of() : List.copyOf(sequentialScans);
        rawDetails = rawDetails == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(rawDetails));
    }
}
