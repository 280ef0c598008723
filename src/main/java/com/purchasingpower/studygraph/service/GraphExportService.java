package com.purchasingpower.studygraph.service;

import com.purchasingpower.studygraph.core.GraphData;
import com.purchasingpower.studygraph.model.GraphExport;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Wraps exported graph data with statistics and a timestamp.
 */
@Service
public class GraphExportService {

    static final String UNKNOWN_TYPE = "unknown";

    private final Clock clock;

    public GraphExportService() {
        this(Clock.systemUTC());
    }

    GraphExportService(Clock clock) {
        this.clock = clock;
    }

    public GraphExport export(String userId, GraphData data) {
        Map<String, Integer> nodeTypes = new TreeMap<>();
        data.getNodes().forEach(node ->
                nodeTypes.merge(node.getType() == null ? UNKNOWN_TYPE : node.getType(), 1, Integer::sum));

        return GraphExport.builder()
                .userId(userId)
                .exportedAt(Instant.now(clock).toString())
                .statistics(new GraphExport.Statistics(data.getNodes().size(), data.getEdges().size(), nodeTypes))
                .data(data)
                .success(true)
                .build();
    }

    public GraphExport failed(String userId, String error) {
        return GraphExport.builder()
                .userId(userId)
                .exportedAt(Instant.now(clock).toString())
                .success(false)
                .error(error)
                .build();
    }
}
