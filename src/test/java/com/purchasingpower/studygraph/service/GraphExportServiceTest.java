package com.purchasingpower.studygraph.service;

import com.purchasingpower.studygraph.core.GraphData;
import com.purchasingpower.studygraph.model.GraphExport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

@DisplayName("GraphExportService")
class GraphExportServiceTest {

    private final GraphExportService service =
        new GraphExportService(Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC));

    @Test
    @DisplayName("Export counts nodes, edges and node types")
    void export_shouldComputeStatistics() {
        // Given
        GraphData data = GraphData.builder()
            .nodes(List.of(
                new GraphData.Node("Price", "Price", "concept"),
                new GraphData.Node("Product", "Product", "concept"),
                new GraphData.Node("Marketing Mix", "Marketing Mix", "framework"),
                new GraphData.Node("Legacy", "Legacy", null)))
            .edges(List.of(new GraphData.Edge("Marketing Mix", "Price", "has_component")))
            .build();

        // When
        GraphExport export = service.export("u1", data);

        // Then
        assertThat(export.isSuccess()).isTrue();
        assertThat(export.getUserId()).isEqualTo("u1");
        assertThat(export.getExportedAt()).isEqualTo("2026-03-01T10:15:30Z");
        assertThat(export.getStatistics().getNodes()).isEqualTo(4);
        assertThat(export.getStatistics().getEdges()).isEqualTo(1);
        assertThat(export.getStatistics().getNodeTypes())
            .containsExactly(entry("concept", 2), entry("framework", 1), entry("unknown", 1));
        assertThat(export.getData()).isSameAs(data);
    }

    @Test
    @DisplayName("Empty graph exports zero statistics")
    void export_withEmptyGraph_shouldSucceed() {
        GraphExport export = service.export("u1", GraphData.builder().build());

        assertThat(export.isSuccess()).isTrue();
        assertThat(export.getStatistics().getNodes()).isZero();
        assertThat(export.getStatistics().getNodeTypes()).isEmpty();
    }

    @Test
    @DisplayName("Failed export carries the error and no data")
    void failed_shouldCarryError() {
        GraphExport export = service.failed("u1", "Neo4j unavailable");

        assertThat(export.isSuccess()).isFalse();
        assertThat(export.getError()).isEqualTo("Neo4j unavailable");
        assertThat(export.getData()).isNull();
    }
}
