package com.purchasingpower.studygraph.workflow;

import com.purchasingpower.studygraph.core.Entity;
import com.purchasingpower.studygraph.core.EntityType;
import com.purchasingpower.studygraph.exception.GraphStoreException;
import com.purchasingpower.studygraph.exception.TextExtractionException;
import com.purchasingpower.studygraph.ingest.IngestionPipeline;
import com.purchasingpower.studygraph.knowledge.ExtractedText;
import com.purchasingpower.studygraph.knowledge.TextExtractionService;
import com.purchasingpower.studygraph.knowledge.impl.InMemoryGraphStore;
import com.purchasingpower.studygraph.query.QueryPipeline;
import com.purchasingpower.studygraph.workflow.state.IngestionResult;
import com.purchasingpower.studygraph.workflow.state.QueryResult;
import com.purchasingpower.studygraph.workflow.state.WorkflowAction;
import com.purchasingpower.studygraph.workflow.state.WorkflowState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("StudyWorkflow")
class StudyWorkflowTest {

    private static final String USER = "u1";
    private static final byte[] FILE = "PRICE\nPrice reflects value.".getBytes();

    private TextExtractionService textExtraction;
    private IngestionPipeline ingestion;
    private QueryPipeline query;
    private InMemoryGraphStore store;
    private StudyWorkflow workflow;

    @BeforeEach
    void setUp() {
        textExtraction = mock(TextExtractionService.class);
        ingestion = mock(IngestionPipeline.class);
        query = mock(QueryPipeline.class);
        store = new InMemoryGraphStore();
        workflow = new StudyWorkflow(textExtraction, ingestion, query, store);
    }

    private WorkflowState upload() {
        return WorkflowState.builder().action(WorkflowAction.UPLOAD).userId(USER)
            .fileData(FILE).filename("notes.txt").build();
    }

    @Test
    @DisplayName("Upload runs extraction then ingestion and succeeds")
    void upload_shouldIngestExtractedText() {
        // Given
        when(textExtraction.extract(any(), anyString())).thenReturn(new ExtractedText("PRICE\nPrice reflects value.", "text"));
        IngestionResult ingested = IngestionResult.builder().success(true).processedChunks(1).build();
        when(ingestion.ingest("PRICE\nPrice reflects value.", USER)).thenReturn(ingested);

        // When
        WorkflowState state = workflow.run(upload());

        // Then
        assertThat(state.isSuccess()).isTrue();
        assertThat(state.getError()).isNull();
        assertThat(state.getFileType()).isEqualTo("text");
        assertThat(state.getProcessingResult()).isSameAs(ingested);
        assertThat(state.getTrail()).containsExactly(
            WorkflowNode.ROUTE, WorkflowNode.UPLOAD, WorkflowNode.EXTRACT, WorkflowNode.END);
    }

    @Test
    @DisplayName("Unreadable or blank files fail with a text extraction error")
    void upload_withUnreadableFile_shouldFail() {
        when(textExtraction.extract(any(), anyString()))
            .thenThrow(new TextExtractionException("Unsupported file type: exe", "virus.exe"));

        WorkflowState failed = workflow.run(upload());

        assertThat(failed.isSuccess()).isFalse();
        assertThat(failed.getError()).isEqualTo("Text extraction failed");
        assertThat(failed.getTrail()).containsExactly(
            WorkflowNode.ROUTE, WorkflowNode.UPLOAD, WorkflowNode.ERROR, WorkflowNode.END);
        verify(ingestion, never()).ingest(anyString(), anyString());

        doReturn(new ExtractedText("   ", "text")).when(textExtraction).extract(any(), anyString());
        WorkflowState blank = workflow.run(upload());
        assertThat(blank.getError()).isEqualTo("Text extraction failed");
    }

    @Test
    @DisplayName("A not-found answer still completes the query run successfully")
    void query_shouldSucceedEvenWhenTopicMissing() {
        QueryResult notFound = QueryResult.builder().success(false).answer(QueryPipeline.NOT_FOUND_ANSWER).build();
        when(query.answer("What is X?", USER)).thenReturn(notFound);

        WorkflowState state = workflow.run(WorkflowState.builder()
            .action(WorkflowAction.QUERY).userId(USER).question("What is X?").build());

        assertThat(state.isSuccess()).isTrue();
        assertThat(state.getQueryResult().isSuccess()).isFalse();
        assertThat(state.getTrail()).containsExactly(WorkflowNode.ROUTE, WorkflowNode.QUERY, WorkflowNode.END);
    }

    @Test
    @DisplayName("Visualize exports the user's graph")
    void visualize_shouldExportGraph() {
        store.upsertEntities(List.of(new Entity("Price", EntityType.CONCEPT)), USER);

        WorkflowState state = workflow.run(WorkflowState.builder()
            .action(WorkflowAction.VISUALIZE).userId(USER).build());

        assertThat(state.isSuccess()).isTrue();
        assertThat(state.getGraphData().getNodes()).hasSize(1);
    }

    @Test
    @DisplayName("Missing action or a pre-existing error is routed to the error node")
    void route_shouldRejectInvalidState() {
        WorkflowState noAction = workflow.run(WorkflowState.builder().userId(USER).build());
        assertThat(noAction.isSuccess()).isFalse();
        assertThat(noAction.getError()).isNotBlank();
        assertThat(noAction.getTrail()).containsExactly(WorkflowNode.ROUTE, WorkflowNode.ERROR, WorkflowNode.END);

        WorkflowState preFailed = workflow.run(WorkflowState.builder()
            .action(WorkflowAction.VISUALIZE).userId(USER).error("upstream problem").build());
        assertThat(preFailed.isSuccess()).isFalse();
        assertThat(preFailed.getError()).isEqualTo("upstream problem");
        assertThat(preFailed.getGraphData()).isNull();
    }

    @Test
    @DisplayName("Exceptions thrown by a handler end the run as a failure with the message kept")
    void handlerException_shouldBeCaptured() {
        when(query.answer(anyString(), anyString()))
            .thenThrow(new GraphStoreException("Neo4j getNeighborhood failed: connection refused", USER, null));

        WorkflowState state = workflow.run(WorkflowState.builder()
            .action(WorkflowAction.QUERY).userId(USER).question("What is price?").build());

        assertThat(state.isSuccess()).isFalse();
        assertThat(state.getError()).contains("connection refused");
        assertThat(state.getTrail()).containsExactly(WorkflowNode.ROUTE, WorkflowNode.QUERY, WorkflowNode.ERROR, WorkflowNode.END);
    }
}
