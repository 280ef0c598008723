package com.purchasingpower.studygraph.workflow;

import com.purchasingpower.studygraph.exception.TextExtractionException;
import com.purchasingpower.studygraph.ingest.IngestionPipeline;
import com.purchasingpower.studygraph.knowledge.ExtractedText;
import com.purchasingpower.studygraph.knowledge.GraphStore;
import com.purchasingpower.studygraph.knowledge.TextExtractionService;
import com.purchasingpower.studygraph.query.QueryPipeline;
import com.purchasingpower.studygraph.workflow.state.WorkflowState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Runs one request (upload, query or visualize) through the node graph in {@link WorkflowNode}.
 *
 * <p>Every run ends in {@link WorkflowNode#END}. Handler exceptions are caught, recorded as the
 * state's error and routed to {@link WorkflowNode#ERROR}, which marks the run unsuccessful.
 */
@Slf4j
@Component
public class StudyWorkflow {

    static final String TEXT_EXTRACTION_FAILED = "Text extraction failed";
    private static final int MAX_STEPS = 16;

    private final TextExtractionService textExtractionService;
    private final IngestionPipeline ingestionPipeline;
    private final QueryPipeline queryPipeline;
    private final GraphStore graphStore;
    private final Map<WorkflowNode, NodeHandler> handlers = new EnumMap<>(WorkflowNode.class);

    public StudyWorkflow(TextExtractionService textExtractionService,
                         IngestionPipeline ingestionPipeline,
                         QueryPipeline queryPipeline,
                         GraphStore graphStore) {
        this.textExtractionService = textExtractionService;
        this.ingestionPipeline = ingestionPipeline;
        this.queryPipeline = queryPipeline;
        this.graphStore = graphStore;

        handlers.put(WorkflowNode.ROUTE, this::route);
        handlers.put(WorkflowNode.UPLOAD, this::upload);
        handlers.put(WorkflowNode.EXTRACT, this::extract);
        handlers.put(WorkflowNode.QUERY, this::query);
        handlers.put(WorkflowNode.VISUALIZE, this::visualize);
        handlers.put(WorkflowNode.ERROR, this::error);
    }

    public WorkflowState run(WorkflowState state) {
        WorkflowNode node = WorkflowNode.ROUTE;
        int steps = 0;
        while (node != WorkflowNode.END) {
            if (++steps > MAX_STEPS) {
                throw new IllegalStateException("Workflow did not terminate: " + state.getTrail());
            }
            state.getTrail().add(node);
            node = step(node, state);
        }
        state.getTrail().add(WorkflowNode.END);
        log.info("🏁 Workflow {} for user {} finished: success={} path={}",
                state.getAction(), state.getUserId(), state.isSuccess(), state.getTrail());
        return state;
    }

    private WorkflowNode step(WorkflowNode node, WorkflowState state) {
        try {
            WorkflowEvent event = handlers.get(node).handle(state);
            log.debug("Node {} -> {}", node, event);
            return node.next(event);
        } catch (Exception e) {
            if (node == WorkflowNode.ERROR) {
                log.error("❌ Error node failed for user {}", state.getUserId(), e);
                state.setSuccess(false);
                return WorkflowNode.END;
            }
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("❌ Workflow node {} failed for user {}: {}", node, state.getUserId(), message, e);
            state.setError(message);
            return WorkflowNode.ERROR;
        }
    }

    // ================================================================
    // Node handlers
    // ================================================================

    private WorkflowEvent route(WorkflowState state) {
        if (state.hasError()) {
            return WorkflowEvent.REJECTED;
        }
        if (state.getAction() == null) {
            state.setError("No action specified");
            return WorkflowEvent.REJECTED;
        }
        if (state.getUserId() == null || state.getUserId().isBlank()) {
            state.setError("User id is required");
            return WorkflowEvent.REJECTED;
        }
        switch (state.getAction()) {
            case UPLOAD:
                return WorkflowEvent.UPLOAD_REQUESTED;
            case QUERY:
                return WorkflowEvent.QUERY_REQUESTED;
            case VISUALIZE:
                return WorkflowEvent.VISUALIZE_REQUESTED;
            default:
                state.setError("Unknown action: " + state.getAction());
                return WorkflowEvent.REJECTED;
        }
    }

    private WorkflowEvent upload(WorkflowState state) {
        ExtractedText extracted;
        try {
            extracted = textExtractionService.extract(state.getFileData(), state.getFilename());
        } catch (TextExtractionException e) {
            log.warn("⚠️  Text extraction failed for {}: {}", state.getFilename(), e.getMessage());
            state.setError(TEXT_EXTRACTION_FAILED);
            return WorkflowEvent.FAILED;
        }
        if (extracted == null || extracted.getText() == null || extracted.getText().isBlank()) {
            state.setError(TEXT_EXTRACTION_FAILED);
            return WorkflowEvent.FAILED;
        }
        state.setExtractedText(extracted.getText());
        state.setFileType(extracted.getFileType());
        return WorkflowEvent.COMPLETED;
    }

    private WorkflowEvent extract(WorkflowState state) {
        state.setProcessingResult(ingestionPipeline.ingest(state.getExtractedText(), state.getUserId()));
        state.setSuccess(true);
        return WorkflowEvent.COMPLETED;
    }

    private WorkflowEvent query(WorkflowState state) {
        if (state.getQuestion() == null || state.getQuestion().isBlank()) {
            state.setError("Question is required");
            return WorkflowEvent.FAILED;
        }
        state.setQueryResult(queryPipeline.answer(state.getQuestion(), state.getUserId()));
        state.setSuccess(true);
        return WorkflowEvent.COMPLETED;
    }

    private WorkflowEvent visualize(WorkflowState state) {
        state.setGraphData(graphStore.exportGraph(state.getUserId()));
        state.setSuccess(true);
        return WorkflowEvent.COMPLETED;
    }

    private WorkflowEvent error(WorkflowState state) {
        state.setSuccess(false);
        if (!state.hasError()) {
            state.setError("Workflow failed");
        }
        return WorkflowEvent.COMPLETED;
    }
}
