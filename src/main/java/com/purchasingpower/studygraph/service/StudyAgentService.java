package com.purchasingpower.studygraph.service;

import com.purchasingpower.studygraph.knowledge.GraphStore;
import com.purchasingpower.studygraph.model.AskResponse;
import com.purchasingpower.studygraph.model.GraphExport;
import com.purchasingpower.studygraph.model.ResetResponse;
import com.purchasingpower.studygraph.model.UploadResponse;
import com.purchasingpower.studygraph.model.VisualizeResponse;
import com.purchasingpower.studygraph.workflow.StudyWorkflow;
import com.purchasingpower.studygraph.workflow.state.WorkflowAction;
import com.purchasingpower.studygraph.workflow.state.WorkflowState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for the user-facing operations. Each call runs a fresh workflow state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StudyAgentService {

    private final StudyWorkflow workflow;
    private final GraphExportService graphExportService;
    private final GraphStore graphStore;

    public UploadResponse upload(String userId, byte[] fileData, String filename) {
        log.info("📤 Upload {} ({} bytes) for user {}", filename, fileData == null ? 0 : fileData.length, userId);
        WorkflowState state = workflow.run(WorkflowState.builder()
                .action(WorkflowAction.UPLOAD)
                .userId(userId)
                .fileData(fileData)
                .filename(filename)
                .build());

        return UploadResponse.builder()
                .success(state.isSuccess())
                .filename(filename)
                .fileType(state.getFileType())
                .processingResult(state.getProcessingResult())
                .error(state.getError())
                .build();
    }

    public AskResponse ask(String userId, String question) {
        log.info("❓ Question from user {}", userId);
        WorkflowState state = workflow.run(WorkflowState.builder()
                .action(WorkflowAction.QUERY)
                .userId(userId)
                .question(question)
                .build());

        return AskResponse.builder()
                .success(state.isSuccess())
                .queryResult(state.getQueryResult())
                .error(state.getError())
                .build();
    }

    public VisualizeResponse visualize(String userId) {
        WorkflowState state = workflow.run(WorkflowState.builder()
                .action(WorkflowAction.VISUALIZE)
                .userId(userId)
                .build());

        return VisualizeResponse.builder()
                .success(state.isSuccess())
                .graph(state.getGraphData())
                .error(state.getError())
                .build();
    }

    public GraphExport exportGraph(String userId) {
        VisualizeResponse visualized = visualize(userId);
        if (!visualized.isSuccess()) {
            return graphExportService.failed(userId, visualized.getError());
        }
        return graphExportService.export(userId, visualized.getGraph());
    }

    /**
     * Deletes everything stored for the user.
     */
    public ResetResponse resetGraph(String userId) {
        long entities = graphStore.countEntities(userId);
        graphStore.deletePartition(userId);
        log.info("🗑️  Reset graph for user {} ({} entities removed)", userId, entities);
        return ResetResponse.builder()
                .success(true)
                .userId(userId)
                .entitiesRemoved(entities)
                .build();
    }
}
