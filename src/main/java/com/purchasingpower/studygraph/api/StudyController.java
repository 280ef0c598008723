package com.purchasingpower.studygraph.api;

import com.purchasingpower.studygraph.model.AskRequest;
import com.purchasingpower.studygraph.model.AskResponse;
import com.purchasingpower.studygraph.model.GraphExport;
import com.purchasingpower.studygraph.model.ResetResponse;
import com.purchasingpower.studygraph.model.UploadResponse;
import com.purchasingpower.studygraph.model.VisualizeResponse;
import com.purchasingpower.studygraph.service.StudyAgentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for uploading study material, asking questions and inspecting the per-user graph.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/users/{userId}")
@RequiredArgsConstructor
public class StudyController {

    private final StudyAgentService studyAgentService;

    /**
     * Upload a document and ingest it into the user's graph.
     *
     * POST /api/v1/users/{userId}/documents (multipart "file")
     */
    @PostMapping("/documents")
    public ResponseEntity<UploadResponse> upload(@PathVariable String userId,
                                                 @RequestParam("file") MultipartFile file) {
        if (userId.isBlank()) {
            return ResponseEntity.badRequest().body(UploadResponse.error("User id is required"));
        }
        if (file.isEmpty()) {
            return ResponseEntity.badRequest().body(UploadResponse.error("File is empty"));
        }
        try {
            UploadResponse response = studyAgentService.upload(userId, file.getBytes(), file.getOriginalFilename());
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            log.error("Upload failed for user {}", userId, e);
            return ResponseEntity.internalServerError()
                .body(UploadResponse.error("Upload failed: " + e.getMessage()));
        }
    }

    /**
     * Ask a question against the user's graph.
     *
     * POST /api/v1/users/{userId}/questions {"question": "..."}
     */
    @PostMapping("/questions")
    public ResponseEntity<AskResponse> ask(@PathVariable String userId, @RequestBody AskRequest request) {
        if (userId.isBlank()) {
            return ResponseEntity.badRequest().body(AskResponse.error("User id is required"));
        }
        if (request.getQuestion() == null || request.getQuestion().isBlank()) {
            return ResponseEntity.badRequest().body(AskResponse.error("Question is required"));
        }
        try {
            return ResponseEntity.ok(studyAgentService.ask(userId, request.getQuestion()));
        } catch (Exception e) {
            log.error("Question failed for user {}", userId, e);
            return ResponseEntity.internalServerError()
                .body(AskResponse.error("Question failed: " + e.getMessage()));
        }
    }

    /**
     * GET /api/v1/users/{userId}/graph
     */
    @GetMapping("/graph")
    public ResponseEntity<VisualizeResponse> graph(@PathVariable String userId) {
        if (userId.isBlank()) {
            return ResponseEntity.badRequest().body(VisualizeResponse.error("User id is required"));
        }
        try {
            return ResponseEntity.ok(studyAgentService.visualize(userId));
        } catch (Exception e) {
            log.error("Graph retrieval failed for user {}", userId, e);
            return ResponseEntity.internalServerError()
                .body(VisualizeResponse.error("Graph retrieval failed: " + e.getMessage()));
        }
    }

    /**
     * GET /api/v1/users/{userId}/graph/export
     */
    @GetMapping("/graph/export")
    public ResponseEntity<GraphExport> export(@PathVariable String userId) {
        if (userId.isBlank()) {
            return ResponseEntity.badRequest()
                .body(GraphExport.builder().success(false).error("User id is required").build());
        }
        GraphExport export = studyAgentService.exportGraph(userId);
        return ResponseEntity.ok(export);
    }

    /**
     * Remove the user's whole graph.
     *
     * DELETE /api/v1/users/{userId}/graph
     */
    @DeleteMapping("/graph")
    public ResponseEntity<ResetResponse> reset(@PathVariable String userId) {
        if (userId.isBlank()) {
            return ResponseEntity.badRequest()
                .body(ResetResponse.builder().success(false).error("User id is required").build());
        }
        try {
            return ResponseEntity.ok(studyAgentService.resetGraph(userId));
        } catch (Exception e) {
            log.error("Reset failed for user {}", userId, e);
            return ResponseEntity.internalServerError()
                .body(ResetResponse.builder().success(false).userId(userId).error("Reset failed: " + e.getMessage()).build());
        }
    }
}
