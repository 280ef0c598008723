package com.purchasingpower.studygraph.model;

import com.purchasingpower.studygraph.workflow.state.IngestionResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadResponse {

    private boolean success;
    private String filename;
    private String fileType;
    private IngestionResult processingResult;
    private String error;

    public static UploadResponse error(String error) {
        return UploadResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
