package com.purchasingpower.studygraph.model;

import com.purchasingpower.studygraph.core.GraphData;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VisualizeResponse {

    private boolean success;
    private GraphData graph;
    private String error;

    public static VisualizeResponse error(String error) {
        return VisualizeResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
