package com.purchasingpower.studygraph.model;

import com.purchasingpower.studygraph.workflow.state.QueryResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * {@code success} reports whether the request ran; whether the topic was found is
 * {@code queryResult.success}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AskResponse {

    private boolean success;
    private QueryResult queryResult;
    private String error;

    public static AskResponse error(String error) {
        return AskResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
