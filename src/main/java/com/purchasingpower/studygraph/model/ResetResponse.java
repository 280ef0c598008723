package com.purchasingpower.studygraph.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResetResponse {

    private boolean success;
    private String userId;
    private long entitiesRemoved;
    private String error;
}
