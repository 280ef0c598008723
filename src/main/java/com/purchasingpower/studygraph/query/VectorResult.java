package com.purchasingpower.studygraph.query;

import com.purchasingpower.studygraph.core.StoredChunk;
import lombok.Value;

@Value
public class VectorResult {
    StoredChunk chunk;
    double similarity;
}
