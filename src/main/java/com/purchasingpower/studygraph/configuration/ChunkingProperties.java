package com.purchasingpower.studygraph.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class ChunkingProperties {

    @Min(1)
    private int maxChars = 6000;
}
