package com.purchasingpower.studygraph.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class RetrievalProperties {

    @Min(1)
    private int topK = 5;

    /**
     * Results at or below this cosine similarity are dropped.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double similarityThreshold = 0.10;

    @Min(1)
    private int excerptChars = 500;
}
