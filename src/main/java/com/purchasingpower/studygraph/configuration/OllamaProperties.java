package com.purchasingpower.studygraph.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class OllamaProperties {

    @NotBlank
    private String baseUrl = "http://localhost:11434";

    @NotBlank
    private String chatModel = "llama3.1:8b";

    /**
     * One embedding model per deployment. Stored chunk vectors are tagged with this name
     * and re-embedded at query time when it changes.
     */
    @NotBlank
    private String embeddingModel = "all-minilm";

    @Min(1)
    private int timeoutSeconds = 120;

    @Min(0)
    private int maxRetries = 3;

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private double temperature = 0.1;

    @Min(512)
    private int numCtx = 8192;

    @Min(1)
    private int maxTokens = 2000;
}
