package com.purchasingpower.studygraph.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class ExtractionProperties {

    /**
     * Entity names with more words than this are discarded.
     */
    @Min(1)
    private int maxEntityWords = 6;
}
