package com.purchasingpower.studygraph.core;

import lombok.Value;

/**
 * Bounded, heading-scoped segment of ingested text.
 */
@Value
public class Chunk {
    String text;
    /** Heading that was active when the chunk was cut, or null before the first heading. */
    String sourceHeading;
    int sequenceIndex;
}
