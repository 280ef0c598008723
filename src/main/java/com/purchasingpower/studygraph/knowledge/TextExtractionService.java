package com.purchasingpower.studygraph.knowledge;

import com.purchasingpower.studygraph.exception.TextExtractionException;

/**
 * Turns an uploaded file into raw text.
 */
public interface TextExtractionService {

    /**
     * @throws TextExtractionException when the format is unsupported or the content unreadable
     */
    ExtractedText extract(byte[] fileData, String filename);
}
