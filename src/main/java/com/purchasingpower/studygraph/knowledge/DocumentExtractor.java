package com.purchasingpower.studygraph.knowledge;

import java.io.IOException;

/**
 * Raw text extraction for one family of file formats.
 */
public interface DocumentExtractor {

    /**
     * @param extension lower-case file extension without the dot
     */
    boolean supports(String extension);

    /**
     * Label reported back to the uploader, e.g. {@code "pdf"}.
     */
    String getFileType();

    String extract(byte[] fileData) throws IOException;
}
