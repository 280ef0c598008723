package com.purchasingpower.studygraph.knowledge.impl;

import com.purchasingpower.studygraph.exception.TextExtractionException;
import com.purchasingpower.studygraph.knowledge.DocumentExtractor;
import com.purchasingpower.studygraph.knowledge.ExtractedText;
import com.purchasingpower.studygraph.knowledge.TextExtractionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Picks the {@link DocumentExtractor} for the upload's extension and normalizes its output.
 *
 * <p>Whitespace runs inside a line collapse to one space and lines of two characters or fewer are
 * dropped. Line breaks are kept so the chunker can still see headings.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentTextExtractionService implements TextExtractionService {

    private static final int MIN_LINE_LENGTH = 3;

    private final List<DocumentExtractor> extractors;

    @Override
    public ExtractedText extract(byte[] fileData, String filename) {
        if (fileData == null || fileData.length == 0) {
            throw new TextExtractionException("File is empty", filename);
        }
        String extension = extensionOf(filename);
        DocumentExtractor extractor = extractors.stream()
                .filter(candidate -> candidate.supports(extension))
                .findFirst()
                .orElseThrow(() -> new TextExtractionException("Unsupported file type: " + extension, filename));

        String raw;
        try {
            raw = extractor.extract(fileData);
        } catch (IOException | RuntimeException e) {
            throw new TextExtractionException("Could not read " + extractor.getFileType() + " file: "
                    + e.getMessage(), filename, e);
        }

        String cleaned = clean(raw);
        log.info("📄 Extracted {} chars of {} from {} ({} raw bytes)",
                cleaned.length(), extractor.getFileType(), filename, fileData.length);
        return new ExtractedText(cleaned, extractor.getFileType());
    }

    static String clean(String text) {
        return Arrays.stream(text.split("\\R"))
                .map(line -> line.trim().replaceAll("\\s+", " "))
                .filter(line -> line.length() >= MIN_LINE_LENGTH)
                .collect(Collectors.joining("\n"));
    }

    private String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
