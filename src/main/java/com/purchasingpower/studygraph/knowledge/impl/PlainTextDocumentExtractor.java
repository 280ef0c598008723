package com.purchasingpower.studygraph.knowledge.impl;

import com.purchasingpower.studygraph.knowledge.DocumentExtractor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Set;

@Component
public class PlainTextDocumentExtractor implements DocumentExtractor {

    private static final Set<String> EXTENSIONS = Set.of("txt", "md");

    @Override
    public boolean supports(String extension) {
        return EXTENSIONS.contains(extension);
    }

    @Override
    public String getFileType() {
        return "text";
    }

    @Override
    public String extract(byte[] fileData) {
        return new String(fileData, StandardCharsets.UTF_8);
    }
}
