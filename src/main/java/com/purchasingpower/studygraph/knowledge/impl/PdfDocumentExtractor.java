package com.purchasingpower.studygraph.knowledge.impl;

import com.purchasingpower.studygraph.knowledge.DocumentExtractor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Text layer of a PDF, page by page. Scanned pages without a text layer yield nothing.
 */
@Slf4j
@Component
public class PdfDocumentExtractor implements DocumentExtractor {

    @Override
    public boolean supports(String extension) {
        return "pdf".equals(extension);
    }

    @Override
    public String getFileType() {
        return "pdf";
    }

    @Override
    public String extract(byte[] fileData) throws IOException {
        try (PDDocument document = Loader.loadPDF(fileData)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            log.debug("Reading {} PDF pages", document.getNumberOfPages());
            return stripper.getText(document);
        }
    }
}
