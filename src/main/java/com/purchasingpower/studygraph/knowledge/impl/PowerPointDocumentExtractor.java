package com.purchasingpower.studygraph.knowledge.impl;

import com.purchasingpower.studygraph.knowledge.DocumentExtractor;
import org.apache.poi.sl.usermodel.Placeholder;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFGroupShape;
import org.apache.poi.xslf.usermodel.XSLFShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTextParagraph;
import org.apache.poi.xslf.usermodel.XSLFTextShape;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@code .pptx} decks slide by slide.
 *
 * <p>Each slide with text starts with a {@code === SLIDE n ===} line, which the chunker treats as a
 * heading. Title placeholders become {@code TITLE: ...}; every other paragraph becomes a bullet line.
 */
@Component
public class PowerPointDocumentExtractor implements DocumentExtractor {

    static final String BULLET = "• ";

    @Override
    public boolean supports(String extension) {
        return "pptx".equals(extension);
    }

    @Override
    public String getFileType() {
        return "powerpoint";
    }

    @Override
    public String extract(byte[] fileData) throws IOException {
        StringBuilder text = new StringBuilder();
        try (XMLSlideShow slideShow = new XMLSlideShow(new ByteArrayInputStream(fileData))) {
            int slideNumber = 0;
            for (XSLFSlide slide : slideShow.getSlides()) {
                slideNumber++;
                List<String> lines = new ArrayList<>();
                collectText(slide.getShapes(), lines);
                if (lines.isEmpty()) {
                    continue;
                }
                text.append("=== SLIDE ").append(slideNumber).append(" ===\n");
                lines.forEach(line -> text.append(line).append('\n'));
            }
        }
        return text.toString();
    }

    private void collectText(List<XSLFShape> shapes, List<String> lines) {
        for (XSLFShape shape : shapes) {
            if (shape instanceof XSLFGroupShape group) {
                collectText(group.getShapes(), lines);
            } else if (shape instanceof XSLFTextShape textShape) {
                if (isTitle(textShape)) {
                    String title = textShape.getText().strip();
                    if (!title.isEmpty()) {
                        lines.add("TITLE: " + title.replaceAll("\\s+", " "));
                    }
                    continue;
                }
                for (XSLFTextParagraph paragraph : textShape.getTextParagraphs()) {
                    String line = paragraph.getText().strip();
                    if (!line.isEmpty()) {
                        lines.add(BULLET + line);
                    }
                }
            }
        }
    }

    private boolean isTitle(XSLFTextShape shape) {
        Placeholder type = shape.getPlaceholder();
        return type == Placeholder.TITLE || type == Placeholder.CENTERED_TITLE;
    }
}
