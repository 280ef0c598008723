package com.purchasingpower.studygraph.knowledge;

import lombok.Value;

@Value
public class ExtractedText {
    String text;
    String fileType;
}
