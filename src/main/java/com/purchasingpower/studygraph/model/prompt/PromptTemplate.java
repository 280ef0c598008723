package com.purchasingpower.studygraph.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Prompt template loaded from {@code classpath:prompts/*.yaml}.
 *
 * <pre>
 * name: concept-extraction
 * version: "1.0"
 * systemPrompt: |
 *   You are ...
 * userPrompt: |
 *   Question: {{question}}
 * </pre>
 *
 * @see com.purchasingpower.studygraph.service.PromptLibraryService
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptTemplate {
    private String name;
    private String version;
    private String systemPrompt;
    private String userPrompt;

    /**
     * System and user parts joined by a blank line; either part may be absent.
     */
    public String fullText() {
        if (systemPrompt == null || systemPrompt.isBlank()) {
            return userPrompt == null ? "" : userPrompt;
        }
        if (userPrompt == null || userPrompt.isBlank()) {
            return systemPrompt;
        }
        return systemPrompt + "\n\n" + userPrompt;
    }
}
