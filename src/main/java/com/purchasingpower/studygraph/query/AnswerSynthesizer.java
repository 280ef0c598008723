package com.purchasingpower.studygraph.query;

import com.purchasingpower.studygraph.client.CompletionService;
import com.purchasingpower.studygraph.service.PromptLibraryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Produces the tutor-style answer from the structured context with a single completion call.
 * The reply is returned as-is.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnswerSynthesizer {

    static final String PROMPT_NAME = "answer-synthesis";
    static final String AGENT_NAME = "answer-synthesizer";

    private final CompletionService completionService;
    private final PromptLibraryService promptLibrary;

    public String synthesize(String question, StructuredContext context) {
        String prompt = buildPrompt(question, context);
        log.debug("Answer prompt: {} chars", prompt.length());
        return completionService.complete(prompt, AGENT_NAME);
    }

    /**
     * Empty sections are left out of the prompt entirely.
     */
    String buildPrompt(String question, StructuredContext context) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("question", question);
        variables.put("hasConcepts", !context.getConcepts().isEmpty());
        variables.put("concepts", String.join(", ", context.getConcepts()));
        variables.put("hasRelationships", !context.getRelationships().isEmpty());
        variables.put("relationships", context.getRelationships());
        variables.put("hasDocuments", !context.getDocuments().isEmpty());
        variables.put("documents", context.getDocuments());
        return promptLibrary.render(PROMPT_NAME, variables);
    }
}
