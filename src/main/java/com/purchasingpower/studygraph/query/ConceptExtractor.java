package com.purchasingpower.studygraph.query;

import com.purchasingpower.studygraph.client.CompletionService;
import com.purchasingpower.studygraph.service.PromptLibraryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Reduces a question to the single concept name used to look up the graph.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConceptExtractor {

    static final String PROMPT_NAME = "concept-extraction";
    static final String AGENT_NAME = "concept-extractor";

    private final CompletionService completionService;
    private final PromptLibraryService promptLibrary;

    public String extractConcept(String question) {
        String prompt = promptLibrary.render(PROMPT_NAME, Map.of("question", question));
        String reply = completionService.complete(prompt, AGENT_NAME);
        String concept = normalize(reply);
        log.info("🎯 Main concept for question: '{}'", concept);
        return concept;
    }

    /**
     * First non-blank line, without surrounding quotes or backticks and without trailing punctuation.
     */
    static String normalize(String reply) {
        if (reply == null) {
            return "";
        }
        String line = reply.lines()
                .map(String::strip)
                .filter(l -> !l.isEmpty())
                .findFirst()
                .orElse("");

        String previous;
        do {
            previous = line;
            line = stripWrapping(line).replaceAll("[.!?:;,]+$", "").strip();
        } while (!line.equals(previous));
        return line;
    }

    private static String stripWrapping(String s) {
        if (s.length() >= 2) {
            char first = s.charAt(0);
            char last = s.charAt(s.length() - 1);
            if ((first == '"' || first == '\'' || first == '`') && first == last) {
                return s.substring(1, s.length() - 1).strip();
            }
        }
        return s;
    }
}
