package com.purchasingpower.studygraph.query;

import com.purchasingpower.studygraph.client.CompletionService;
import com.purchasingpower.studygraph.service.PromptLibraryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("AnswerSynthesizer")
class AnswerSynthesizerTest {

    private CompletionService completionService;
    private AnswerSynthesizer synthesizer;

    @BeforeEach
    void setUp() {
        completionService = mock(CompletionService.class);
        PromptLibraryService promptLibrary = new PromptLibraryService();
        promptLibrary.loadPrompts();
        synthesizer = new AnswerSynthesizer(completionService, promptLibrary);
    }

    @Test
    @DisplayName("Prompt carries the six-part structure and every non-empty section")
    void buildPrompt_shouldIncludeAllSections() {
        StructuredContext context = new StructuredContext(
            List.of("Marketing Mix", "Price"),
            List.of("Marketing Mix has_component Price"),
            List.of("Price is what customers pay & \"value\" they get."));

        String prompt = synthesizer.buildPrompt("What is the marketing mix?", context);

        assertThat(prompt)
            .contains("You are a university tutor.")
            .contains("1. Definition")
            .contains("6. Example")
            .contains("ONLY use the context below.")
            .contains("Concepts:")
            .contains("Marketing Mix, Price")
            .contains("Relationships:")
            .contains("Marketing Mix has_component Price")
            .contains("Documents:")
            .contains("Price is what customers pay & \"value\" they get.")
            .contains("Question: What is the marketing mix?");
    }

    @Test
    @DisplayName("Empty sections are left out entirely")
    void buildPrompt_shouldOmitEmptySections() {
        StructuredContext context = new StructuredContext(List.of("Price"), List.of(), List.of());

        String prompt = synthesizer.buildPrompt("What is price?", context);

        assertThat(prompt).contains("Concepts:").doesNotContain("Relationships:").doesNotContain("Documents:");
    }

    @Test
    @DisplayName("One completion call; the reply is returned unchanged")
    void synthesize_shouldReturnRawCompletion() {
        when(completionService.complete(anyString(), anyString())).thenReturn("  1. Definition: ...  ");

        String answer = synthesizer.synthesize("Q?", new StructuredContext(List.of("Price"), List.of(), List.of()));

        assertThat(answer).isEqualTo("  1. Definition: ...  ");
        verify(completionService, times(1)).complete(anyString(), eq(AnswerSynthesizer.AGENT_NAME));
    }
}
