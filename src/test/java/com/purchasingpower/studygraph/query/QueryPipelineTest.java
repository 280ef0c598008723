package com.purchasingpower.studygraph.query;

import com.purchasingpower.studygraph.core.Entity;
import com.purchasingpower.studygraph.core.EntityType;
import com.purchasingpower.studygraph.core.Relationship;
import com.purchasingpower.studygraph.core.RelationshipType;
import com.purchasingpower.studygraph.core.StoredChunk;
import com.purchasingpower.studygraph.knowledge.impl.InMemoryGraphStore;
import com.purchasingpower.studygraph.workflow.state.QueryResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("QueryPipeline")
class QueryPipelineTest {

    private static final String USER = "u1";

    private ConceptExtractor conceptExtractor;
    private VectorRetriever vectorRetriever;
    private AnswerSynthesizer answerSynthesizer;
    private InMemoryGraphStore store;
    private QueryPipeline pipeline;

    @BeforeEach
    void setUp() {
        conceptExtractor = mock(ConceptExtractor.class);
        vectorRetriever = mock(VectorRetriever.class);
        answerSynthesizer = mock(AnswerSynthesizer.class);
        store = new InMemoryGraphStore();
        store.upsertEntities(List.of(
            new Entity("Marketing Mix", EntityType.FRAMEWORK),
            new Entity("Price", EntityType.CONCEPT)), USER);
        store.upsertRelationships(List.of(
            new Relationship("Marketing Mix", "Price", RelationshipType.HAS_COMPONENT)), USER);

        pipeline = new QueryPipeline(conceptExtractor, new GraphContextResolver(store),
            vectorRetriever, new ContextStructurer(500), answerSynthesizer);
    }

    @Test
    @DisplayName("A concept missing from the graph short-circuits without search or synthesis")
    void unknownConcept_shouldShortCircuit() {
        // Given
        when(conceptExtractor.extractConcept(anyString())).thenReturn("Supply Chain");

        // When
        QueryResult result = pipeline.answer("What is a supply chain?", USER);

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getAnswer()).contains("not found");
        assertThat(result.getConcept()).isEqualTo("Supply Chain");
        verify(vectorRetriever, never()).search(anyString(), anyString());
        verify(vectorRetriever, never()).search(anyString(), anyString(), anyInt());
        verify(answerSynthesizer, never()).synthesize(anyString(), any());
    }

    @Test
    @DisplayName("A known concept combines graph and vector context into one answer")
    void knownConcept_shouldSynthesize() {
        // Given
        when(conceptExtractor.extractConcept(anyString())).thenReturn("Marketing Mix");
        when(vectorRetriever.search("Marketing Mix", USER)).thenReturn(List.of(
            new VectorResult(StoredChunk.builder().id("c1").text("The marketing mix has four parts.").build(), 0.8)));
        when(answerSynthesizer.synthesize(anyString(), any())).thenReturn("1. Definition ...");

        // When
        QueryResult result = pipeline.answer("Explain the marketing mix", USER);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAnswer()).isEqualTo("1. Definition ...");
        assertThat(result.getContext().getDocumentsFound()).isEqualTo(1);
        assertThat(result.getContext().getGraphEntities()).isEqualTo(2);
        assertThat(result.getContext().getGraphRelationships()).isEqualTo(1);

        ArgumentCaptor<StructuredContext> context = ArgumentCaptor.forClass(StructuredContext.class);
        verify(answerSynthesizer).synthesize(eq("Explain the marketing mix"), context.capture());
        assertThat(context.getValue().getConcepts()).containsExactly("Marketing Mix", "Price");
        assertThat(context.getValue().getRelationships()).containsExactly("Marketing Mix has_component Price");
        assertThat(context.getValue().getDocuments()).containsExactly("The marketing mix has four parts.");
    }

    @Test
    @DisplayName("A blank concept is treated as not found")
    void blankConcept_shouldBeNotFound() {
        when(conceptExtractor.extractConcept(anyString())).thenReturn("");

        QueryResult result = pipeline.answer("???", USER);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getAnswer()).isEqualTo(QueryPipeline.NOT_FOUND_ANSWER);
    }
}
