package com.purchasingpower.studygraph.query;

import com.purchasingpower.studygraph.core.GraphContext;
import com.purchasingpower.studygraph.workflow.state.QueryResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Question answering over a user's graph.
 *
 * <ol>
 *   <li>Extract the main concept from the question.</li>
 *   <li>Resolve its one-hop neighborhood. If the graph does not know the concept, stop here with a
 *       not-found answer; no vector search and no synthesis happen.</li>
 *   <li>Rank stored chunks against the concept.</li>
 *   <li>Structure both sources and synthesize the answer.</li>
 * </ol>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryPipeline {

    public static final String NOT_FOUND_ANSWER = "This topic was not found in your uploaded materials.";

    private final ConceptExtractor conceptExtractor;
    private final GraphContextResolver graphContextResolver;
    private final VectorRetriever vectorRetriever;
    private final ContextStructurer contextStructurer;
    private final AnswerSynthesizer answerSynthesizer;

    public QueryResult answer(String question, String userId) {
        String concept = conceptExtractor.extractConcept(question);
        GraphContext graphContext = graphContextResolver.resolve(concept, userId);

        if (graphContext.isEmpty()) {
            log.info("Concept '{}' not in graph of user {}", concept, userId);
            return QueryResult.builder()
                    .answer(NOT_FOUND_ANSWER)
                    .success(false)
                    .concept(concept)
                    .context(new QueryResult.ContextMetrics(0, 0, 0))
                    .build();
        }

        List<VectorResult> vectorResults = vectorRetriever.search(concept, userId);
        StructuredContext structured = contextStructurer.structure(graphContext, vectorResults);
        String answer = answerSynthesizer.synthesize(question, structured);

        log.info("✅ Answered question for user {} (concept '{}', {} entities, {} documents)",
                userId, concept, graphContext.getEntities().size(), vectorResults.size());
        return QueryResult.builder()
                .answer(answer)
                .success(true)
                .concept(concept)
                .context(new QueryResult.ContextMetrics(
                        vectorResults.size(),
                        graphContext.getEntities().size(),
                        graphContext.getRelationships().size()))
                .build();
    }
}
