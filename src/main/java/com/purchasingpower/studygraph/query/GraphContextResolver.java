package com.purchasingpower.studygraph.query;

import com.purchasingpower.studygraph.core.GraphContext;
import com.purchasingpower.studygraph.knowledge.GraphStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Looks up the one-hop neighborhood of a concept in the user's graph.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphContextResolver {

    private final GraphStore graphStore;

    /**
     * @return the neighborhood, or an empty context when the concept is blank or unknown
     */
    public GraphContext resolve(String concept, String userId) {
        if (concept == null || concept.isBlank()) {
            return GraphContext.empty();
        }
        GraphContext context = graphStore.getNeighborhood(concept.strip(), userId);
        log.debug("Graph context for '{}': {} entities, {} relationships",
                concept, context.getEntities().size(), context.getRelationships().size());
        return context;
    }
}
