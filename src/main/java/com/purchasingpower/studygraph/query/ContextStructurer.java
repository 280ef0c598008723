package com.purchasingpower.studygraph.query;

import com.purchasingpower.studygraph.configuration.AppProperties;
import com.purchasingpower.studygraph.core.Entity;
import com.purchasingpower.studygraph.core.GraphContext;
import com.purchasingpower.studygraph.core.Relationship;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

@Component
public class ContextStructurer {

    private final int excerptChars;

    @Autowired
    public ContextStructurer(AppProperties appProperties) {
        this(appProperties.getRetrieval().getExcerptChars());
    }

    public ContextStructurer(int excerptChars) {
        this.excerptChars = excerptChars;
    }

    /**
     * Entity names in neighborhood order, edges as "from type to", excerpts in rank order.
     */
    public StructuredContext structure(GraphContext graphContext, List<VectorResult> vectorResults) {
        List<String> concepts = graphContext.getEntities().stream()
                .map(Entity::getName)
                .collect(Collectors.toList());
        List<String> relationships = graphContext.getRelationships().stream()
                .map(Relationship::render)
                .collect(Collectors.toList());
        List<String> documents = vectorResults.stream()
                .map(r -> excerpt(r.getChunk().getText()))
                .collect(Collectors.toList());
        return new StructuredContext(concepts, relationships, documents);
    }

    /**
     * First {@code excerptChars} chars, one fewer when the cut would split a surrogate pair.
     */
    private String excerpt(String text) {
        if (text.length() <= excerptChars) {
            return text;
        }
        int end = excerptChars;
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }
}
