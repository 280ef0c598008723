package com.purchasingpower.studygraph.client;

/**
 * Text completion backend used for extraction, concept detection and answer synthesis.
 */
public interface CompletionService {

    /**
     * @param prompt    fully rendered prompt
     * @param agentName caller label, used for logging only
     * @return raw model reply
     * @throws com.purchasingpower.studygraph.exception.LlmCallException after retries are exhausted
     */
    String complete(String prompt, String agentName);
}
