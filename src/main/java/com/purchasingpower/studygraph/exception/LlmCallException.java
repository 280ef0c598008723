package com.purchasingpower.studygraph.exception;

import lombok.Getter;

@Getter
public class LlmCallException extends RuntimeException {

    private final String agentName;

    public LlmCallException(String message, String agentName, Throwable cause) {
        super(message, cause);
        this.agentName = agentName;
    }

    public LlmCallException(String message, String agentName) {
        super(message);
        this.agentName = agentName;
    }
}
