package com.purchasingpower.studygraph.exception;

import lombok.Getter;

@Getter
public class GraphStoreException extends RuntimeException {

    private final String tenantId;

    public GraphStoreException(String message, String tenantId, Throwable cause) {
        super(message, cause);
        this.tenantId = tenantId;
    }
}
