package com.purchasingpower.studygraph.exception;

import lombok.Getter;

@Getter
public class TextExtractionException extends RuntimeException {

    private final String filename;

    public TextExtractionException(String message, String filename) {
        super(message);
        this.filename = filename;
    }

    public TextExtractionException(String message, String filename, Throwable cause) {
        super(message, cause);
        this.filename = filename;
    }
}
