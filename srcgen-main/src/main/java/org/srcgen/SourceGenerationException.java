package org.srcgen;

public class SourceGenerationException extends RuntimeException {

    public SourceGenerationException(String message) {
        super(message);
    }

    public SourceGenerationException(String message, Throwable cause) {
        super(message, cause);
    }

    public SourceGenerationException(Throwable cause) {
        super(cause);
    }
}
