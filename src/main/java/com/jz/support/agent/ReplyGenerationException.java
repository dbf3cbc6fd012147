package com.jz.support.agent;

public class ReplyGenerationException extends RuntimeException {
    public ReplyGenerationException(String message) {
        super(message);
    }

    public ReplyGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
