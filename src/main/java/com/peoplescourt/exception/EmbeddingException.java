package com.peoplescourt.exception;

public class EmbeddingException extends UpstreamServiceException {
    
    public EmbeddingException(String message) {
        super(message);
    }
    
    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
