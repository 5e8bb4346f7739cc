package com.peoplescourt.exception;

public class CourtException extends RuntimeException {
    
    public CourtException(String message) {
        super(message);
    }
    
    public CourtException(String message, Throwable cause) {
        super(message, cause);
    }
}
