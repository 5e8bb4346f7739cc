package com.peoplescourt.exception;

/**
 * The Judge's accumulated output could not be read as a structured ruling.
 * The message is safe to show callers; the raw output is only logged.
 */
public class MalformedVerdictException extends CourtException {

    public MalformedVerdictException(String message) {
        super(message);
    }

    public MalformedVerdictException(String message, Throwable cause) {
        super(message, cause);
    }
}
