package com.peoplescourt.exception;

/**
 * An external collaborator (embedder, jury, judge) failed or timed out.
 */
public class UpstreamServiceException extends CourtException {

    public UpstreamServiceException(String message) {
        super(message);
    }

    public UpstreamServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
