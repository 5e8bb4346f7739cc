package com.peoplescourt.exception;

/**
 * A required setting (such as the Judge credential) is missing. Never retried.
 */
public class ConfigurationException extends CourtException {

    public ConfigurationException(String message) {
        super(message);
    }
}
