package org.salesintel.exception;

public class SuggestionUnavailableException extends RuntimeException {

    public SuggestionUnavailableException(String message) {
        super(message);
    }

    public SuggestionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
