package org.salesintel.exception;

/**
 * A live schema provider could not answer. The schema registry recovers from this with defaults.
 */
public class SchemaProviderException extends RuntimeException {

    public SchemaProviderException(String message) {
        super(message);
    }

    public SchemaProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
