package org.salesintel.exception;

public class MappingPersistenceException extends RuntimeException {

    public MappingPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
