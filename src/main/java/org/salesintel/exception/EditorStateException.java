package org.salesintel.exception;

public class EditorStateException extends RuntimeException {

    public EditorStateException(String message) {
        super(message);
    }
}
