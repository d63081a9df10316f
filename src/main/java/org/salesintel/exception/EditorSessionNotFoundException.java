package org.salesintel.exception;

public class EditorSessionNotFoundException extends RuntimeException {

    public EditorSessionNotFoundException(String sessionId) {
        super("Mapping editor session not found: " + sessionId);
    }
}
