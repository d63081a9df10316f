package org.salesintel.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised when a draft cannot be committed. Carries every problem found so the operator can fix
 * them in one pass; the draft stays in edit mode.
 */
@Getter
public class MappingValidationException extends RuntimeException {

    private final List<String> errors;

    public MappingValidationException(List<String> errors) {
        super("Mapping entry is invalid: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }
}
