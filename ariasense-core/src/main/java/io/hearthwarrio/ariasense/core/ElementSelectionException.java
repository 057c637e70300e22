package io.hearthwarrio.ariasense.core;

/**
 * Thrown when no element or more than one element matches a role query.
 */
public class ElementSelectionException extends RuntimeException {
    public ElementSelectionException(String message) {
        super(message);
    }
}
