package io.hearthwarrio.ariasense.core.dom;

/**
 * Generated-content pseudo-elements that contribute to accessible names.
 */
public enum PseudoElement {
    BEFORE("::before"),
    AFTER("::after");

    private final String selector;

    PseudoElement(String selector) {
        this.selector = selector;
    }

    public String getSelector() {
        return selector;
    }
}
