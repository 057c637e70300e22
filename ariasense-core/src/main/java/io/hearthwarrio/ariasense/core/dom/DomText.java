package io.hearthwarrio.ariasense.core.dom;

/**
 * Text node.
 */
public interface DomText extends DomNode {

    /**
     * @return raw text content (never null)
     */
    String getText();

    /**
     * Whether the text occupies a non-empty box in the layout.
     *
     * @return true if the text node is rendered
     */
    boolean isVisible();
}
