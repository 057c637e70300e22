package io.hearthwarrio.ariasense.core.dom;

/**
 * A node of the rendered document tree as seen by the accessibility engine.
 * <p>
 * Only two kinds of nodes are relevant: {@link DomElement} and {@link DomText}. Comments and other node types
 * are not exposed. Nodes are owned by the tree provider; the engine only reads them.
 */
public interface DomNode {

    /**
     * Returns the slot this node is projected into, or {@code null} when the node is not assigned to a slot.
     *
     * @return assigned slot element or null
     */
    DomElement getAssignedSlot();
}
