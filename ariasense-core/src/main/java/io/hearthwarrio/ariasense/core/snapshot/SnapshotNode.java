package io.hearthwarrio.ariasense.core.snapshot;

import io.hearthwarrio.ariasense.core.dom.DomElement;
import io.hearthwarrio.ariasense.core.dom.DomNode;

/**
 * Base of snapshot nodes: tracks the light parent, or the shadow root / document that owns a top-level node.
 */
public abstract class SnapshotNode implements DomNode {

    private SnapshotElement parent;
    private SnapshotScope owner;

    void attachTo(SnapshotElement parent) {
        ensureDetached();
        this.parent = parent;
    }

    void attachTo(SnapshotScope owner) {
        ensureDetached();
        this.owner = owner;
    }

    private void ensureDetached() {
        if (parent != null || owner != null) {
            throw new IllegalStateException("Node is already attached: " + this);
        }
    }

    /**
     * @return light-tree parent element or null
     */
    public SnapshotElement getParent() {
        return parent;
    }

    /**
     * @return shadow root or document this node is a top-level child of, null otherwise
     */
    SnapshotScope getOwner() {
        return owner;
    }

    /**
     * @return enclosing document or shadow root, null when the node is detached
     */
    SnapshotScope scope() {
        SnapshotNode n = this;
        while (n.parent != null) {
            n = n.parent;
        }
        return n.owner;
    }

    @Override
    public DomElement getAssignedSlot() {
        if (parent == null || !parent.hasShadowRoot()) {
            return null;
        }
        return parent.getShadowRoot().findSlotFor(this);
    }
}
