package io.hearthwarrio.ariasense.core.snapshot;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of a DOM snapshot.
 * <pre>{@code
 * SnapshotDocument doc = new SnapshotDocument();
 * doc.append(new SnapshotElement("button").text("Save"));
 * }</pre>
 */
public class SnapshotDocument extends SnapshotScope {

    @Override
    public SnapshotDocument append(SnapshotNode... nodes) {
        super.append(nodes);
        return this;
    }

    /**
     * All elements in document order, shadow trees included. The content of a shadow tree follows its host and
     * precedes the host's light children.
     *
     * @return elements
     */
    public List<SnapshotElement> getElements() {
        List<SnapshotElement> out = new ArrayList<>();
        for (SnapshotNode n : getChildren()) {
            collect(n, out);
        }
        return out;
    }

    private static void collect(SnapshotNode node, List<SnapshotElement> out) {
        if (!(node instanceof SnapshotElement)) {
            return;
        }
        SnapshotElement element = (SnapshotElement) node;
        out.add(element);
        if (element.hasShadowRoot()) {
            for (SnapshotNode n : element.getShadowRoot().getChildren()) {
                collect(n, out);
            }
        }
        for (SnapshotNode child : element.getChildren()) {
            collect(child, out);
        }
    }
}
