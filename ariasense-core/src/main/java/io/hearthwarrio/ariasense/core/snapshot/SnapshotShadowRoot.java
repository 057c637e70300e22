package io.hearthwarrio.ariasense.core.snapshot;

/**
 * Open shadow root attached to a {@link SnapshotElement}.
 */
public class SnapshotShadowRoot extends SnapshotScope {

    private final SnapshotElement host;

    SnapshotShadowRoot(SnapshotElement host) {
        this.host = host;
    }

    public SnapshotElement getHost() {
        return host;
    }

    @Override
    public SnapshotShadowRoot append(SnapshotNode... nodes) {
        super.append(nodes);
        return this;
    }

    /**
     * Named slotting: elements go to the first slot whose {@code name} equals their {@code slot} attribute,
     * text nodes and elements without a slot name go to the first unnamed slot.
     *
     * @param node light child of the host
     * @return slot or null when the node is not assigned
     */
    SnapshotElement findSlotFor(SnapshotNode node) {
        String wanted = "";
        if (node instanceof SnapshotElement) {
            String slot = ((SnapshotElement) node).getAttribute("slot");
            wanted = slot == null ? "" : slot;
        }
        String slotName = wanted;
        return findFirst(e -> "SLOT".equals(e.getTagName()) && slotName.equals(nameOf(e)));
    }

    private static String nameOf(SnapshotElement slot) {
        String name = slot.getAttribute("name");
        return name == null ? "" : name;
    }
}
