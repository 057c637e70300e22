package io.hearthwarrio.ariasense.core.snapshot;

import io.hearthwarrio.ariasense.core.dom.DomElement;
import io.hearthwarrio.ariasense.core.dom.DomScope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Common part of {@link SnapshotDocument} and {@link SnapshotShadowRoot}: an ordered list of top-level nodes
 * forming one id scope.
 */
public abstract class SnapshotScope implements DomScope {

    private final List<SnapshotNode> children = new ArrayList<>();

    // built on first lookup, dropped by any tree or attribute change inside the scope
    private Map<String, SnapshotElement> idIndex;
    private Map<SnapshotElement, List<DomElement>> labelIndex;

    /**
     * Appends top-level nodes.
     *
     * @param nodes nodes to append; each node can be attached only once
     * @return this scope
     */
    public SnapshotScope append(SnapshotNode... nodes) {
        for (SnapshotNode n : nodes) {
            Objects.requireNonNull(n, "node must not be null");
            n.attachTo(this);
            children.add(n);
        }
        invalidate();
        return this;
    }

    void invalidate() {
        idIndex = null;
        labelIndex = null;
    }

    public List<SnapshotNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * @throws IllegalArgumentException for a null or blank id
     */
    @Override
    public SnapshotElement getElementById(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (idIndex == null) {
            Map<String, SnapshotElement> index = new HashMap<>();
            for (SnapshotElement e : elementsInScope()) {
                String elementId = e.getAttribute("id");
                if (elementId != null) {
                    index.putIfAbsent(elementId, e);
                }
            }
            idIndex = index;
        }
        return idIndex.get(id);
    }

    /**
     * First element of this scope in tree order matching the predicate; nested shadow trees are not searched.
     */
    SnapshotElement findFirst(Predicate<SnapshotElement> predicate) {
        for (SnapshotElement e : elementsInScope()) {
            if (predicate.test(e)) {
                return e;
            }
        }
        return null;
    }

    /**
     * @return elements of this scope in tree order, without nested shadow trees
     */
    List<SnapshotElement> elementsInScope() {
        List<SnapshotElement> out = new ArrayList<>();
        for (SnapshotNode n : children) {
            if (n instanceof SnapshotElement) {
                collectLight((SnapshotElement) n, out);
            }
        }
        return out;
    }

    private static void collectLight(SnapshotElement element, List<SnapshotElement> out) {
        out.add(element);
        for (SnapshotNode child : element.getChildren()) {
            if (child instanceof SnapshotElement) {
                collectLight((SnapshotElement) child, out);
            }
        }
    }

    /**
     * @return labels of this scope whose labeled control is the given element
     */
    List<DomElement> labelsOf(SnapshotElement control) {
        if (labelIndex == null) {
            Map<SnapshotElement, List<DomElement>> index = new IdentityHashMap<>();
            for (SnapshotElement e : elementsInScope()) {
                if ("LABEL".equals(e.getTagName())) {
                    SnapshotElement labeled = labeledControl(e);
                    if (labeled != null) {
                        index.computeIfAbsent(labeled, k -> new ArrayList<>()).add(e);
                    }
                }
            }
            labelIndex = index;
        }
        List<DomElement> labels = labelIndex.get(control);
        return labels == null ? Collections.emptyList() : Collections.unmodifiableList(labels);
    }

    private SnapshotElement labeledControl(SnapshotElement label) {
        String forId = label.getAttribute("for");
        if (forId != null) {
            if (forId.isBlank()) {
                return null;
            }
            SnapshotElement target = getElementById(forId);
            return target != null && target.isLabelable() ? target : null;
        }
        return firstLabelableDescendant(label);
    }

    private static SnapshotElement firstLabelableDescendant(SnapshotElement element) {
        for (SnapshotNode child : element.getChildren()) {
            if (child instanceof SnapshotElement) {
                SnapshotElement e = (SnapshotElement) child;
                if (e.isLabelable()) {
                    return e;
                }
                SnapshotElement nested = firstLabelableDescendant(e);
                if (nested != null) {
                    return nested;
                }
            }
        }
        return null;
    }
}
