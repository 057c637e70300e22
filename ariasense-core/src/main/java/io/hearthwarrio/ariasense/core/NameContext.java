package io.hearthwarrio.ariasense.core;

import io.hearthwarrio.ariasense.core.dom.DomElement;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Per-call state of the accessible name computation.
 * <p>
 * Instances are immutable apart from the visited set, which is shared by every context derived from the same
 * top-level computation. Each descent creates a new context, so flags never leak between sibling branches.
 */
final class NameContext {

    /**
     * Position of the current node relative to a referenced/embedding node.
     */
    enum Embedding {
        /** Not inside such an expansion. */
        NONE,
        /** The current node is the referenced node itself. */
        SELF,
        /** The current node is a descendant of the referenced node. */
        DESCENDANT;

        Embedding descend() {
            return this == SELF ? DESCENDANT : this;
        }
    }

    final boolean includeHidden;
    final Set<DomElement> visited;
    final Embedding labelledBy;
    final Embedding label;
    final boolean textAlternative;
    final Embedding target;

    private NameContext(
            boolean includeHidden,
            Set<DomElement> visited,
            Embedding labelledBy,
            Embedding label,
            boolean textAlternative,
            Embedding target
    ) {
        this.includeHidden = includeHidden;
        this.visited = visited;
        this.labelledBy = labelledBy;
        this.label = label;
        this.textAlternative = textAlternative;
        this.target = target;
    }

    /**
     * Context for naming the query target itself.
     */
    static NameContext forTarget(boolean includeHidden) {
        return new NameContext(
                includeHidden,
                Collections.newSetFromMap(new IdentityHashMap<>()),
                Embedding.NONE,
                Embedding.NONE,
                false,
                Embedding.SELF
        );
    }

    /**
     * Context for the children of the current node: every {@code SELF} becomes {@code DESCENDANT}.
     */
    NameContext forChild() {
        return new NameContext(includeHidden, visited, labelledBy.descend(), label.descend(), textAlternative,
                target.descend());
    }

    /**
     * Context for an element referenced by {@code aria-labelledby}.
     */
    NameContext forLabelledByTarget() {
        return new NameContext(includeHidden, visited, Embedding.SELF, Embedding.NONE, false, Embedding.NONE);
    }

    /**
     * Context for an associated {@code <label>}.
     */
    NameContext forLabel() {
        return new NameContext(includeHidden, visited, Embedding.NONE, Embedding.SELF, false, Embedding.NONE);
    }

    /**
     * Child context for a legend/figcaption/caption that provides a text alternative.
     */
    NameContext forTextAlternativeChild() {
        NameContext child = forChild();
        return new NameContext(includeHidden, visited, child.labelledBy, child.label, true, child.target);
    }

    /**
     * Child context for an SVG {@code <title>}, expanded as if it were referenced by {@code aria-labelledby}.
     */
    NameContext forSvgTitleChild() {
        NameContext child = forChild();
        return new NameContext(includeHidden, visited, Embedding.SELF, child.label, child.textAlternative,
                child.target);
    }

    boolean isVisited(DomElement element) {
        return visited.contains(element);
    }

    void markVisited(DomElement element) {
        visited.add(element);
    }

    boolean isInsideLabelOrLabelledBy() {
        return label != Embedding.NONE || labelledBy != Embedding.NONE;
    }
}
