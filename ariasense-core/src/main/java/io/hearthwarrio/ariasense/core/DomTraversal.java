package io.hearthwarrio.ariasense.core;

import io.hearthwarrio.ariasense.core.dom.DomElement;
import io.hearthwarrio.ariasense.core.dom.DomNode;
import io.hearthwarrio.ariasense.core.dom.DomScope;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Tree helpers shared by the resolvers.
 */
final class DomTraversal {

    private DomTraversal() {
    }

    static boolean isTag(DomElement e, String tag) {
        return e != null && tag.equals(e.getTagName());
    }

    static String attr(DomElement e, String name) {
        String v = e.getAttribute(name);
        return v == null ? "" : v;
    }

    static String lower(String v) {
        return v == null ? "" : v.toLowerCase(Locale.ROOT);
    }

    /**
     * Closest inclusive ancestor matching the predicate, climbing across shadow boundaries.
     */
    static DomElement closestCrossShadow(DomElement element, Predicate<DomElement> predicate) {
        for (DomElement e = element; e != null; e = e.getParentElementOrShadowHost()) {
            if (predicate.test(e)) {
                return e;
            }
        }
        return null;
    }

    /**
     * Closest inclusive ancestor matching the predicate within the same light tree.
     */
    static DomElement closest(DomElement element, Predicate<DomElement> predicate) {
        for (DomElement e = element; e != null; e = e.getParentElement()) {
            if (predicate.test(e)) {
                return e;
            }
        }
        return null;
    }

    /**
     * Resolves a whitespace-separated id list in the element's scope.
     * <p>
     * Repeated ids and ids resolving to an already collected element are dropped, keeping the first occurrence.
     * A scope that cannot query an id yields an empty result.
     *
     * @param element referencing element
     * @param ref     raw attribute value (may be null)
     * @return referenced elements in list order
     */
    static List<DomElement> getIdRefs(DomElement element, String ref) {
        if (ref == null || ref.isEmpty()) {
            return List.of();
        }
        DomScope scope = element.getEnclosingScope();
        if (scope == null) {
            return List.of();
        }
        try {
            Set<DomElement> out = new LinkedHashSet<>();
            for (String id : ref.split(" ")) {
                if (id.isEmpty()) {
                    continue;
                }
                DomElement found = scope.getElementById(id);
                if (found != null) {
                    out.add(found);
                }
            }
            return new ArrayList<>(out);
        } catch (RuntimeException e) {
            return List.of();
        }
    }

    /**
     * Light-tree descendants in document order (the element itself excluded).
     */
    static List<DomElement> descendants(DomElement element) {
        List<DomElement> out = new ArrayList<>();
        collectDescendants(element, out);
        return out;
    }

    private static void collectDescendants(DomElement element, List<DomElement> out) {
        for (DomNode child : element.getChildNodes()) {
            if (child instanceof DomElement) {
                DomElement e = (DomElement) child;
                out.add(e);
                collectDescendants(e, out);
            }
        }
    }

    /**
     * Descendants plus {@code aria-owns} targets and their descendants.
     */
    static List<DomElement> descendantsIncludingOwned(DomElement element) {
        List<DomElement> out = descendants(element);
        for (DomElement owned : getIdRefs(element, element.getAttribute("aria-owns"))) {
            out.add(owned);
            out.addAll(descendants(owned));
        }
        return out;
    }
}
