package io.hearthwarrio.ariasense.core;

import io.hearthwarrio.ariasense.core.dom.DomElement;

import java.util.List;

/**
 * Selects the elements matching a {@link RoleQuery} from a list of candidates.
 */
public interface ElementSelector {

    /**
     * Select all matching elements.
     *
     * @param query      role query
     * @param candidates candidate elements in document order (must not be null)
     * @return matches in candidate order; may be empty
     */
    List<ElementMatch> selectAll(RoleQuery query, List<? extends DomElement> candidates);

    /**
     * Select the single matching element.
     *
     * @param query      role query
     * @param candidates candidate elements in document order (must not be null)
     * @return the match
     * @throws ElementSelectionException if nothing matches or the result is ambiguous
     */
    ElementMatch selectOne(RoleQuery query, List<? extends DomElement> candidates);
}
