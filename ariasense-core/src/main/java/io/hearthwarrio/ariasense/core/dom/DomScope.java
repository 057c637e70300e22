package io.hearthwarrio.ariasense.core.dom;

/**
 * Identifier scope: a document or a shadow root.
 */
public interface DomScope {

    /**
     * Looks up the first element in tree order with the given id, without descending into nested shadow roots.
     * <p>
     * Implementations may throw a {@link RuntimeException} for identifiers they cannot query;
     * callers treat that as an unresolved reference.
     *
     * @param id element id
     * @return element or null
     */
    DomElement getElementById(String id);
}
