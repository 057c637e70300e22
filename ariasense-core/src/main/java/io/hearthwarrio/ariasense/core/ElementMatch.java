package io.hearthwarrio.ariasense.core;

import io.hearthwarrio.ariasense.core.dom.DomElement;

/**
 * Element matched by a {@link RoleQuery}, with the accessible name it was matched by.
 */
public final class ElementMatch {

    private final RoleQuery query;
    private final DomElement element;
    private final String accessibleName;

    public ElementMatch(RoleQuery query, DomElement element, String accessibleName) {
        this.query = query;
        this.element = element;
        this.accessibleName = accessibleName == null ? "" : accessibleName;
    }

    public RoleQuery getQuery() {
        return query;
    }

    public AriaRole getRole() {
        return query.getRole();
    }

    public DomElement getElement() {
        return element;
    }

    public String getAccessibleName() {
        return accessibleName;
    }

    @Override
    public String toString() {
        return "ElementMatch{" +
                "query=" + query +
                ", accessibleName='" + accessibleName + '\'' +
                ", element=" + element +
                '}';
    }
}
