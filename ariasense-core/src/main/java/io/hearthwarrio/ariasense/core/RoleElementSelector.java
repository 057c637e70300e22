package io.hearthwarrio.ariasense.core;

import io.hearthwarrio.ariasense.core.dom.DomElement;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Default selector: filters candidates by role, hidden state, accessible name and state filters.
 * <p>
 * All candidates are evaluated within one cache pass, so shared ancestors and referenced labels are resolved
 * once per call.
 */
public class RoleElementSelector implements ElementSelector {

    private final AriaEngine engine;

    public RoleElementSelector() {
        this(new AriaEngine());
    }

    public RoleElementSelector(AriaEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    public AriaEngine getEngine() {
        return engine;
    }

    @Override
    public List<ElementMatch> selectAll(RoleQuery query, List<? extends DomElement> candidates) {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(candidates, "candidates must not be null");

        List<ElementMatch> out = new ArrayList<>();
        try (AriaCache.Pass ignored = engine.openPass()) {
            for (DomElement c : candidates) {
                if (c == null) {
                    continue;
                }
                ElementMatch m = matchOrNull(query, c);
                if (m != null) {
                    out.add(m);
                }
            }
        }
        return out;
    }

    @Override
    public ElementMatch selectOne(RoleQuery query, List<? extends DomElement> candidates) {
        List<ElementMatch> matches = selectAll(query, candidates);
        if (matches.isEmpty()) {
            throw new ElementSelectionException(
                    "No element matches " + query + " (" + candidates.size() + " candidates)"
            );
        }
        if (matches.size() > 1) {
            throw new ElementSelectionException(
                    "Ambiguous match for " + query + ": " + matches.size() + " elements match. First="
                            + matches.get(0) + ", Second=" + matches.get(1)
            );
        }
        return matches.get(0);
    }

    private ElementMatch matchOrNull(RoleQuery query, DomElement element) {
        if (engine.getRole(element) != query.getRole()) {
            return null;
        }
        if (!query.isIncludeHidden() && engine.isHiddenForAria(element)) {
            return null;
        }
        if (!matchesStates(query, element)) {
            return null;
        }

        String name = engine.getAccessibleName(element, query.isIncludeHidden());
        if (!query.matchesName(name)) {
            return null;
        }
        return new ElementMatch(query, element, name);
    }

    private boolean matchesStates(RoleQuery query, DomElement element) {
        if (query.getChecked() != null && engine.getAriaChecked(element) != query.getChecked()) {
            return false;
        }
        if (query.getPressed() != null && engine.getPressed(element) != query.getPressed()) {
            return false;
        }
        if (query.getSelected() != null && engine.getSelected(element) != query.getSelected()) {
            return false;
        }
        if (query.getExpanded() != null) {
            // an element without aria-expanded is neither expanded nor collapsed
            ExpandedState expected = query.getExpanded() ? ExpandedState.EXPANDED : ExpandedState.COLLAPSED;
            if (engine.getExpanded(element) != expected) {
                return false;
            }
        }
        if (query.getLevel() != null && engine.getLevel(element) != query.getLevel()) {
            return false;
        }
        return query.getDisabled() == null || engine.getDisabled(element) == query.getDisabled();
    }
}
