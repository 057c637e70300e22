package io.hearthwarrio.ariasense.core;

import io.hearthwarrio.ariasense.core.dom.DomElement;

import java.util.Objects;

/**
 * Entry point of the accessibility engine for one document snapshot.
 * <p>
 * All components share the engine's {@link AriaCache}. Bracket a batch of calls that belong to one logical snapshot
 * with {@link AriaCache#open()} (or {@link #openPass()}) so that repeated lookups are memoized:
 * <pre>{@code
 * AriaEngine engine = new AriaEngine();
 * try (AriaCache.Pass pass = engine.openPass()) {
 *     AriaRole role = engine.getRole(element);
 *     String name = engine.getAccessibleName(element, false);
 * }
 * }</pre>
 * Calls made outside of a pass are correct, just not memoized.
 * <p>
 * This class is not thread-safe. Use one engine per document snapshot.
 */
public class AriaEngine {

    private final AriaCache cache;
    private final RoleResolver roles;
    private final VisibilityClassifier visibility;
    private final AccessibleNameComputer names;
    private final AriaStates states;

    public AriaEngine() {
        this(new AriaCache());
    }

    public AriaEngine(AriaCache cache) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.roles = new RoleResolver(cache);
        this.visibility = new VisibilityClassifier(cache);
        this.names = new AccessibleNameComputer(cache, roles, visibility);
        this.states = new AriaStates(roles);
    }

    public AriaCache cache() {
        return cache;
    }

    /**
     * Shortcut for {@code cache().open()}.
     */
    public AriaCache.Pass openPass() {
        return cache.open();
    }

    public AriaRole getRole(DomElement element) {
        return roles.getRole(Objects.requireNonNull(element, "element must not be null"));
    }

    public String getAccessibleName(DomElement element, boolean includeHidden) {
        return names.getAccessibleName(Objects.requireNonNull(element, "element must not be null"), includeHidden);
    }

    public boolean isHiddenForAria(DomElement element) {
        return visibility.isHiddenForAria(Objects.requireNonNull(element, "element must not be null"));
    }

    public boolean getSelected(DomElement element) {
        return states.getSelected(element);
    }

    public CheckedState getChecked(DomElement element, boolean allowMixed) {
        return states.getChecked(element, allowMixed);
    }

    public CheckedState getAriaChecked(DomElement element) {
        return states.getAriaChecked(element);
    }

    public PressedState getPressed(DomElement element) {
        return states.getPressed(element);
    }

    public ExpandedState getExpanded(DomElement element) {
        return states.getExpanded(element);
    }

    public int getLevel(DomElement element) {
        return states.getLevel(element);
    }

    public boolean getDisabled(DomElement element) {
        return states.getDisabled(element);
    }

    /**
     * Computes role, name (hidden content excluded) and all states of the element within one pass.
     *
     * @param element element
     * @return description
     */
    public ElementDescription describe(DomElement element) {
        Objects.requireNonNull(element, "element must not be null");
        try (AriaCache.Pass ignored = cache.open()) {
            return new ElementDescription(
                    roles.getRole(element),
                    names.getAccessibleName(element, false),
                    visibility.isHiddenForAria(element),
                    states.getSelected(element),
                    states.getAriaChecked(element),
                    states.getPressed(element),
                    states.getExpanded(element),
                    states.getLevel(element),
                    states.getDisabled(element)
            );
        }
    }
}
