package io.hearthwarrio.ariasense.core;

import io.hearthwarrio.ariasense.core.dom.ComputedStyle;
import io.hearthwarrio.ariasense.core.dom.DomElement;
import io.hearthwarrio.ariasense.core.dom.DomNode;
import io.hearthwarrio.ariasense.core.dom.DomText;

import java.util.Objects;
import java.util.Set;

import static io.hearthwarrio.ariasense.core.DomTraversal.closest;
import static io.hearthwarrio.ariasense.core.DomTraversal.isTag;

/**
 * Decides whether an element is excluded from the accessibility tree.
 * <p>
 * Covers the tree exclusion rules of WAI-ARIA (including {@code none}/{@code presentation} subtrees being kept):
 * non-rendered metadata elements, {@code display: contents} transparency, {@code visibility},
 * {@code content-visibility}, {@code display: none}, {@code aria-hidden="true"} and light children of a shadow host
 * that are not assigned to any slot.
 */
public class VisibilityClassifier {

    private static final Set<String> NEVER_RENDERED_TAGS = Set.of("STYLE", "SCRIPT", "NOSCRIPT", "TEMPLATE");

    private final AriaCache cache;

    public VisibilityClassifier(AriaCache cache) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
    }

    /**
     * @param element element to classify
     * @return true if assistive technology would not see the element
     */
    public boolean isHiddenForAria(DomElement element) {
        if (NEVER_RENDERED_TAGS.contains(element.getTagName())) {
            return true;
        }
        ComputedStyle style = element.getComputedStyle();
        boolean isSlot = isTag(element, "SLOT");
        if (style != null && "contents".equals(style.getDisplay()) && !isSlot) {
            // not rendered itself, but its children are
            for (DomNode child : element.getChildNodes()) {
                if (child instanceof DomElement && !isHiddenForAria((DomElement) child)) {
                    return false;
                }
                if (child instanceof DomText && isVisibleText((DomText) child)) {
                    return false;
                }
            }
            return true;
        }
        // options inside a select and slots ignore visibility and content-visibility
        boolean isOptionInsideSelect = isTag(element, "OPTION") && closest(element, e -> isTag(e, "SELECT")) != null;
        if (!isOptionInsideSelect && !isSlot && !isStyleVisibilityVisible(element, style)) {
            return true;
        }
        return belongsToDisplayNoneOrAriaHiddenOrNonSlotted(element);
    }

    private static boolean isVisibleText(DomText text) {
        return text.isVisible() && !text.getText().isEmpty();
    }

    /**
     * {@code visibility} of the element itself, plus {@code content-visibility: hidden} on any ancestor
     * (the property hides descendants, not the element that carries it).
     */
    static boolean isStyleVisibilityVisible(DomElement element, ComputedStyle style) {
        if (style == null) {
            return true;
        }
        for (DomElement a = element.getParentElementOrShadowHost(); a != null; a = a.getParentElementOrShadowHost()) {
            ComputedStyle s = a.getComputedStyle();
            if (s != null && "hidden".equals(s.getContentVisibility())) {
                return false;
            }
        }
        return "visible".equals(style.getVisibility());
    }

    private boolean belongsToDisplayNoneOrAriaHiddenOrNonSlotted(DomElement element) {
        Boolean cached = cache.getHidden(element);
        if (cached != null) {
            return cached;
        }

        boolean hidden = false;

        // light children of a shadow host are rendered only through a slot
        DomElement parentElement = element.getParentElement();
        if (parentElement != null && parentElement.hasShadowRoot() && element.getAssignedSlot() == null) {
            hidden = true;
        }

        if (!hidden) {
            ComputedStyle style = element.getComputedStyle();
            hidden = style == null
                    || "none".equals(style.getDisplay())
                    || isAriaTrue(element.getAttribute("aria-hidden"));
        }

        if (!hidden) {
            DomElement parent = element.getParentElementOrShadowHost();
            if (parent != null) {
                hidden = belongsToDisplayNoneOrAriaHiddenOrNonSlotted(parent);
            }
        }

        cache.putHidden(element, hidden);
        return hidden;
    }

    static boolean isAriaTrue(String value) {
        return value != null && "true".equalsIgnoreCase(value);
    }
}
