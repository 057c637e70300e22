package io.hearthwarrio.ariasense.core;

import io.hearthwarrio.ariasense.core.dom.DomElement;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

import static io.hearthwarrio.ariasense.core.DomTraversal.closestCrossShadow;
import static io.hearthwarrio.ariasense.core.DomTraversal.getIdRefs;
import static io.hearthwarrio.ariasense.core.DomTraversal.isTag;
import static io.hearthwarrio.ariasense.core.DomTraversal.lower;

/**
 * Computes explicit and implicit ARIA roles.
 * <p>
 * Implicit roles follow the HTML-AAM element mappings. Presentation roles are inherited by required-owned
 * children (list items, table parts, description list parts) unless a global ARIA attribute cancels them.
 * Focusability is not taken into account for presentation conflict resolution.
 */
public class RoleResolver {

    /**
     * Global states and properties; any of them cancels a {@code none}/{@code presentation} override.
     */
    static final List<String> GLOBAL_ARIA_ATTRIBUTES = List.of(
            "aria-atomic",
            "aria-busy",
            "aria-controls",
            "aria-current",
            "aria-describedby",
            "aria-details",
            "aria-disabled",
            "aria-dropeffect",
            "aria-errormessage",
            "aria-flowto",
            "aria-grabbed",
            "aria-haspopup",
            "aria-hidden",
            "aria-invalid",
            "aria-keyshortcuts",
            "aria-label",
            "aria-labelledby",
            "aria-live",
            "aria-owns",
            "aria-relevant",
            "aria-roledescription"
    );

    private static final Set<String> LANDMARK_PREVENTING_TAGS = Set.of("ARTICLE", "ASIDE", "MAIN", "NAV", "SECTION");

    private static final Set<AriaRole> LANDMARK_PREVENTING_ROLES = Set.of(
            AriaRole.ARTICLE, AriaRole.COMPLEMENTARY, AriaRole.MAIN, AriaRole.NAVIGATION, AriaRole.REGION
    );

    private static final Pattern PREFIXED_INTEGER = Pattern.compile("0([xX][0-9a-fA-F]+|[oO][0-7]+|[bB][01]+)");

    private static final Set<String> TEXT_INPUT_TYPES = Set.of("email", "tel", "text", "url", "");

    private static final Map<String, AriaRole> INPUT_ROLES = Map.of(
            "button", AriaRole.BUTTON,
            "checkbox", AriaRole.CHECKBOX,
            "image", AriaRole.BUTTON,
            "number", AriaRole.SPINBUTTON,
            "radio", AriaRole.RADIO,
            "range", AriaRole.SLIDER,
            "reset", AriaRole.BUTTON,
            "submit", AriaRole.BUTTON
    );

    private static final Map<String, Function<DomElement, AriaRole>> IMPLICIT_ROLES = buildImplicitRoles();

    private static final Map<String, Set<String>> PRESENTATION_INHERITANCE_PARENTS = Map.of(
            "DD", Set.of("DL", "DIV"),
            "DIV", Set.of("DL"),
            "DT", Set.of("DL", "DIV"),
            "LI", Set.of("OL", "UL"),
            "TBODY", Set.of("TABLE"),
            "TD", Set.of("TR"),
            "TFOOT", Set.of("TABLE"),
            "TH", Set.of("TR"),
            "THEAD", Set.of("TABLE"),
            "TR", Set.of("THEAD", "TBODY", "TFOOT", "TABLE")
    );

    private final AriaCache cache;

    public RoleResolver(AriaCache cache) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
    }

    /**
     * Returns the role of the element, or null when neither an explicit nor an implicit role applies.
     *
     * @param element element
     * @return role or null
     */
    public AriaRole getRole(DomElement element) {
        AriaCache.Holder cached = cache.getRole(element);
        if (cached != null) {
            return cached.role;
        }
        AriaRole role = computeRole(element);
        cache.putRole(element, role);
        return role;
    }

    private AriaRole computeRole(DomElement element) {
        AriaRole explicitRole = getExplicitRole(element);
        if (explicitRole == null) {
            return getImplicitRole(element);
        }
        if (explicitRole.isPresentational() && hasPresentationConflictResolution(element)) {
            return getImplicitRole(element);
        }
        return explicitRole;
    }

    /**
     * First valid concrete role token of the {@code role} attribute.
     *
     * @param element element
     * @return explicit role or null
     */
    public static AriaRole getExplicitRole(DomElement element) {
        String raw = element.getAttribute("role");
        if (raw == null) {
            return null;
        }
        for (String token : raw.split(" ")) {
            AriaRole role = AriaRole.fromName(token.trim());
            if (role != null) {
                return role;
            }
        }
        return null;
    }

    static boolean hasGlobalAriaAttribute(DomElement element) {
        for (String a : GLOBAL_ARIA_ATTRIBUTES) {
            if (element.hasAttribute(a)) {
                return true;
            }
        }
        return false;
    }

    /**
     * A global ARIA attribute on a none/presentation element is a conflict; it is resolved by ignoring the
     * presentation role.
     */
    // TODO: focusable elements are a conflict as well; needs a tabindex/focusability oracle on DomElement.
    private static boolean hasPresentationConflictResolution(DomElement element) {
        return hasGlobalAriaAttribute(element);
    }

    private AriaRole getImplicitRole(DomElement element) {
        Function<DomElement, AriaRole> mapping = IMPLICIT_ROLES.get(element.getTagName());
        AriaRole implicitRole = mapping == null ? null : mapping.apply(element);
        if (implicitRole == null) {
            return null;
        }

        DomElement ancestor = element;
        while (ancestor != null) {
            DomElement parent = ancestor.getParentElementOrShadowHost();
            Set<String> parents = PRESENTATION_INHERITANCE_PARENTS.get(ancestor.getTagName());
            if (parents == null || parent == null || !parents.contains(parent.getTagName())) {
                break;
            }
            AriaRole parentExplicitRole = getExplicitRole(parent);
            if (parentExplicitRole != null && parentExplicitRole.isPresentational()
                    && !hasPresentationConflictResolution(parent)) {
                return parentExplicitRole;
            }
            ancestor = parent;
        }
        return implicitRole;
    }

    private static boolean hasExplicitAccessibleName(DomElement e) {
        return e.hasAttribute("aria-label") || e.hasAttribute("aria-labelledby");
    }

    private static boolean preventsLandmark(DomElement e) {
        if (LANDMARK_PREVENTING_TAGS.contains(e.getTagName()) && !e.hasAttribute("role")) {
            return true;
        }
        // [role=...] is an exact attribute match, not the resolved explicit role
        AriaRole role = AriaRole.fromName(e.getAttribute("role"));
        return role != null && LANDMARK_PREVENTING_ROLES.contains(role);
    }

    private static AriaRole landmarkUnlessNested(DomElement e, AriaRole role) {
        return closestCrossShadow(e, RoleResolver::preventsLandmark) != null ? null : role;
    }

    private static AriaRole cellRole(DomElement e) {
        DomElement table = closestCrossShadow(e, t -> isTag(t, "TABLE"));
        AriaRole tableRole = table == null ? null : getExplicitRole(table);
        return (tableRole == AriaRole.GRID || tableRole == AriaRole.TREEGRID) ? AriaRole.GRIDCELL : AriaRole.CELL;
    }

    private static boolean isNumeric(String s) {
        if (s == null) {
            return false;
        }
        String t = s.trim();
        if (t.isEmpty()) {
            // Number("") is 0
            return true;
        }
        if (PREFIXED_INTEGER.matcher(t).matches()) {
            return true;
        }
        try {
            double v = Double.parseDouble(t);
            return !Double.isNaN(v) && !t.endsWith("d") && !t.endsWith("D") && !t.endsWith("f") && !t.endsWith("F");
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static AriaRole inputRole(DomElement e) {
        String type = lower(e.getInputType());
        if ("search".equals(type)) {
            return e.hasAttribute("list") ? AriaRole.COMBOBOX : AriaRole.SEARCHBOX;
        }
        if (TEXT_INPUT_TYPES.contains(type)) {
            List<DomElement> lists = getIdRefs(e, e.getAttribute("list"));
            DomElement list = lists.isEmpty() ? null : lists.get(0);
            return isTag(list, "DATALIST") ? AriaRole.COMBOBOX : AriaRole.TEXTBOX;
        }
        if ("hidden".equals(type)) {
            return null;
        }
        AriaRole role = INPUT_ROLES.get(type);
        return role == null ? AriaRole.TEXTBOX : role;
    }

    private static Map<String, Function<DomElement, AriaRole>> buildImplicitRoles() {
        Map<String, Function<DomElement, AriaRole>> m = new HashMap<>();

        m.put("A", e -> e.hasAttribute("href") ? AriaRole.LINK : null);
        m.put("AREA", e -> e.hasAttribute("href") ? AriaRole.LINK : null);
        m.put("ARTICLE", e -> AriaRole.ARTICLE);
        m.put("ASIDE", e -> AriaRole.COMPLEMENTARY);
        m.put("BLOCKQUOTE", e -> AriaRole.BLOCKQUOTE);
        m.put("BUTTON", e -> AriaRole.BUTTON);
        m.put("CAPTION", e -> AriaRole.CAPTION);
        m.put("CODE", e -> AriaRole.CODE);
        m.put("DATALIST", e -> AriaRole.LISTBOX);
        m.put("DD", e -> AriaRole.DEFINITION);
        m.put("DEL", e -> AriaRole.DELETION);
        m.put("DETAILS", e -> AriaRole.GROUP);
        m.put("DFN", e -> AriaRole.TERM);
        m.put("DIALOG", e -> AriaRole.DIALOG);
        m.put("DT", e -> AriaRole.TERM);
        m.put("EM", e -> AriaRole.EMPHASIS);
        m.put("FIELDSET", e -> AriaRole.GROUP);
        m.put("FIGURE", e -> AriaRole.FIGURE);
        m.put("FOOTER", e -> landmarkUnlessNested(e, AriaRole.CONTENTINFO));
        m.put("FORM", e -> hasExplicitAccessibleName(e) ? AriaRole.FORM : null);
        for (int level = 1; level <= 6; level++) {
            m.put("H" + level, e -> AriaRole.HEADING);
        }
        m.put("HEADER", e -> landmarkUnlessNested(e, AriaRole.BANNER));
        m.put("HR", e -> AriaRole.SEPARATOR);
        m.put("HTML", e -> AriaRole.DOCUMENT);
        m.put("IMG", e -> "".equals(e.getAttribute("alt")) && !hasGlobalAriaAttribute(e)
                && !isNumeric(String.valueOf(e.getAttribute("tabindex")))
                ? AriaRole.PRESENTATION : AriaRole.IMG);
        m.put("INPUT", RoleResolver::inputRole);
        m.put("INS", e -> AriaRole.INSERTION);
        m.put("LI", e -> AriaRole.LISTITEM);
        m.put("MAIN", e -> AriaRole.MAIN);
        m.put("MARK", e -> AriaRole.MARK);
        m.put("MATH", e -> AriaRole.MATH);
        m.put("MENU", e -> AriaRole.LIST);
        m.put("METER", e -> AriaRole.METER);
        m.put("NAV", e -> AriaRole.NAVIGATION);
        m.put("OL", e -> AriaRole.LIST);
        m.put("OPTGROUP", e -> AriaRole.GROUP);
        m.put("OPTION", e -> AriaRole.OPTION);
        m.put("OUTPUT", e -> AriaRole.STATUS);
        m.put("P", e -> AriaRole.PARAGRAPH);
        m.put("PROGRESS", e -> AriaRole.PROGRESSBAR);
        m.put("SECTION", e -> hasExplicitAccessibleName(e) ? AriaRole.REGION : null);
        m.put("SELECT", e -> e.hasAttribute("multiple") || e.getSize() > 1 ? AriaRole.LISTBOX : AriaRole.COMBOBOX);
        m.put("STRONG", e -> AriaRole.STRONG);
        m.put("SUB", e -> AriaRole.SUBSCRIPT);
        m.put("SUP", e -> AriaRole.SUPERSCRIPT);
        // Chrome reports img for <svg>
        m.put("SVG", e -> AriaRole.IMG);
        m.put("TABLE", e -> AriaRole.TABLE);
        m.put("TBODY", e -> AriaRole.ROWGROUP);
        m.put("TD", RoleResolver::cellRole);
        m.put("TEXTAREA", e -> AriaRole.TEXTBOX);
        m.put("TFOOT", e -> AriaRole.ROWGROUP);
        m.put("TH", e -> {
            if ("col".equals(e.getAttribute("scope"))) {
                return AriaRole.COLUMNHEADER;
            }
            if ("row".equals(e.getAttribute("scope"))) {
                return AriaRole.ROWHEADER;
            }
            return cellRole(e);
        });
        m.put("THEAD", e -> AriaRole.ROWGROUP);
        m.put("TIME", e -> AriaRole.TIME);
        m.put("TR", e -> AriaRole.ROW);
        m.put("UL", e -> AriaRole.LIST);

        return Collections.unmodifiableMap(m);
    }
}
