package io.hearthwarrio.ariasense.core;

import io.hearthwarrio.ariasense.core.dom.ComputedStyle;
import io.hearthwarrio.ariasense.core.dom.DomElement;
import io.hearthwarrio.ariasense.core.dom.DomNode;
import io.hearthwarrio.ariasense.core.dom.DomText;
import io.hearthwarrio.ariasense.core.dom.PseudoElement;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

import static io.hearthwarrio.ariasense.core.DomTraversal.attr;
import static io.hearthwarrio.ariasense.core.DomTraversal.descendantsIncludingOwned;
import static io.hearthwarrio.ariasense.core.DomTraversal.getIdRefs;
import static io.hearthwarrio.ariasense.core.DomTraversal.isTag;

/**
 * Accessible name computation (AccName 1.2) with the deviations rendering engines actually implement.
 * <p>
 * Deviations from the AccName text, all matching Chromium/Firefox:
 * <ul>
 *   <li>{@code aria-labelledby} does not suppress the native name of button-like and image inputs and of images</li>
 *   <li>a table {@code title} is never used; {@code summary} is</li>
 *   <li>children aggregate without separators unless they are not inline, {@code <br>} always adds one</li>
 *   <li>pseudo-element content is padded with spaces when the pseudo-element is not inline</li>
 * </ul>
 */
public class AccessibleNameComputer {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Set<AriaRole> NAMING_PROHIBITED = EnumSet.of(
            AriaRole.CAPTION, AriaRole.CODE, AriaRole.DEFINITION, AriaRole.DELETION, AriaRole.EMPHASIS,
            AriaRole.GENERIC, AriaRole.INSERTION, AriaRole.MARK, AriaRole.PARAGRAPH, AriaRole.PRESENTATION,
            AriaRole.STRONG, AriaRole.SUBSCRIPT, AriaRole.SUPERSCRIPT, AriaRole.TERM, AriaRole.TIME
    );

    private static final Set<AriaRole> NAME_FROM_CONTENT = EnumSet.of(
            AriaRole.BUTTON, AriaRole.CELL, AriaRole.CHECKBOX, AriaRole.COLUMNHEADER, AriaRole.GRIDCELL,
            AriaRole.HEADING, AriaRole.LINK, AriaRole.MENUITEM, AriaRole.MENUITEMCHECKBOX, AriaRole.MENUITEMRADIO,
            AriaRole.OPTION, AriaRole.RADIO, AriaRole.ROW, AriaRole.ROWHEADER, AriaRole.SWITCH, AriaRole.TAB,
            AriaRole.TOOLTIP, AriaRole.TREEITEM
    );

    /**
     * Roles that take their name from content only when they are inside the element being named.
     * Elements without a role belong here as well.
     */
    private static final Set<AriaRole> NAME_FROM_CONTENT_IN_TARGET = EnumSet.of(
            AriaRole.CAPTION, AriaRole.CODE, AriaRole.CONTENTINFO, AriaRole.DEFINITION, AriaRole.DELETION,
            AriaRole.EMPHASIS, AriaRole.INSERTION, AriaRole.LIST, AriaRole.LISTITEM, AriaRole.MARK, AriaRole.NONE,
            AriaRole.PARAGRAPH, AriaRole.PRESENTATION, AriaRole.REGION, AriaRole.ROW, AriaRole.ROWGROUP,
            AriaRole.STRONG, AriaRole.SUBSCRIPT, AriaRole.SUPERSCRIPT, AriaRole.TABLE, AriaRole.TERM, AriaRole.TIME
    );

    private static final Set<AriaRole> RANGE_ROLES = EnumSet.of(
            AriaRole.PROGRESSBAR, AriaRole.SCROLLBAR, AriaRole.SLIDER, AriaRole.SPINBUTTON, AriaRole.METER
    );

    private static final Set<String> BUTTON_INPUT_TYPES = Set.of("button", "submit", "reset");

    private static final Set<String> PLACEHOLDER_INPUT_TYPES = Set.of("text", "password", "search", "tel", "email", "url");

    private final AriaCache cache;
    private final RoleResolver roles;
    private final VisibilityClassifier visibility;

    public AccessibleNameComputer(AriaCache cache, RoleResolver roles, VisibilityClassifier visibility) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.roles = Objects.requireNonNull(roles, "roles must not be null");
        this.visibility = Objects.requireNonNull(visibility, "visibility must not be null");
    }

    /**
     * Computes the normalized accessible name of the element.
     *
     * @param element       element to name
     * @param includeHidden whether hidden content contributes to the name
     * @return normalized name, empty when the element has none
     */
    public String getAccessibleName(DomElement element, boolean includeHidden) {
        String cached = cache.getName(element, includeHidden);
        if (cached != null) {
            return cached;
        }

        String name = "";
        AriaRole role = roles.getRole(element);
        if (role == null || !NAMING_PROHIBITED.contains(role)) {
            name = normalize(compute(element, NameContext.forTarget(includeHidden)));
        }

        cache.putName(element, includeHidden, name);
        return name;
    }

    /**
     * Flat-string normalization: CR and CRLF to LF, NBSP to space, Unicode whitespace runs collapsed, stripped.
     *
     * @param s raw string
     * @return normalized string
     */
    public static String normalize(String s) {
        if (s == null) {
            return "";
        }
        String folded = s.replace("\r\n", "\n")
                .replace('\r', '\n')
                .replace('\u00A0', ' ');
        return WHITESPACE_RUN.matcher(folded).replaceAll(" ").strip();
    }

    private String compute(DomElement element, NameContext ctx) {
        if (ctx.isVisited(element)) {
            return "";
        }

        NameContext childCtx = ctx.forChild();

        if (!ctx.includeHidden && ctx.labelledBy != NameContext.Embedding.SELF && visibility.isHiddenForAria(element)) {
            ctx.markVisited(element);
            return "";
        }

        List<DomElement> labelledBy = element.hasAttribute("aria-labelledby")
                ? getIdRefs(element, element.getAttribute("aria-labelledby"))
                : null;

        if (ctx.labelledBy == NameContext.Embedding.NONE && labelledBy != null) {
            List<String> parts = new ArrayList<>();
            for (DomElement ref : labelledBy) {
                parts.add(compute(ref, ctx.forLabelledByTarget()));
            }
            String name = String.join(" ", parts);
            if (!name.isEmpty()) {
                return name;
            }
        }

        AriaRole role = roles.getRole(element);

        if (ctx.isInsideLabelOrLabelledBy()) {
            boolean isOwnLabel = element.getLabels().contains(element);
            boolean isOwnLabelledBy = labelledBy != null && labelledBy.contains(element);
            if (!isOwnLabel && !isOwnLabelledBy) {
                String embedded = embeddedControlValue(element, role, ctx, childCtx);
                if (embedded != null) {
                    return embedded;
                }
            }
        }

        String ariaLabel = attr(element, "aria-label");
        if (!ariaLabel.isBlank()) {
            ctx.markVisited(element);
            return ariaLabel;
        }

        if (role == null || !role.isPresentational()) {
            String nativeName = nativeName(element, labelledBy != null, ctx);
            if (nativeName != null) {
                return nativeName;
            }
        }

        if (allowsNameFromContent(role, ctx.target == NameContext.Embedding.DESCENDANT)
                || ctx.isInsideLabelOrLabelledBy()
                || ctx.textAlternative) {
            ctx.markVisited(element);
            String name = nameFromContent(element, childCtx);
            if (!name.isBlank()) {
                return name;
            }
        }

        if (role == null || !role.isPresentational() || isTag(element, "IFRAME")) {
            ctx.markVisited(element);
            String title = attr(element, "title");
            if (!title.isBlank()) {
                return title;
            }
        }

        ctx.markVisited(element);
        return "";
    }

    /**
     * Value of a form control embedded into a label or a labelledby expansion, or null when the element is not
     * such a control.
     */
    private String embeddedControlValue(DomElement element, AriaRole role, NameContext ctx, NameContext childCtx) {
        if (role == AriaRole.TEXTBOX) {
            ctx.markVisited(element);
            if (isTag(element, "INPUT") || isTag(element, "TEXTAREA")) {
                return element.getValue();
            }
            return element.getTextContent();
        }
        if (role == AriaRole.COMBOBOX || role == AriaRole.LISTBOX) {
            ctx.markVisited(element);
            List<String> parts = new ArrayList<>();
            for (DomElement option : selectedOptions(element, role)) {
                parts.add(compute(option, childCtx));
            }
            return String.join(" ", parts);
        }
        if (role != null && RANGE_ROLES.contains(role)) {
            ctx.markVisited(element);
            if (element.hasAttribute("aria-valuetext")) {
                return attr(element, "aria-valuetext");
            }
            if (element.hasAttribute("aria-valuenow")) {
                return attr(element, "aria-valuenow");
            }
            return attr(element, "value");
        }
        if (role == AriaRole.MENU) {
            ctx.markVisited(element);
            return "";
        }
        return null;
    }

    private List<DomElement> selectedOptions(DomElement element, AriaRole role) {
        if (isTag(element, "SELECT")) {
            List<DomElement> selected = new ArrayList<>(element.getSelectedOptions());
            List<DomElement> options = element.getOptions();
            if (selected.isEmpty() && !options.isEmpty()) {
                selected.add(options.get(0));
            }
            return selected;
        }

        DomElement listbox = null;
        if (role == AriaRole.COMBOBOX) {
            for (DomElement e : descendantsIncludingOwned(element)) {
                if (roles.getRole(e) == AriaRole.LISTBOX) {
                    listbox = e;
                    break;
                }
            }
        } else {
            listbox = element;
        }
        if (listbox == null) {
            return List.of();
        }

        List<DomElement> out = new ArrayList<>();
        for (DomElement e : descendantsIncludingOwned(listbox)) {
            if ("true".equals(e.getAttribute("aria-selected")) && roles.getRole(e) == AriaRole.OPTION) {
                out.add(e);
            }
        }
        return out;
    }

    /**
     * Host-language rules (HTML-AAM, SVG-AAM). Returns null when no rule applies and the computation falls
     * through to name-from-content.
     */
    private String nativeName(DomElement element, boolean hasLabelledBy, NameContext ctx) {
        String tag = element.getTagName();
        String inputType = "INPUT".equals(tag) ? element.getInputType() : "";

        if ("INPUT".equals(tag) && BUTTON_INPUT_TYPES.contains(inputType)) {
            ctx.markVisited(element);
            String value = element.getValue();
            if (!value.isBlank()) {
                return value;
            }
            if ("submit".equals(inputType)) {
                return "Submit";
            }
            if ("reset".equals(inputType)) {
                return "Reset";
            }
            return attr(element, "title");
        }

        if ("INPUT".equals(tag) && "image".equals(inputType)) {
            ctx.markVisited(element);
            List<DomElement> labels = element.getLabels();
            if (!labels.isEmpty() && ctx.labelledBy == NameContext.Embedding.NONE) {
                return nameFromAssociatedLabels(labels, ctx);
            }
            String alt = attr(element, "alt");
            if (!alt.isBlank()) {
                return alt;
            }
            String title = attr(element, "title");
            if (!title.isBlank()) {
                return title;
            }
            // browsers and axe-core report "Submit", not the localized "Submit Query"
            return "Submit";
        }

        if (!hasLabelledBy && "BUTTON".equals(tag)) {
            ctx.markVisited(element);
            List<DomElement> labels = element.getLabels();
            if (!labels.isEmpty()) {
                return nameFromAssociatedLabels(labels, ctx);
            }
            // continues with name from content
        }

        if (!hasLabelledBy && "OUTPUT".equals(tag)) {
            ctx.markVisited(element);
            List<DomElement> labels = element.getLabels();
            if (!labels.isEmpty()) {
                return nameFromAssociatedLabels(labels, ctx);
            }
            return attr(element, "title");
        }

        if (!hasLabelledBy && ("TEXTAREA".equals(tag) || "SELECT".equals(tag) || "INPUT".equals(tag))) {
            ctx.markVisited(element);
            List<DomElement> labels = element.getLabels();
            if (!labels.isEmpty()) {
                return nameFromAssociatedLabels(labels, ctx);
            }
            boolean usePlaceholder = ("INPUT".equals(tag) && PLACEHOLDER_INPUT_TYPES.contains(inputType))
                    || "TEXTAREA".equals(tag);
            String title = attr(element, "title");
            if (!usePlaceholder || !title.isEmpty()) {
                return title;
            }
            return attr(element, "placeholder");
        }

        if (!hasLabelledBy && "FIELDSET".equals(tag)) {
            return firstChildTextAlternative(element, "LEGEND", ctx);
        }

        if (!hasLabelledBy && "FIGURE".equals(tag)) {
            return firstChildTextAlternative(element, "FIGCAPTION", ctx);
        }

        if ("IMG".equals(tag)) {
            ctx.markVisited(element);
            String alt = attr(element, "alt");
            if (!alt.isBlank()) {
                return alt;
            }
            return attr(element, "title");
        }

        if ("TABLE".equals(tag)) {
            ctx.markVisited(element);
            for (DomElement child : element.getChildElements()) {
                if (isTag(child, "CAPTION")) {
                    return compute(child, ctx.forTextAlternativeChild());
                }
            }
            String summary = attr(element, "summary");
            if (!summary.isEmpty()) {
                return summary;
            }
            // title is deliberately ignored for tables
        }

        if ("AREA".equals(tag)) {
            ctx.markVisited(element);
            String alt = attr(element, "alt");
            if (!alt.isBlank()) {
                return alt;
            }
            return attr(element, "title");
        }

        if ("SVG".equals(tag) || element.isInSvg()) {
            ctx.markVisited(element);
            for (DomElement child : element.getChildElements()) {
                if (isTag(child, "TITLE") && child.isInSvg()) {
                    return compute(child, ctx.forSvgTitleChild());
                }
            }
        }
        if (element.isInSvg() && "A".equals(tag)) {
            String title = attr(element, "xlink:title");
            if (!title.isBlank()) {
                ctx.markVisited(element);
                return title;
            }
        }

        return null;
    }

    private String firstChildTextAlternative(DomElement element, String childTag, NameContext ctx) {
        ctx.markVisited(element);
        for (DomElement child : element.getChildElements()) {
            if (isTag(child, childTag)) {
                return compute(child, ctx.forTextAlternativeChild());
            }
        }
        return attr(element, "title");
    }

    private String nameFromAssociatedLabels(List<DomElement> labels, NameContext ctx) {
        List<String> parts = new ArrayList<>();
        for (DomElement label : labels) {
            String name = compute(label, ctx.forLabel());
            if (!name.isEmpty()) {
                parts.add(name);
            }
        }
        return String.join(" ", parts);
    }

    private static boolean allowsNameFromContent(AriaRole role, boolean targetDescendant) {
        if (role != null && NAME_FROM_CONTENT.contains(role)) {
            return true;
        }
        return targetDescendant && (role == null || NAME_FROM_CONTENT_IN_TARGET.contains(role));
    }

    private String nameFromContent(DomElement element, NameContext childCtx) {
        StringBuilder sb = new StringBuilder();
        sb.append(pseudoContent(element.getPseudoStyle(PseudoElement.BEFORE)));

        List<DomNode> assigned = isTag(element, "SLOT") ? element.getAssignedNodes() : List.of();
        if (!assigned.isEmpty()) {
            for (DomNode child : assigned) {
                appendChild(sb, child, false, childCtx);
            }
        } else {
            for (DomNode child : element.getChildNodes()) {
                appendChild(sb, child, true, childCtx);
            }
            if (element.hasShadowRoot()) {
                for (DomNode child : element.getShadowRootChildNodes()) {
                    appendChild(sb, child, true, childCtx);
                }
            }
            for (DomElement owned : getIdRefs(element, element.getAttribute("aria-owns"))) {
                appendChild(sb, owned, true, childCtx);
            }
        }

        sb.append(pseudoContent(element.getPseudoStyle(PseudoElement.AFTER)));
        return sb.toString();
    }

    private void appendChild(StringBuilder sb, DomNode node, boolean skipSlotted, NameContext childCtx) {
        if (skipSlotted && node.getAssignedSlot() != null) {
            return;
        }
        if (node instanceof DomElement) {
            DomElement child = (DomElement) node;
            ComputedStyle style = child.getComputedStyle();
            String display = style == null ? "inline" : style.getDisplay();
            String token = compute(child, childCtx);
            // inline children join without a separator; <br> always separates
            if (!"inline".equals(display) || isTag(child, "BR")) {
                token = ' ' + token + ' ';
            }
            sb.append(token);
        } else if (node instanceof DomText) {
            sb.append(((DomText) node).getText());
        }
    }

    private static String pseudoContent(ComputedStyle pseudoStyle) {
        if (pseudoStyle == null) {
            return "";
        }
        String content = pseudoStyle.getContent();
        if (content.length() >= 2 && isQuoted(content)) {
            String unquoted = content.substring(1, content.length() - 1);
            if (!"inline".equals(pseudoStyle.getDisplay())) {
                return ' ' + unquoted + ' ';
            }
            return unquoted;
        }
        return "";
    }

    private static boolean isQuoted(String content) {
        char first = content.charAt(0);
        char last = content.charAt(content.length() - 1);
        return (first == '\'' && last == '\'') || (first == '"' && last == '"');
    }
}
