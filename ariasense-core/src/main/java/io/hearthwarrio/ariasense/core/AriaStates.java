package io.hearthwarrio.ariasense.core;

import io.hearthwarrio.ariasense.core.dom.DomElement;

import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

import static io.hearthwarrio.ariasense.core.DomTraversal.isTag;
import static io.hearthwarrio.ariasense.core.DomTraversal.lower;

/**
 * State and property extractors: selected, checked, pressed, expanded, level and disabled.
 * <p>
 * Native HTML state wins where HTML-AAM maps it; otherwise the ARIA attribute is read, but only for roles that
 * support it.
 */
public class AriaStates {

    // plain decimal literal as Number() reads it; Java's d/f suffixes and hex are not levels
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    public static final Set<AriaRole> SELECTED_ROLES = EnumSet.of(
            AriaRole.GRIDCELL, AriaRole.OPTION, AriaRole.ROW, AriaRole.TAB, AriaRole.ROWHEADER,
            AriaRole.COLUMNHEADER, AriaRole.TREEITEM
    );

    public static final Set<AriaRole> CHECKED_ROLES = EnumSet.of(
            AriaRole.CHECKBOX, AriaRole.MENUITEMCHECKBOX, AriaRole.OPTION, AriaRole.RADIO, AriaRole.SWITCH,
            AriaRole.MENUITEMRADIO, AriaRole.TREEITEM
    );

    public static final Set<AriaRole> PRESSED_ROLES = EnumSet.of(AriaRole.BUTTON);

    public static final Set<AriaRole> EXPANDED_ROLES = EnumSet.of(
            AriaRole.APPLICATION, AriaRole.BUTTON, AriaRole.CHECKBOX, AriaRole.COMBOBOX, AriaRole.GRIDCELL,
            AriaRole.LINK, AriaRole.LISTBOX, AriaRole.MENUITEM, AriaRole.ROW, AriaRole.ROWHEADER, AriaRole.TAB,
            AriaRole.TREEITEM, AriaRole.COLUMNHEADER, AriaRole.MENUITEMCHECKBOX, AriaRole.MENUITEMRADIO,
            AriaRole.SWITCH
    );

    public static final Set<AriaRole> LEVEL_ROLES = EnumSet.of(
            AriaRole.HEADING, AriaRole.LISTITEM, AriaRole.ROW, AriaRole.TREEITEM
    );

    /**
     * Abstract roles in this list never match, since they are not valid explicit roles; they are kept so the list
     * reads like the WAI-ARIA table it comes from.
     */
    public static final Set<AriaRole> DISABLED_ROLES = EnumSet.of(
            AriaRole.APPLICATION, AriaRole.BUTTON, AriaRole.COMPOSITE, AriaRole.GRIDCELL, AriaRole.GROUP,
            AriaRole.INPUT, AriaRole.LINK, AriaRole.MENUITEM, AriaRole.SCROLLBAR, AriaRole.SEPARATOR, AriaRole.TAB,
            AriaRole.CHECKBOX, AriaRole.COLUMNHEADER, AriaRole.COMBOBOX, AriaRole.GRID, AriaRole.LISTBOX,
            AriaRole.MENU, AriaRole.MENUBAR, AriaRole.MENUITEMCHECKBOX, AriaRole.MENUITEMRADIO, AriaRole.OPTION,
            AriaRole.RADIO, AriaRole.RADIOGROUP, AriaRole.ROW, AriaRole.ROWHEADER, AriaRole.SEARCHBOX,
            AriaRole.SELECT, AriaRole.SLIDER, AriaRole.SPINBUTTON, AriaRole.SWITCH, AriaRole.TABLIST,
            AriaRole.TEXTBOX, AriaRole.TOOLBAR, AriaRole.TREE, AriaRole.TREEGRID, AriaRole.TREEITEM
    );

    private static final Set<String> NATIVE_FORM_CONTROLS = Set.of(
            "BUTTON", "INPUT", "SELECT", "TEXTAREA", "OPTION", "OPTGROUP"
    );

    private static final Map<String, Integer> HEADING_LEVELS = Map.of(
            "H1", 1, "H2", 2, "H3", 3, "H4", 4, "H5", 5, "H6", 6
    );

    private final RoleResolver roles;

    public AriaStates(RoleResolver roles) {
        this.roles = Objects.requireNonNull(roles, "roles must not be null");
    }

    public boolean getSelected(DomElement element) {
        if (isTag(element, "OPTION")) {
            return element.isSelected();
        }
        if (hasRoleIn(element, SELECTED_ROLES)) {
            return VisibilityClassifier.isAriaTrue(element.getAttribute("aria-selected"));
        }
        return false;
    }

    /**
     * Checked state with {@link CheckedState#NOT_APPLICABLE} collapsed to {@link CheckedState#UNCHECKED}
     * and mixed values allowed.
     */
    public CheckedState getAriaChecked(DomElement element) {
        CheckedState state = getChecked(element, true);
        return state == CheckedState.NOT_APPLICABLE ? CheckedState.UNCHECKED : state;
    }

    /**
     * @param element    element
     * @param allowMixed whether {@link CheckedState#MIXED} may be reported
     * @return checked state; {@link CheckedState#NOT_APPLICABLE} when the element cannot be checked
     */
    public CheckedState getChecked(DomElement element, boolean allowMixed) {
        boolean isInput = isTag(element, "INPUT");
        if (allowMixed && isInput && element.isIndeterminate()) {
            return CheckedState.MIXED;
        }
        if (isInput && ("checkbox".equals(element.getInputType()) || "radio".equals(element.getInputType()))) {
            return element.isChecked() ? CheckedState.CHECKED : CheckedState.UNCHECKED;
        }
        if (hasRoleIn(element, CHECKED_ROLES)) {
            String checked = element.getAttribute("aria-checked");
            if ("true".equals(checked)) {
                return CheckedState.CHECKED;
            }
            if (allowMixed && "mixed".equals(checked)) {
                return CheckedState.MIXED;
            }
            return CheckedState.UNCHECKED;
        }
        return CheckedState.NOT_APPLICABLE;
    }

    public PressedState getPressed(DomElement element) {
        if (hasRoleIn(element, PRESSED_ROLES)) {
            String pressed = element.getAttribute("aria-pressed");
            if ("true".equals(pressed)) {
                return PressedState.PRESSED;
            }
            if ("mixed".equals(pressed)) {
                return PressedState.MIXED;
            }
        }
        return PressedState.NOT_PRESSED;
    }

    public ExpandedState getExpanded(DomElement element) {
        if (isTag(element, "DETAILS")) {
            return element.isOpen() ? ExpandedState.EXPANDED : ExpandedState.COLLAPSED;
        }
        if (hasRoleIn(element, EXPANDED_ROLES)) {
            String expanded = element.getAttribute("aria-expanded");
            if (expanded == null) {
                return ExpandedState.NONE;
            }
            return "true".equals(expanded) ? ExpandedState.EXPANDED : ExpandedState.COLLAPSED;
        }
        return ExpandedState.NONE;
    }

    /**
     * @return heading/tree level, or 0 when the element has none
     */
    public int getLevel(DomElement element) {
        Integer nativeLevel = HEADING_LEVELS.get(element.getTagName());
        if (nativeLevel != null) {
            return nativeLevel;
        }
        if (hasRoleIn(element, LEVEL_ROLES)) {
            return parseLevel(element.getAttribute("aria-level"));
        }
        return 0;
    }

    static int parseLevel(String raw) {
        if (raw == null) {
            return 0;
        }
        String t = raw.trim();
        if (!DECIMAL.matcher(t).matches()) {
            return 0;
        }
        try {
            double value = Double.parseDouble(t);
            if (value >= 1 && value == Math.floor(value) && value <= Integer.MAX_VALUE) {
                return (int) value;
            }
        } catch (NumberFormatException e) {
            return 0;
        }
        return 0;
    }

    public boolean getDisabled(DomElement element) {
        boolean isNativeFormControl = NATIVE_FORM_CONTROLS.contains(element.getTagName());
        if (isNativeFormControl && (element.hasAttribute("disabled") || belongsToDisabledFieldSet(element))) {
            return true;
        }
        return hasExplicitAriaDisabled(element);
    }

    private static boolean belongsToDisabledFieldSet(DomElement element) {
        // fieldset does not work across shadow boundaries
        for (DomElement e = element; e != null; e = e.getParentElement()) {
            if (isTag(e, "FIELDSET") && e.hasAttribute("disabled")) {
                return true;
            }
        }
        return false;
    }

    private boolean hasExplicitAriaDisabled(DomElement element) {
        // aria-disabled applies to descendants, shadow trees included
        for (DomElement e = element; e != null; e = e.getParentElementOrShadowHost()) {
            if (hasRoleIn(e, DISABLED_ROLES)) {
                String attribute = lower(e.getAttribute("aria-disabled"));
                if ("true".equals(attribute)) {
                    return true;
                }
                if ("false".equals(attribute)) {
                    return false;
                }
            }
        }
        return false;
    }

    private boolean hasRoleIn(DomElement element, Set<AriaRole> allowed) {
        AriaRole role = roles.getRole(element);
        return role != null && allowed.contains(role);
    }
}
