package io.hearthwarrio.ariasense.core;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * WAI-ARIA 1.2 role taxonomy.
 * <p>
 * Abstract roles are listed so that they are recognized, but they are never valid as an explicit role.
 */
public enum AriaRole {
    ALERT,
    ALERTDIALOG,
    APPLICATION,
    ARTICLE,
    BANNER,
    BLOCKQUOTE,
    BUTTON,
    CAPTION,
    CELL,
    CHECKBOX,
    CODE,
    COLUMNHEADER,
    COMBOBOX,
    COMMAND(true),
    COMPLEMENTARY,
    COMPOSITE(true),
    CONTENTINFO,
    DEFINITION,
    DELETION,
    DIALOG,
    DIRECTORY,
    DOCUMENT,
    EMPHASIS,
    FEED,
    FIGURE,
    FORM,
    GENERIC,
    GRID,
    GRIDCELL,
    GROUP,
    HEADING,
    IMG,
    INPUT(true),
    INSERTION,
    LANDMARK(true),
    LINK,
    LIST,
    LISTBOX,
    LISTITEM,
    LOG,
    MAIN,
    MARK,
    MARQUEE,
    MATH,
    METER,
    MENU,
    MENUBAR,
    MENUITEM,
    MENUITEMCHECKBOX,
    MENUITEMRADIO,
    NAVIGATION,
    NONE,
    NOTE,
    OPTION,
    PARAGRAPH,
    PRESENTATION,
    PROGRESSBAR,
    RADIO,
    RADIOGROUP,
    RANGE(true),
    REGION,
    ROLETYPE(true),
    ROW,
    ROWGROUP,
    ROWHEADER,
    SCROLLBAR,
    SEARCH,
    SEARCHBOX,
    SECTION(true),
    SECTIONHEAD(true),
    SELECT(true),
    SEPARATOR,
    SLIDER,
    SPINBUTTON,
    STATUS,
    STRONG,
    STRUCTURE(true),
    SUBSCRIPT,
    SUPERSCRIPT,
    SWITCH,
    TAB,
    TABLE,
    TABLIST,
    TABPANEL,
    TERM,
    TEXTBOX,
    TIME,
    TIMER,
    TOOLBAR,
    TOOLTIP,
    TREE,
    TREEGRID,
    TREEITEM,
    WIDGET(true),
    WINDOW(true);

    private static final Map<String, AriaRole> BY_NAME = new HashMap<>();

    static {
        for (AriaRole r : values()) {
            BY_NAME.put(r.getName(), r);
        }
    }

    private final boolean abstractRole;
    private final String name;

    AriaRole() {
        this(false);
    }

    AriaRole(boolean abstractRole) {
        this.abstractRole = abstractRole;
        this.name = name().toLowerCase(Locale.ROOT);
    }

    /**
     * @return role name as written in the {@code role} attribute
     */
    public String getName() {
        return name;
    }

    public boolean isAbstract() {
        return abstractRole;
    }

    /**
     * @return true for {@code none} and {@code presentation}
     */
    public boolean isPresentational() {
        return this == NONE || this == PRESENTATION;
    }

    /**
     * Looks up a concrete role by its attribute spelling.
     * <p>
     * Matching is case-sensitive, as in the {@code role} attribute. Abstract roles and unknown names yield null.
     *
     * @param name role token
     * @return concrete role or null
     */
    public static AriaRole fromName(String name) {
        if (name == null) {
            return null;
        }
        AriaRole role = BY_NAME.get(name);
        if (role == null || role.isAbstract()) {
            return null;
        }
        return role;
    }

    @Override
    public String toString() {
        return name;
    }
}
