package io.hearthwarrio.ariasense.core;

/**
 * Role, name and states of one element, computed within a single pass.
 */
public final class ElementDescription {

    private final AriaRole role;
    private final String name;
    private final boolean hidden;
    private final boolean selected;
    private final CheckedState checked;
    private final PressedState pressed;
    private final ExpandedState expanded;
    private final int level;
    private final boolean disabled;

    public ElementDescription(
            AriaRole role,
            String name,
            boolean hidden,
            boolean selected,
            CheckedState checked,
            PressedState pressed,
            ExpandedState expanded,
            int level,
            boolean disabled
    ) {
        this.role = role;
        this.name = name == null ? "" : name;
        this.hidden = hidden;
        this.selected = selected;
        this.checked = checked;
        this.pressed = pressed;
        this.expanded = expanded;
        this.level = level;
        this.disabled = disabled;
    }

    /**
     * @return role, or null when the element has none
     */
    public AriaRole getRole() {
        return role;
    }

    public String getName() {
        return name;
    }

    public boolean isHidden() {
        return hidden;
    }

    public boolean isSelected() {
        return selected;
    }

    public CheckedState getChecked() {
        return checked;
    }

    public PressedState getPressed() {
        return pressed;
    }

    public ExpandedState getExpanded() {
        return expanded;
    }

    public int getLevel() {
        return level;
    }

    public boolean isDisabled() {
        return disabled;
    }

    @Override
    public String toString() {
        return "ElementDescription{" +
                "role=" + role +
                ", name='" + name + '\'' +
                ", hidden=" + hidden +
                ", selected=" + selected +
                ", checked=" + checked +
                ", pressed=" + pressed +
                ", expanded=" + expanded +
                ", level=" + level +
                ", disabled=" + disabled +
                '}';
    }
}
