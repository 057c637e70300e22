package io.hearthwarrio.ariasense.core;

import java.util.Locale;
import java.util.Objects;

/**
 * Immutable "find by role" query: role, optional accessible name and optional state filters.
 * <p>
 * Each method returns a new query:
 * <pre>{@code
 * RoleQuery.role(AriaRole.CHECKBOX).name("Remember me").checked(CheckedState.CHECKED)
 * }</pre>
 * State filters are validated against the role: asking for a state the role cannot carry is a mistake in the
 * test code and fails fast with {@link IllegalArgumentException}.
 */
public final class RoleQuery {

    private final AriaRole role;
    private final String name;
    private final boolean exact;
    private final boolean includeHidden;
    private final CheckedState checked;
    private final PressedState pressed;
    private final Boolean selected;
    private final Boolean expanded;
    private final Integer level;
    private final Boolean disabled;

    private RoleQuery(
            AriaRole role,
            String name,
            boolean exact,
            boolean includeHidden,
            CheckedState checked,
            PressedState pressed,
            Boolean selected,
            Boolean expanded,
            Integer level,
            Boolean disabled
    ) {
        this.role = role;
        this.name = name;
        this.exact = exact;
        this.includeHidden = includeHidden;
        this.checked = checked;
        this.pressed = pressed;
        this.selected = selected;
        this.expanded = expanded;
        this.level = level;
        this.disabled = disabled;
    }

    /**
     * Starts a query for the given role.
     *
     * @param role concrete role
     * @return query
     * @throws IllegalArgumentException for abstract roles
     */
    public static RoleQuery role(AriaRole role) {
        Objects.requireNonNull(role, "role must not be null");
        if (role.isAbstract()) {
            throw new IllegalArgumentException("Abstract role cannot be queried: " + role);
        }
        return new RoleQuery(role, null, false, false, null, null, null, null, null, null);
    }

    /**
     * Starts a query for the role with the given attribute spelling (for example {@code "button"}).
     *
     * @param roleName role token
     * @return query
     * @throws IllegalArgumentException for unknown or abstract roles
     */
    public static RoleQuery role(String roleName) {
        AriaRole role = AriaRole.fromName(roleName == null ? null : roleName.trim().toLowerCase(Locale.ROOT));
        if (role == null) {
            throw new IllegalArgumentException("Unknown role: '" + roleName + "'");
        }
        return role(role);
    }

    /**
     * Accessible name filter. By default a case-insensitive substring match, see {@link #exact()}.
     */
    public RoleQuery name(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return new RoleQuery(role, name, exact, includeHidden, checked, pressed, selected, expanded, level, disabled);
    }

    /**
     * Requires the accessible name to equal the query name (case-sensitive, whitespace-normalized).
     */
    public RoleQuery exact() {
        return new RoleQuery(role, name, true, includeHidden, checked, pressed, selected, expanded, level, disabled);
    }

    /**
     * Matches hidden elements too, and computes names with hidden content included.
     */
    public RoleQuery includeHidden() {
        return new RoleQuery(role, name, exact, true, checked, pressed, selected, expanded, level, disabled);
    }

    public RoleQuery checked(CheckedState value) {
        Objects.requireNonNull(value, "checked must not be null");
        if (value == CheckedState.NOT_APPLICABLE) {
            throw new IllegalArgumentException("\"checked\" filter must be CHECKED, UNCHECKED or MIXED");
        }
        requireRole("checked", AriaStates.CHECKED_ROLES.contains(role));
        return new RoleQuery(role, name, exact, includeHidden, value, pressed, selected, expanded, level, disabled);
    }

    public RoleQuery checked(boolean value) {
        return checked(value ? CheckedState.CHECKED : CheckedState.UNCHECKED);
    }

    public RoleQuery pressed(PressedState value) {
        Objects.requireNonNull(value, "pressed must not be null");
        requireRole("pressed", AriaStates.PRESSED_ROLES.contains(role));
        return new RoleQuery(role, name, exact, includeHidden, checked, value, selected, expanded, level, disabled);
    }

    public RoleQuery pressed(boolean value) {
        return pressed(value ? PressedState.PRESSED : PressedState.NOT_PRESSED);
    }

    public RoleQuery selected(boolean value) {
        requireRole("selected", AriaStates.SELECTED_ROLES.contains(role));
        return new RoleQuery(role, name, exact, includeHidden, checked, pressed, value, expanded, level, disabled);
    }

    public RoleQuery expanded(boolean value) {
        requireRole("expanded", AriaStates.EXPANDED_ROLES.contains(role));
        return new RoleQuery(role, name, exact, includeHidden, checked, pressed, selected, value, level, disabled);
    }

    public RoleQuery level(int value) {
        requireRole("level", AriaStates.LEVEL_ROLES.contains(role));
        if (value < 1) {
            throw new IllegalArgumentException("\"level\" must be a positive integer, got " + value);
        }
        return new RoleQuery(role, name, exact, includeHidden, checked, pressed, selected, expanded, value, disabled);
    }

    public RoleQuery disabled(boolean value) {
        return new RoleQuery(role, name, exact, includeHidden, checked, pressed, selected, expanded, level, value);
    }

    private void requireRole(String state, boolean supported) {
        if (!supported) {
            throw new IllegalArgumentException("\"" + state + "\" is not supported for role " + role);
        }
    }

    public AriaRole getRole() {
        return role;
    }

    /**
     * @return name filter or null
     */
    public String getName() {
        return name;
    }

    public boolean isExact() {
        return exact;
    }

    public boolean isIncludeHidden() {
        return includeHidden;
    }

    public CheckedState getChecked() {
        return checked;
    }

    public PressedState getPressed() {
        return pressed;
    }

    public Boolean getSelected() {
        return selected;
    }

    public Boolean getExpanded() {
        return expanded;
    }

    public Integer getLevel() {
        return level;
    }

    public Boolean getDisabled() {
        return disabled;
    }

    /**
     * Compares an accessible name against the name filter. Always true when no name filter is set.
     *
     * @param accessibleName normalized accessible name
     * @return true if the name matches
     */
    public boolean matchesName(String accessibleName) {
        if (name == null) {
            return true;
        }
        String expected = AccessibleNameComputer.normalize(name);
        String actual = AccessibleNameComputer.normalize(accessibleName);
        if (exact) {
            return expected.equals(actual);
        }
        return actual.toLowerCase(Locale.ROOT).contains(expected.toLowerCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("role=").append(role.getName());
        if (name != null) {
            sb.append("[name=\"").append(name).append('"').append(exact ? "s" : "i").append(']');
        }
        if (includeHidden) {
            sb.append("[include-hidden]");
        }
        if (checked != null) {
            sb.append("[checked=").append(checked.name().toLowerCase(Locale.ROOT)).append(']');
        }
        if (pressed != null) {
            sb.append("[pressed=").append(pressed.name().toLowerCase(Locale.ROOT)).append(']');
        }
        if (selected != null) {
            sb.append("[selected=").append(selected).append(']');
        }
        if (expanded != null) {
            sb.append("[expanded=").append(expanded).append(']');
        }
        if (level != null) {
            sb.append("[level=").append(level).append(']');
        }
        if (disabled != null) {
            sb.append("[disabled=").append(disabled).append(']');
        }
        return sb.toString();
    }
}
