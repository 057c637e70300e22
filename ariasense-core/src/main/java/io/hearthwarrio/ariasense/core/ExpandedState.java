package io.hearthwarrio.ariasense.core;

/**
 * Value of the expanded state.
 * <p>
 * {@link #NONE} means the element is not expandable at all, which is different from {@link #COLLAPSED}.
 */
public enum ExpandedState {
    EXPANDED,
    COLLAPSED,
    NONE
}
