package io.hearthwarrio.ariasense.core;

/**
 * Value of the checked state.
 * <p>
 * {@link #NOT_APPLICABLE} is reported for elements whose role does not support {@code aria-checked}.
 */
public enum CheckedState {
    CHECKED,
    UNCHECKED,
    MIXED,
    NOT_APPLICABLE;

    /**
     * Collapses the state to a boolean: only {@link #CHECKED} is true.
     */
    public boolean isChecked() {
        return this == CHECKED;
    }
}
