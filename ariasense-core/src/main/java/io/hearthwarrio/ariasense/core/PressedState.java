package io.hearthwarrio.ariasense.core;

/**
 * Value of {@code aria-pressed} on toggle buttons.
 */
public enum PressedState {
    PRESSED,
    NOT_PRESSED,
    MIXED
}
