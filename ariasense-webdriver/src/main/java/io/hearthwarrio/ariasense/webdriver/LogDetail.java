package io.hearthwarrio.ariasense.webdriver;

/**
 * Controls how much of a resolved element is computed for logging.
 */
public enum LogDetail {

    /**
     * Query and role only.
     */
    NONE,

    /**
     * Query, role and accessible name.
     */
    NAME,

    /**
     * Query, role, accessible name and all state properties.
     * Requires an extra description pass over the snapshot.
     */
    FULL
}
