package io.hearthwarrio.ariasense.webdriver;

import io.hearthwarrio.ariasense.core.ElementDescription;
import io.hearthwarrio.ariasense.core.ElementMatch;

/**
 * Receives information about a resolved element.
 * <p>
 * Implementations may log to stdout, Allure, files, etc.
 * <p>
 * Note: {@link #detail()} is used by {@link AriaWebDriver} to decide whether a full {@link ElementDescription}
 * should be computed at all.
 */
@FunctionalInterface
public interface ResolvedElementLogger {

    /**
     * Called after an element is resolved.
     *
     * @param target      query string or target description
     * @param match       role match (null for targets given as {@code WebElement})
     * @param description full description; null unless {@link #detail()} is {@link LogDetail#FULL} or the target
     *                    is a {@code WebElement}
     */
    void logResolvedElement(String target, ElementMatch match, ElementDescription description);

    /**
     * Declares how much detail this logger needs.
     * <p>
     * Default is {@link LogDetail#FULL} so that lambda loggers see everything.
     */
    default LogDetail detail() {
        return LogDetail.FULL;
    }
}
