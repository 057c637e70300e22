package io.hearthwarrio.ariasense.allure;

import io.hearthwarrio.ariasense.webdriver.LogDetail;
import io.hearthwarrio.ariasense.webdriver.ResolvedElementLogger;
import org.openqa.selenium.WebDriver;

/**
 * Factory methods for Allure-related loggers.
 */
public final class AriaAllureLoggers {

    private AriaAllureLoggers() {
        // utility class
    }

    /**
     * Creates an Allure logger with full element descriptions and without screenshots.
     */
    public static ResolvedElementLogger resolvedElements(WebDriver driver) {
        return new AllureResolvedElementLogger(driver, LogDetail.FULL, false);
    }

    /**
     * Creates an Allure logger with explicit detail and screenshot flag.
     */
    public static ResolvedElementLogger resolvedElements(WebDriver driver, LogDetail detail, boolean screenshots) {
        return new AllureResolvedElementLogger(driver, detail, screenshots);
    }
}
