package io.hearthwarrio.ariasense.testkit;

import io.hearthwarrio.ariasense.webdriver.AriaWebDriver;
import io.hearthwarrio.ariasense.webdriver.LogDetail;
import org.openqa.selenium.WebDriver;

import java.util.Objects;

/**
 * Convenience factory methods for creating {@link AriaWebDriver} instances in tests.
 * Does not depend on Allure.
 */
public final class TestAria {

    private TestAria() {
        // utility class
    }

    /**
     * Creates a plain AriaWebDriver without logging.
     */
    public static AriaWebDriver plain(WebDriver driver) {
        Objects.requireNonNull(driver, "driver must not be null");
        return new AriaWebDriver(driver);
    }

    /**
     * Creates an AriaWebDriver with stdout logging of resolved elements.
     */
    public static AriaWebDriver stdout(WebDriver driver, LogDetail detail) {
        Objects.requireNonNull(driver, "driver must not be null");
        return new AriaWebDriver(driver).withLoggingToStdOut(detail);
    }
}
