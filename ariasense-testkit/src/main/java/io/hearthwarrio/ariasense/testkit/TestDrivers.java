package io.hearthwarrio.ariasense.testkit;

import org.openqa.selenium.Capabilities;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.remote.RemoteWebDriver;

import java.net.URL;
import java.time.Duration;
import java.util.Objects;

/**
 * Minimal WebDriver factory for tests.
 * <p>
 * Local Chrome by default, headless on request, RemoteWebDriver for a grid.
 * Lives outside the library modules so ariasense does not turn into a test framework.
 */
public final class TestDrivers {

    /**
     * Default implicit wait used by the testkit.
     */
    public static final Duration DEFAULT_IMPLICIT_WAIT = Duration.ofSeconds(5);

    /**
     * System property that switches {@link #chrome()} to headless mode ({@code -Dariasense.headless=true}).
     */
    public static final String HEADLESS_PROPERTY = "ariasense.headless";

    private TestDrivers() {
        // utility class
    }

    /**
     * Creates a local ChromeDriver; headless when {@value #HEADLESS_PROPERTY} is {@code true}.
     */
    public static WebDriver chrome() {
        return Boolean.getBoolean(HEADLESS_PROPERTY) ? headlessChrome() : chrome(new ChromeOptions());
    }

    public static WebDriver headlessChrome() {
        return chrome(new ChromeOptions().addArguments("--headless=new", "--window-size=1280,1024"));
    }

    public static WebDriver chrome(ChromeOptions options) {
        Objects.requireNonNull(options, "options must not be null");

        WebDriver driver = new ChromeDriver(options);
        applyDefaults(driver);
        return driver;
    }

    public static WebDriver remote(URL remoteUrl, Capabilities capabilities) {
        Objects.requireNonNull(remoteUrl, "remoteUrl must not be null");
        Objects.requireNonNull(capabilities, "capabilities must not be null");

        WebDriver driver = new RemoteWebDriver(remoteUrl, capabilities);
        applyDefaults(driver);
        return driver;
    }

    private static void applyDefaults(WebDriver driver) {
        driver.manage().timeouts().implicitlyWait(DEFAULT_IMPLICIT_WAIT);
    }
}
