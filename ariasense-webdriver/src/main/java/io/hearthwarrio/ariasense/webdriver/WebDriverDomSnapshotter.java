package io.hearthwarrio.ariasense.webdriver;

import io.hearthwarrio.ariasense.core.snapshot.DomSnapshotReader;
import io.hearthwarrio.ariasense.core.snapshot.SnapshotDocument;
import io.hearthwarrio.ariasense.core.snapshot.SnapshotElement;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Takes {@link PageSnapshot}s of the current page.
 * <p>
 * One {@code executeScript} round trip serializes the whole document (open shadow roots included) together with
 * computed styles and live form state; the script also returns the element references, so every snapshot element
 * maps back to its {@link WebElement}.
 * <p>
 * This class is not thread-safe and is expected to be used from a single test thread.
 */
public class WebDriverDomSnapshotter {

    static final String SCRIPT_RESOURCE = "dom-snapshot.js";

    private static String script;

    private final WebDriver driver;
    private final JavascriptExecutor js;
    private final DomSnapshotReader reader = new DomSnapshotReader();

    /**
     * @param driver Selenium WebDriver instance; must implement {@link JavascriptExecutor}
     */
    public WebDriverDomSnapshotter(WebDriver driver) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        if (!(driver instanceof JavascriptExecutor)) {
            throw new IllegalArgumentException("driver must implement JavascriptExecutor: " + driver.getClass());
        }
        this.js = (JavascriptExecutor) driver;
    }

    /**
     * Serializes the current page.
     *
     * @return snapshot
     * @throws IllegalStateException when the browser returns something that is not a snapshot
     */
    public PageSnapshot snapshot() {
        Object raw = js.executeScript(script());
        if (!(raw instanceof Map)) {
            throw new IllegalStateException("Browser returned no DOM snapshot: " + raw);
        }
        Map<?, ?> result = (Map<?, ?>) raw;

        Object documentRaw = result.get("document");
        if (!(documentRaw instanceof Map)) {
            throw new IllegalStateException("DOM snapshot has no document: " + result.keySet());
        }
        Object refsRaw = result.get("elements");
        List<?> refs = refsRaw instanceof List ? (List<?>) refsRaw : List.of();

        SnapshotDocument document;
        try {
            document = reader.read((Map<?, ?>) documentRaw);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Malformed DOM snapshot: " + e.getMessage(), e);
        }

        Map<SnapshotElement, WebElement> webElements = new IdentityHashMap<>();
        for (SnapshotElement element : document.getElements()) {
            int ref = element.getRef();
            if (ref >= 0 && ref < refs.size() && refs.get(ref) instanceof WebElement) {
                webElements.put(element, (WebElement) refs.get(ref));
            }
        }

        return new PageSnapshot(currentUrl(), document, webElements);
    }

    private String currentUrl() {
        try {
            return driver.getCurrentUrl();
        } catch (RuntimeException e) {
            return null;
        }
    }

    static synchronized String script() {
        if (script == null) {
            try (InputStream in = WebDriverDomSnapshotter.class.getResourceAsStream(SCRIPT_RESOURCE)) {
                if (in == null) {
                    throw new IllegalStateException("Missing classpath resource: " + SCRIPT_RESOURCE);
                }
                script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read " + SCRIPT_RESOURCE, e);
            }
        }
        return script;
    }
}
