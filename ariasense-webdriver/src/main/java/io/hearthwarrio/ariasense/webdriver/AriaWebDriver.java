package io.hearthwarrio.ariasense.webdriver;

import io.hearthwarrio.ariasense.core.AriaEngine;
import io.hearthwarrio.ariasense.core.ElementDescription;
import io.hearthwarrio.ariasense.core.ElementMatch;
import io.hearthwarrio.ariasense.core.ElementSelectionException;
import io.hearthwarrio.ariasense.core.ElementSelector;
import io.hearthwarrio.ariasense.core.RoleElementSelector;
import io.hearthwarrio.ariasense.core.RoleQuery;
import io.hearthwarrio.ariasense.core.snapshot.SnapshotElement;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Role-based entry point for Selenium WebDriver.
 * <p>
 * Two execution modes:
 * <ul>
 *   <li>Direct API (e.g. {@link #click(RoleQuery)}, {@link #sendKeys(RoleQuery, CharSequence...)}): each call is
 *       an independent step and takes a fresh page snapshot.</li>
 *   <li>{@link ActionsChain} (via {@link #actionsChain()}): one {@link ActionsChain#perform()} call is one step; it
 *       reuses a single page snapshot and one cache pass across all queries of the chain.</li>
 * </ul>
 * <p>
 * Snapshot invalidation within a chain is triggered by URL change (navigation). DOM mutations without URL change are
 * outside the snapshot reuse guarantee.
 *
 * <pre>{@code
 * AriaWebDriver aria = new AriaWebDriver(driver).logResolvedElements();
 * aria.sendKeys(RoleQuery.role(AriaRole.TEXTBOX).name("User name"), "alice");
 * aria.click(RoleQuery.role(AriaRole.BUTTON).name("Sign in"));
 * }</pre>
 */
public class AriaWebDriver {

    private final WebDriver driver;
    private final AriaEngine engine;
    private final WebDriverDomSnapshotter snapshotter;

    private ElementSelector elementSelector;

    /**
     * Mutable to support runtime overrides and DSL sugar.
     */
    private ResolvedElementLogger resolvedElementLogger;

    /**
     * Element resolved for one target, package-private for the action helpers.
     */
    static final class ResolvedElement {
        final String target;
        final ElementMatch match;
        final WebElement element;

        ResolvedElement(String target, ElementMatch match, WebElement element) {
            this.target = target;
            this.match = match;
            this.element = element;
        }
    }

    public AriaWebDriver(WebDriver driver) {
        this(driver, null);
    }

    public AriaWebDriver(WebDriver driver, ResolvedElementLogger logger) {
        this(driver, new AriaEngine(), logger);
    }

    /**
     * @param driver Selenium WebDriver; must implement {@code JavascriptExecutor}
     * @param engine engine shared by the default selector and {@link #describe(WebElement)}
     * @param logger resolved element logger (optional)
     */
    public AriaWebDriver(WebDriver driver, AriaEngine engine, ResolvedElementLogger logger) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.snapshotter = new WebDriverDomSnapshotter(driver);
        this.elementSelector = new RoleElementSelector(engine);
        this.resolvedElementLogger = logger;
    }

    // ----------- configuration -----------

    public AriaWebDriver withLogger(ResolvedElementLogger logger) {
        this.resolvedElementLogger = logger;
        return this;
    }

    public AriaWebDriver withLoggingToStdOut(LogDetail detail) {
        return withLogger(new StdOutResolvedElementLogger(detail));
    }

    /**
     * Enables stdout logging with full element descriptions.
     */
    public AriaWebDriver logResolvedElements() {
        return withLoggingToStdOut(LogDetail.FULL);
    }

    public AriaWebDriver disableLogging() {
        this.resolvedElementLogger = null;
        return this;
    }

    /**
     * Replaces the selector used to match queries. The selector should evaluate candidates with
     * {@link #getEngine()} so that chains share its cache pass.
     */
    public AriaWebDriver withSelector(ElementSelector selector) {
        this.elementSelector = Objects.requireNonNull(selector, "selector must not be null");
        return this;
    }

    public WebDriver getDriver() {
        return driver;
    }

    public AriaEngine getEngine() {
        return engine;
    }

    // package-private for ActionsChain overrides
    ResolvedElementLogger getResolvedElementLogger() {
        return resolvedElementLogger;
    }

    void setResolvedElementLogger(ResolvedElementLogger logger) {
        this.resolvedElementLogger = logger;
    }

    private LogDetail currentLogDetail() {
        if (resolvedElementLogger == null) {
            return LogDetail.NONE;
        }
        LogDetail d;
        try {
            d = resolvedElementLogger.detail();
        } catch (RuntimeException e) {
            d = LogDetail.FULL;
        }
        return d == null ? LogDetail.FULL : d;
    }

    String currentUrl() {
        return driver.getCurrentUrl();
    }

    /**
     * Takes a fresh snapshot of the current page.
     *
     * @return snapshot
     */
    public PageSnapshot snapshot() {
        return snapshotter.snapshot();
    }

    // ----------- main API -----------

    /**
     * Resolves the single element matching the query.
     * <p>
     * Snapshot contract: this direct call is an independent step and takes a fresh page snapshot.
     *
     * @param query role query
     * @return matching element
     * @throws ElementSelectionException when nothing or more than one element matches
     */
    public WebElement findElement(RoleQuery query) {
        return resolve(query, snapshot()).element;
    }

    /**
     * Resolves all elements matching the query, in document order.
     *
     * @param query role query
     * @return matching elements; may be empty
     */
    public List<WebElement> findElements(RoleQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        PageSnapshot snapshot = snapshot();
        List<WebElement> out = new ArrayList<>();
        for (ElementMatch m : elementSelector.selectAll(query, snapshot.getElements())) {
            WebElement element = snapshot.getWebElement((SnapshotElement) m.getElement());
            if (element != null) {
                out.add(element);
            }
        }
        return out;
    }

    public void click(RoleQuery query) {
        findElement(query).click();
    }

    public void sendKeys(RoleQuery query, CharSequence... keys) {
        findElement(query).sendKeys(keys);
    }

    /**
     * Computes role, accessible name and states of an element found by other means.
     *
     * @param element browser element
     * @return description
     * @throws ElementSelectionException when the element is not part of the current page
     */
    public ElementDescription describe(WebElement element) {
        return describe(element, snapshot());
    }

    /**
     * Creates a helper bound to one query.
     */
    public SingleQueryAction into(RoleQuery query) {
        return new SingleQueryAction(this, Objects.requireNonNull(query, "query must not be null"));
    }

    /**
     * Alias for {@link #into(RoleQuery)}.
     */
    public SingleQueryAction at(RoleQuery query) {
        return into(query);
    }

    /**
     * @return new actions chain instance bound to this driver
     */
    public ActionsChain actionsChain() {
        return new ActionsChain(this);
    }

    // ----------- internal resolve API -----------

    ResolvedElement resolve(RoleQuery query, PageSnapshot snapshot) {
        Objects.requireNonNull(query, "query must not be null");
        if (snapshot.getElements().isEmpty()) {
            throw new ElementSelectionException("No elements found on page for " + query);
        }

        ElementMatch match = elementSelector.selectOne(query, snapshot.getElements());
        if (!(match.getElement() instanceof SnapshotElement)) {
            throw new ElementSelectionException(
                    "Internal error: selector returned an element that is not part of the snapshot: " + match
            );
        }
        SnapshotElement selected = (SnapshotElement) match.getElement();
        WebElement webElement = snapshot.getWebElement(selected);
        if (webElement == null) {
            throw new ElementSelectionException("Matched element has no browser counterpart: " + match);
        }

        logResolved(query.toString(), match, selected);
        return new ResolvedElement(query.toString(), match, webElement);
    }

    ResolvedElement resolveWebElement(WebElement element, PageSnapshot snapshot) {
        Objects.requireNonNull(element, "element must not be null");
        if (resolvedElementLogger != null) {
            SnapshotElement known = snapshot.findElement(element);
            if (known != null) {
                logResolved("WebElement", null, known);
            }
        }
        return new ResolvedElement("WebElement", null, element);
    }

    ElementDescription describe(WebElement element, PageSnapshot snapshot) {
        Objects.requireNonNull(element, "element must not be null");
        SnapshotElement known = snapshot.findElement(element);
        if (known == null) {
            throw new ElementSelectionException("Element is not part of the current page: " + element);
        }
        return engine.describe(known);
    }

    private void logResolved(String target, ElementMatch match, SnapshotElement element) {
        if (resolvedElementLogger == null) {
            return;
        }
        ElementDescription description = null;
        if (match == null || currentLogDetail() == LogDetail.FULL) {
            description = engine.describe(element);
        }
        resolvedElementLogger.logResolvedElement(target, match, description);
    }
}
