package io.hearthwarrio.ariasense.webdriver;

import io.hearthwarrio.ariasense.core.AriaCache;
import io.hearthwarrio.ariasense.core.ElementDescription;
import io.hearthwarrio.ariasense.core.RoleQuery;
import org.openqa.selenium.WebElement;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * DSL for executing a sequence of role-driven actions.
 * <p>
 * Per-chain caching:
 * <ul>
 *   <li>the page is snapshotted once per {@link #perform()} (again only after a URL change)</li>
 *   <li>one engine cache pass stays open for the whole {@link #perform()}</li>
 *   <li>each target is resolved once per perform()</li>
 * </ul>
 *
 * <pre>{@code
 * aria.actionsChain()
 *     .into(RoleQuery.role(AriaRole.TEXTBOX).name("User name")).send("user")
 *     .into(RoleQuery.role(AriaRole.TEXTBOX).name("Password")).send("secret")
 *     .at(RoleQuery.role(AriaRole.BUTTON).name("Sign in")).performClick();
 * }</pre>
 */
public final class ActionsChain {

    private final AriaWebDriver aria;

    private TargetRef currentTarget;

    private final List<Consumer<ExecutionContext>> steps = new ArrayList<>();

    private boolean loggerOverrideSpecified = false;
    private ResolvedElementLogger loggerOverrideValue = null;

    public ActionsChain(AriaWebDriver aria) {
        this.aria = Objects.requireNonNull(aria, "aria must not be null");
    }

    /**
     * Overrides logger for this chain (null disables logging).
     */
    public ActionsChain withLogger(ResolvedElementLogger logger) {
        this.loggerOverrideSpecified = true;
        this.loggerOverrideValue = logger;
        return this;
    }

    public ActionsChain withLoggingToStdOut(LogDetail detail) {
        return withLogger(new StdOutResolvedElementLogger(detail));
    }

    public ActionsChain logResolvedElements() {
        return withLoggingToStdOut(LogDetail.FULL);
    }

    public ActionsChain disableLogging() {
        return withLogger(null);
    }

    /**
     * Selects the current target by role query for subsequent actions.
     */
    public ActionsChain into(RoleQuery query) {
        this.currentTarget = new QueryTarget(query);
        return this;
    }

    /**
     * Selects the current target by an existing {@link WebElement} reference for subsequent actions.
     */
    public ActionsChain into(WebElement element) {
        this.currentTarget = new ElementTarget(element);
        return this;
    }

    /**
     * Alias for {@link #into(RoleQuery)}.
     */
    public ActionsChain at(RoleQuery query) {
        return into(query);
    }

    /**
     * Alias for {@link #into(WebElement)}.
     */
    public ActionsChain at(WebElement element) {
        return into(element);
    }

    /**
     * Adds a sendKeys step for the current target.
     */
    public ActionsChain send(CharSequence... keys) {
        final TargetRef target = requireCurrentTarget();
        steps.add(ctx -> ctx.resolve(target).element.sendKeys(keys));
        return this;
    }

    /**
     * Adds a click step for the current target.
     */
    public ActionsChain click() {
        final TargetRef target = requireCurrentTarget();
        steps.add(ctx -> ctx.resolve(target).element.click());
        return this;
    }

    /**
     * Adds a step that hands the description of the current target to the consumer, typically an assertion.
     * The description is computed from the chain snapshot.
     */
    public ActionsChain inspect(Consumer<ElementDescription> consumer) {
        Objects.requireNonNull(consumer, "consumer must not be null");
        final TargetRef target = requireCurrentTarget();
        steps.add(ctx -> consumer.accept(ctx.describe(target)));
        return this;
    }

    /**
     * Sugar alias for into(query).send(keys).
     */
    public ActionsChain type(RoleQuery query, CharSequence... keys) {
        return into(query).send(keys);
    }

    /**
     * Sugar: at(query) + performClick().
     */
    public void performClickAt(RoleQuery query) {
        at(query);
        performClick();
    }

    /**
     * Executes all accumulated steps.
     */
    public void perform() {
        ResolvedElementLogger originalLogger = aria.getResolvedElementLogger();

        try (AriaCache.Pass ignored = aria.getEngine().openPass()) {
            if (loggerOverrideSpecified) {
                aria.setResolvedElementLogger(loggerOverrideValue);
            }
            ExecutionContext ctx = new ExecutionContext(aria);
            for (Consumer<ExecutionContext> step : steps) {
                step.accept(ctx);
            }
        } finally {
            if (loggerOverrideSpecified) {
                aria.setResolvedElementLogger(originalLogger);
            }
        }
    }

    /**
     * Convenience: add click for current target and execute chain immediately.
     */
    public void performClick() {
        click();
        perform();
    }

    private TargetRef requireCurrentTarget() {
        if (currentTarget == null) {
            throw new IllegalStateException("No current target selected. Call into(...) or at(...) first.");
        }
        return currentTarget;
    }

    /**
     * Target abstraction for chain steps.
     */
    private interface TargetRef {
        AriaWebDriver.ResolvedElement resolve(ExecutionContext ctx);
    }

    private static final class QueryTarget implements TargetRef {
        private final RoleQuery query;

        private QueryTarget(RoleQuery query) {
            this.query = Objects.requireNonNull(query, "query must not be null");
        }

        @Override
        public AriaWebDriver.ResolvedElement resolve(ExecutionContext ctx) {
            return ctx.aria.resolve(query, ctx.snapshot());
        }
    }

    private static final class ElementTarget implements TargetRef {
        private final WebElement element;

        private ElementTarget(WebElement element) {
            this.element = Objects.requireNonNull(element, "element must not be null");
        }

        @Override
        public AriaWebDriver.ResolvedElement resolve(ExecutionContext ctx) {
            return ctx.aria.resolveWebElement(element, ctx.snapshot());
        }
    }

    /**
     * Per-execution context holding a page snapshot and per-target resolved cache.
     */
    private static final class ExecutionContext {

        private final AriaWebDriver aria;

        private String urlSnapshot;

        private PageSnapshot pageSnapshot;

        private final Map<TargetRef, AriaWebDriver.ResolvedElement> resolvedCache = new IdentityHashMap<>();

        private ExecutionContext(AriaWebDriver aria) {
            this.aria = aria;
            refreshSnapshot();
        }

        AriaWebDriver.ResolvedElement resolve(TargetRef target) {
            ensureSnapshotIsValid();
            AriaWebDriver.ResolvedElement cached = resolvedCache.get(target);
            if (cached != null) {
                return cached;
            }
            AriaWebDriver.ResolvedElement resolved = target.resolve(this);
            resolvedCache.put(target, resolved);
            return resolved;
        }

        ElementDescription describe(TargetRef target) {
            return aria.describe(resolve(target).element, snapshot());
        }

        PageSnapshot snapshot() {
            return pageSnapshot;
        }

        private void ensureSnapshotIsValid() {
            String currentUrl = aria.currentUrl();
            if (!Objects.equals(currentUrl, urlSnapshot)) {
                refreshSnapshot();
            }
        }

        private void refreshSnapshot() {
            this.pageSnapshot = aria.snapshot();
            this.urlSnapshot = pageSnapshot.getUrl();
            if (pageSnapshot.getElements().isEmpty()) {
                throw new IllegalStateException("No elements found on page, cannot execute chain.");
            }
            this.resolvedCache.clear();
        }
    }
}
