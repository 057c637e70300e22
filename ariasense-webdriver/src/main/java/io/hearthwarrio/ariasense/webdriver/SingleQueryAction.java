package io.hearthwarrio.ariasense.webdriver;

import io.hearthwarrio.ariasense.core.ElementDescription;
import io.hearthwarrio.ariasense.core.RoleQuery;
import org.openqa.selenium.WebElement;

/**
 * Fluent helper for interacting with a single target identified by a {@link RoleQuery}.
 * <p>
 * Created via {@link AriaWebDriver#into(RoleQuery)} (or {@link AriaWebDriver#at(RoleQuery)}); useful when several
 * operations go against the same target.
 * <p>
 * The query is resolved at most once per helper instance, against the snapshot taken on first use. Later calls
 * reuse the resolved {@link WebElement}, so they keep working after the page changes the element's name or state.
 *
 * <pre>
 * aria.into(RoleQuery.role(AriaRole.TEXTBOX).name("User name")).send("user");
 * </pre>
 */
public final class SingleQueryAction {

    private final AriaWebDriver aria;
    private final RoleQuery query;

    private AriaWebDriver.ResolvedElement cached;

    SingleQueryAction(AriaWebDriver aria, RoleQuery query) {
        this.aria = aria;
        this.query = query;
    }

    public SingleQueryAction send(CharSequence... keys) {
        resolve().element.sendKeys(keys);
        return this;
    }

    public SingleQueryAction click() {
        resolve().element.click();
        return this;
    }

    /**
     * @return resolved target element
     */
    public WebElement element() {
        return resolve().element;
    }

    /**
     * Describes the target against a fresh snapshot, so the result reflects the current page state.
     *
     * @return description
     */
    public ElementDescription describe() {
        return aria.describe(resolve().element);
    }

    private AriaWebDriver.ResolvedElement resolve() {
        if (cached == null) {
            cached = aria.resolve(query, aria.snapshot());
        }
        return cached;
    }
}
