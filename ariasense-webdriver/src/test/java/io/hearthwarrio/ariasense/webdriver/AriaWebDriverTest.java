package io.hearthwarrio.ariasense.webdriver;

import io.hearthwarrio.ariasense.core.AriaRole;
import io.hearthwarrio.ariasense.core.CheckedState;
import io.hearthwarrio.ariasense.core.ElementDescription;
import io.hearthwarrio.ariasense.core.ElementMatch;
import io.hearthwarrio.ariasense.core.ElementSelectionException;
import io.hearthwarrio.ariasense.core.RoleQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static io.hearthwarrio.ariasense.webdriver.MockBrowser.text;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

public class AriaWebDriverTest {

    private static final RoleQuery USER = RoleQuery.role(AriaRole.TEXTBOX).name("User name");
    private static final RoleQuery PASSWORD = RoleQuery.role(AriaRole.TEXTBOX).name("Password");
    private static final RoleQuery SIGN_IN = RoleQuery.role(AriaRole.BUTTON).name("Sign in");
    private static final RoleQuery REMEMBER = RoleQuery.role(AriaRole.CHECKBOX).name("Remember me");

    private MockBrowser browser;
    private AriaWebDriver aria;
    private WebElement user;
    private WebElement password;
    private WebElement signIn;
    private WebElement help;

    @BeforeEach
    void setUp() {
        browser = new MockBrowser();
        browser.body.add(browser.node("label", Map.of("for", "user"), text("User name")));
        browser.body.add(browser.bound("input", Map.of("id", "user")));
        browser.body.add(browser.node("label", Map.of("for", "pass"), text("Password")));
        browser.body.add(browser.bound("input", Map.of("id", "pass", "type", "text")));
        browser.body.add(browser.node("label", Map.of(),
                browser.bound("input", Map.of("type", "checkbox", "checked", "")),
                text(" Remember me")));
        browser.body.add(browser.bound("button", Map.of(), text("Sign in")));
        browser.body.add(browser.bound("a", Map.of("href", "/help"), text("Help")));
        user = browser.element(0);
        password = browser.element(1);
        signIn = browser.element(3);
        help = browser.element(4);
        aria = new AriaWebDriver(browser.driver);
    }

    private void verifySnapshots(int count) {
        verify(browser.js(), times(count)).executeScript(anyString());
    }

    @Test
    void directCallsResolveByRoleAndName() {
        aria.sendKeys(USER, "alice");
        aria.click(SIGN_IN);

        InOrder order = inOrder(user, signIn);
        order.verify(user).sendKeys("alice");
        order.verify(signIn).click();
        verifySnapshots(2);
    }

    @Test
    void findElementsReturnsDocumentOrder() {
        List<WebElement> textboxes = aria.findElements(RoleQuery.role(AriaRole.TEXTBOX));

        assertEquals(2, textboxes.size());
        assertSame(user, textboxes.get(0));
        assertSame(password, textboxes.get(1));
        assertTrue(aria.findElements(RoleQuery.role(AriaRole.TAB)).isEmpty());
    }

    @Test
    void ambiguousQueryFails() {
        ElementSelectionException ex = assertThrows(ElementSelectionException.class,
                () -> aria.findElement(RoleQuery.role(AriaRole.TEXTBOX)));

        assertTrue(ex.getMessage().contains("Ambiguous"));
        verifyNoInteractions(user, password);
    }

    @Test
    void describeComputesStatesForKnownElement() {
        ElementDescription description = aria.describe(browser.element(2));

        assertEquals(AriaRole.CHECKBOX, description.getRole());
        assertEquals("Remember me", description.getName());
        assertEquals(CheckedState.CHECKED, description.getChecked());
    }

    @Test
    void describeRejectsForeignElement() {
        WebElement foreign = mock(WebElement.class);

        assertThrows(ElementSelectionException.class, () -> aria.describe(foreign));
    }

    @Test
    void chainUsesOneSnapshot() {
        aria.actionsChain()
                .into(USER).send("alice")
                .into(PASSWORD).send("secret")
                .into(REMEMBER).inspect(d -> assertEquals(CheckedState.CHECKED, d.getChecked()))
                .performClickAt(SIGN_IN);

        InOrder order = inOrder(user, password, signIn);
        order.verify(user).sendKeys("alice");
        order.verify(password).sendKeys("secret");
        order.verify(signIn).click();
        verifySnapshots(1);
        assertFalse(aria.getEngine().cache().isOpen());
    }

    @Test
    void chainResolvesEachTargetOnce() {
        aria.actionsChain()
                .into(USER).send("a").send("b").click()
                .perform();

        InOrder order = inOrder(user);
        order.verify(user).sendKeys("a");
        order.verify(user).sendKeys("b");
        order.verify(user).click();
        verifySnapshots(1);
    }

    @Test
    void chainTakesNewSnapshotAfterNavigation() {
        doAnswer(invocation -> {
            browser.url = "https://example.test/help";
            return null;
        }).when(help).click();

        aria.actionsChain()
                .at(RoleQuery.role(AriaRole.LINK).name("Help")).click()
                .into(USER).send("bob")
                .perform();

        verifySnapshots(2);
        InOrder order = inOrder(help, user);
        order.verify(help).click();
        order.verify(user).sendKeys("bob");
    }

    @Test
    void chainAcceptsWebElementTargets() {
        List<String> logged = new ArrayList<>();
        aria.withLogger((target, match, description) -> logged.add(target + "/" + description.getRole()));

        aria.actionsChain().into(signIn).click().perform();

        verify(signIn).click();
        verify(user, never()).click();
        assertEquals(List.of("WebElement/button"), logged);
    }

    @Test
    void chainWithoutTargetFails() {
        assertThrows(IllegalStateException.class, () -> aria.actionsChain().click());
    }

    @Test
    void chainLoggerOverrideIsRestored() {
        List<String> global = new ArrayList<>();
        List<String> chain = new ArrayList<>();
        ResolvedElementLogger globalLogger = (target, match, description) -> global.add(target);
        aria.withLogger(globalLogger);

        aria.actionsChain()
                .withLogger(new ResolvedElementLogger() {
                    @Override
                    public void logResolvedElement(String target, ElementMatch match, ElementDescription description) {
                        assertNull(description);
                        chain.add(match.getAccessibleName());
                    }

                    @Override
                    public LogDetail detail() {
                        return LogDetail.NAME;
                    }
                })
                .into(SIGN_IN).click()
                .perform();

        assertEquals(List.of("Sign in"), chain);
        assertTrue(global.isEmpty());
        assertSame(globalLogger, aria.getResolvedElementLogger());
    }

    @Test
    void singleQueryActionResolvesOnce() {
        SingleQueryAction action = aria.into(USER);

        action.send("a").send("b").click();

        InOrder order = inOrder(user);
        order.verify(user).sendKeys("a");
        order.verify(user).sendKeys("b");
        order.verify(user).click();
        verifySnapshots(1);
        assertSame(user, action.element());
    }

    @Test
    void emptyPageFails() {
        browser.body.clear();
        browser.elements.clear();
        browser.scriptResult = Map.of("document", Map.of("children", List.of()), "elements", List.of());

        assertThrows(ElementSelectionException.class, () -> aria.findElement(SIGN_IN));
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> aria.actionsChain().into(SIGN_IN).click().perform());
        assertEquals("No elements found on page, cannot execute chain.", ex.getMessage());
        verify(signIn, never()).click();
    }

    @Test
    void driverWithoutJavascriptIsRejected() {
        WebDriver plain = mock(WebDriver.class);

        assertThrows(IllegalArgumentException.class, () -> new AriaWebDriver(plain));
    }

    @Test
    void unexpectedScriptResultIsReported() {
        browser.scriptResult = "oops";
        assertThrows(IllegalStateException.class, () -> aria.snapshot());

        browser.scriptResult = Map.of("elements", List.of());
        assertThrows(IllegalStateException.class, () -> aria.snapshot());

        browser.scriptResult = Map.of("document", Map.of("children", List.of(Map.of("t", "?"))));
        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> aria.snapshot());
        assertTrue(ex.getMessage().startsWith("Malformed DOM snapshot"));
    }
}
