package io.hearthwarrio.ariasense.allure;

import io.hearthwarrio.ariasense.core.AriaRole;
import io.hearthwarrio.ariasense.core.CheckedState;
import io.hearthwarrio.ariasense.core.ElementDescription;
import io.hearthwarrio.ariasense.core.ElementMatch;
import io.hearthwarrio.ariasense.core.ExpandedState;
import io.hearthwarrio.ariasense.core.PressedState;
import io.hearthwarrio.ariasense.core.RoleQuery;
import io.hearthwarrio.ariasense.core.snapshot.SnapshotElement;
import io.hearthwarrio.ariasense.webdriver.LogDetail;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.WebDriver;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

public class AllureResolvedElementLoggerTest {

    private final WebDriver driver = mock(WebDriver.class);

    private final RoleQuery query = RoleQuery.role(AriaRole.CHECKBOX).name("Agree");
    private final ElementMatch match = new ElementMatch(query, new SnapshotElement("input"), "Agree to terms");
    private final ElementDescription description = new ElementDescription(
            AriaRole.CHECKBOX, "Agree to terms", false, false, CheckedState.CHECKED, PressedState.NOT_PRESSED,
            ExpandedState.NONE, 0, true
    );

    @Test
    void nullDetailMeansRoleOnly() {
        AllureResolvedElementLogger logger = new AllureResolvedElementLogger(driver, null, false);

        assertEquals(LogDetail.NONE, logger.detail());
        assertEquals("target: " + query + "\nrole: checkbox\n", logger.render(query.toString(), match, null));
    }

    @Test
    void nameDetailUsesMatchedName() {
        AllureResolvedElementLogger logger = new AllureResolvedElementLogger(driver, LogDetail.NAME, false);

        String text = logger.render(query.toString(), match, null);

        assertTrue(text.endsWith("name: Agree to terms\n"), text);
    }

    @Test
    void fullDetailListsStates() {
        AllureResolvedElementLogger logger = (AllureResolvedElementLogger) AriaAllureLoggers.resolvedElements(driver);

        String text = logger.render(query.toString(), match, description);

        assertTrue(text.contains("checked: CHECKED\n"), text);
        assertTrue(text.contains("disabled: true\n"), text);
        assertTrue(text.contains("level: 0\n"), text);
        verifyNoInteractions(driver);
    }

    @Test
    void driverIsRequired() {
        assertThrows(NullPointerException.class,
                () -> AriaAllureLoggers.resolvedElements(null, LogDetail.FULL, true));
    }
}
