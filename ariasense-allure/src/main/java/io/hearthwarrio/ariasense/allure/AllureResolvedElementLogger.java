package io.hearthwarrio.ariasense.allure;

import io.hearthwarrio.ariasense.core.ElementDescription;
import io.hearthwarrio.ariasense.core.ElementMatch;
import io.hearthwarrio.ariasense.webdriver.LogDetail;
import io.hearthwarrio.ariasense.webdriver.ResolvedElementLogger;
import io.qameta.allure.Allure;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Allure logger for resolved elements: one step per resolution with a text attachment and an optional screenshot.
 * <p>
 * Lives in ariasense-allure to avoid leaking the Allure dependency into core/webdriver.
 */
public final class AllureResolvedElementLogger implements ResolvedElementLogger {

    private final WebDriver driver;
    private final LogDetail detail;
    private final boolean attachScreenshot;

    public AllureResolvedElementLogger(WebDriver driver, LogDetail detail, boolean attachScreenshot) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.detail = detail == null ? LogDetail.NONE : detail;
        this.attachScreenshot = attachScreenshot;
    }

    @Override
    public LogDetail detail() {
        return detail;
    }

    @Override
    public void logResolvedElement(String target, ElementMatch match, ElementDescription description) {
        String title = "ariasense: " + safe(target);

        Allure.step(title, () -> {
            byte[] txt = render(target, match, description).getBytes(StandardCharsets.UTF_8);
            Allure.addAttachment(
                    "Resolved element",
                    "text/plain",
                    new ByteArrayInputStream(txt),
                    ".txt"
            );

            if (attachScreenshot && driver instanceof TakesScreenshot ts) {
                byte[] png = ts.getScreenshotAs(OutputType.BYTES);
                Allure.addAttachment(
                        "Screenshot",
                        "image/png",
                        new ByteArrayInputStream(png),
                        ".png"
                );
            }
        });
    }

    String render(String target, ElementMatch match, ElementDescription description) {
        StringBuilder sb = new StringBuilder(512);
        sb.append("target: ").append(safe(target)).append('\n');

        if (description != null) {
            sb.append("role: ").append(description.getRole()).append('\n');
        } else if (match != null) {
            sb.append("role: ").append(match.getRole()).append('\n');
        }
        if (detail == LogDetail.NONE) {
            return sb.toString();
        }

        String name = description != null ? description.getName() : match != null ? match.getAccessibleName() : "";
        sb.append("name: ").append(name).append('\n');

        if (detail == LogDetail.FULL && description != null) {
            sb.append("hidden: ").append(description.isHidden()).append('\n')
                    .append("disabled: ").append(description.isDisabled()).append('\n')
                    .append("checked: ").append(description.getChecked()).append('\n')
                    .append("pressed: ").append(description.getPressed()).append('\n')
                    .append("expanded: ").append(description.getExpanded()).append('\n')
                    .append("selected: ").append(description.isSelected()).append('\n')
                    .append("level: ").append(description.getLevel()).append('\n');
        }
        return sb.toString();
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
