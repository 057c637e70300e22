package io.hearthwarrio.ariasense.webdriver;

import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.withSettings;

/**
 * Mocked browser: the snapshot script returns a page built from serialized nodes, and every element bound into
 * the page is a Mockito {@link WebElement}.
 */
final class MockBrowser {

    final List<WebElement> elements = new ArrayList<>();
    final WebDriver driver = mock(WebDriver.class, withSettings().extraInterfaces(JavascriptExecutor.class));

    List<Object> body = new ArrayList<>();
    Object scriptResult;
    String url = "https://example.test/login";

    MockBrowser() {
        when(driver.getCurrentUrl()).thenAnswer(invocation -> url);
        when(js().executeScript(anyString())).thenAnswer(invocation -> scriptResult != null ? scriptResult : page());
    }

    JavascriptExecutor js() {
        return (JavascriptExecutor) driver;
    }

    Map<String, Object> node(String tag, Map<String, String> attrs, Object... children) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("t", "e");
        node.put("tag", tag);
        node.put("attrs", attrs);
        node.put("children", Arrays.asList(children));
        return node;
    }

    /**
     * Element node whose reference resolves to a new mocked {@link WebElement}.
     */
    Map<String, Object> bound(String tag, Map<String, String> attrs, Object... children) {
        Map<String, Object> node = node(tag, attrs, children);
        node.put("ref", elements.size());
        elements.add(mock(WebElement.class, tag + "#" + elements.size()));
        return node;
    }

    static Map<String, Object> text(String text) {
        return Map.of("t", "t", "text", text, "visible", true);
    }

    WebElement element(int index) {
        return elements.get(index);
    }

    private Map<String, Object> page() {
        Map<String, Object> result = new HashMap<>();
        result.put("document", Map.of("children", List.of(node("html", Map.of(),
                node("body", Map.of(), body.toArray())))));
        result.put("elements", new ArrayList<>(elements));
        return result;
    }
}
