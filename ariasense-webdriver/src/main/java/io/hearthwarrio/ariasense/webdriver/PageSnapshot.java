package io.hearthwarrio.ariasense.webdriver;

import io.hearthwarrio.ariasense.core.snapshot.SnapshotDocument;
import io.hearthwarrio.ariasense.core.snapshot.SnapshotElement;
import org.openqa.selenium.WebElement;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * DOM snapshot of one page state.
 * <p>
 * Holds:
 * <ul>
 *   <li>the snapshot document</li>
 *   <li>all elements in document order, shadow trees included</li>
 *   <li>identity-based mapping snapshot element -> {@link WebElement}</li>
 * </ul>
 */
public final class PageSnapshot {

    private final String url;
    private final SnapshotDocument document;
    private final List<SnapshotElement> elements;
    private final Map<SnapshotElement, WebElement> webElements;

    PageSnapshot(String url, SnapshotDocument document, Map<SnapshotElement, WebElement> webElements) {
        this.url = url;
        this.document = Objects.requireNonNull(document, "document must not be null");
        this.elements = Collections.unmodifiableList(document.getElements());
        this.webElements = new IdentityHashMap<>(webElements);
    }

    /**
     * @return URL the snapshot was taken at (may be null)
     */
    public String getUrl() {
        return url;
    }

    public SnapshotDocument getDocument() {
        return document;
    }

    public List<SnapshotElement> getElements() {
        return elements;
    }

    /**
     * @param element snapshot element
     * @return browser element or null when the element has no browser counterpart
     */
    public WebElement getWebElement(SnapshotElement element) {
        return webElements.get(element);
    }

    /**
     * Reverse lookup, based on {@link WebElement#equals(Object)} (remote element id).
     *
     * @param webElement browser element
     * @return snapshot element or null when the element is not part of this snapshot
     */
    public SnapshotElement findElement(WebElement webElement) {
        Objects.requireNonNull(webElement, "webElement must not be null");
        for (Map.Entry<SnapshotElement, WebElement> e : webElements.entrySet()) {
            if (webElement.equals(e.getValue())) {
                return e.getKey();
            }
        }
        return null;
    }
}
