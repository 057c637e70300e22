package io.hearthwarrio.ariasense.core.snapshot;

import io.hearthwarrio.ariasense.core.AriaEngine;
import io.hearthwarrio.ariasense.core.AriaRole;
import io.hearthwarrio.ariasense.core.dom.PseudoElement;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class DomSnapshotReaderTest {

    private final DomSnapshotReader reader = new DomSnapshotReader();

    private static Map<String, Object> element(String tag, Object... children) {
        Map<String, Object> node = new HashMap<>();
        node.put("t", "e");
        node.put("tag", tag);
        node.put("children", List.of(children));
        return node;
    }

    private static Map<String, Object> text(String text, boolean visible) {
        return Map.of("t", "t", "text", text, "visible", visible);
    }

    @Test
    void readsElementsTextAndAttributes() {
        Map<String, Object> label = element("label", text("User name", true));
        label.put("attrs", Map.of("for", "user"));
        Map<String, Object> input = element("input");
        input.put("attrs", Map.of("id", "user", "type", "text"));
        input.put("ref", 1L);
        input.put("value", "alice");

        SnapshotDocument doc = reader.read(Map.of("children", List.of(element("body", label, input))));

        List<SnapshotElement> elements = doc.getElements();
        assertEquals(3, elements.size());
        SnapshotElement readInput = elements.get(2);
        assertEquals("INPUT", readInput.getTagName());
        assertEquals(1, readInput.getRef());
        assertEquals("alice", readInput.getValue());
        assertEquals("User name", new AriaEngine().getAccessibleName(readInput, false));
    }

    @Test
    void readsStyleStateAndPseudo() {
        Map<String, Object> box = element("input");
        box.put("attrs", Map.of("type", "checkbox"));
        box.put("style", Map.of("display", "none", "visibility", "visible"));
        box.put("checked", true);
        box.put("indeterminate", true);
        Map<String, Object> details = element("details");
        details.put("open", true);
        details.put("before", Map.of("display", "inline", "content", "\"x\""));

        SnapshotDocument doc = reader.read(Map.of("children", List.of(box, details)));

        SnapshotElement readBox = doc.getElements().get(0);
        assertEquals("none", readBox.getComputedStyle().getDisplay());
        assertTrue(readBox.isChecked());
        assertTrue(readBox.isIndeterminate());
        SnapshotElement readDetails = doc.getElements().get(1);
        assertTrue(readDetails.isOpen());
        assertEquals("\"x\"", readDetails.getPseudoStyle(PseudoElement.BEFORE).getContent());
    }

    @Test
    void readsShadowRootBeforeLightChildren() {
        Map<String, Object> slot = element("slot");
        Map<String, Object> host = element("div", element("span"));
        host.put("shadow", List.of(element("button", slot)));

        SnapshotDocument doc = reader.read(Map.of("children", List.of(host)));

        List<SnapshotElement> elements = doc.getElements();
        assertEquals(List.of("DIV", "BUTTON", "SLOT", "SPAN"),
                List.of(elements.get(0).getTagName(), elements.get(1).getTagName(),
                        elements.get(2).getTagName(), elements.get(3).getTagName()));
        assertTrue(elements.get(0).hasShadowRoot());
        assertSame(elements.get(0), elements.get(1).getParentElementOrShadowHost());
        assertSame(elements.get(2), elements.get(3).getAssignedSlot());
    }

    @Test
    void invisibleTextIsKept() {
        Map<String, Object> div = element("div", text("ghost", false));

        SnapshotDocument doc = reader.read(Map.of("children", List.of(div)));

        SnapshotText t = (SnapshotText) doc.getElements().get(0).getChildren().get(0);
        assertEquals("ghost", t.getText());
        assertFalse(t.isVisible());
    }

    @Test
    void missingStyleFallsBackToDefaults() {
        SnapshotDocument doc = reader.read(Map.of("children", List.of(element("ul", element("li")))));

        assertEquals(AriaRole.LIST, new AriaEngine().getRole(doc.getElements().get(0)));
        assertEquals("list-item", doc.getElements().get(1).getComputedStyle().getDisplay());
    }

    @Test
    void malformedInputIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> reader.read(Map.of("children", List.of("not a node"))));
        assertThrows(IllegalArgumentException.class,
                () -> reader.read(Map.of("children", List.of(Map.of("t", "x")))));
        assertThrows(IllegalArgumentException.class,
                () -> reader.read(Map.of("children", List.of(Map.of("t", "e")))));
        assertThrows(IllegalArgumentException.class,
                () -> reader.read(Map.of("children", "oops")));
    }
}
