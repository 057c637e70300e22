package io.hearthwarrio.ariasense.core.snapshot;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SnapshotElementTest {

    private static SnapshotElement el(String tag) {
        return new SnapshotElement(tag);
    }

    @Test
    void nodeCanBeAttachedOnlyOnce() {
        SnapshotElement child = el("span");
        el("div").append(child);

        assertThrows(IllegalStateException.class, () -> el("p").append(child));
        assertThrows(IllegalStateException.class, () -> new SnapshotDocument().append(child));
    }

    @Test
    void secondShadowRootIsRejected() {
        SnapshotElement host = el("div");
        host.attachShadow();

        assertThrows(IllegalStateException.class, host::attachShadow);
    }

    @Test
    void getElementByIdRejectsBlankIds() {
        SnapshotDocument doc = new SnapshotDocument().append(el("div").attr("id", "a"));

        assertThrows(IllegalArgumentException.class, () -> doc.getElementById(" "));
        assertThrows(IllegalArgumentException.class, () -> doc.getElementById(null));
        assertNotNull(doc.getElementById("a"));
        assertNull(doc.getElementById("b"));
    }

    @Test
    void duplicateIdResolvesToFirstInTreeOrder() {
        SnapshotElement first = el("span").attr("id", "dup");
        SnapshotElement second = el("span").attr("id", "dup");
        SnapshotDocument doc = new SnapshotDocument().append(el("div").append(first), second);

        assertSame(first, doc.getElementById("dup"));
    }

    @Test
    void idLookupSeesLaterChanges() {
        SnapshotElement container = el("div");
        SnapshotDocument doc = new SnapshotDocument().append(container);
        assertNull(doc.getElementById("late"));

        SnapshotElement late = el("span").attr("id", "late");
        container.append(late);
        assertSame(late, doc.getElementById("late"));

        late.attr("id", "renamed");
        assertNull(doc.getElementById("late"));
        assertSame(late, doc.getElementById("renamed"));

        SnapshotElement top = el("p").attr("id", "top");
        doc.append(top);
        assertSame(top, doc.getElementById("top"));
    }

    @Test
    void idLookupStaysInsideShadowScope() {
        SnapshotElement inner = el("span").attr("id", "x");
        SnapshotElement host = el("div");
        SnapshotDocument doc = new SnapshotDocument().append(host);
        host.attachShadow().append(inner);

        assertNull(doc.getElementById("x"));
        assertSame(inner, host.getShadowRoot().getElementById("x"));
        assertSame(host.getShadowRoot(), inner.getEnclosingScope());
    }

    @Test
    void namedSlotting() {
        SnapshotElement named = el("span").attr("slot", "icon");
        SnapshotElement plain = el("span");
        SnapshotElement host = el("div").append(named, plain);
        SnapshotElement iconSlot = el("slot").attr("name", "icon");
        SnapshotElement defaultSlot = el("slot");
        host.attachShadow().append(el("div").append(iconSlot), defaultSlot);

        assertSame(iconSlot, named.getAssignedSlot());
        assertSame(defaultSlot, plain.getAssignedSlot());
        assertEquals(List.of(named), iconSlot.getAssignedNodes());
        assertEquals(List.of(plain), defaultSlot.getAssignedNodes());
    }

    @Test
    void labelsResolveByForAndNesting() {
        SnapshotElement byFor = el("input").attr("id", "a");
        SnapshotElement nested = el("input");
        SnapshotElement forLabel = el("label").attr("for", "a").text("A");
        SnapshotElement wrapping = el("label").append(nested);
        SnapshotElement blankFor = el("label").attr("for", "").append(el("select"));
        new SnapshotDocument().append(forLabel, byFor, wrapping, blankFor);

        assertEquals(List.of(forLabel), byFor.getLabels());
        assertEquals(List.of(wrapping), nested.getLabels());
        assertTrue(((SnapshotElement) blankFor.getChildren().get(0)).getLabels().isEmpty());
    }

    @Test
    void labelsSeeLaterChanges() {
        SnapshotElement input = el("input").attr("id", "a");
        SnapshotElement other = el("input").attr("id", "b");
        SnapshotDocument doc = new SnapshotDocument().append(input, other);
        assertTrue(input.getLabels().isEmpty());

        SnapshotElement label = el("label").attr("for", "a");
        doc.append(label);
        assertEquals(List.of(label), input.getLabels());

        label.attr("for", "b");
        assertTrue(input.getLabels().isEmpty());
        assertEquals(List.of(label), other.getLabels());
    }

    @Test
    void hiddenInputIsNotLabelable() {
        SnapshotElement hidden = el("input").attr("type", "hidden").attr("id", "h");
        new SnapshotDocument().append(el("label").attr("for", "h"), hidden);

        assertTrue(hidden.getLabels().isEmpty());
    }

    @Test
    void unknownInputTypeIsText() {
        assertEquals("text", el("input").attr("type", "fancy").getInputType());
        assertEquals("email", el("input").attr("type", " EMAIL ").getInputType());
        assertEquals("", el("div").getInputType());
    }

    @Test
    void singleSelectShowsFirstEnabledOption() {
        SnapshotElement disabled = el("option").attr("disabled", "").text("None");
        SnapshotElement first = el("option").attr("value", "1").text("One");
        SnapshotElement second = el("option").text("Two");
        SnapshotElement select = el("select").append(disabled, el("optgroup").append(first, second));

        assertFalse(disabled.isSelected());
        assertTrue(first.isSelected());
        assertEquals("1", select.getValue());
        assertEquals(3, select.getOptions().size());

        second.selected(true);
        assertFalse(first.isSelected());
        assertEquals("Two", select.getValue());
    }

    @Test
    void multiSelectHasNoDefaultSelection() {
        SnapshotElement option = el("option").text("One");
        el("select").attr("multiple", "").append(option);

        assertFalse(option.isSelected());
    }

    @Test
    void svgDescendantsKnowTheyAreInSvg() {
        SnapshotElement title = el("title");
        SnapshotElement svg = el("svg").append(el("g").append(title));

        assertTrue(title.isInSvg());
        assertFalse(svg.isInSvg());
    }
}
