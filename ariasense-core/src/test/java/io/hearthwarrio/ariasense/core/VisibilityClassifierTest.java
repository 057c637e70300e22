package io.hearthwarrio.ariasense.core;

import io.hearthwarrio.ariasense.core.dom.ComputedStyle;
import io.hearthwarrio.ariasense.core.snapshot.SnapshotElement;
import io.hearthwarrio.ariasense.core.snapshot.SnapshotText;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class VisibilityClassifierTest {

    private final AriaEngine engine = new AriaEngine();

    private static SnapshotElement el(String tag) {
        return new SnapshotElement(tag);
    }

    @Test
    void displayNoneHidesWholeSubtree() {
        SnapshotElement inner = el("span").text("x");
        el("div").style(ComputedStyle.display("none")).append(el("p").append(inner));

        assertTrue(engine.isHiddenForAria(inner));
    }

    @Test
    void ariaHiddenIsCaseInsensitiveAndInherited() {
        SnapshotElement inner = el("button");
        SnapshotElement outer = el("div").attr("aria-hidden", "TRUE").append(inner);

        assertTrue(engine.isHiddenForAria(outer));
        assertTrue(engine.isHiddenForAria(inner));
        assertFalse(engine.isHiddenForAria(el("div").attr("aria-hidden", "false")));
    }

    @Test
    void visibilityHiddenAppliesToElementButChildrenMayOverride() {
        SnapshotElement child = el("span").style(ComputedStyle.of("inline", "visible"));
        SnapshotElement parent = el("div").style(ComputedStyle.of("block", "hidden")).append(child);

        assertTrue(engine.isHiddenForAria(parent));
        assertFalse(engine.isHiddenForAria(child));
        assertTrue(engine.isHiddenForAria(el("span").style(ComputedStyle.of("inline", "collapse"))));
    }

    @Test
    void nonRenderedTagsAreAlwaysHidden() {
        assertTrue(engine.isHiddenForAria(el("script")));
        assertTrue(engine.isHiddenForAria(el("style").style(ComputedStyle.display("block"))));
        assertTrue(engine.isHiddenForAria(el("template")));
        assertTrue(engine.isHiddenForAria(el("noscript")));
    }

    @Test
    void displayContentsIsVisibleOnlyThroughItsChildren() {
        SnapshotElement withText = el("div").style(ComputedStyle.display("contents")).text("hello");
        SnapshotElement withInvisibleText = el("div").style(ComputedStyle.display("contents"))
                .append(new SnapshotText("hello", false));
        SnapshotElement withHiddenChild = el("div").style(ComputedStyle.display("contents"))
                .append(el("span").attr("aria-hidden", "true"));
        SnapshotElement withVisibleChild = el("div").style(ComputedStyle.display("contents"))
                .append(el("span"));

        assertFalse(engine.isHiddenForAria(withText));
        assertTrue(engine.isHiddenForAria(withInvisibleText));
        assertTrue(engine.isHiddenForAria(withHiddenChild));
        assertFalse(engine.isHiddenForAria(withVisibleChild));
        assertTrue(engine.isHiddenForAria(el("div").style(ComputedStyle.display("contents"))));
    }

    @Test
    void lightChildOfShadowHostIsHiddenUnlessSlotted() {
        SnapshotElement slotted = el("span").attr("slot", "label");
        SnapshotElement unslotted = el("span").attr("slot", "missing");
        SnapshotElement defaultSlotted = el("em");
        SnapshotElement host = el("div").append(slotted, unslotted, defaultSlotted);
        host.attachShadow().append(el("slot").attr("name", "label"), el("slot"));

        assertFalse(engine.isHiddenForAria(slotted));
        assertTrue(engine.isHiddenForAria(unslotted));
        assertFalse(engine.isHiddenForAria(defaultSlotted));
    }

    @Test
    void hostWithoutSlotsHidesAllLightChildren() {
        SnapshotElement child = el("span");
        SnapshotElement host = el("div").append(child);
        host.attachShadow().append(el("p"));

        assertTrue(engine.isHiddenForAria(child));
    }

    @Test
    void optionInsideSelectIgnoresVisibility() {
        SnapshotElement option = el("option").style(ComputedStyle.of("block", "hidden"));
        el("select").append(option);
        SnapshotElement looseOption = el("option").style(ComputedStyle.of("block", "hidden"));

        assertFalse(engine.isHiddenForAria(option));
        assertTrue(engine.isHiddenForAria(looseOption));
    }

    @Test
    void contentVisibilityHiddenHidesDescendantsOnly() {
        SnapshotElement inner = el("span");
        SnapshotElement outer = el("div").style(new ComputedStyle("block", "visible", "hidden", "")).append(inner);

        assertFalse(engine.isHiddenForAria(outer));
        assertTrue(engine.isHiddenForAria(inner));
    }

    @Test
    void elementWithoutComputedStyleIsHidden() {
        assertTrue(engine.isHiddenForAria(el("div").style(null)));
    }
}
