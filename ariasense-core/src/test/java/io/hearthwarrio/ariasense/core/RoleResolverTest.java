package io.hearthwarrio.ariasense.core;

import io.hearthwarrio.ariasense.core.snapshot.SnapshotDocument;
import io.hearthwarrio.ariasense.core.snapshot.SnapshotElement;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RoleResolverTest {

    private final AriaEngine engine = new AriaEngine();

    private static SnapshotElement el(String tag) {
        return new SnapshotElement(tag);
    }

    @Test
    void explicitRoleIsFirstValidToken() {
        assertEquals(AriaRole.BUTTON, engine.getRole(el("div").attr("role", "foo button link")));
        assertEquals(AriaRole.CHECKBOX, engine.getRole(el("div").attr("role", "widget checkbox")));
    }

    @Test
    void abstractOrUnknownRoleFallsBackToImplicitRole() {
        assertNull(engine.getRole(el("div").attr("role", "widget")));
        assertEquals(AriaRole.BUTTON, engine.getRole(el("button").attr("role", "Button")));
    }

    @Test
    void anchorIsLinkOnlyWithHref() {
        assertEquals(AriaRole.LINK, engine.getRole(el("a").attr("href", "/home")));
        assertNull(engine.getRole(el("a")));
    }

    @Test
    void inputRoleDependsOnType() {
        assertEquals(AriaRole.TEXTBOX, engine.getRole(el("input")));
        assertEquals(AriaRole.TEXTBOX, engine.getRole(el("input").attr("type", "whatever")));
        assertEquals(AriaRole.TEXTBOX, engine.getRole(el("input").attr("type", "password")));
        assertEquals(AriaRole.CHECKBOX, engine.getRole(el("input").attr("type", "CheckBox")));
        assertEquals(AriaRole.SLIDER, engine.getRole(el("input").attr("type", "range")));
        assertEquals(AriaRole.SPINBUTTON, engine.getRole(el("input").attr("type", "number")));
        assertEquals(AriaRole.BUTTON, engine.getRole(el("input").attr("type", "image")));
        assertEquals(AriaRole.SEARCHBOX, engine.getRole(el("input").attr("type", "search")));
        assertNull(engine.getRole(el("input").attr("type", "hidden")));
    }

    @Test
    void textInputWithDatalistIsCombobox() {
        SnapshotElement withList = el("input").attr("list", "fruits");
        SnapshotElement withMissingList = el("input").attr("list", "nothing");
        new SnapshotDocument().append(el("body").append(
                withList,
                withMissingList,
                el("datalist").attr("id", "fruits")
        ));

        assertEquals(AriaRole.COMBOBOX, engine.getRole(withList));
        assertEquals(AriaRole.TEXTBOX, engine.getRole(withMissingList));
    }

    @Test
    void selectIsListboxWhenMultipleOrSized() {
        assertEquals(AriaRole.COMBOBOX, engine.getRole(el("select")));
        assertEquals(AriaRole.LISTBOX, engine.getRole(el("select").attr("multiple", "")));
        assertEquals(AriaRole.LISTBOX, engine.getRole(el("select").attr("size", "4")));
        assertEquals(AriaRole.COMBOBOX, engine.getRole(el("select").attr("size", "1")));
    }

    @Test
    void listItemInheritsPresentationFromList() {
        SnapshotElement item = el("li").text("one");
        SnapshotElement list = el("ul").attr("role", "presentation").append(item);

        assertEquals(AriaRole.PRESENTATION, engine.getRole(list));
        assertEquals(AriaRole.PRESENTATION, engine.getRole(item));
    }

    @Test
    void globalAriaAttributeCancelsPresentation() {
        SnapshotElement item = el("li").text("one");
        el("ul").attr("role", "none").attr("aria-label", "Steps").append(item);

        assertEquals(AriaRole.LISTITEM, engine.getRole(item));
        assertEquals(AriaRole.BUTTON, engine.getRole(el("button").attr("role", "none").attr("aria-describedby", "x")));
        assertEquals(AriaRole.NONE, engine.getRole(el("button").attr("role", "none")));
    }

    @Test
    void presentationInheritanceStopsAtUnrelatedParent() {
        SnapshotElement item = el("li");
        el("ul").attr("role", "presentation").append(el("div").append(item));

        assertEquals(AriaRole.LISTITEM, engine.getRole(item));
    }

    @Test
    void tableCellsFollowTableRole() {
        SnapshotElement td = el("td");
        SnapshotElement colHeader = el("th").attr("scope", "col");
        SnapshotElement rowHeader = el("th").attr("scope", "row");
        el("table").append(el("tbody").append(el("tr").append(colHeader, rowHeader, td)));

        SnapshotElement gridCell = el("td");
        el("table").attr("role", "grid").append(el("tr").append(gridCell));

        assertEquals(AriaRole.CELL, engine.getRole(td));
        assertEquals(AriaRole.COLUMNHEADER, engine.getRole(colHeader));
        assertEquals(AriaRole.ROWHEADER, engine.getRole(rowHeader));
        assertEquals(AriaRole.GRIDCELL, engine.getRole(gridCell));
    }

    @Test
    void headerIsBannerOnlyOutsideSectioningContent() {
        SnapshotElement topHeader = el("header");
        SnapshotElement articleHeader = el("header");
        SnapshotElement regionFooter = el("footer");
        el("body").append(
                topHeader,
                el("article").append(articleHeader),
                el("div").attr("role", "region").append(regionFooter)
        );

        assertEquals(AriaRole.BANNER, engine.getRole(topHeader));
        assertNull(engine.getRole(articleHeader));
        assertNull(engine.getRole(regionFooter));
    }

    @Test
    void landmarkSuppressionCrossesShadowBoundary() {
        SnapshotElement footer = el("footer");
        SnapshotElement host = el("div");
        host.attachShadow().append(footer);
        el("nav").append(host);

        assertNull(engine.getRole(footer));
    }

    @Test
    void imageWithEmptyAltIsPresentationUnlessFocusableOrAnnotated() {
        assertEquals(AriaRole.PRESENTATION, engine.getRole(el("img").attr("alt", "")));
        assertEquals(AriaRole.IMG, engine.getRole(el("img").attr("alt", "").attr("tabindex", "0")));
        assertEquals(AriaRole.IMG, engine.getRole(el("img").attr("alt", "").attr("aria-label", "Logo")));
        assertEquals(AriaRole.IMG, engine.getRole(el("img").attr("alt", "Logo")));
        assertEquals(AriaRole.IMG, engine.getRole(el("img")));
    }

    @Test
    void prefixedIntegerTabIndexCountsAsNumeric() {
        assertEquals(AriaRole.IMG, engine.getRole(el("img").attr("alt", "").attr("tabindex", "0x1")));
        assertEquals(AriaRole.IMG, engine.getRole(el("img").attr("alt", "").attr("tabindex", "0b10")));
        assertEquals(AriaRole.IMG, engine.getRole(el("img").attr("alt", "").attr("tabindex", "0o7")));
        assertEquals(AriaRole.PRESENTATION, engine.getRole(el("img").attr("alt", "").attr("tabindex", "0x1g")));
        assertEquals(AriaRole.PRESENTATION, engine.getRole(el("img").attr("alt", "").attr("tabindex", "1d")));
    }

    @Test
    void sectionAndFormNeedAName() {
        assertNull(engine.getRole(el("section")));
        assertEquals(AriaRole.REGION, engine.getRole(el("section").attr("aria-label", "News")));
        assertNull(engine.getRole(el("form")));
        assertEquals(AriaRole.FORM, engine.getRole(el("form").attr("aria-labelledby", "t")));
    }

    @Test
    void phrasingElementsWithoutMappingHaveNoRole() {
        assertNull(engine.getRole(el("span")));
        assertNull(engine.getRole(el("div")));
    }
}
