package io.hearthwarrio.ariasense.core.dom;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Subset of the computed style that matters for accessibility.
 * <p>
 * For pseudo-elements {@link #getContent()} holds the serialized {@code content} property
 * (for example {@code "\"foo\""} or {@code none}).
 */
public final class ComputedStyle {

    private static final Set<String> BLOCK_TAGS = Set.of(
            "ADDRESS", "ARTICLE", "ASIDE", "BLOCKQUOTE", "BODY", "DD", "DETAILS", "DIALOG", "DIV", "DL", "DT",
            "FIELDSET", "FIGCAPTION", "FIGURE", "FOOTER", "FORM", "H1", "H2", "H3", "H4", "H5", "H6", "HEADER",
            "HGROUP", "HR", "HTML", "LEGEND", "MAIN", "MENU", "NAV", "OL", "P", "PRE", "SECTION", "SUMMARY", "UL"
    );

    private static final Set<String> NOT_RENDERED_TAGS = Set.of(
            "HEAD", "LINK", "META", "NOSCRIPT", "SCRIPT", "STYLE", "TEMPLATE", "TITLE", "DATALIST"
    );

    private final String display;
    private final String visibility;
    private final String contentVisibility;
    private final String content;

    public ComputedStyle(String display, String visibility, String contentVisibility, String content) {
        this.display = normalize(display, "inline");
        this.visibility = normalize(visibility, "visible");
        this.contentVisibility = normalize(contentVisibility, "visible");
        this.content = content == null ? "" : content;
    }

    public static ComputedStyle of(String display, String visibility) {
        return new ComputedStyle(display, visibility, "visible", "");
    }

    public static ComputedStyle display(String display) {
        return of(display, "visible");
    }

    /**
     * Style of a pseudo-element with the given {@code content} value.
     */
    public static ComputedStyle pseudo(String display, String content) {
        return new ComputedStyle(display, "visible", "visible", content);
    }

    /**
     * User-agent default style for an element whose style was not recorded.
     *
     * @param tagName upper-case tag name
     * @return default style
     */
    public static ComputedStyle defaultFor(String tagName) {
        String tag = tagName == null ? "" : tagName.toUpperCase(Locale.ROOT);
        if (NOT_RENDERED_TAGS.contains(tag)) {
            return display("none");
        }
        if (BLOCK_TAGS.contains(tag)) {
            return display("block");
        }
        switch (tag) {
            case "LI":
                return display("list-item");
            case "TABLE":
                return display("table");
            case "CAPTION":
                return display("table-caption");
            case "THEAD":
                return display("table-header-group");
            case "TBODY":
                return display("table-row-group");
            case "TFOOT":
                return display("table-footer-group");
            case "TR":
                return display("table-row");
            case "TD":
            case "TH":
                return display("table-cell");
            case "BUTTON":
            case "INPUT":
            case "SELECT":
            case "TEXTAREA":
            case "IMG":
            case "METER":
            case "PROGRESS":
                return display("inline-block");
            case "SLOT":
                return display("contents");
            default:
                return display("inline");
        }
    }

    private static String normalize(String v, String fallback) {
        if (v == null || v.isBlank()) {
            return fallback;
        }
        return v.trim().toLowerCase(Locale.ROOT);
    }

    public String getDisplay() {
        return display;
    }

    public String getVisibility() {
        return visibility;
    }

    public String getContentVisibility() {
        return contentVisibility;
    }

    public String getContent() {
        return content;
    }

    @Override
    public String toString() {
        return "ComputedStyle{" +
                "display='" + display + '\'' +
                ", visibility='" + visibility + '\'' +
                ", contentVisibility='" + contentVisibility + '\'' +
                ", content='" + content + '\'' +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ComputedStyle)) return false;
        ComputedStyle that = (ComputedStyle) o;
        return Objects.equals(display, that.display) &&
                Objects.equals(visibility, that.visibility) &&
                Objects.equals(contentVisibility, that.contentVisibility) &&
                Objects.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(display, visibility, contentVisibility, content);
    }
}
