package io.hearthwarrio.ariasense.core.snapshot;

import io.hearthwarrio.ariasense.core.dom.ComputedStyle;
import io.hearthwarrio.ariasense.core.dom.PseudoElement;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds a {@link SnapshotDocument} from the nested {@code Map}/{@code List} structure produced by the browser
 * serializer (the shape a {@code JavascriptExecutor} returns for a JSON-like object).
 * <p>
 * Node format:
 * <ul>
 *   <li>element: {@code {t: "e", tag, attrs: {..}, style: {display, visibility, contentVisibility},
 *   before: {display, content}, after: {..}, children: [..], shadow: [..], ref, value, checked, indeterminate,
 *   selected, open, size}}</li>
 *   <li>text: {@code {t: "t", text, visible}}</li>
 * </ul>
 * Every key except {@code t} and {@code tag} is optional. Missing style falls back to user-agent defaults.
 */
public class DomSnapshotReader {

    /**
     * @param root map with a {@code children} list of top-level nodes (usually just the html element)
     * @return document
     * @throws IllegalArgumentException for structurally invalid input
     */
    public SnapshotDocument read(Map<?, ?> root) {
        Objects.requireNonNull(root, "root must not be null");
        SnapshotDocument document = new SnapshotDocument();
        for (Object child : list(root.get("children"), "children")) {
            document.append(readNode(child));
        }
        return document;
    }

    SnapshotNode readNode(Object raw) {
        if (!(raw instanceof Map)) {
            throw new IllegalArgumentException("Snapshot node must be an object, got: " + raw);
        }
        Map<?, ?> node = (Map<?, ?>) raw;
        String type = string(node.get("t"));
        if ("t".equals(type)) {
            Object visible = node.get("visible");
            return new SnapshotText(string(node.get("text")), !(visible instanceof Boolean) || (Boolean) visible);
        }
        if ("e".equals(type)) {
            return readElement(node);
        }
        throw new IllegalArgumentException("Unknown snapshot node type: '" + type + "'");
    }

    private SnapshotElement readElement(Map<?, ?> node) {
        String tag = string(node.get("tag"));
        if (tag.isBlank()) {
            throw new IllegalArgumentException("Snapshot element without tag: " + node);
        }
        SnapshotElement element = new SnapshotElement(tag);

        Object attrs = node.get("attrs");
        if (attrs instanceof Map) {
            for (Map.Entry<?, ?> a : ((Map<?, ?>) attrs).entrySet()) {
                if (a.getKey() != null && a.getValue() != null) {
                    element.attr(String.valueOf(a.getKey()), String.valueOf(a.getValue()));
                }
            }
        }

        Object style = node.get("style");
        if (style instanceof Map) {
            Map<?, ?> s = (Map<?, ?>) style;
            element.style(new ComputedStyle(
                    stringOrNull(s.get("display")),
                    stringOrNull(s.get("visibility")),
                    stringOrNull(s.get("contentVisibility")),
                    ""
            ));
        }
        readPseudo(element, PseudoElement.BEFORE, node.get("before"));
        readPseudo(element, PseudoElement.AFTER, node.get("after"));

        Object ref = node.get("ref");
        if (ref instanceof Number) {
            element.ref(((Number) ref).intValue());
        }
        if (node.get("value") != null) {
            element.value(string(node.get("value")));
        }
        if (node.get("checked") instanceof Boolean) {
            element.checked((Boolean) node.get("checked"));
        }
        if (node.get("indeterminate") instanceof Boolean) {
            element.indeterminate((Boolean) node.get("indeterminate"));
        }
        if (node.get("selected") instanceof Boolean) {
            element.selected((Boolean) node.get("selected"));
        }
        if (node.get("open") instanceof Boolean) {
            element.open((Boolean) node.get("open"));
        }
        if (node.get("size") instanceof Number) {
            element.size(((Number) node.get("size")).intValue());
        }

        if (node.get("shadow") != null) {
            SnapshotShadowRoot shadow = element.attachShadow();
            for (Object child : list(node.get("shadow"), "shadow")) {
                shadow.append(readNode(child));
            }
        }
        if (node.get("children") != null) {
            for (Object child : list(node.get("children"), "children")) {
                element.append(readNode(child));
            }
        }
        return element;
    }

    private static void readPseudo(SnapshotElement element, PseudoElement pseudo, Object raw) {
        if (!(raw instanceof Map)) {
            return;
        }
        Map<?, ?> p = (Map<?, ?>) raw;
        element.pseudo(pseudo, ComputedStyle.pseudo(stringOrNull(p.get("display")), string(p.get("content"))));
    }

    private static List<?> list(Object raw, String key) {
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List)) {
            throw new IllegalArgumentException("'" + key + "' must be a list, got: " + raw);
        }
        return (List<?>) raw;
    }

    private static String string(Object v) {
        return v == null ? "" : String.valueOf(v);
    }

    private static String stringOrNull(Object v) {
        return v == null ? null : String.valueOf(v);
    }
}
