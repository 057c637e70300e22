package io.hearthwarrio.ariasense.core.snapshot;

import io.hearthwarrio.ariasense.core.dom.ComputedStyle;
import io.hearthwarrio.ariasense.core.dom.DomElement;
import io.hearthwarrio.ariasense.core.dom.DomNode;
import io.hearthwarrio.ariasense.core.dom.DomScope;
import io.hearthwarrio.ariasense.core.dom.PseudoElement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Element of an in-memory DOM snapshot.
 * <p>
 * Built either by {@link DomSnapshotReader} from browser output, or by hand:
 * <pre>{@code
 * SnapshotElement label = new SnapshotElement("label").attr("for", "user").text("User name");
 * SnapshotElement input = new SnapshotElement("input").attr("id", "user");
 * }</pre>
 * Native state (value, checked, selected, open, size) defaults to what the attributes say, the way a freshly
 * parsed page would report it; explicit setters override it with live browser state.
 */
public class SnapshotElement extends SnapshotNode implements DomElement {

    private static final Set<String> INPUT_TYPES = Set.of(
            "button", "checkbox", "color", "date", "datetime-local", "email", "file", "hidden", "image", "month",
            "number", "password", "radio", "range", "reset", "search", "submit", "tel", "text", "time", "url", "week"
    );

    private static final Set<String> LABELABLE_TAGS = Set.of(
            "BUTTON", "INPUT", "METER", "OUTPUT", "PROGRESS", "SELECT", "TEXTAREA"
    );

    private final String tagName;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final List<SnapshotNode> children = new ArrayList<>();
    private final Map<PseudoElement, ComputedStyle> pseudoStyles = new EnumMap<>(PseudoElement.class);

    private ComputedStyle style;
    private SnapshotShadowRoot shadowRoot;
    private int ref = -1;

    private String value;
    private Boolean checked;
    private boolean indeterminate;
    private Boolean selected;
    private Boolean open;
    private Integer size;

    /**
     * @param tagName tag name in any case
     */
    public SnapshotElement(String tagName) {
        Objects.requireNonNull(tagName, "tagName must not be null");
        if (tagName.isBlank()) {
            throw new IllegalArgumentException("tagName must not be blank");
        }
        this.tagName = tagName.trim().toUpperCase(Locale.ROOT);
        this.style = ComputedStyle.defaultFor(this.tagName);
    }

    // ----------- building -----------

    public SnapshotElement attr(String name, String value) {
        Objects.requireNonNull(name, "name must not be null");
        if (value == null) {
            attributes.remove(name);
        } else {
            attributes.put(name, value);
        }
        invalidateScope();
        return this;
    }

    /**
     * Replaces the computed style; {@code null} marks the element as not rendered.
     */
    public SnapshotElement style(ComputedStyle style) {
        this.style = style;
        return this;
    }

    public SnapshotElement pseudo(PseudoElement pseudo, ComputedStyle style) {
        Objects.requireNonNull(pseudo, "pseudo must not be null");
        if (style == null) {
            pseudoStyles.remove(pseudo);
        } else {
            pseudoStyles.put(pseudo, style);
        }
        return this;
    }

    public SnapshotElement append(SnapshotNode... nodes) {
        for (SnapshotNode n : nodes) {
            Objects.requireNonNull(n, "node must not be null");
            n.attachTo(this);
            children.add(n);
        }
        invalidateScope();
        return this;
    }

    private void invalidateScope() {
        SnapshotScope scope = scope();
        if (scope != null) {
            scope.invalidate();
        }
    }

    /**
     * Appends a visible text node.
     */
    public SnapshotElement text(String text) {
        return append(new SnapshotText(text));
    }

    /**
     * Attaches an open shadow root.
     *
     * @return the new shadow root
     * @throws IllegalStateException when a shadow root is already attached
     */
    public SnapshotShadowRoot attachShadow() {
        if (shadowRoot != null) {
            throw new IllegalStateException("Shadow root already attached to " + this);
        }
        shadowRoot = new SnapshotShadowRoot(this);
        return shadowRoot;
    }

    /**
     * Index of the browser element this snapshot element was read from, or -1.
     */
    public SnapshotElement ref(int ref) {
        this.ref = ref;
        return this;
    }

    public SnapshotElement value(String value) {
        this.value = value;
        return this;
    }

    public SnapshotElement checked(boolean checked) {
        this.checked = checked;
        return this;
    }

    public SnapshotElement indeterminate(boolean indeterminate) {
        this.indeterminate = indeterminate;
        return this;
    }

    public SnapshotElement selected(boolean selected) {
        this.selected = selected;
        return this;
    }

    public SnapshotElement open(boolean open) {
        this.open = open;
        return this;
    }

    public SnapshotElement size(int size) {
        this.size = size;
        return this;
    }

    // ----------- reading -----------

    public int getRef() {
        return ref;
    }

    public List<SnapshotNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public SnapshotShadowRoot getShadowRoot() {
        return shadowRoot;
    }

    public Map<String, String> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    @Override
    public String getTagName() {
        return tagName;
    }

    @Override
    public boolean isInSvg() {
        for (SnapshotElement p = parentOrHost(); p != null; p = p.parentOrHost()) {
            if ("SVG".equals(p.tagName)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String getAttribute(String name) {
        return attributes.get(name);
    }

    @Override
    public ComputedStyle getComputedStyle() {
        return style;
    }

    @Override
    public ComputedStyle getPseudoStyle(PseudoElement pseudo) {
        return pseudoStyles.get(pseudo);
    }

    @Override
    public DomElement getParentElement() {
        return getParent();
    }

    @Override
    public DomElement getParentElementOrShadowHost() {
        return parentOrHost();
    }

    private SnapshotElement parentOrHost() {
        if (getParent() != null) {
            return getParent();
        }
        SnapshotScope owner = getOwner();
        if (owner instanceof SnapshotShadowRoot) {
            return ((SnapshotShadowRoot) owner).getHost();
        }
        return null;
    }

    @Override
    public List<DomNode> getChildNodes() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public boolean hasShadowRoot() {
        return shadowRoot != null;
    }

    @Override
    public List<DomNode> getShadowRootChildNodes() {
        if (shadowRoot == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(shadowRoot.getChildren());
    }

    @Override
    public List<DomNode> getAssignedNodes() {
        if (!"SLOT".equals(tagName)) {
            return Collections.emptyList();
        }
        SnapshotScope scope = scope();
        if (!(scope instanceof SnapshotShadowRoot)) {
            return Collections.emptyList();
        }
        SnapshotShadowRoot root = (SnapshotShadowRoot) scope;
        List<DomNode> out = new ArrayList<>();
        for (SnapshotNode n : root.getHost().getChildren()) {
            if (root.findSlotFor(n) == this) {
                out.add(n);
            }
        }
        return out;
    }

    @Override
    public DomScope getEnclosingScope() {
        return scope();
    }

    boolean isLabelable() {
        if ("INPUT".equals(tagName)) {
            return !"hidden".equals(getInputType());
        }
        return LABELABLE_TAGS.contains(tagName);
    }

    @Override
    public List<DomElement> getLabels() {
        SnapshotScope scope = scope();
        if (scope == null || !isLabelable()) {
            return Collections.emptyList();
        }
        return scope.labelsOf(this);
    }

    @Override
    public String getValue() {
        if (value != null) {
            return value;
        }
        if ("INPUT".equals(tagName)) {
            String v = attributes.get("value");
            return v == null ? "" : v;
        }
        if ("TEXTAREA".equals(tagName)) {
            return getTextContent();
        }
        if ("SELECT".equals(tagName)) {
            List<DomElement> selectedOptions = getSelectedOptions();
            if (selectedOptions.isEmpty()) {
                return "";
            }
            DomElement option = selectedOptions.get(0);
            String v = option.getAttribute("value");
            return v == null ? option.getTextContent() : v;
        }
        return "";
    }

    @Override
    public String getInputType() {
        if (!"INPUT".equals(tagName)) {
            return "";
        }
        String type = attributes.get("type");
        if (type == null) {
            return "text";
        }
        String t = type.trim().toLowerCase(Locale.ROOT);
        return INPUT_TYPES.contains(t) ? t : "text";
    }

    @Override
    public boolean isChecked() {
        return checked != null ? checked : attributes.containsKey("checked");
    }

    @Override
    public boolean isIndeterminate() {
        return indeterminate;
    }

    @Override
    public boolean isSelected() {
        if (!"OPTION".equals(tagName)) {
            return false;
        }
        if (hasExplicitSelectedness()) {
            return isExplicitlySelected();
        }
        // a single-choice select with nothing selected displays its first enabled option
        SnapshotElement select = owningSelect();
        if (select == null || select.isMultiChoice()) {
            return false;
        }
        for (SnapshotElement option : select.optionElements()) {
            if (option.hasExplicitSelectedness() && option.isExplicitlySelected()) {
                return false;
            }
        }
        for (SnapshotElement option : select.optionElements()) {
            if (!option.attributes.containsKey("disabled")) {
                return option == this;
            }
        }
        return false;
    }

    private boolean hasExplicitSelectedness() {
        return selected != null || attributes.containsKey("selected");
    }

    private boolean isExplicitlySelected() {
        return selected != null ? selected : attributes.containsKey("selected");
    }

    private SnapshotElement owningSelect() {
        for (SnapshotElement p = getParent(); p != null; p = p.getParent()) {
            if ("SELECT".equals(p.tagName)) {
                return p;
            }
        }
        return null;
    }

    private boolean isMultiChoice() {
        return attributes.containsKey("multiple") || getSize() > 1;
    }

    @Override
    public boolean isOpen() {
        return open != null ? open : attributes.containsKey("open");
    }

    @Override
    public int getSize() {
        if (size != null) {
            return size;
        }
        String raw = attributes.get("size");
        if (raw == null) {
            return 0;
        }
        try {
            return Math.max(0, Integer.parseInt(raw.trim()));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    @Override
    public List<DomElement> getOptions() {
        return new ArrayList<>(optionElements());
    }

    private List<SnapshotElement> optionElements() {
        if (!"SELECT".equals(tagName)) {
            return Collections.emptyList();
        }
        List<SnapshotElement> out = new ArrayList<>();
        collectOptions(this, out);
        return out;
    }

    private static void collectOptions(SnapshotElement element, List<SnapshotElement> out) {
        for (SnapshotNode child : element.children) {
            if (child instanceof SnapshotElement) {
                SnapshotElement e = (SnapshotElement) child;
                if ("OPTION".equals(e.tagName)) {
                    out.add(e);
                } else {
                    collectOptions(e, out);
                }
            }
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("<").append(tagName.toLowerCase(Locale.ROOT));
        for (Map.Entry<String, String> a : attributes.entrySet()) {
            sb.append(' ').append(a.getKey()).append("=\"").append(a.getValue()).append('"');
        }
        return sb.append('>').toString();
    }
}
