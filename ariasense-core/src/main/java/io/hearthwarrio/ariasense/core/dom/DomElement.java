package io.hearthwarrio.ariasense.core.dom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Element of the rendered tree together with the style, shadow-tree and native form state the
 * accessibility engine needs.
 * <p>
 * Implementations are read-only views. Methods returning lists never return null.
 */
public interface DomElement extends DomNode {

    /**
     * Returns the upper-case tag name, for SVG elements as well (for example {@code "SVG"}, {@code "TITLE"}).
     *
     * @return upper-case tag name
     */
    String getTagName();

    /**
     * Whether this element lives inside an {@code <svg>} element (the svg root itself excluded).
     *
     * @return true for SVG descendants
     */
    boolean isInSvg();

    /**
     * @param name attribute name
     * @return attribute value, or null when the attribute is absent
     */
    String getAttribute(String name);

    default boolean hasAttribute(String name) {
        return getAttribute(name) != null;
    }

    /**
     * @return computed style, or null when the element is not rendered (for example detached)
     */
    ComputedStyle getComputedStyle();

    /**
     * @param pseudo pseudo-element
     * @return computed style of the pseudo-element, or null when it does not exist
     */
    ComputedStyle getPseudoStyle(PseudoElement pseudo);

    /**
     * @return light-tree parent element, or null for the root and for the top-level nodes of a shadow tree
     */
    DomElement getParentElement();

    /**
     * @return light-tree parent, or the shadow host for top-level nodes of a shadow tree
     */
    DomElement getParentElementOrShadowHost();

    /**
     * @return light-tree child nodes in document order
     */
    List<DomNode> getChildNodes();

    default List<DomElement> getChildElements() {
        List<DomElement> out = new ArrayList<>();
        for (DomNode n : getChildNodes()) {
            if (n instanceof DomElement) {
                out.add((DomElement) n);
            }
        }
        return out;
    }

    boolean hasShadowRoot();

    /**
     * @return top-level nodes of the attached shadow root, empty when there is none
     */
    List<DomNode> getShadowRootChildNodes();

    /**
     * @return nodes assigned to this slot element; empty for non-slot elements
     */
    default List<DomNode> getAssignedNodes() {
        return Collections.emptyList();
    }

    /**
     * @return enclosing shadow root or document, or null when detached
     */
    DomScope getEnclosingScope();

    /**
     * @return associated {@code <label>} elements in tree order; empty for non-labelable elements
     */
    List<DomElement> getLabels();

    // ----------- native state -----------

    /**
     * @return current value of input/textarea/select, empty string otherwise
     */
    String getValue();

    /**
     * @return normalized input type (lower-case; missing or unknown types report {@code "text"}), empty for non-inputs
     */
    String getInputType();

    boolean isChecked();

    boolean isIndeterminate();

    /**
     * @return selectedness of an option element
     */
    boolean isSelected();

    /**
     * @return open state of a details/dialog element
     */
    boolean isOpen();

    /**
     * @return display size of a select element (0 when not specified)
     */
    int getSize();

    /**
     * @return options of a select element in tree order
     */
    List<DomElement> getOptions();

    /**
     * @return currently selected options of a select element
     */
    default List<DomElement> getSelectedOptions() {
        List<DomElement> out = new ArrayList<>();
        for (DomElement option : getOptions()) {
            if (option.isSelected()) {
                out.add(option);
            }
        }
        return out;
    }

    /**
     * @return concatenated text of all light-tree descendant text nodes
     */
    default String getTextContent() {
        StringBuilder sb = new StringBuilder();
        for (DomNode n : getChildNodes()) {
            if (n instanceof DomText) {
                sb.append(((DomText) n).getText());
            } else if (n instanceof DomElement) {
                sb.append(((DomElement) n).getTextContent());
            }
        }
        return sb.toString();
    }
}
