package io.hearthwarrio.ariasense.core.snapshot;

import io.hearthwarrio.ariasense.core.dom.DomText;

/**
 * Text node of a snapshot.
 */
public class SnapshotText extends SnapshotNode implements DomText {

    private final String text;
    private final boolean visible;

    public SnapshotText(String text) {
        this(text, true);
    }

    /**
     * @param text    raw text
     * @param visible whether the text has a non-empty layout box
     */
    public SnapshotText(String text, boolean visible) {
        this.text = text == null ? "" : text;
        this.visible = visible;
    }

    @Override
    public String getText() {
        return text;
    }

    @Override
    public boolean isVisible() {
        return visible;
    }

    @Override
    public String toString() {
        return "#text \"" + text + '"';
    }
}
