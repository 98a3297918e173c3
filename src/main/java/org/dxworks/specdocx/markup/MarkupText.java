package org.dxworks.specdocx.markup;

public final class MarkupText implements MarkupNode {

    private final String text;

    public MarkupText(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Text must not be null");
        }
        this.text = text;
    }

    public String getText() {
        return text;
    }

    @Override
    public boolean isBlank() {
        return text.isBlank();
    }

    @Override
    public String toString() {
        return "\"" + text + "\"";
    }
}
