package org.dxworks.specdocx.markup;

import java.util.Arrays;
import java.util.List;

public final class MarkupElement implements MarkupNode {

    private final Tag tag;
    private final List<MarkupNode> children;

    public MarkupElement(Tag tag, List<MarkupNode> children) {
        if (tag == null) {
            throw new IllegalArgumentException("Tag must not be null");
        }
        this.tag = tag;
        this.children = List.copyOf(children);
    }

    public static MarkupElement of(Tag tag, MarkupNode... children) {
        return new MarkupElement(tag, Arrays.asList(children));
    }

    /** Element holding a single text node. */
    public static MarkupElement of(Tag tag, String text) {
        return new MarkupElement(tag, List.of(new MarkupText(text)));
    }

    public Tag getTag() {
        return tag;
    }

    public List<MarkupNode> getChildren() {
        return children;
    }

    @Override
    public boolean isBlank() {
        return false;
    }

    @Override
    public String toString() {
        return tag + children.toString();
    }
}
