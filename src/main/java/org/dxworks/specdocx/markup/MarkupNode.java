package org.dxworks.specdocx.markup;

/**
 * Node of the parsed markup tree: either a {@link MarkupText} or a
 * {@link MarkupElement}. Trees are read-only once built.
 */
public interface MarkupNode {

    /** True for text nodes that contain nothing but whitespace. */
    boolean isBlank();
}
