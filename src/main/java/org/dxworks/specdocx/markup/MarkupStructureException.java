package org.dxworks.specdocx.markup;

/**
 * Raised when the markup uses a construct outside the supported vocabulary or
 * places a known construct where it cannot be converted. Always aborts the
 * whole conversion.
 */
public class MarkupStructureException extends RuntimeException {

    private final String tagName;

    public MarkupStructureException(String tagName, String message) {
        super(message + ": <" + tagName + ">");
        this.tagName = tagName;
    }

    public MarkupStructureException(Tag tag, String message) {
        this(tag.getTagName(), message);
    }

    public String getTagName() {
        return tagName;
    }
}
