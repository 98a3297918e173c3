package org.dxworks.specdocx.markup;

/**
 * Closed vocabulary of markup elements the converter understands. Tag names
 * follow the HTML rendering of the Markdown source.
 */
public enum Tag {
    DOCUMENT("document", Kind.CONTAINER),
    PARAGRAPH("p", Kind.BLOCK),
    HEADING_1("h1", Kind.BLOCK),
    HEADING_2("h2", Kind.BLOCK),
    HEADING_3("h3", Kind.BLOCK),
    HEADING_4("h4", Kind.BLOCK),
    HEADING_5("h5", Kind.BLOCK),
    HEADING_6("h6", Kind.BLOCK),
    UNORDERED_LIST("ul", Kind.BLOCK),
    ORDERED_LIST("ol", Kind.BLOCK),
    LIST_ITEM("li", Kind.LIST_ITEM),
    BLOCKQUOTE("blockquote", Kind.BLOCK),
    PREFORMATTED("pre", Kind.BLOCK),
    HORIZONTAL_RULE("hr", Kind.BLOCK),
    CODE("code", Kind.INLINE),
    EMPHASIS("em", Kind.INLINE),
    STRONG("strong", Kind.INLINE),
    STRONG_CODE("strong-code", Kind.INLINE);

    private enum Kind { CONTAINER, BLOCK, LIST_ITEM, INLINE }

    private final String tagName;
    private final Kind kind;

    Tag(String tagName, Kind kind) {
        this.tagName = tagName;
        this.kind = kind;
    }

    public String getTagName() {
        return tagName;
    }

    public boolean isInline() {
        return kind == Kind.INLINE;
    }

    /** 1-6 for headings, 0 for every other tag. */
    public int headingLevel() {
        return switch (this) {
            case HEADING_1 -> 1;
            case HEADING_2 -> 2;
            case HEADING_3 -> 3;
            case HEADING_4 -> 4;
            case HEADING_5 -> 5;
            case HEADING_6 -> 6;
            default -> 0;
        };
    }

    public static Tag heading(int level) {
        return switch (level) {
            case 1 -> HEADING_1;
            case 2 -> HEADING_2;
            case 3 -> HEADING_3;
            case 4 -> HEADING_4;
            case 5 -> HEADING_5;
            case 6 -> HEADING_6;
            default -> throw new MarkupStructureException("h" + level, "heading level out of range");
        };
    }

    @Override
    public String toString() {
        return "<" + tagName + ">";
    }
}
