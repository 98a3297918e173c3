package org.dxworks.specdocx.model;

import java.util.Objects;

/**
 * Smallest piece of run content: a piece of text or one of the control
 * segments (line break, page break, tab).
 */
public final class Segment {

    public enum Kind {
        TEXT,
        LINE_BREAK,
        PAGE_BREAK,
        TAB
    }

    private static final Segment LINE_BREAK = new Segment(Kind.LINE_BREAK, null, false);
    private static final Segment PAGE_BREAK = new Segment(Kind.PAGE_BREAK, null, false);
    private static final Segment TAB = new Segment(Kind.TAB, null, false);

    private final Kind kind;
    private final String text;
    private final boolean preserveSpace;

    private Segment(Kind kind, String text, boolean preserveSpace) {
        this.kind = kind;
        this.text = text;
        this.preserveSpace = preserveSpace;
    }

    /**
     * Text segment. Leading or trailing whitespace marks the segment as
     * space-preserving so the writer keeps it in the container format.
     */
    public static Segment text(String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Text segment must not be empty");
        }
        boolean preserve = Character.isWhitespace(text.charAt(0))
                || Character.isWhitespace(text.charAt(text.length() - 1));
        return new Segment(Kind.TEXT, text, preserve);
    }

    public static Segment lineBreak() {
        return LINE_BREAK;
    }

    public static Segment pageBreak() {
        return PAGE_BREAK;
    }

    public static Segment tab() {
        return TAB;
    }

    public Kind getKind() {
        return kind;
    }

    /** Null for every kind except {@link Kind#TEXT}. */
    public String getText() {
        return text;
    }

    public boolean isPreserveSpace() {
        return preserveSpace;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Segment other)) return false;
        return kind == other.kind && Objects.equals(text, other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text);
    }

    @Override
    public String toString() {
        return kind == Kind.TEXT ? "\"" + text + "\"" : kind.name();
    }
}
