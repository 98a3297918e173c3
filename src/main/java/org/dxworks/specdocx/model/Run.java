package org.dxworks.specdocx.model;

import java.util.List;

public final class Run {

    private final List<Segment> segments;
    private final RunAttributes attributes;

    public Run(List<Segment> segments, RunAttributes attributes) {
        this.segments = List.copyOf(segments);
        this.attributes = attributes == null ? RunAttributes.PLAIN : attributes;
    }

    public List<Segment> getSegments() {
        return segments;
    }

    public RunAttributes getAttributes() {
        return attributes;
    }

    public boolean hasContent() {
        return !segments.isEmpty();
    }

    /**
     * Concatenated text of the run, breaks rendered as {@code \n} and
     * {@code \f}, tabs as {@code \t}.
     */
    public String plainText() {
        StringBuilder text = new StringBuilder();
        for (Segment segment : segments) {
            switch (segment.getKind()) {
                case TEXT -> text.append(segment.getText());
                case LINE_BREAK -> text.append('\n');
                case PAGE_BREAK -> text.append('\f');
                case TAB -> text.append('\t');
            }
        }
        return text.toString();
    }

    @Override
    public String toString() {
        return "Run" + segments + (attributes.equals(RunAttributes.PLAIN) ? "" : " " + attributes);
    }
}
