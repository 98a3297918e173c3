package org.dxworks.specdocx.converter;

import org.dxworks.specdocx.model.Run;
import org.dxworks.specdocx.model.RunAttributes;
import org.dxworks.specdocx.model.Segment;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lowers a piece of markup text into a {@link Run}: whitespace handling first,
 * then splitting on the control characters that become break segments.
 */
public final class RunBuilder {

    public static final String NOTE_PREFIX = "NOTE ";
    public static final String NOTE_LABEL = "NOTE";

    // Form feed is left alone so it can still become a page break.
    private static final Pattern COLLAPSIBLE_WHITESPACE = Pattern.compile("[ \\t\\n\\x0B\\r]+");
    private static final Pattern NORMALIZED_CONTROL = Pattern.compile("\\f");
    private static final Pattern PRESERVED_CONTROL = Pattern.compile("[\\n\\f\\t]");

    private RunBuilder() {}

    /**
     * Collapses every run of whitespace to a single space. A boundary space is
     * kept as one space rather than trimmed, since it separates this text from
     * the neighbouring run.
     */
    public static Run build(String text, RunAttributes attributes) {
        String bracketed = "[" + text + "]";
        String collapsed = COLLAPSIBLE_WHITESPACE.matcher(bracketed).replaceAll(" ");
        String normalized = collapsed.substring(1, collapsed.length() - 1);
        return new Run(split(normalized, NORMALIZED_CONTROL), attributes);
    }

    /** Keeps the text verbatim; newlines become line breaks and tabs become tab segments. */
    public static Run buildPreserved(String text, RunAttributes attributes) {
        return new Run(split(text, PRESERVED_CONTROL), attributes);
    }

    /**
     * Rewrites a leading {@code "NOTE "} into the {@code NOTE} label followed by
     * a tab. Runs that do not start that way are returned unchanged.
     */
    public static Run withNoteLabel(Run run) {
        List<Segment> segments = run.getSegments();
        if (segments.isEmpty() || segments.get(0).getKind() != Segment.Kind.TEXT) {
            return run;
        }
        String first = segments.get(0).getText();
        if (!first.startsWith(NOTE_PREFIX)) {
            return run;
        }
        List<Segment> rewritten = new ArrayList<>();
        rewritten.add(Segment.text(NOTE_LABEL));
        rewritten.add(Segment.tab());
        String rest = first.substring(NOTE_PREFIX.length());
        if (!rest.isEmpty()) {
            rewritten.add(Segment.text(rest));
        }
        rewritten.addAll(segments.subList(1, segments.size()));
        return new Run(rewritten, run.getAttributes());
    }

    /**
     * Trims whitespace at the outer edges of a block's content: the start of
     * the first run and the end of the last. Runs left empty are dropped.
     */
    public static List<Run> trimBlockEdges(List<Run> runs) {
        List<Run> trimmed = new ArrayList<>(runs);
        while (!trimmed.isEmpty()) {
            Run first = stripEdge(trimmed.get(0), true);
            if (first.hasContent()) {
                trimmed.set(0, first);
                break;
            }
            trimmed.remove(0);
        }
        while (!trimmed.isEmpty()) {
            int last = trimmed.size() - 1;
            Run run = stripEdge(trimmed.get(last), false);
            if (run.hasContent()) {
                trimmed.set(last, run);
                break;
            }
            trimmed.remove(last);
        }
        return trimmed;
    }

    public static boolean startsWithNoteLabel(Run run) {
        List<Segment> segments = run.getSegments();
        return segments.size() >= 2
                && segments.get(0).equals(Segment.text(NOTE_LABEL))
                && segments.get(1).getKind() == Segment.Kind.TAB;
    }

    private static Run stripEdge(Run run, boolean leading) {
        List<Segment> segments = new ArrayList<>(run.getSegments());
        if (segments.isEmpty()) {
            return run;
        }
        int index = leading ? 0 : segments.size() - 1;
        Segment edge = segments.get(index);
        if (edge.getKind() != Segment.Kind.TEXT) {
            return run;
        }
        String text = leading ? edge.getText().stripLeading() : edge.getText().stripTrailing();
        if (text.length() == edge.getText().length()) {
            return run;
        }
        if (text.isEmpty()) {
            segments.remove(index);
        } else {
            segments.set(index, Segment.text(text));
        }
        return new Run(segments, run.getAttributes());
    }

    private static List<Segment> split(String text, Pattern controls) {
        List<Segment> segments = new ArrayList<>();
        Matcher matcher = controls.matcher(text);
        int start = 0;
        while (matcher.find()) {
            addText(segments, text.substring(start, matcher.start()));
            segments.add(controlSegment(text.charAt(matcher.start())));
            start = matcher.end();
        }
        addText(segments, text.substring(start));
        return segments;
    }

    private static void addText(List<Segment> segments, String text) {
        if (!text.isEmpty()) {
            segments.add(Segment.text(text));
        }
    }

    private static Segment controlSegment(char control) {
        return switch (control) {
            case '\n' -> Segment.lineBreak();
            case '\f' -> Segment.pageBreak();
            case '\t' -> Segment.tab();
            default -> throw new IllegalArgumentException("Not a control character: " + (int) control);
        };
    }
}
