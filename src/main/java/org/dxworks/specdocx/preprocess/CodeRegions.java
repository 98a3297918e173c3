package org.dxworks.specdocx.preprocess;

import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.Code;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Node;
import org.commonmark.node.SourceSpan;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Character ranges of a Markdown source that hold code: fenced and indented
 * code blocks (whole lines, fences included) and inline code spans. Located
 * from commonmark source spans, so they agree with what the markup tree is
 * later built from.
 */
final class CodeRegions {

    private static final Parser PARSER = Parser.builder()
            .includeSourceSpans(IncludeSourceSpans.BLOCKS_AND_INLINES)
            .build();

    // sorted, non-overlapping [start, end) pairs
    private final List<int[]> ranges;

    private CodeRegions(List<int[]> ranges) {
        this.ranges = ranges;
    }

    static CodeRegions of(String source) {
        int[] lineStarts = lineStarts(source);
        List<int[]> found = new ArrayList<>();
        PARSER.parse(source).accept(new AbstractVisitor() {
            @Override
            public void visit(FencedCodeBlock fencedCodeBlock) {
                addWholeLines(fencedCodeBlock);
            }

            @Override
            public void visit(IndentedCodeBlock indentedCodeBlock) {
                addWholeLines(indentedCodeBlock);
            }

            @Override
            public void visit(Code code) {
                for (SourceSpan span : code.getSourceSpans()) {
                    int start = lineStarts[span.getLineIndex()] + span.getColumnIndex();
                    found.add(new int[]{start, start + span.getLength()});
                }
            }

            private void addWholeLines(Node block) {
                List<SourceSpan> spans = block.getSourceSpans();
                if (spans.isEmpty()) {
                    return;
                }
                int firstLine = spans.get(0).getLineIndex();
                int lastLine = spans.get(spans.size() - 1).getLineIndex();
                int end = lastLine + 1 < lineStarts.length ? lineStarts[lastLine + 1] : source.length();
                found.add(new int[]{lineStarts[firstLine], end});
            }
        });
        return new CodeRegions(merge(found));
    }

    boolean contains(int offset) {
        for (int[] range : ranges) {
            if (offset < range[0]) {
                return false;
            }
            if (offset < range[1]) {
                return true;
            }
        }
        return false;
    }

    List<int[]> getRanges() {
        return ranges;
    }

    /** Line start offsets, splitting on the same terminators commonmark does. */
    private static int[] lineStarts(String source) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\r' && i + 1 < source.length() && source.charAt(i + 1) == '\n') {
                i++;
                starts.add(i + 1);
            } else if (c == '\n' || c == '\r') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    private static List<int[]> merge(List<int[]> ranges) {
        ranges.sort(Comparator.comparingInt(range -> range[0]));
        List<int[]> merged = new ArrayList<>();
        for (int[] range : ranges) {
            int[] last = merged.isEmpty() ? null : merged.get(merged.size() - 1);
            if (last != null && range[0] <= last[1]) {
                last[1] = Math.max(last[1], range[1]);
            } else {
                merged.add(new int[]{range[0], range[1]});
            }
        }
        return merged;
    }
}
