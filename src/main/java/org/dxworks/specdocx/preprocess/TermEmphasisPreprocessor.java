package org.dxworks.specdocx.preprocess;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Emphasizes the names an algorithm section introduces (parameters from the
 * heading, "Let x be" aliases, receivers) wherever they occur in that section's
 * body. Runs on the Markdown source, before it is parsed.
 *
 * Sections start at every line beginning with {@code #} outside code; text
 * ahead of the first heading is left untouched. Terms never leak from one
 * section into the next. Code spans and code blocks, fenced or indented, are
 * not rewritten.
 */
public final class TermEmphasisPreprocessor {

    private static final Pattern HEADING_LINE = Pattern.compile("^#.*$", Pattern.MULTILINE);
    private static final Pattern PARENTHESIZED = Pattern.compile("\\(([^)]*)\\)");
    private static final Pattern WORD = Pattern.compile("\\w+");
    private static final Pattern CALLED_ON_OBJECT = Pattern.compile("called on an object (\\w+)");
    private static final Pattern LET_BE = Pattern.compile("\\b(?i:let) (\\w+) be\\b");
    private static final Pattern THIS_VALUE = Pattern.compile("\\bthe this value\\b");

    private TermEmphasisPreprocessor() {}

    public static String preprocess(String source) {
        if (source == null) return null;
        if (!HEADING_LINE.matcher(source).find()) {
            return source;
        }

        CodeRegions code = CodeRegions.of(source);
        List<int[]> headings = new ArrayList<>();
        Matcher heading = HEADING_LINE.matcher(source);
        while (heading.find()) {
            if (!code.contains(heading.start())) {
                headings.add(new int[]{heading.start(), heading.end()});
            }
        }
        if (headings.isEmpty()) {
            return source;
        }

        StringBuilder out = new StringBuilder(source.length() + 64);
        out.append(source, 0, headings.get(0)[0]);
        for (int i = 0; i < headings.size(); i++) {
            int[] line = headings.get(i);
            int bodyEnd = i + 1 < headings.size() ? headings.get(i + 1)[0] : source.length();
            String headingLine = source.substring(line[0], line[1]);
            Set<String> terms = collectTerms(headingLine, source.substring(line[1], bodyEnd));
            Pattern termPattern = terms.isEmpty() ? null : termPattern(terms);

            out.append(headingLine);
            rewriteOutsideCode(source, line[1], bodyEnd, termPattern, code, out);
        }
        return out.toString();
    }

    private static void rewriteOutsideCode(String source, int start, int end, Pattern termPattern,
                                           CodeRegions code, StringBuilder out) {
        int cursor = start;
        for (int[] range : code.getRanges()) {
            if (range[1] <= cursor) {
                continue;
            }
            if (range[0] >= end) {
                break;
            }
            int codeStart = Math.max(range[0], cursor);
            int codeEnd = Math.min(range[1], end);
            out.append(rewriteProse(source.substring(cursor, codeStart), termPattern));
            out.append(source, codeStart, codeEnd);
            cursor = codeEnd;
        }
        out.append(rewriteProse(source.substring(cursor, end), termPattern));
    }

    /**
     * Candidate terms of a section: every word in the heading's first
     * parenthesized group, the object named in "called on an object X", and
     * every X of "Let X be".
     */
    public static Set<String> collectTerms(String headingLine, String body) {
        Set<String> terms = new LinkedHashSet<>();

        Matcher parenthesized = PARENTHESIZED.matcher(headingLine);
        if (parenthesized.find()) {
            Matcher word = WORD.matcher(parenthesized.group(1));
            while (word.find()) {
                terms.add(word.group());
            }
        }

        Matcher calledOn = CALLED_ON_OBJECT.matcher(body);
        while (calledOn.find()) {
            terms.add(calledOn.group(1));
        }

        Matcher let = LET_BE.matcher(body);
        while (let.find()) {
            terms.add(let.group(1));
        }
        return terms;
    }

    private static Pattern termPattern(Set<String> terms) {
        List<String> ordered = new ArrayList<>(terms);
        // Longest first so "len" does not win over "lenValue" in the alternation.
        ordered.sort(Comparator.comparingInt(String::length).reversed());
        String alternation = ordered.stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return Pattern.compile("(?<![\\w*])(?:" + alternation + ")(?![\\w*])");
    }

    private static String rewriteProse(String prose, Pattern termPattern) {
        String result = prose;
        if (termPattern != null) {
            result = termPattern.matcher(result).replaceAll(match -> Matcher.quoteReplacement("*" + match.group() + "*"));
        }
        return THIS_VALUE.matcher(result).replaceAll("the **this** value");
    }
}
