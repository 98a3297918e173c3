package org.dxworks.specdocx.source;

/**
 * Pulls the prose out of a source file: only lines whose trimmed form starts
 * with the annotation prefix are kept, with the prefix and one following space
 * removed.
 */
public final class AnnotatedSourceExtractor {

    public static final String DEFAULT_PREFIX = "//>";

    private final String prefix;

    public AnnotatedSourceExtractor(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("Annotation prefix must not be blank");
        }
        this.prefix = prefix;
    }

    public AnnotatedSourceExtractor() {
        this(DEFAULT_PREFIX);
    }

    public String extract(String sourceCode) {
        // Remove BOM if present
        if (sourceCode.startsWith("\uFEFF")) {
            sourceCode = sourceCode.substring(1);
        }

        StringBuilder markup = new StringBuilder();
        for (String line : sourceCode.split("\r?\n", -1)) {
            String trimmed = line.strip();
            if (!trimmed.startsWith(prefix)) {
                continue;
            }
            String prose = trimmed.substring(prefix.length());
            if (prose.startsWith(" ")) {
                prose = prose.substring(1);
            }
            markup.append(prose).append('\n');
        }
        return markup.toString();
    }

    public String getPrefix() {
        return prefix;
    }
}
