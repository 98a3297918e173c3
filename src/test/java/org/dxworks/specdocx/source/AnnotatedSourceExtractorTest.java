package org.dxworks.specdocx.source;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AnnotatedSourceExtractorTest {

    private final AnnotatedSourceExtractor extractor = new AnnotatedSourceExtractor();

    @Test
    void keepsOnlyAnnotatedLines() {
        String source = "//> # indexOf (value)\n"
                + "function indexOf(value) {\n"
                + "    //> 1. Let O be ToObject(this).\n"
                + "    var O = Object(this);\n"
                + "}\n";

        assertEquals("# indexOf (value)\n1. Let O be ToObject(this).\n", extractor.extract(source));
    }

    @Test
    void dropsOnlyOneSpaceAfterThePrefix() {
        assertEquals("   - nested\n", extractor.extract("//>    - nested"));
    }

    @Test
    void bareAnnotationYieldsBlankLine() {
        assertEquals("first\n\nsecond\n", extractor.extract("//> first\n//>\n//> second\n"));
    }

    @Test
    void handlesCrlfAndByteOrderMark() {
        assertEquals("one\ntwo\n", extractor.extract("\uFEFF//> one\r\ncode();\r\n//> two\r\n"));
    }

    @Test
    void ordinaryCommentsAreIgnored() {
        assertEquals("", extractor.extract("// not prose\n/* //> nor this */\n"));
    }

    @Test
    void customPrefix() {
        AnnotatedSourceExtractor hashes = new AnnotatedSourceExtractor("#>");

        assertEquals("#>", hashes.getPrefix());
        assertEquals("text\n", hashes.extract("#> text\n//> other\n"));
    }

    @Test
    void blankPrefixIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new AnnotatedSourceExtractor("  "));
    }
}
