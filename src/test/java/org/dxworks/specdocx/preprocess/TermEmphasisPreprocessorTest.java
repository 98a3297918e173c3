package org.dxworks.specdocx.preprocess;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TermEmphasisPreprocessorTest {

    @Test
    void emphasizesStandaloneHeadingParameters() {
        String source = "## Foo (bar, baz)\n\nUse bar here, but not barred or rebar.\n";

        String result = TermEmphasisPreprocessor.preprocess(source);

        assertEquals("## Foo (bar, baz)\n\nUse *bar* here, but not barred or rebar.\n", result);
    }

    @Test
    void collectsHeadingWordsFromFirstParenthesizedGroupOnly() {
        Set<String> terms = TermEmphasisPreprocessor.collectTerms(
                "#### Array.prototype.indexOf ( searchElement [ , fromIndex ] ) (ignored)", "");

        assertEquals(Set.of("searchElement", "fromIndex"), terms);
    }

    @Test
    void collectsLetAndCalledOnTerms() {
        Set<String> terms = TermEmphasisPreprocessor.collectTerms("# Heading",
                "1. Let O be ToObject(this).\n2. let len be 0.\nWhen called on an object obj, do this.\n");

        assertEquals(Set.of("O", "len", "obj"), terms);
    }

    @Test
    void letWithoutBeIsNotATerm() {
        Set<String> terms = TermEmphasisPreprocessor.collectTerms("# Heading", "Let us continue. Outlet k be.\n");

        assertTrue(terms.isEmpty());
    }

    @Test
    void termsAreScopedToTheirSection() {
        String source = "# First (alpha)\nalpha here\n# Second\nalpha there\n";

        String result = TermEmphasisPreprocessor.preprocess(source);

        assertEquals("# First (alpha)\n*alpha* here\n# Second\nalpha there\n", result);
    }

    @Test
    void textBeforeFirstHeadingIsUntouched() {
        String source = "Let k be the preamble. the this value\n# Section\nk\n";

        String result = TermEmphasisPreprocessor.preprocess(source);

        assertEquals("Let k be the preamble. the this value\n# Section\nk\n", result);
    }

    @Test
    void alreadyEmphasizedTermsAreLeftAlone() {
        String source = "# F (x)\n*x* and x\n";

        assertEquals("# F (x)\n*x* and *x*\n", TermEmphasisPreprocessor.preprocess(source));
    }

    @Test
    void longerTermsWinOverTheirPrefixes() {
        String source = "# F (len, lenValue)\nlenValue and len\n";

        assertEquals("# F (len, lenValue)\n*lenValue* and *len*\n", TermEmphasisPreprocessor.preprocess(source));
    }

    @Test
    void thisValueBecomesStrong() {
        String source = "# Section\nCall ToObject passing the this value as the argument.\n";

        assertEquals("# Section\nCall ToObject passing the **this** value as the argument.\n",
                TermEmphasisPreprocessor.preprocess(source));
    }

    @Test
    void codeSpansAndFencesAreNotRewritten() {
        String source = "# F (n)\nUse n with `n + 1`.\n```\nvar n = 0;\n```\nthen n\n";

        String result = TermEmphasisPreprocessor.preprocess(source);

        assertEquals("# F (n)\nUse *n* with `n + 1`.\n```\nvar n = 0;\n```\nthen *n*\n", result);
    }

    @Test
    void tildeFencesAndIndentedCodeAreNotRewritten() {
        String source = "# F (n)\nUse n.\n\n    var n = 0;\n\n~~~\nn++\n~~~\nthen n\n";

        String result = TermEmphasisPreprocessor.preprocess(source);

        assertEquals("# F (n)\nUse *n*.\n\n    var n = 0;\n\n~~~\nn++\n~~~\nthen *n*\n", result);
    }

    @Test
    void codeInsideListItemsIsNotRewritten() {
        String source = "# F (n)\n1. Set n.\n\n   ```js\n   n = 1;\n   ```\n";

        String result = TermEmphasisPreprocessor.preprocess(source);

        assertEquals("# F (n)\n1. Set *n*.\n\n   ```js\n   n = 1;\n   ```\n", result);
    }

    @Test
    void hashLinesInsideCodeDoNotStartSections() {
        String source = "# F (n)\n```\n# comment n\n```\nthen n\n";

        String result = TermEmphasisPreprocessor.preprocess(source);

        assertEquals("# F (n)\n```\n# comment n\n```\nthen *n*\n", result);
    }

    @Test
    void doubleBacktickSpansAreNotRewritten() {
        String source = "# F (n)\nSee ``n ` n`` and n.\n";

        assertEquals("# F (n)\nSee ``n ` n`` and *n*.\n", TermEmphasisPreprocessor.preprocess(source));
    }

    @Test
    void headingInsideCodeOnlyLeavesSourceUntouched() {
        String source = "Intro n\n\n```\n# not a heading (n)\nn\n```\n";

        assertSame(source, TermEmphasisPreprocessor.preprocess(source));
    }

    @Test
    void sourceWithoutHeadingsIsReturnedAsIs() {
        String source = "Let x be 1.\n";

        assertSame(source, TermEmphasisPreprocessor.preprocess(source));
    }
}
