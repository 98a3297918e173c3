package org.dxworks.specdocx.converter;

import org.dxworks.specdocx.model.Run;
import org.dxworks.specdocx.model.RunAttributes;
import org.dxworks.specdocx.model.Segment;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RunBuilderTest {

    @Test
    void collapsesInteriorWhitespace() {
        Run run = RunBuilder.build("one  two\n\tthree", RunAttributes.PLAIN);

        assertEquals(List.of(Segment.text("one two three")), run.getSegments());
        assertFalse(run.getSegments().get(0).isPreserveSpace());
    }

    @Test
    void keepsOneBoundarySpaceAndMarksItPreserved() {
        Run run = RunBuilder.build("  before\n", RunAttributes.PLAIN);

        assertEquals(" before ", run.plainText());
        assertTrue(run.getSegments().get(0).isPreserveSpace());
    }

    @Test
    void whitespaceOnlyTextBecomesSingleSpace() {
        Run run = RunBuilder.build(" \n ", RunAttributes.PLAIN);

        assertEquals(List.of(Segment.text(" ")), run.getSegments());
    }

    @Test
    void emptyTextHasNoSegments() {
        assertFalse(RunBuilder.build("", RunAttributes.PLAIN).hasContent());
    }

    @Test
    void formFeedBecomesPageBreak() {
        Run run = RunBuilder.build("end\fstart", RunAttributes.PLAIN);

        assertEquals(List.of(Segment.text("end"), Segment.pageBreak(), Segment.text("start")), run.getSegments());
    }

    @Test
    void preservedTextKeepsSpacesAndSplitsLines() {
        Run run = RunBuilder.buildPreserved("if (x)\n    y();\n", RunAttributes.PLAIN);

        assertEquals(List.of(
                Segment.text("if (x)"),
                Segment.lineBreak(),
                Segment.text("    y();"),
                Segment.lineBreak()), run.getSegments());
        assertTrue(run.getSegments().get(2).isPreserveSpace());
    }

    @Test
    void preservedTabsBecomeTabSegments() {
        Run run = RunBuilder.buildPreserved("a\tb", RunAttributes.PLAIN);

        assertEquals(List.of(Segment.text("a"), Segment.tab(), Segment.text("b")), run.getSegments());
    }

    @Test
    void attributesAreCarriedThrough() {
        RunAttributes attributes = RunAttributes.PLAIN.withEmphasis().withCode();

        Run run = RunBuilder.build("x", attributes);

        assertTrue(run.getAttributes().isEmphasis());
        assertTrue(run.getAttributes().isCode());
        assertFalse(run.getAttributes().isStrong());
    }

    @Test
    void noteLabelReplacesLeadingNoteAndSpace() {
        Run run = RunBuilder.withNoteLabel(RunBuilder.build("NOTE The value is cached.", RunAttributes.PLAIN));

        assertEquals(List.of(Segment.text("NOTE"), Segment.tab(), Segment.text("The value is cached.")), run.getSegments());
        assertTrue(RunBuilder.startsWithNoteLabel(run));
    }

    @Test
    void noteLabelIgnoresOtherText() {
        Run original = RunBuilder.build("NOTES are separate", RunAttributes.PLAIN);

        Run run = RunBuilder.withNoteLabel(original);

        assertSame(original, run);
        assertFalse(RunBuilder.startsWithNoteLabel(run));
    }

    @Test
    void blockEdgesAreTrimmedAcrossRuns() {
        List<Run> runs = List.of(
                RunBuilder.build("   ", RunAttributes.PLAIN),
                RunBuilder.build(" lead", RunAttributes.PLAIN.withStrong()),
                RunBuilder.build(" middle ", RunAttributes.PLAIN),
                RunBuilder.build("end\f ", RunAttributes.PLAIN));

        List<Run> trimmed = RunBuilder.trimBlockEdges(runs);

        assertEquals(3, trimmed.size());
        assertEquals(List.of(Segment.text("lead")), trimmed.get(0).getSegments());
        assertTrue(trimmed.get(0).getAttributes().isStrong());
        assertEquals(List.of(Segment.text(" middle ")), trimmed.get(1).getSegments());
        assertEquals(List.of(Segment.text("end"), Segment.pageBreak()), trimmed.get(2).getSegments());
    }

    @Test
    void trimmingKeepsUntouchedRunsAsTheyAre() {
        Run run = RunBuilder.build("plain", RunAttributes.PLAIN);

        assertSame(run, RunBuilder.trimBlockEdges(List.of(run)).get(0));
    }
}
