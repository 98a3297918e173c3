package org.dxworks.specdocx.model;

import java.util.List;

public final class Paragraph {

    private final List<Run> runs;
    private final String style; // nullable
    private final ListPlacement listPlacement; // nullable

    public Paragraph(List<Run> runs, String style, ListPlacement listPlacement) {
        this.runs = List.copyOf(runs);
        this.style = style;
        this.listPlacement = listPlacement;
    }

    public Paragraph(List<Run> runs, String style) {
        this(runs, style, null);
    }

    public List<Run> getRuns() {
        return runs;
    }

    public String getStyle() {
        return style;
    }

    public ListPlacement getListPlacement() {
        return listPlacement;
    }

    public String plainText() {
        StringBuilder text = new StringBuilder();
        for (Run run : runs) {
            text.append(run.plainText());
        }
        return text.toString();
    }

    @Override
    public String toString() {
        return "Paragraph{style=" + style + (listPlacement == null ? "" : ", " + listPlacement) + ", runs=" + runs + "}";
    }
}
