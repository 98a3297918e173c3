package org.dxworks.specdocx.model;

import java.util.List;

public final class WordDocument {

    private final List<Paragraph> paragraphs;

    public WordDocument(List<Paragraph> paragraphs) {
        this.paragraphs = List.copyOf(paragraphs);
    }

    public List<Paragraph> getParagraphs() {
        return paragraphs;
    }
}
