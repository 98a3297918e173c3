package org.dxworks.specdocx.converter;

import org.dxworks.specdocx.model.NumberingPair;
import org.dxworks.specdocx.model.WordDocument;

import java.util.List;

public final class ConversionResult {

    private final WordDocument document;
    private final List<NumberingPair> numberingPairs;

    public ConversionResult(WordDocument document, List<NumberingPair> numberingPairs) {
        this.document = document;
        this.numberingPairs = List.copyOf(numberingPairs);
    }

    public WordDocument getDocument() {
        return document;
    }

    public List<NumberingPair> getNumberingPairs() {
        return numberingPairs;
    }
}
