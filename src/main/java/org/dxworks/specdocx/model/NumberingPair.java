package org.dxworks.specdocx.model;

/**
 * A numbering instance minted during conversion together with the abstract
 * numbering definition it points at.
 */
public final class NumberingPair {

    private final int numId;
    private final int abstractNumId;

    public NumberingPair(int numId, int abstractNumId) {
        this.numId = numId;
        this.abstractNumId = abstractNumId;
    }

    public int getNumId() {
        return numId;
    }

    public int getAbstractNumId() {
        return abstractNumId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NumberingPair other)) return false;
        return numId == other.numId && abstractNumId == other.abstractNumId;
    }

    @Override
    public int hashCode() {
        return 31 * numId + abstractNumId;
    }

    @Override
    public String toString() {
        return "NumberingPair{numId=" + numId + ", abstractNumId=" + abstractNumId + "}";
    }
}
