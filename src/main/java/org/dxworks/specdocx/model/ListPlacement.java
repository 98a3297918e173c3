package org.dxworks.specdocx.model;

/**
 * Numbering reference of a list paragraph: the numbering instance and the
 * zero-based indent level inside it.
 */
public final class ListPlacement {

    private final int numId;
    private final int level;

    public ListPlacement(int numId, int level) {
        if (level < 0) {
            throw new IllegalArgumentException("List level must not be negative: " + level);
        }
        this.numId = numId;
        this.level = level;
    }

    public int getNumId() {
        return numId;
    }

    public int getLevel() {
        return level;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ListPlacement other)) return false;
        return numId == other.numId && level == other.level;
    }

    @Override
    public int hashCode() {
        return 31 * numId + level;
    }

    @Override
    public String toString() {
        return "numId=" + numId + ", level=" + level;
    }
}
