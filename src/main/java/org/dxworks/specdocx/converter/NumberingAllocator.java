package org.dxworks.specdocx.converter;

import org.dxworks.specdocx.model.NumberingPair;

import java.util.ArrayList;
import java.util.List;

/**
 * Mints numbering instances for top-level lists. Seeded from the largest ids
 * already present in the target numbering catalog so that every minted id is
 * new to it. One allocator serves exactly one conversion.
 */
public class NumberingAllocator {

    public enum ListKind { UNORDERED, ORDERED }

    public static final int DEFAULT_BULLET_ABSTRACT_NUM_ID = 1;

    private final int bulletAbstractNumId;
    private final List<NumberingPair> allocated = new ArrayList<>();
    private int nextNumId;
    private int nextAbstractNumId;

    /**
     * @param maxNumId largest numbering instance id in the catalog, 0 when it has none
     * @param maxAbstractNumId largest abstract numbering id in the catalog, -1 when it has none
     * @param bulletAbstractNumId abstract definition shared by every unordered list
     */
    public NumberingAllocator(int maxNumId, int maxAbstractNumId, int bulletAbstractNumId) {
        if (maxNumId < 0) {
            throw new IllegalArgumentException("maxNumId must not be negative: " + maxNumId);
        }
        if (maxAbstractNumId < -1) {
            throw new IllegalArgumentException("maxAbstractNumId must be -1 or larger: " + maxAbstractNumId);
        }
        if (bulletAbstractNumId < 0) {
            throw new IllegalArgumentException("bulletAbstractNumId must not be negative: " + bulletAbstractNumId);
        }
        this.nextNumId = maxNumId + 1;
        this.nextAbstractNumId = maxAbstractNumId + 1;
        this.bulletAbstractNumId = bulletAbstractNumId;
    }

    public NumberingAllocator(int maxNumId, int maxAbstractNumId) {
        this(maxNumId, maxAbstractNumId, DEFAULT_BULLET_ABSTRACT_NUM_ID);
    }

    public NumberingPair allocate(ListKind kind) {
        int abstractNumId;
        if (kind == ListKind.UNORDERED) {
            abstractNumId = bulletAbstractNumId;
        } else {
            if (nextAbstractNumId == bulletAbstractNumId) {
                nextAbstractNumId++;
            }
            abstractNumId = nextAbstractNumId++;
        }
        NumberingPair pair = new NumberingPair(nextNumId++, abstractNumId);
        allocated.add(pair);
        return pair;
    }

    /** Pairs minted so far, in allocation order. */
    public List<NumberingPair> getAllocated() {
        return List.copyOf(allocated);
    }

    public int getBulletAbstractNumId() {
        return bulletAbstractNumId;
    }
}
