package org.dxworks.specdocx.docx;

import org.apache.poi.xwpf.usermodel.XWPFAbstractNum;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFNum;
import org.apache.poi.xwpf.usermodel.XWPFNumbering;
import org.dxworks.specdocx.converter.NumberingAllocator;
import org.dxworks.specdocx.model.NumberingPair;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTAbstractNum;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTInd;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTLvl;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STMultiLevelType;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STNumberFormat;

import java.math.BigInteger;
import java.util.List;

/**
 * The numbering part of a .docx package: reports the ids already taken and
 * registers the numbering instances minted by a conversion.
 */
public class NumberingCatalog {

    private static final int LEVEL_COUNT = 9;
    private static final int INDENT_STEP_TWIPS = 720;
    private static final int HANGING_TWIPS = 360;
    private static final String[] BULLET_SYMBOLS = {"\u2022", "o", "\u25AA"};
    private static final STNumberFormat.Enum[] ORDERED_FORMATS = {
            STNumberFormat.DECIMAL, STNumberFormat.LOWER_LETTER, STNumberFormat.LOWER_ROMAN
    };

    private final XWPFNumbering numbering;
    private final int bulletAbstractNumId;

    private NumberingCatalog(XWPFNumbering numbering, int bulletAbstractNumId) {
        this.numbering = numbering;
        this.bulletAbstractNumId = bulletAbstractNumId;
    }

    public static NumberingCatalog of(XWPFDocument document, int bulletAbstractNumId) {
        XWPFNumbering numbering = document.getNumbering();
        if (numbering == null) {
            numbering = document.createNumbering();
        }
        return new NumberingCatalog(numbering, bulletAbstractNumId);
    }

    /** Adds the shared bullet definition unless the package already has one under that id. */
    public void ensureBulletDefinition() {
        BigInteger id = BigInteger.valueOf(bulletAbstractNumId);
        if (numbering.getAbstractNum(id) == null) {
            numbering.addAbstractNum(new XWPFAbstractNum(definition(id, true)));
        }
    }

    public int maxNumId() {
        int max = 0;
        for (XWPFNum num : numbering.getNums()) {
            BigInteger id = num.getCTNum().getNumId();
            if (id != null) {
                max = Math.max(max, id.intValue());
            }
        }
        return max;
    }

    public int maxAbstractNumId() {
        int max = -1;
        for (XWPFAbstractNum abstractNum : numbering.getAbstractNums()) {
            BigInteger id = abstractNum.getCTAbstractNum().getAbstractNumId();
            if (id != null) {
                max = Math.max(max, id.intValue());
            }
        }
        return max;
    }

    /** Allocator seeded one past the ids currently in the catalog. */
    public NumberingAllocator newAllocator() {
        return new NumberingAllocator(maxNumId(), maxAbstractNumId(), bulletAbstractNumId);
    }

    /**
     * Registers every pair. Abstract ids not yet defined get a fresh decimal
     * multi-level definition, which is what ordered lists mint.
     */
    public void register(List<NumberingPair> pairs) {
        for (NumberingPair pair : pairs) {
            BigInteger abstractNumId = BigInteger.valueOf(pair.getAbstractNumId());
            if (numbering.getAbstractNum(abstractNumId) == null) {
                numbering.addAbstractNum(new XWPFAbstractNum(definition(abstractNumId, false)));
            }
            numbering.addNum(abstractNumId, BigInteger.valueOf(pair.getNumId()));
        }
    }

    private static CTAbstractNum definition(BigInteger abstractNumId, boolean bullet) {
        CTAbstractNum abstractNum = CTAbstractNum.Factory.newInstance();
        abstractNum.setAbstractNumId(abstractNumId);
        abstractNum.addNewMultiLevelType().setVal(STMultiLevelType.HYBRID_MULTILEVEL);
        for (int level = 0; level < LEVEL_COUNT; level++) {
            CTLvl lvl = abstractNum.addNewLvl();
            lvl.setIlvl(BigInteger.valueOf(level));
            lvl.addNewStart().setVal(BigInteger.ONE);
            if (bullet) {
                lvl.addNewNumFmt().setVal(STNumberFormat.BULLET);
                lvl.addNewLvlText().setVal(BULLET_SYMBOLS[level % BULLET_SYMBOLS.length]);
            } else {
                lvl.addNewNumFmt().setVal(ORDERED_FORMATS[level % ORDERED_FORMATS.length]);
                lvl.addNewLvlText().setVal("%" + (level + 1) + ".");
            }
            CTInd indent = lvl.addNewPPr().addNewInd();
            indent.setLeft(BigInteger.valueOf((long) INDENT_STEP_TWIPS * (level + 1)));
            indent.setHanging(BigInteger.valueOf(HANGING_TWIPS));
        }
        return abstractNum;
    }
}
