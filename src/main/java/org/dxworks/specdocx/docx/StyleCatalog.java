package org.dxworks.specdocx.docx;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.dxworks.specdocx.converter.BlockConverter;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTFonts;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTStyle;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STStyleType;

/**
 * Makes sure every paragraph style the converter emits is defined. Styles a
 * template already carries are left as they are.
 */
public final class StyleCatalog {

    static final String CODE_FONT = "Courier New";

    private StyleCatalog() {}

    public static void ensureParagraphStyles(XWPFDocument document) {
        XWPFStyles styles = document.createStyles();
        for (int level = 1; level <= 6; level++) {
            ensure(styles, BlockConverter.HEADING_STYLE_PREFIX + level, "heading " + level, true, false);
        }
        ensure(styles, BlockConverter.BULLET_STYLE, "Bullet Notlast", false, false);
        ensure(styles, BlockConverter.ORDERED_STYLE, "Alg4", false, false);
        ensure(styles, BlockConverter.NOTE_STYLE, "Note", false, false);
        ensure(styles, BlockConverter.CODE_STYLE, "Code Sample3", false, true);
    }

    private static void ensure(XWPFStyles styles, String styleId, String name, boolean bold, boolean code) {
        if (styles.styleExist(styleId)) {
            return;
        }
        CTStyle style = CTStyle.Factory.newInstance();
        style.setStyleId(styleId);
        style.setType(STStyleType.PARAGRAPH);
        style.addNewName().setVal(name);
        style.addNewQFormat();
        if (bold || code) {
            CTRPr runProperties = style.addNewRPr();
            if (bold) {
                runProperties.addNewB();
            }
            if (code) {
                CTFonts fonts = runProperties.addNewRFonts();
                fonts.setAscii(CODE_FONT);
                fonts.setHAnsi(CODE_FONT);
            }
        }
        styles.addStyle(new XWPFStyle(style));
    }
}
