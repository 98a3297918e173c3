package org.dxworks.specdocx.docx;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.xmlbeans.XmlCursor;
import org.dxworks.specdocx.converter.ConversionResult;
import org.dxworks.specdocx.converter.DocumentAssembler;
import org.dxworks.specdocx.markup.MarkupElement;
import org.dxworks.specdocx.model.ListPlacement;
import org.dxworks.specdocx.model.Paragraph;
import org.dxworks.specdocx.model.Run;
import org.dxworks.specdocx.model.RunAttributes;
import org.dxworks.specdocx.model.Segment;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTR;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTText;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STBrType;

import javax.xml.namespace.QName;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a converted markup tree into a .docx package. The body of the
 * template is replaced; styles, numbering, headers and every other part stay.
 */
public class DocxWriter {

    private static final QName XML_SPACE = new QName("http://www.w3.org/XML/1998/namespace", "space", "xml");

    private final int bulletAbstractNumId;

    public DocxWriter(int bulletAbstractNumId) {
        this.bulletAbstractNumId = bulletAbstractNumId;
    }

    /**
     * Converts {@code root} and writes the result to {@code output}. The
     * conversion finishes before the output file is touched, so a structural
     * error never leaves a partial document behind.
     *
     * @param template existing .docx to splice into, or null for an empty document
     */
    public ConversionResult write(MarkupElement root, Path template, Path output) throws IOException {
        byte[] bytes;
        ConversionResult result;
        try (XWPFDocument document = open(template)) {
            result = render(root, document);
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            document.write(buffer);
            bytes = buffer.toByteArray();
        }
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }
        Files.write(output, bytes);
        return result;
    }

    /** Replaces the body of {@code document} with the conversion of {@code root}. */
    public ConversionResult render(MarkupElement root, XWPFDocument document) {
        StyleCatalog.ensureParagraphStyles(document);
        NumberingCatalog numbering = NumberingCatalog.of(document, bulletAbstractNumId);
        numbering.ensureBulletDefinition();

        ConversionResult result = new DocumentAssembler().assemble(root, numbering.newAllocator());

        numbering.register(result.getNumberingPairs());
        clearBody(document);
        for (Paragraph paragraph : result.getDocument().getParagraphs()) {
            writeParagraph(document.createParagraph(), paragraph);
        }
        return result;
    }

    private static XWPFDocument open(Path template) throws IOException {
        if (template == null) {
            return new XWPFDocument();
        }
        try (InputStream in = Files.newInputStream(template)) {
            return new XWPFDocument(in);
        }
    }

    private static void clearBody(XWPFDocument document) {
        for (int i = document.getBodyElements().size() - 1; i >= 0; i--) {
            document.removeBodyElement(i);
        }
    }

    private static void writeParagraph(XWPFParagraph target, Paragraph paragraph) {
        if (paragraph.getStyle() != null) {
            target.setStyle(paragraph.getStyle());
        }
        ListPlacement placement = paragraph.getListPlacement();
        if (placement != null) {
            target.setNumID(BigInteger.valueOf(placement.getNumId()));
            target.setNumILvl(BigInteger.valueOf(placement.getLevel()));
        }
        for (Run run : paragraph.getRuns()) {
            writeRun(target.createRun(), run);
        }
    }

    private static void writeRun(XWPFRun target, Run run) {
        RunAttributes attributes = run.getAttributes();
        if (attributes.isEmphasis()) {
            target.setItalic(true);
        }
        if (attributes.isStrong() || attributes.isCode()) {
            target.setBold(true);
        }
        if (attributes.isCode()) {
            target.setFontFamily(StyleCatalog.CODE_FONT, XWPFRun.FontCharRange.ascii);
            target.setFontFamily(StyleCatalog.CODE_FONT, XWPFRun.FontCharRange.hAnsi);
        }

        CTR ctr = target.getCTR();
        for (Segment segment : run.getSegments()) {
            switch (segment.getKind()) {
                case TEXT -> addText(ctr, segment);
                case LINE_BREAK -> ctr.addNewBr();
                case PAGE_BREAK -> ctr.addNewBr().setType(STBrType.PAGE);
                case TAB -> ctr.addNewTab();
            }
        }
    }

    private static void addText(CTR ctr, Segment segment) {
        CTText text = ctr.addNewT();
        text.setStringValue(segment.getText());
        if (segment.isPreserveSpace()) {
            try (XmlCursor cursor = text.newCursor()) {
                cursor.toNextToken();
                cursor.insertAttributeWithValue(XML_SPACE, "preserve");
            }
        }
    }
}
