package org.dxworks.specdocx.converter;

import org.dxworks.specdocx.markup.MarkupElement;
import org.dxworks.specdocx.markup.MarkupStructureException;
import org.dxworks.specdocx.markup.Tag;
import org.dxworks.specdocx.model.Paragraph;
import org.dxworks.specdocx.model.WordDocument;

import java.util.List;

public class DocumentAssembler {

    /**
     * Converts every top-level block of {@code root}. The allocator must be
     * fresh: all pairs it holds afterwards are reported as minted by this call.
     *
     * @throws MarkupStructureException on any construct that cannot be converted;
     *         nothing is returned in that case
     */
    public ConversionResult assemble(MarkupElement root, NumberingAllocator allocator) {
        if (root == null || allocator == null) {
            throw new IllegalArgumentException("Root element and allocator are required");
        }
        if (root.getTag() != Tag.DOCUMENT) {
            throw new MarkupStructureException(root.getTag(), "expected the document root");
        }
        List<Paragraph> paragraphs = new BlockConverter(allocator).convertChildren(root);
        return new ConversionResult(new WordDocument(paragraphs), allocator.getAllocated());
    }
}
