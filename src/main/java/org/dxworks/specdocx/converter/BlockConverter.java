package org.dxworks.specdocx.converter;

import org.dxworks.specdocx.converter.NumberingAllocator.ListKind;
import org.dxworks.specdocx.markup.MarkupElement;
import org.dxworks.specdocx.markup.MarkupNode;
import org.dxworks.specdocx.markup.MarkupStructureException;
import org.dxworks.specdocx.markup.MarkupText;
import org.dxworks.specdocx.markup.Tag;
import org.dxworks.specdocx.model.ListPlacement;
import org.dxworks.specdocx.model.NumberingPair;
import org.dxworks.specdocx.model.Paragraph;
import org.dxworks.specdocx.model.Run;
import org.dxworks.specdocx.model.RunAttributes;
import org.dxworks.specdocx.model.Segment;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps block-level markup to paragraphs. The paragraph style vocabulary is
 * fixed; list paragraphs additionally carry a numbering reference.
 */
public class BlockConverter {

    public static final String HEADING_STYLE_PREFIX = "Heading";
    public static final String BULLET_STYLE = "BulletNotlast";
    public static final String ORDERED_STYLE = "Alg4";
    public static final String CODE_STYLE = "CodeSample3";
    public static final String NOTE_STYLE = "Note";

    private final NumberingAllocator allocator;

    public BlockConverter(NumberingAllocator allocator) {
        this.allocator = allocator;
    }

    /** Converts the block children of a container element (document root or blockquote). */
    public List<Paragraph> convertChildren(MarkupElement container) {
        List<Paragraph> out = new ArrayList<>();
        convertBlocks(container, container.getChildren(), ListContext.NONE, out);
        return out;
    }

    public List<Paragraph> convert(MarkupElement block) {
        List<Paragraph> out = new ArrayList<>();
        convertBlock(block, ListContext.NONE, out);
        return out;
    }

    private void convertBlocks(MarkupElement parent, List<MarkupNode> blocks, ListContext list, List<Paragraph> out) {
        MarkupElement previous = null;
        for (MarkupNode node : blocks) {
            if (node instanceof MarkupText text) {
                if (!text.isBlank()) {
                    Tag offending = previous == null ? parent.getTag() : previous.getTag();
                    throw new MarkupStructureException(offending, "unexpected tail text \"" + text.getText().strip() + "\"");
                }
                continue;
            }
            MarkupElement element = (MarkupElement) node;
            convertBlock(element, list, out);
            previous = element;
        }
    }

    private void convertBlock(MarkupElement element, ListContext list, List<Paragraph> out) {
        Tag tag = element.getTag();
        switch (tag) {
            case PARAGRAPH -> out.add(convertParagraph(element, list));
            case HEADING_1, HEADING_2, HEADING_3, HEADING_4, HEADING_5, HEADING_6 ->
                    out.add(contentToParagraph(element, HEADING_STYLE_PREFIX + tag.headingLevel()));
            case UNORDERED_LIST -> convertList(element, ListKind.UNORDERED, list, out);
            case ORDERED_LIST -> convertList(element, ListKind.ORDERED, list, out);
            case BLOCKQUOTE -> {
                if (list.isInList()) {
                    throw new MarkupStructureException(tag, "can't convert a blockquote inside a list");
                }
                if (list.isInQuote()) {
                    throw new MarkupStructureException(tag, "can't convert a nested blockquote");
                }
                convertBlocks(element, element.getChildren(), list.quoted(), out);
            }
            case PREFORMATTED -> out.add(convertPreformatted(element));
            case HORIZONTAL_RULE -> out.add(pageBreakParagraph());
            case LIST_ITEM -> throw new MarkupStructureException(tag, "list item outside a list");
            default -> throw new MarkupStructureException(tag, "unrecognized block tag");
        }
    }

    private Paragraph convertParagraph(MarkupElement element, ListContext list) {
        List<Run> runs = lowerBlockContent(element.getChildren());
        if (list.isInList() || runs.isEmpty()) {
            return new Paragraph(runs, null);
        }
        // The style depends on the lowered first run, so it is decided last.
        List<Run> labelled = new ArrayList<>(runs);
        labelled.set(0, RunBuilder.withNoteLabel(runs.get(0)));
        String style = RunBuilder.startsWithNoteLabel(labelled.get(0)) ? NOTE_STYLE : null;
        return new Paragraph(labelled, style);
    }

    private Paragraph contentToParagraph(MarkupElement element, String style) {
        return new Paragraph(lowerBlockContent(element.getChildren()), style);
    }

    private static List<Run> lowerBlockContent(List<MarkupNode> content) {
        return RunBuilder.trimBlockEdges(InlineConverter.lowerContent(content, RunAttributes.PLAIN, false));
    }

    private void convertList(MarkupElement element, ListKind kind, ListContext list, List<Paragraph> out) {
        ListContext items;
        if (list.isInList()) {
            items = list.nested();
        } else {
            String style = kind == ListKind.UNORDERED ? BULLET_STYLE : ORDERED_STYLE;
            items = list.start(allocator.allocate(kind), style);
        }
        for (MarkupNode child : element.getChildren()) {
            if (child instanceof MarkupElement item && item.getTag() == Tag.LIST_ITEM) {
                convertListItem(item, items, out);
            } else if (!child.isBlank()) {
                throw new MarkupStructureException(element.getTag(), "list may only contain list items, found " + child);
            }
        }
    }

    private void convertListItem(MarkupElement item, ListContext list, List<Paragraph> out) {
        List<MarkupNode> children = item.getChildren();
        int split = 0;
        while (split < children.size() && InlineConverter.isInline(children.get(split))) {
            split++;
        }
        List<MarkupNode> inline = children.subList(0, split);
        List<MarkupNode> blocks = children.subList(split, children.size());

        if (!blocks.isEmpty() && inline.stream().allMatch(MarkupNode::isBlank)) {
            throw new MarkupStructureException(Tag.LIST_ITEM, "list item must start with inline content");
        }

        List<Run> runs = lowerBlockContent(inline);
        out.add(new Paragraph(runs, list.style, new ListPlacement(list.numId, list.level)));

        for (MarkupNode node : blocks) {
            if (node.isBlank()) {
                continue;
            }
            if (InlineConverter.isInline(node)) {
                throw new MarkupStructureException(Tag.LIST_ITEM, "inline content after block content in list item");
            }
            convertBlock((MarkupElement) node, list, out);
        }
    }

    private Paragraph convertPreformatted(MarkupElement element) {
        MarkupElement content = element;
        List<MarkupNode> children = element.getChildren();
        if (children.size() == 1 && children.get(0) instanceof MarkupElement only && only.getTag() == Tag.CODE) {
            content = only;
        }
        return new Paragraph(InlineConverter.lowerContent(content.getChildren(), RunAttributes.PLAIN, true), CODE_STYLE);
    }

    private static Paragraph pageBreakParagraph() {
        return new Paragraph(List.of(new Run(List.of(Segment.pageBreak()), RunAttributes.PLAIN)), null);
    }

    /**
     * Numbering and style shared by every item of one top-level list, plus the
     * indent level of the items currently being converted and the blockquote
     * depth. A list inside a blockquote still starts at level 0.
     */
    private static final class ListContext {
        static final ListContext NONE = new ListContext(0, null, -1, 0);

        final int numId;
        final String style;
        final int level;
        final int quoteDepth;

        private ListContext(int numId, String style, int level, int quoteDepth) {
            this.numId = numId;
            this.style = style;
            this.level = level;
            this.quoteDepth = quoteDepth;
        }

        ListContext start(NumberingPair pair, String listStyle) {
            return new ListContext(pair.getNumId(), listStyle, 0, quoteDepth);
        }

        ListContext nested() {
            return new ListContext(numId, style, level + 1, quoteDepth);
        }

        ListContext quoted() {
            return new ListContext(numId, style, level, quoteDepth + 1);
        }

        boolean isInList() {
            return level >= 0;
        }

        boolean isInQuote() {
            return quoteDepth > 0;
        }
    }
}
