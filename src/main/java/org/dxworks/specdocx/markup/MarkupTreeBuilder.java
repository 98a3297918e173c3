package org.dxworks.specdocx.markup;

import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.BlockQuote;
import org.commonmark.node.BulletList;
import org.commonmark.node.Code;
import org.commonmark.node.CustomBlock;
import org.commonmark.node.CustomNode;
import org.commonmark.node.Document;
import org.commonmark.node.Emphasis;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.Heading;
import org.commonmark.node.HtmlBlock;
import org.commonmark.node.HtmlInline;
import org.commonmark.node.Image;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Link;
import org.commonmark.node.ListItem;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.StrongEmphasis;
import org.commonmark.node.Text;
import org.commonmark.node.ThematicBreak;
import org.commonmark.parser.Parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Parses Markdown with commonmark and lowers the resulting AST into the closed
 * markup vocabulary of {@link Tag}. Constructs outside the vocabulary are
 * rejected here, before any conversion starts.
 */
public class MarkupTreeBuilder {

    private final Parser parser;

    public MarkupTreeBuilder() {
        this.parser = Parser.builder().build();
    }

    public MarkupElement parse(String markdown) {
        if (markdown == null) {
            throw new IllegalArgumentException("Markdown source must not be null");
        }
        return build(parser.parse(markdown));
    }

    public MarkupElement build(Node document) {
        if (!(document instanceof Document)) {
            throw new IllegalArgumentException("Expected a commonmark Document but got: "
                    + (document == null ? "null" : document.getClass().getSimpleName()));
        }
        MarkupTreeVisitor visitor = new MarkupTreeVisitor();
        document.accept(visitor);
        return visitor.root;
    }

    private static class MarkupTreeVisitor extends AbstractVisitor {
        private final Deque<List<MarkupNode>> childStack = new ArrayDeque<>();
        private MarkupElement root;

        @Override
        public void visit(Document document) {
            root = withElementContext(Tag.DOCUMENT, () -> visitChildren(document));
        }

        @Override
        public void visit(Paragraph paragraph) {
            withElementContext(Tag.PARAGRAPH, () -> visitChildren(paragraph));
        }

        @Override
        public void visit(Heading heading) {
            withElementContext(Tag.heading(heading.getLevel()), () -> visitChildren(heading));
        }

        @Override
        public void visit(BulletList bulletList) {
            withElementContext(Tag.UNORDERED_LIST, () -> visitChildren(bulletList));
        }

        @Override
        public void visit(OrderedList orderedList) {
            withElementContext(Tag.ORDERED_LIST, () -> visitChildren(orderedList));
        }

        @Override
        public void visit(ListItem listItem) {
            // A leading paragraph becomes the item's inline content, as in the HTML rendering.
            withElementContext(Tag.LIST_ITEM, () -> {
                Node child = listItem.getFirstChild();
                if (child instanceof Paragraph) {
                    visitChildren(child);
                    child = child.getNext();
                }
                for (; child != null; child = child.getNext()) {
                    child.accept(this);
                }
            });
        }

        @Override
        public void visit(BlockQuote blockQuote) {
            withElementContext(Tag.BLOCKQUOTE, () -> visitChildren(blockQuote));
        }

        @Override
        public void visit(FencedCodeBlock codeBlock) {
            addCodeBlock(codeBlock.getLiteral());
        }

        @Override
        public void visit(IndentedCodeBlock codeBlock) {
            addCodeBlock(codeBlock.getLiteral());
        }

        @Override
        public void visit(ThematicBreak thematicBreak) {
            withElementContext(Tag.HORIZONTAL_RULE, () -> { });
        }

        @Override
        public void visit(Emphasis emphasis) {
            withElementContext(Tag.EMPHASIS, () -> visitChildren(emphasis));
        }

        @Override
        public void visit(StrongEmphasis strongEmphasis) {
            Node only = strongEmphasis.getFirstChild();
            if (only instanceof Code code && only.getNext() == null) {
                withElementContext(Tag.STRONG_CODE, () -> addText(code.getLiteral()));
                return;
            }
            withElementContext(Tag.STRONG, () -> visitChildren(strongEmphasis));
        }

        @Override
        public void visit(Code code) {
            withElementContext(Tag.CODE, () -> addText(code.getLiteral()));
        }

        @Override
        public void visit(Text text) {
            addText(text.getLiteral());
        }

        @Override
        public void visit(SoftLineBreak softLineBreak) {
            addText("\n");
        }

        @Override
        public void visit(HardLineBreak hardLineBreak) {
            throw new MarkupStructureException("br", "unrecognized tag");
        }

        @Override
        public void visit(Link link) {
            throw new MarkupStructureException("a", "unrecognized tag");
        }

        @Override
        public void visit(Image image) {
            throw new MarkupStructureException("img", "unrecognized tag");
        }

        @Override
        public void visit(HtmlBlock htmlBlock) {
            throw new MarkupStructureException("html", "raw HTML is not supported");
        }

        @Override
        public void visit(HtmlInline htmlInline) {
            throw new MarkupStructureException("html", "raw HTML is not supported");
        }

        @Override
        public void visit(CustomBlock customBlock) {
            throw new MarkupStructureException(customBlock.getClass().getSimpleName(), "unrecognized tag");
        }

        @Override
        public void visit(CustomNode customNode) {
            throw new MarkupStructureException(customNode.getClass().getSimpleName(), "unrecognized tag");
        }

        private void addCodeBlock(String literal) {
            String code = literal.endsWith("\n") ? literal.substring(0, literal.length() - 1) : literal;
            withElementContext(Tag.PREFORMATTED,
                    () -> withElementContext(Tag.CODE, () -> addText(code)));
        }

        private void addText(String text) {
            if (text == null || text.isEmpty()) {
                return;
            }
            addToCurrentContext(new MarkupText(text));
        }

        private void addToCurrentContext(MarkupNode node) {
            List<MarkupNode> siblings = childStack.peek();
            if (siblings == null) {
                return;
            }
            // Adjacent text (text, soft break, text) reads as one text node.
            int last = siblings.size() - 1;
            if (node instanceof MarkupText text && last >= 0 && siblings.get(last) instanceof MarkupText previous) {
                siblings.set(last, new MarkupText(previous.getText() + text.getText()));
                return;
            }
            siblings.add(node);
        }

        private MarkupElement withElementContext(Tag tag, Runnable visitorAction) {
            List<MarkupNode> children = new ArrayList<>();
            childStack.push(children);
            try {
                visitorAction.run();
            } finally {
                childStack.pop();
            }
            MarkupElement element = new MarkupElement(tag, children);
            addToCurrentContext(element);
            return element;
        }
    }
}
