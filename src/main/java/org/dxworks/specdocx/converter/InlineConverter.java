package org.dxworks.specdocx.converter;

import org.dxworks.specdocx.markup.MarkupElement;
import org.dxworks.specdocx.markup.MarkupNode;
import org.dxworks.specdocx.markup.MarkupStructureException;
import org.dxworks.specdocx.markup.MarkupText;
import org.dxworks.specdocx.model.Run;
import org.dxworks.specdocx.model.RunAttributes;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens inline markup (emphasis, strong, code) into a sequence of runs.
 * Attributes accumulate on the way down; text that follows a child element
 * belongs to the enclosing element and gets the enclosing attributes.
 */
final class InlineConverter {

    private InlineConverter() {}

    static List<Run> lowerContent(List<MarkupNode> nodes, RunAttributes attributes, boolean preserveSpace) {
        List<Run> runs = new ArrayList<>();
        for (MarkupNode node : nodes) {
            if (node instanceof MarkupText text) {
                Run run = preserveSpace
                        ? RunBuilder.buildPreserved(text.getText(), attributes)
                        : RunBuilder.build(text.getText(), attributes);
                if (run.hasContent()) {
                    runs.add(run);
                }
            } else if (node instanceof MarkupElement element) {
                runs.addAll(convertInline(element, attributes, preserveSpace));
            } else {
                throw new IllegalStateException("Unknown markup node: " + node);
            }
        }
        return runs;
    }

    static List<Run> convertInline(MarkupElement element, RunAttributes inherited, boolean preserveSpace) {
        RunAttributes attributes = switch (element.getTag()) {
            case EMPHASIS -> inherited.withEmphasis();
            case STRONG -> inherited.withStrong();
            case CODE -> inherited.withCode();
            case STRONG_CODE -> inherited.withStrong().withCode();
            default -> throw new MarkupStructureException(element.getTag(), "unrecognized inline tag");
        };
        return lowerContent(element.getChildren(), attributes, preserveSpace);
    }

    static boolean isInline(MarkupNode node) {
        return node instanceof MarkupText
                || (node instanceof MarkupElement element && element.getTag().isInline());
    }
}
