package org.dxworks.specdocx;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.specdocx.converter.DocumentAssembler;
import org.dxworks.specdocx.converter.NumberingAllocator;
import org.dxworks.specdocx.markup.MarkupTreeBuilder;
import org.dxworks.specdocx.model.Paragraph;

import java.util.List;

public class TestUtils {
    public static final ObjectMapper APPROVAL_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    /** Serializes through a plain map tree so property order is alphabetical. */
    public static String toApprovalJson(Object value) throws JsonProcessingException {
        return APPROVAL_MAPPER.writeValueAsString(APPROVAL_MAPPER.convertValue(value, Object.class));
    }

    public static List<Paragraph> convertMarkdown(String markdown, NumberingAllocator allocator) {
        return new DocumentAssembler()
                .assemble(new MarkupTreeBuilder().parse(markdown), allocator)
                .getDocument()
                .getParagraphs();
    }

    public static List<Paragraph> convertMarkdown(String markdown) {
        return convertMarkdown(markdown, new NumberingAllocator(0, -1));
    }
}
