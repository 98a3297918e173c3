package org.dxworks.specdocx;

import org.dxworks.specdocx.converter.ConversionResult;
import org.dxworks.specdocx.docx.DocxWriter;
import org.dxworks.specdocx.markup.MarkupElement;
import org.dxworks.specdocx.markup.MarkupStructureException;
import org.dxworks.specdocx.markup.MarkupTreeBuilder;
import org.dxworks.specdocx.preprocess.TermEmphasisPreprocessor;
import org.dxworks.specdocx.source.AnnotatedSourceExtractor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;

public class App {

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar specdocx.jar <source-file> <output-file> [template-file]");
            System.err.println("  <source-file>:   Source file with //> annotated prose lines");
            System.err.println("  <output-file>:   Path to the .docx file to write");
            System.err.println("  <template-file>: Optional .docx whose styles and numbering are reused");
            System.exit(2);
        }

        Path source = Paths.get(args[0]);
        if (!Files.isRegularFile(source)) {
            System.err.println("Error: Source file does not exist: " + source);
            System.exit(1);
        }
        Path output = Paths.get(args[1]);

        SpecdocxConfig config = SpecdocxConfig.load();
        Path template = args.length > 2 ? Paths.get(args[2]) : config.getTemplatePath();
        if (template != null && !Files.isRegularFile(template)) {
            System.err.println("Error: Template file does not exist: " + template);
            System.exit(1);
        }

        System.out.println("Starting document generation...");
        System.out.println("Source: " + source.toAbsolutePath());
        if (template != null) {
            System.out.println("Template: " + template.toAbsolutePath());
        }

        Instant startTime = Instant.now();
        ConversionResult result;
        try {
            result = convertFile(source, template, output, config);
        } catch (MarkupStructureException e) {
            System.err.println("Error: cannot convert " + source.getFileName() + ": " + e.getMessage());
            System.err.println("No document was written.");
            System.exit(1);
            return;
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
            return;
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Conversion complete!");
        System.out.println("Paragraphs written: " + result.getDocument().getParagraphs().size());
        System.out.println("Numbering instances added: " + result.getNumberingPairs().size());
        System.out.println("Duration: " + Duration.between(startTime, Instant.now()).toMillis() + " ms");
        System.out.println("Output written to: " + output.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    /** Annotated source text to the Markdown that gets parsed. */
    public static String prepareMarkup(String sourceCode, SpecdocxConfig config) {
        String markup = new AnnotatedSourceExtractor(config.getCommentPrefix()).extract(sourceCode);
        return config.isEmphasizeTerms() ? TermEmphasisPreprocessor.preprocess(markup) : markup;
    }

    public static ConversionResult convertFile(Path source, Path template, Path output, SpecdocxConfig config)
            throws IOException {
        String sourceCode = Files.readString(source, StandardCharsets.UTF_8);
        MarkupElement root = new MarkupTreeBuilder().parse(prepareMarkup(sourceCode, config));
        return new DocxWriter(config.getBulletAbstractNumId()).write(root, template, output);
    }
}
