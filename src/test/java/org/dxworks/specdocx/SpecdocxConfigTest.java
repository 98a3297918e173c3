package org.dxworks.specdocx;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class SpecdocxConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileGivesDefaults() {
        SpecdocxConfig config = SpecdocxConfig.load(tempDir.resolve("absent.yml"));

        assertEquals("//>", config.getCommentPrefix());
        assertNull(config.getTemplatePath());
        assertEquals(1, config.getBulletAbstractNumId());
        assertTrue(config.isEmphasizeTerms());
    }

    @Test
    void readsAllKeys() throws IOException {
        Path file = tempDir.resolve("specdocx-config.yml");
        Files.writeString(file, "commentPrefix: \"#>\"\n"
                + "templatePath: templates/es5.docx\n"
                + "bulletAbstractNumId: 7\n"
                + "emphasizeTerms: false\n");

        SpecdocxConfig config = SpecdocxConfig.load(file);

        assertEquals("#>", config.getCommentPrefix());
        assertEquals(Paths.get("templates/es5.docx"), config.getTemplatePath());
        assertEquals(7, config.getBulletAbstractNumId());
        assertFalse(config.isEmphasizeTerms());
    }

    @Test
    void invalidValuesFallBackPerKey() throws IOException {
        Path file = tempDir.resolve("specdocx-config.yml");
        Files.writeString(file, "commentPrefix: \"  \"\nbulletAbstractNumId: -3\nemphasizeTerms: false\n");

        SpecdocxConfig config = SpecdocxConfig.load(file);

        assertEquals("//>", config.getCommentPrefix());
        assertEquals(1, config.getBulletAbstractNumId());
        assertFalse(config.isEmphasizeTerms());
    }

    @Test
    void unreadableFileGivesDefaults() throws IOException {
        Path file = tempDir.resolve("specdocx-config.yml");
        Files.writeString(file, "bulletAbstractNumId: [not, a, number]\n");

        SpecdocxConfig config = SpecdocxConfig.load(file);

        assertEquals(1, config.getBulletAbstractNumId());
        assertEquals("//>", config.getCommentPrefix());
    }

    @Test
    void withReplacesBlankPrefixAndNegativeBulletId() {
        SpecdocxConfig config = SpecdocxConfig.with("", null, -1, false);

        assertEquals("//>", config.getCommentPrefix());
        assertEquals(1, config.getBulletAbstractNumId());
        assertFalse(config.isEmphasizeTerms());
    }
}
