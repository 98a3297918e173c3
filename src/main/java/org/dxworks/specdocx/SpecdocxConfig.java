package org.dxworks.specdocx;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.specdocx.converter.NumberingAllocator;
import org.dxworks.specdocx.source.AnnotatedSourceExtractor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class SpecdocxConfig {

    private static final String CONFIG_FILE_NAME = "specdocx-config.yml";
    private static final String DEFAULT_COMMENT_PREFIX = AnnotatedSourceExtractor.DEFAULT_PREFIX;
    private static final int DEFAULT_BULLET_ABSTRACT_NUM_ID = NumberingAllocator.DEFAULT_BULLET_ABSTRACT_NUM_ID;
    private static final boolean DEFAULT_EMPHASIZE_TERMS = true;

    private final String commentPrefix;
    private final Path templatePath; // nullable
    private final int bulletAbstractNumId;
    private final boolean emphasizeTerms;

    private SpecdocxConfig(String commentPrefix, Path templatePath, int bulletAbstractNumId, boolean emphasizeTerms) {
        this.commentPrefix = commentPrefix;
        this.templatePath = templatePath;
        this.bulletAbstractNumId = bulletAbstractNumId;
        this.emphasizeTerms = emphasizeTerms;
    }

    public String getCommentPrefix() {
        return commentPrefix;
    }

    public Path getTemplatePath() {
        return templatePath;
    }

    public int getBulletAbstractNumId() {
        return bulletAbstractNumId;
    }

    public boolean isEmphasizeTerms() {
        return emphasizeTerms;
    }

    public static SpecdocxConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static SpecdocxConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                String effectivePrefix = (yamlConfig.commentPrefix != null && !yamlConfig.commentPrefix.isBlank())
                        ? yamlConfig.commentPrefix
                        : DEFAULT_COMMENT_PREFIX;
                Path effectiveTemplate = (yamlConfig.templatePath != null && !yamlConfig.templatePath.isBlank())
                        ? Paths.get(yamlConfig.templatePath)
                        : null;
                int effectiveBulletId = (yamlConfig.bulletAbstractNumId != null && yamlConfig.bulletAbstractNumId >= 0)
                        ? yamlConfig.bulletAbstractNumId
                        : DEFAULT_BULLET_ABSTRACT_NUM_ID;
                boolean effectiveEmphasizeTerms = (yamlConfig.emphasizeTerms != null)
                        ? yamlConfig.emphasizeTerms
                        : DEFAULT_EMPHASIZE_TERMS;

                return new SpecdocxConfig(effectivePrefix, effectiveTemplate, effectiveBulletId, effectiveEmphasizeTerms);
            }
        } catch (IOException e) {
            System.err.println("Warning: could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    public static SpecdocxConfig defaults() {
        return new SpecdocxConfig(DEFAULT_COMMENT_PREFIX, null, DEFAULT_BULLET_ABSTRACT_NUM_ID, DEFAULT_EMPHASIZE_TERMS);
    }

    public static SpecdocxConfig with(String commentPrefix, Path templatePath, int bulletAbstractNumId, boolean emphasizeTerms) {
        String effectivePrefix = (commentPrefix != null && !commentPrefix.isBlank()) ? commentPrefix : DEFAULT_COMMENT_PREFIX;
        int effectiveBulletId = bulletAbstractNumId >= 0 ? bulletAbstractNumId : DEFAULT_BULLET_ABSTRACT_NUM_ID;
        return new SpecdocxConfig(effectivePrefix, templatePath, effectiveBulletId, emphasizeTerms);
    }

    private static class YamlConfig {
        public String commentPrefix;
        public String templatePath;
        public Integer bulletAbstractNumId;
        public Boolean emphasizeTerms;
    }
}
