package com.metaextract.core.util;

import com.metaextract.core.error.ConfigurationException;
import com.metaextract.core.model.ExtractionConfig;
import com.metaextract.core.technique.FacebookOpengraphTags;
import com.metaextract.core.technique.HeadTags;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class YamlConfigLoaderTest {

    @TempDir
    Path tmp;

    private static ExtractionConfig fromString(String yaml) {
        return YamlConfigLoader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void loads_techniques_singular_and_url_categories_from_file() throws Exception {
        Path file = tmp.resolve("extract.yml");
        Files.writeString(file, """
            techniques:
              - com.metaextract.core.technique.HeadTags
              - com.metaextract.core.technique.FacebookOpengraphTags
            singular:
              title: titles
              tag: tags
            urlCategories: [images, videos]
            """);

        ExtractionConfig cfg = YamlConfigLoader.load(file);

        assertThat(cfg.getTechniques()).containsExactly(HeadTags.ID, FacebookOpengraphTags.ID);
        assertThat(cfg.getSingularCategories()).containsExactly(entry("title", "titles"), entry("tag", "tags"));
        assertThat(cfg.getUrlCategories()).containsExactly("images", "videos");
    }

    @Test
    void missing_keys_keep_defaults_and_empty_document_is_default() {
        ExtractionConfig partial = fromString("urlCategories: images, urls\n");
        assertThat(partial.getTechniques()).isEqualTo(ExtractionConfig.DEFAULT_TECHNIQUES);
        assertThat(partial.getUrlCategories()).containsExactly("images", "urls");

        ExtractionConfig empty = fromString("");
        assertThat(empty.getSingularCategories()).isEqualTo(ExtractionConfig.DEFAULT_SINGULAR_CATEGORIES);
    }

    @Test
    void wrong_shapes_are_configuration_errors() {
        assertThatThrownBy(() -> fromString("singular: [title, titles]\n"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("singular");
        assertThatThrownBy(() -> fromString("techniques:\n  - {a: b}\n"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("techniques");
        assertThatThrownBy(() -> fromString("techniques: [a, ''] \n"))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> fromString("techniques: [unclosed\n"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("invalid yaml");
    }

    @Test
    void missing_file_is_io_error() {
        assertThatThrownBy(() -> YamlConfigLoader.load(tmp.resolve("nope.yml")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void loads_classpath_resource() throws Exception {
        ExtractionConfig cfg = YamlConfigLoader.loadResource("extract-all.yml");

        assertThat(cfg.getTechniques()).isEqualTo(ExtractionConfig.ALL_BUILTIN_TECHNIQUES);
        assertThat(cfg.getSingularCategories()).containsEntry("feed", "feeds");
        assertThatThrownBy(() -> YamlConfigLoader.loadResource("missing.yml")).isInstanceOf(IOException.class);
    }
}
