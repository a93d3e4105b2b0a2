package com.metaextract.core.model;

import com.metaextract.core.error.ConfigurationException;
import com.metaextract.core.technique.FacebookOpengraphTags;
import com.metaextract.core.technique.SemanticTags;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ExtractionConfigTest {

    @Test
    void defaultsAreValid() {
        ExtractionConfig cfg = ExtractionConfig.defaults();
        cfg.validate();

        assertThat(cfg.getTechniques()).containsExactly(FacebookOpengraphTags.ID);
        assertThat(cfg.getSingularCategories()).containsExactly(
                entry("title", "titles"),
                entry("description", "descriptions"),
                entry("image", "images"),
                entry("url", "urls"));
        assertThat(cfg.getUrlCategories()).containsExactly("images", "urls", "feeds");
    }

    @Test
    void allBuiltinTechniquesEndsWithNoisiestTechnique() {
        List<String> ids = ExtractionConfig.allBuiltinTechniques().getTechniques();
        assertThat(ids).hasSize(5).startsWith(FacebookOpengraphTags.ID).endsWith(SemanticTags.ID);
    }

    @Test
    void defaultConstantsAreImmutable() {
        assertThatThrownBy(() -> ExtractionConfig.DEFAULT_TECHNIQUES.add("x"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> ExtractionConfig.DEFAULT_SINGULAR_CATEGORIES.put("a", "b"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void fluentAddersDoNotTouchDefaults() {
        ExtractionConfig cfg = ExtractionConfig.defaults()
                .addTechnique("custom.One")
                .singular("tag", "tags")
                .urlCategory("videos");

        assertThat(cfg.getTechniques()).containsExactly(FacebookOpengraphTags.ID, "custom.One");
        assertThat(cfg.getSingularCategories()).containsEntry("tag", "tags");
        assertThat(cfg.getUrlCategories()).contains("videos");
        assertThat(ExtractionConfig.DEFAULT_TECHNIQUES).containsExactly(FacebookOpengraphTags.ID);
    }

    @Test
    void validateRejectsBlankTechniqueIdentifier() {
        ExtractionConfig cfg = new ExtractionConfig().setTechniques(Arrays.asList(FacebookOpengraphTags.ID, " "));

        assertThatThrownBy(cfg::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("technique identifier");
    }

    @Test
    void validateRejectsNullCollections() {
        assertThrows(NullPointerException.class, () -> new ExtractionConfig().setTechniques(null).validate());
        assertThrows(NullPointerException.class, () -> new ExtractionConfig().setUrlCategories(null).validate());
    }

    @Test
    void validateRejectsSingularAccessorWithoutCategory() {
        ExtractionConfig cfg = new ExtractionConfig().setSingularCategories(Map.of("title", " "));

        assertThatThrownBy(cfg::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("title");
    }

    @Test
    void emptyTechniqueListIsAllowed() {
        ExtractionConfig cfg = new ExtractionConfig().setTechniques(List.of());
        assertThatCode(cfg::validate).doesNotThrowAnyException();
    }
}
