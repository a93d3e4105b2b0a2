package com.metaextract.core.extractor;

import com.metaextract.core.api.TechniqueContext;
import com.metaextract.core.api.TechniqueFactory;
import com.metaextract.core.error.ConfigurationException;
import com.metaextract.core.model.ExtractionConfig;
import com.metaextract.core.technique.FacebookOpengraphTags;
import com.metaextract.core.technique.SemanticTags;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class TechniqueRegistryTest {

    private static final TechniqueContext CTX = new TechniqueContext(
            List.of(), ExtractionConfig.DEFAULT_SINGULAR_CATEGORIES, Set.of());

    @Test
    void builtins_cover_all_builtin_technique_ids_in_order() {
        assertThat(TechniqueRegistry.builtins().identifiers())
                .containsExactlyElementsOf(ExtractionConfig.ALL_BUILTIN_TECHNIQUES);
    }

    @Test
    void builtin_ids_are_fully_qualified_class_names() {
        assertThat(FacebookOpengraphTags.ID).isEqualTo("com.metaextract.core.technique.FacebookOpengraphTags");
        assertThat(TechniqueRegistry.builtins().resolve(FacebookOpengraphTags.ID).create(CTX))
                .isInstanceOf(FacebookOpengraphTags.class);
    }

    @Test
    void resolve_unknown_identifier_throws_with_identifier() {
        assertThatThrownBy(() -> TechniqueRegistry.builtins().resolve("extraction.techniques.Nope"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("extraction.techniques.Nope");
        assertThat(TechniqueRegistry.builtins().lookup(null)).isEmpty();
    }

    @Test
    void duplicate_registration_is_rejected() {
        TechniqueFactory f = ctx -> markup -> Map.of();
        TechniqueRegistry.Builder b = TechniqueRegistry.builder().register("x", f);

        assertThatThrownBy(() -> b.register("x", f))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("already registered");
        assertThatThrownBy(() -> b.register(" ", f)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void replace_swaps_builtin_factory_and_leaves_original_untouched() {
        TechniqueFactory custom = ctx -> markup -> Map.of("titles", List.of("custom"));
        TechniqueRegistry reg = TechniqueRegistry.builtins().toBuilder()
                .replace(SemanticTags.ID, custom)
                .build();

        assertThat(reg.resolve(SemanticTags.ID)).isSameAs(custom);
        assertThat(TechniqueRegistry.builtins().resolve(SemanticTags.ID)).isNotSameAs(custom);
        assertThatThrownBy(() -> TechniqueRegistry.builder().replace("missing", custom))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void identifiers_view_is_read_only() {
        assertThatThrownBy(() -> TechniqueRegistry.builtins().identifiers().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
