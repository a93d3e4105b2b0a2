package com.metaextract.core.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metaextract.core.model.Extracted;
import com.metaextract.core.model.ExtractionConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractedJsonTest {

    @TempDir
    Path tmp;

    private static Extracted sample() {
        Map<String, List<String>> v = new LinkedHashMap<>();
        v.put("titles", List.of("A", "B"));
        v.put("images", List.of());
        v.put("tags", List.of("python"));
        return new Extracted(v, "https://example.org/", ExtractionConfig.DEFAULT_SINGULAR_CATEGORIES);
    }

    @Test
    void renders_singular_values_and_all_categories_in_order() {
        String json = new ExtractedJson().toJson(sample());

        assertThat(json).isEqualTo("{\"sourceUrl\":\"https://example.org/\","
                + "\"singular\":{\"title\":\"A\",\"description\":null,\"image\":null,\"url\":null},"
                + "\"values\":{\"titles\":[\"A\",\"B\"],\"images\":[],\"tags\":[\"python\"]}}");
    }

    @Test
    void missing_source_url_is_null() {
        String json = new ExtractedJson().toJson(Extracted.of(Map.of()));
        assertThat(json).startsWith("{\"sourceUrl\":null,");
    }

    @Test
    void writes_pretty_file() throws Exception {
        Path out = tmp.resolve("result.json");
        new ExtractedJson().writeTo(sample(), out);

        JsonNode n = new ObjectMapper().readTree(Files.readString(out));
        assertThat(n.get("values").get("tags").get(0).asText()).isEqualTo("python");
        assertThat(Files.readString(out)).contains(System.lineSeparator());
        assertThat(Files.readString(out)).isEqualTo(new ExtractedJson().toPrettyJson(sample()));
    }
}
