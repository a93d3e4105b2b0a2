package com.metaextract.core.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.metaextract.core.model.Extracted;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Extracted → JSON.
 * <pre>
 * { "sourceUrl": "...|null",
 *   "singular": { "title": "...|null", ... },   // 설정 순서
 *   "values":   { "titles": [...], ... } }      // 카테고리 등장 순서
 * </pre>
 * 같은 결과는 항상 같은 문자열을 만든다(키 순서 고정).
 */
public final class ExtractedJson {

    private final ObjectMapper om = new ObjectMapper();

    public ObjectNode toTree(Extracted result) {
        Objects.requireNonNull(result, "result");
        ObjectNode root = om.createObjectNode();
        root.put("sourceUrl", result.getSourceUrl().orElse(null));

        ObjectNode singular = root.putObject("singular");
        for (String accessor : result.singularNames()) {
            singular.put(accessor, result.singular(accessor).orElse(null));
        }

        ObjectNode values = root.putObject("values");
        result.asMap().forEach((category, list) -> values.set(category, array(list)));
        return root;
    }

    public String toJson(Extracted result) {
        return write(toTree(result), false);
    }

    public String toPrettyJson(Extracted result) {
        return write(toTree(result), true);
    }

    public void writeTo(Extracted result, Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        Files.writeString(file, toPrettyJson(result), StandardCharsets.UTF_8);
    }

    private ArrayNode array(List<String> list) {
        ArrayNode a = om.createArrayNode();
        for (String v : list) a.add(v);
        return a;
    }

    private String write(JsonNode node, boolean pretty) {
        try {
            return pretty ? om.writerWithDefaultPrettyPrinter().writeValueAsString(node)
                          : om.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            // 트리 노드 직렬화는 실패하지 않아야 정상
            throw new UncheckedIOException(e);
        }
    }
}
