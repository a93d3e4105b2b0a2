package com.metaextract.core.util;

import com.metaextract.core.error.ConfigurationException;
import com.metaextract.core.model.ExtractionConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * extract.yml을 읽어 ExtractionConfig로 변환.
 *
 * 예상 YAML 키:
 * techniques:                 # 우선순위 순. "a, b" 문자열도 허용
 *   - com.metaextract.core.technique.FacebookOpengraphTags
 *   - com.metaextract.core.technique.HeadTags
 * singular:                   # accessor → category (지정 시 기본 매핑을 통째로 교체)
 *   title: titles
 *   tag: tags
 * urlCategories: [images, urls, feeds]
 *
 * 없는 키는 기본값 유지. 타입이 맞지 않는 값은 ConfigurationException.
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static ExtractionConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("extract.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    /** 클래스패스 리소스에서 로드 (예: "extract.yml") */
    public static ExtractionConfig loadResource(String resource) throws IOException {
        Objects.requireNonNull(resource, "resource");
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = YamlConfigLoader.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null) throw new IOException("resource not found: " + resource);
            return load(in);
        }
    }

    public static ExtractionConfig load(InputStream in) {
        Objects.requireNonNull(in, "in");
        Object root;
        try {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            root = yaml.load(in);
        } catch (YAMLException e) {
            throw new ConfigurationException("invalid yaml: " + e.getMessage(), e);
        }

        ExtractionConfig cfg = ExtractionConfig.defaults();

        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        setStringList(map, "techniques", cfg::setTechniques);
        setStringMap(map, "singular", cfg::setSingularCategories);
        setStringList(map, "urlCategories", l -> cfg.setUrlCategories(new LinkedHashSet<>(l)));

        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        if (!map.containsKey(key)) return;
        Object v = map.get(key);
        if (v == null) {
            setter.accept(List.of());
            return;
        }
        if (v instanceof List<?> list) {
            List<String> out = new ArrayList<>();
            for (Object o : list) {
                if (o == null || o instanceof Map || o instanceof List) {
                    throw new ConfigurationException("'" + key + "' must be a list of strings");
                }
                out.add(String.valueOf(o).trim());
            }
            setter.accept(out);
            return;
        }
        if (v instanceof Map) {
            throw new ConfigurationException("'" + key + "' must be a list of strings");
        }
        // "a,b,c" 형태 지원
        List<String> out = new ArrayList<>();
        for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) {
            if (!p.isEmpty()) out.add(p);
        }
        setter.accept(out);
    }

    private static void setStringMap(Map<?, ?> map, String key, Consumer<Map<String, String>> setter) {
        if (!map.containsKey(key)) return;
        Object v = map.get(key);
        if (v == null) {
            setter.accept(Map.of());
            return;
        }
        if (!(v instanceof Map<?, ?> m)) {
            throw new ConfigurationException("'" + key + "' must be a mapping of accessor: category");
        }
        Map<String, String> out = new LinkedHashMap<>();
        m.forEach((k, val) -> {
            if (k == null || val == null || val instanceof Map || val instanceof List) {
                throw new ConfigurationException("'" + key + "' entries must be accessor: category strings");
            }
            out.put(String.valueOf(k).trim(), String.valueOf(val).trim());
        });
        setter.accept(out);
    }
}
