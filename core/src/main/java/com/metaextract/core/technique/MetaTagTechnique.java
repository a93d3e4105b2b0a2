package com.metaextract.core.technique;

import com.metaextract.core.api.TechniqueContext;
import com.metaextract.core.model.Candidates;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * head의 key/value 메타 태그 기반 기법 베이스.
 * - keyAttributes 중 처음으로 값이 있는 속성을 키로 사용(소문자 비교)
 * - keyMap에 있는 키만 인식, 나머지는 무시
 * - value 속성이 없는 태그는 건너뜀 (빈 문자열 값은 그대로 후보)
 */
public abstract class MetaTagTechnique extends JsoupTechnique {

    private final List<String> keyAttributes;
    private final String valueAttribute;
    private final Map<String, String> keyMap; // 메타 키 → 카테고리

    protected MetaTagTechnique(TechniqueContext context,
                               List<String> keyAttributes,
                               String valueAttribute,
                               Map<String, String> keyMap) {
        super(context);
        if (keyAttributes == null || keyAttributes.isEmpty()) {
            throw new IllegalArgumentException("keyAttributes must not be empty");
        }
        this.keyAttributes = List.copyOf(keyAttributes);
        this.valueAttribute = valueAttribute;
        Map<String, String> m = new LinkedHashMap<>();
        keyMap.forEach((k, v) -> m.put(k.toLowerCase(Locale.ROOT), v));
        this.keyMap = Collections.unmodifiableMap(m);
    }

    @Override
    protected void collect(Document document, Candidates out) {
        for (String category : keyMap.values()) out.ensure(category);

        for (Element meta : document.select("meta")) {
            String key = keyOf(meta);
            if (key == null) continue;
            String category = keyMap.get(key);
            if (category == null) continue;
            if (!meta.hasAttr(valueAttribute)) continue;
            out.add(category, meta.attr(valueAttribute));
        }
    }

    private String keyOf(Element meta) {
        for (String attr : keyAttributes) {
            String k = meta.attr(attr).trim();
            if (!k.isEmpty()) return k.toLowerCase(Locale.ROOT);
        }
        return null;
    }
}
