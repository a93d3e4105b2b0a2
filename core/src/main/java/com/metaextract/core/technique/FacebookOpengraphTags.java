package com.metaextract.core.technique;

import com.metaextract.core.api.TechniqueContext;
import com.metaextract.core.model.Categories;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Open Graph 메타 태그 추출 (기본 기법).
 * {@code <meta property="og:title" content="...">} 형태를 문서 순서대로 수집한다.
 */
public class FacebookOpengraphTags extends MetaTagTechnique {

    public static final String ID = FacebookOpengraphTags.class.getName();

    static final Map<String, String> KEYS;
    static {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("og:title", Categories.TITLES);
        m.put("og:description", Categories.DESCRIPTIONS);
        m.put("og:image", Categories.IMAGES);
        m.put("og:url", Categories.URLS);
        KEYS = m;
    }

    public FacebookOpengraphTags(TechniqueContext context) {
        super(context, List.of("property"), "content", KEYS);
    }
}
