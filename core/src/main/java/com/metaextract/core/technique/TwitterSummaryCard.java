package com.metaextract.core.technique;

import com.metaextract.core.api.TechniqueContext;
import com.metaextract.core.model.Categories;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Twitter 카드 메타 태그. name 속성 우선, 없으면 property 속성도 키로 인정 */
public class TwitterSummaryCard extends MetaTagTechnique {

    public static final String ID = TwitterSummaryCard.class.getName();

    static final Map<String, String> KEYS;
    static {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("twitter:title", Categories.TITLES);
        m.put("twitter:description", Categories.DESCRIPTIONS);
        m.put("twitter:image", Categories.IMAGES);
        m.put("twitter:image:src", Categories.IMAGES);
        m.put("twitter:url", Categories.URLS);
        KEYS = m;
    }

    public TwitterSummaryCard(TechniqueContext context) {
        super(context, List.of("name", "property"), "content", KEYS);
    }
}
