package com.metaextract.core.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 기법이 생성 시점에 받는 읽기 전용 설정 뷰.
 * Extractor를 직접 참조하지 않고, 호출자 수준 설정만 노출한다.
 */
public final class TechniqueContext {

    private final List<String> techniques;
    private final Map<String, String> singularCategories; // accessor → category
    private final Set<String> urlCategories;

    public TechniqueContext(List<String> techniques,
                            Map<String, String> singularCategories,
                            Set<String> urlCategories) {
        this.techniques = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(techniques, "techniques")));
        this.singularCategories = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(singularCategories, "singularCategories")));
        this.urlCategories = Collections.unmodifiableSet(new LinkedHashSet<>(
                Objects.requireNonNull(urlCategories, "urlCategories")));
    }

    /** 설정된 기법 식별자(우선순위 순) */
    public List<String> getTechniques() { return techniques; }

    public Map<String, String> getSingularCategories() { return singularCategories; }

    public Set<String> getUrlCategories() { return urlCategories; }

    public boolean isUrlCategory(String category) {
        return category != null && urlCategories.contains(category);
    }
}
