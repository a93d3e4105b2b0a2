package com.metaextract.core.model;

import com.metaextract.core.error.ConfigurationException;
import com.metaextract.core.technique.FacebookOpengraphTags;
import com.metaextract.core.technique.HeadTags;
import com.metaextract.core.technique.Html5SemanticTags;
import com.metaextract.core.technique.SemanticTags;
import com.metaextract.core.technique.TwitterSummaryCard;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 추출 설정 (extract.yml 매핑 대상). 순수 설정 보관용.
 * Extractor는 생성 시 이 값을 불변 사본으로 복사하므로, 이후 이 객체를 고쳐도
 * 이미 만들어진 Extractor에는 영향이 없다.
 */
public final class ExtractionConfig {

    /** 기본 기법 목록: Open Graph 메타 태그 하나 */
    public static final List<String> DEFAULT_TECHNIQUES = List.of(FacebookOpengraphTags.ID);

    /** 내장 기법 전체 (권장 우선순위 순) */
    public static final List<String> ALL_BUILTIN_TECHNIQUES = List.of(
            FacebookOpengraphTags.ID,
            TwitterSummaryCard.ID,
            HeadTags.ID,
            Html5SemanticTags.ID,
            SemanticTags.ID);

    /** accessor → category 기본 매핑 */
    public static final Map<String, String> DEFAULT_SINGULAR_CATEGORIES;
    static {
        Map<String, String> m = new LinkedHashMap<>();
        m.put(Extracted.TITLE, Categories.TITLES);
        m.put(Extracted.DESCRIPTION, Categories.DESCRIPTIONS);
        m.put(Extracted.IMAGE, Categories.IMAGES);
        m.put(Extracted.URL, Categories.URLS);
        DEFAULT_SINGULAR_CATEGORIES = Collections.unmodifiableMap(m);
    }

    /** 상대 URL 절대화 대상 카테고리 기본값 */
    public static final Set<String> DEFAULT_URL_CATEGORIES = Collections.unmodifiableSet(
            new LinkedHashSet<>(List.of(Categories.IMAGES, Categories.URLS, Categories.FEEDS)));

    // ---------- 필드 ----------
    private List<String> techniques = DEFAULT_TECHNIQUES;
    private Map<String, String> singularCategories = DEFAULT_SINGULAR_CATEGORIES;
    private Set<String> urlCategories = DEFAULT_URL_CATEGORIES;

    // ---------- getters ----------
    public List<String> getTechniques() { return techniques; }
    public Map<String, String> getSingularCategories() { return singularCategories; }
    public Set<String> getUrlCategories() { return urlCategories; }

    // ---------- fluent setters ----------
    /** 기법 식별자 목록 교체 (순서 = 우선순위). null이면 validate에서 거부 */
    public ExtractionConfig setTechniques(List<String> techniques) {
        this.techniques = (techniques == null ? null : Collections.unmodifiableList(new ArrayList<>(techniques)));
        return this;
    }

    /** 목록 끝(가장 낮은 우선순위)에 기법 추가 */
    public ExtractionConfig addTechnique(String id) {
        List<String> l = new ArrayList<>(techniques == null ? List.of() : techniques);
        l.add(id);
        this.techniques = Collections.unmodifiableList(l);
        return this;
    }

    /** 단수 접근자 매핑 전체 교체 */
    public ExtractionConfig setSingularCategories(Map<String, String> mapping) {
        this.singularCategories = (mapping == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(mapping)));
        return this;
    }

    /** 단수 접근자 하나 추가/덮어쓰기. 예: singular("tag", "tags") */
    public ExtractionConfig singular(String accessor, String category) {
        Map<String, String> m = new LinkedHashMap<>(singularCategories == null ? Map.of() : singularCategories);
        m.put(accessor, category);
        this.singularCategories = Collections.unmodifiableMap(m);
        return this;
    }

    public ExtractionConfig setUrlCategories(Set<String> categories) {
        this.urlCategories = (categories == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(categories)));
        return this;
    }

    public ExtractionConfig urlCategory(String category) {
        Set<String> s = new LinkedHashSet<>(urlCategories == null ? Set.of() : urlCategories);
        s.add(category);
        this.urlCategories = Collections.unmodifiableSet(s);
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(techniques, "techniques");
        Objects.requireNonNull(singularCategories, "singularCategories");
        Objects.requireNonNull(urlCategories, "urlCategories");

        for (String id : techniques) {
            if (id == null || id.isBlank()) {
                throw new ConfigurationException("technique identifier must not be blank");
            }
        }
        singularCategories.forEach((accessor, category) -> {
            if (accessor == null || accessor.isBlank()) {
                throw new ConfigurationException("singular accessor name must not be blank");
            }
            if (category == null || category.isBlank()) {
                throw new ConfigurationException("singular accessor '" + accessor + "' has no category");
            }
        });
        for (String c : urlCategories) {
            if (c == null || c.isBlank()) {
                throw new ConfigurationException("url category must not be blank");
            }
        }
    }

    // ---------- helpers ----------
    public static ExtractionConfig defaults() { return new ExtractionConfig(); }

    /** 내장 기법 전체를 권장 순서로 사용하는 설정 */
    public static ExtractionConfig allBuiltinTechniques() {
        return new ExtractionConfig().setTechniques(ALL_BUILTIN_TECHNIQUES);
    }
}
