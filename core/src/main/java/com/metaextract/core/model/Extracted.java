package com.metaextract.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 추출 결과 (불변 값 객체).
 *
 * <p>카테고리별 병합 후보 목록 전체와 원본 source URL을 보관한다.
 * 설정된 단수 카테고리(기본 title/description/image/url)는 첫 후보를
 * {@link Optional}로 돌려주는 접근자를 가진다. 기본 스키마에 없는 카테고리도
 * 그대로 보관되므로, 기법 작성자는 이 클래스를 고치지 않고 새 카테고리를 보고할 수 있다.
 *
 * <p>추가 카테고리 접근자가 필요하면 상속 후 {@link ResultFactory}로 Extractor에 넘긴다.
 */
public class Extracted {

    public static final String TITLE       = "title";
    public static final String DESCRIPTION = "description";
    public static final String IMAGE       = "image";
    public static final String URL         = "url";

    private final Map<String, List<String>> values;        // 카테고리 등장 순서 유지
    private final Map<String, String> singularCategories;  // accessor → category
    private final String sourceUrl;                        // nullable

    public Extracted(Map<String, List<String>> values,
                     String sourceUrl,
                     Map<String, String> singularCategories) {
        Objects.requireNonNull(values, "values");
        Objects.requireNonNull(singularCategories, "singularCategories");

        Map<String, List<String>> copy = new LinkedHashMap<>();
        values.forEach((category, list) -> {
            Objects.requireNonNull(category, "category");
            Objects.requireNonNull(list, "values[" + category + "]");
            List<String> l = new ArrayList<>(list.size());
            for (String v : list) l.add(Objects.requireNonNull(v, "values[" + category + "] element"));
            copy.put(category, Collections.unmodifiableList(l));
        });
        this.values = Collections.unmodifiableMap(copy);
        this.singularCategories = Collections.unmodifiableMap(new LinkedHashMap<>(singularCategories));
        this.sourceUrl = sourceUrl;
    }

    /** 기본 단수 카테고리, source URL 없이 생성 (테스트/수동 조립용) */
    public static Extracted of(Map<String, List<String>> values) {
        return new Extracted(values, null, ExtractionConfig.DEFAULT_SINGULAR_CATEGORIES);
    }

    // ---------- 단수 접근자 ----------
    public Optional<String> getTitle()       { return singular(TITLE); }
    public Optional<String> getDescription() { return singular(DESCRIPTION); }
    public Optional<String> getImage()       { return singular(IMAGE); }
    public Optional<String> getUrl()         { return singular(URL); }

    /**
     * accessor 이름으로 첫 후보를 조회.
     * 후보가 없으면 Optional.empty(). 설정되지 않은 accessor 이름은 호출 측 오류로 보고 예외.
     */
    public Optional<String> singular(String accessor) {
        String category = singularCategories.get(accessor);
        if (category == null) {
            throw new IllegalArgumentException("no singular accessor '" + accessor + "' (configured: "
                    + singularCategories.keySet() + ")");
        }
        List<String> l = values(category);
        return l.isEmpty() ? Optional.empty() : Optional.of(l.get(0));
    }

    public boolean hasSingular(String accessor) {
        return singularCategories.containsKey(accessor);
    }

    /** 설정된 accessor 이름 (설정 순서) */
    public Set<String> singularNames() {
        return singularCategories.keySet();
    }

    public Map<String, String> getSingularCategories() {
        return singularCategories;
    }

    // ---------- 목록 접근자 ----------
    public List<String> getTitles()       { return values(Categories.TITLES); }
    public List<String> getDescriptions() { return values(Categories.DESCRIPTIONS); }
    public List<String> getImages()       { return values(Categories.IMAGES); }
    public List<String> getUrls()         { return values(Categories.URLS); }
    public List<String> getFeeds()        { return values(Categories.FEEDS); }

    /** 카테고리의 전체 후보 목록. 보고된 적 없는 카테고리면 빈 목록 */
    public List<String> values(String category) {
        List<String> l = values.get(category);
        return l == null ? List.of() : l;
    }

    /** 보고된 모든 카테고리 (빈 목록 포함) */
    public Set<String> categories() {
        return values.keySet();
    }

    public Map<String, List<String>> asMap() {
        return values;
    }

    /**
     * 기본 스키마에도, 단수 카테고리 설정에도 없는 카테고리들.
     * 예: 커스텀 기법이 보고한 "tags"
     */
    public Map<String, List<String>> unexpectedValues() {
        Map<String, List<String>> out = new LinkedHashMap<>();
        values.forEach((category, list) -> {
            if (!Categories.isBuiltin(category) && !singularCategories.containsValue(category)) {
                out.put(category, list);
            }
        });
        return Collections.unmodifiableMap(out);
    }

    public Optional<String> getSourceUrl() {
        return Optional.ofNullable(sourceUrl);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Extracted that = (Extracted) o;
        return values.equals(that.values)
                && singularCategories.equals(that.singularCategories)
                && Objects.equals(sourceUrl, that.sourceUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values, singularCategories, sourceUrl);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{sourceUrl=" + sourceUrl + ", values=" + values + "}";
    }
}
