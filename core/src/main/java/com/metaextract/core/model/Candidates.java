package com.metaextract.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 카테고리별 후보 누적기.
 * - 카테고리는 처음 등장한 순서, 후보는 추가된 순서를 유지
 * - 중복/빈 문자열도 그대로 보존(필터링은 기법의 몫)
 * - 호출 단위 지역 객체. 스레드 안전하지 않음
 */
public final class Candidates {

    private final Map<String, List<String>> byCategory = new LinkedHashMap<>();

    /** 후보 없이 카테고리만 등록(빈 목록 보고용) */
    public Candidates ensure(String category) {
        slot(category);
        return this;
    }

    public Candidates add(String category, String value) {
        Objects.requireNonNull(value, "value");
        slot(category).add(value);
        return this;
    }

    public Candidates addAll(String category, List<String> values) {
        Objects.requireNonNull(values, "values");
        List<String> slot = slot(category);
        for (String v : values) slot.add(Objects.requireNonNull(v, "value"));
        return this;
    }

    public List<String> get(String category) {
        List<String> l = byCategory.get(category);
        return l == null ? List.of() : Collections.unmodifiableList(l);
    }

    public boolean isEmpty() { return byCategory.isEmpty(); }

    /** 현재 상태의 불변 스냅샷 */
    public Map<String, List<String>> toMap() {
        Map<String, List<String>> out = new LinkedHashMap<>();
        byCategory.forEach((k, v) -> out.put(k, Collections.unmodifiableList(new ArrayList<>(v))));
        return Collections.unmodifiableMap(out);
    }

    private List<String> slot(String category) {
        Objects.requireNonNull(category, "category");
        return byCategory.computeIfAbsent(category, k -> new ArrayList<>());
    }
}
