package com.metaextract.core.model;

import java.util.Set;

/**
 * 기본 스키마의 카테고리 이름. 카테고리 집합은 열려 있으므로
 * 여기 없는 이름도 기법이 자유롭게 보고할 수 있다.
 */
public final class Categories {
    private Categories() {}

    public static final String TITLES       = "titles";
    public static final String DESCRIPTIONS = "descriptions";
    public static final String IMAGES       = "images";
    public static final String URLS         = "urls";
    public static final String FEEDS        = "feeds";

    /** 기본 스키마. 이 밖의 카테고리는 Extracted#unexpectedValues()로 모인다 */
    public static final Set<String> BUILTIN = Set.of(TITLES, DESCRIPTIONS, IMAGES, URLS, FEEDS);

    public static boolean isBuiltin(String category) {
        return category != null && BUILTIN.contains(category);
    }
}
