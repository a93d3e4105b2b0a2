package com.metaextract.core.model;

import java.util.List;
import java.util.Map;

/**
 * 병합이 끝난 후보로 결과 컨테이너를 만든다.
 * 기본은 {@code Extracted::new}. 접근자를 추가한 하위 클래스의 생성자를 넘기면 된다.
 */
@FunctionalInterface
public interface ResultFactory<R extends Extracted> {
    R create(Map<String, List<String>> values, String sourceUrl, Map<String, String> singularCategories);
}
