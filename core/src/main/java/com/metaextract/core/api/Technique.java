package com.metaextract.core.api;

import org.jsoup.nodes.Document;

import java.util.List;
import java.util.Map;

/** 추출 기법 최소 계약: 마크업을 받아 카테고리별 후보 목록을 돌려준다. */
public interface Technique {

    /**
     * 마크업에서 후보를 추출한다.
     * 기대한 요소가 없으면 해당 카테고리는 빈 목록으로 돌려준다(예외 금지).
     * 마크업 자체를 파싱할 수 없을 때만 MalformedInputException.
     */
    Map<String, List<String>> extract(String markup);

    /**
     * 파이프라인이 미리 파싱한 문서의 사본을 함께 받는 오버로드.
     * document는 이 호출 전용 사본이므로 자유롭게 변형해도 된다. 기본 구현은 document를 무시.
     */
    default Map<String, List<String>> extract(String markup, Document document) {
        return extract(markup);
    }
}
