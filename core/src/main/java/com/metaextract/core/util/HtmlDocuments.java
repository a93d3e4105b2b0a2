package com.metaextract.core.util;

import com.metaextract.core.error.MalformedInputException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

/** jsoup 파싱 진입점. 파이프라인/기법 모두 여기를 거쳐 동일한 입력 검증을 받는다. */
public final class HtmlDocuments {
    private HtmlDocuments() {}

    /**
     * 마크업 → jsoup Document.
     * null/공백뿐인 마크업, 파서 내부 오류는 MalformedInputException.
     * base URI는 비워 둔다(상대 URL 해석은 파이프라인 후처리 담당).
     */
    public static Document parse(String markup) {
        requireMarkup(markup);
        try {
            return Jsoup.parse(markup, "");
        } catch (RuntimeException e) {
            throw new MalformedInputException("markup could not be parsed: " + e.getMessage(), e);
        }
    }

    public static void requireMarkup(String markup) {
        if (markup == null || markup.isBlank()) {
            throw new MalformedInputException("markup is empty");
        }
    }
}
