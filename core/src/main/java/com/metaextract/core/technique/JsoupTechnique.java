package com.metaextract.core.technique;

import com.metaextract.core.api.Technique;
import com.metaextract.core.api.TechniqueContext;
import com.metaextract.core.model.Candidates;
import com.metaextract.core.util.HtmlDocuments;
import org.jsoup.nodes.Document;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * jsoup 문서 트리를 순회하는 기법의 공통 베이스.
 * 하위 클래스는 {@link #collect(Document, Candidates)}만 구현한다.
 */
public abstract class JsoupTechnique implements Technique {

    protected final TechniqueContext context;

    protected JsoupTechnique(TechniqueContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    /** 단독 호출용: 직접 파싱 후 수집 */
    @Override
    public final Map<String, List<String>> extract(String markup) {
        return extract(markup, HtmlDocuments.parse(markup));
    }

    @Override
    public Map<String, List<String>> extract(String markup, Document document) {
        Objects.requireNonNull(document, "document");
        Candidates out = new Candidates();
        collect(document, out);
        return out.toMap();
    }

    /** 문서 순서대로 후보를 out에 추가. 찾는 요소가 없으면 빈 카테고리만 남긴다 */
    protected abstract void collect(Document document, Candidates out);
}
