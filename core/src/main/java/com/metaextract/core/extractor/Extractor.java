package com.metaextract.core.extractor;

import com.metaextract.core.api.Technique;
import com.metaextract.core.api.TechniqueContext;
import com.metaextract.core.api.TechniqueFactory;
import com.metaextract.core.error.ConfigurationException;
import com.metaextract.core.error.TechniqueFailureException;
import com.metaextract.core.model.Candidates;
import com.metaextract.core.model.Extracted;
import com.metaextract.core.model.ExtractionConfig;
import com.metaextract.core.model.ResultFactory;
import com.metaextract.core.util.HtmlDocuments;
import com.metaextract.core.util.StructuredLog;
import com.metaextract.core.util.UrlResolver;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 추출 오케스트레이터:
 *  - 1) 입력 검증 + 1회 파싱
 *  - 2) 설정된 기법 식별자 전부 해석 (하나라도 실패하면 아무 기법도 실행하지 않음)
 *  - 3) 설정 순서대로 기법 생성/실행, 카테고리별 누적 (기법 순서 → 기법 내 순서)
 *  - 4) URL 카테고리 상대 경로 절대화
 *  - 5) ResultFactory로 결과 생성
 *
 * 설정은 생성 시 불변 사본으로 고정된다. 호출 간 공유 상태가 없으므로 여러 스레드에서
 * 같은 인스턴스를 동시에 써도 된다. 기법 예외는 잡지 않는다(부분 결과 없음).
 *
 * 커스터마이징은 하위 클래스에서 {@link #postProcess}, {@link #absolutize} 재정의로.
 */
public class Extractor<R extends Extracted> {

    private static final Logger LOG = LoggerFactory.getLogger(Extractor.class);
    private static final StructuredLog SLOG = StructuredLog.get(Extractor.class);

    private final List<String> techniques;
    private final Map<String, String> singularCategories;
    private final Set<String> urlCategories;
    private final TechniqueRegistry registry;
    private final ResultFactory<R> resultFactory;
    private final TechniqueContext context;

    /** 기본 설정(Open Graph 단일 기법) + 내장 레지스트리 */
    public static Extractor<Extracted> withDefaults() {
        return of(ExtractionConfig.defaults());
    }

    public static Extractor<Extracted> of(ExtractionConfig cfg) {
        return of(cfg, TechniqueRegistry.builtins());
    }

    public static Extractor<Extracted> of(ExtractionConfig cfg, TechniqueRegistry registry) {
        return new Extractor<>(cfg, registry, Extracted::new);
    }

    public Extractor(ExtractionConfig cfg, TechniqueRegistry registry, ResultFactory<R> resultFactory) {
        Objects.requireNonNull(cfg, "cfg");
        cfg.validate();
        this.registry = Objects.requireNonNull(registry, "registry");
        this.resultFactory = Objects.requireNonNull(resultFactory, "resultFactory");

        this.context = new TechniqueContext(cfg.getTechniques(), cfg.getSingularCategories(), cfg.getUrlCategories());
        this.techniques = context.getTechniques();
        this.singularCategories = context.getSingularCategories();
        this.urlCategories = context.getUrlCategories();
    }

    public R extract(String markup) {
        return extract(markup, null);
    }

    /**
     * sourceUrl이 주어졌는데 절대 URI가 아니면(예: "example.org/page") 없는 값으로
     * 취급하지 않고 MalformedInputException으로 거부한다. markup 검증에 더해진 입력 검사.
     *
     * @param markup    HTML 원문 (비어 있거나 파싱 불가면 MalformedInputException)
     * @param sourceUrl 원본 URL, nullable. 주어지면 scheme과 host가 있는 절대 URI여야 함
     * @throws com.metaextract.core.error.MalformedInputException markup이 비었거나 sourceUrl이 절대 URI가 아닐 때
     */
    public R extract(String markup, String sourceUrl) {
        // 1) 입력 검증 + 파싱
        HtmlDocuments.requireMarkup(markup);
        URI base = (sourceUrl == null) ? null : UrlResolver.parseBase(sourceUrl);
        Document parsed = HtmlDocuments.parse(markup);

        // 2) 식별자 해석: 실행 전에 전부
        List<String> ids = new ArrayList<>(techniques.size());
        List<TechniqueFactory> factories = new ArrayList<>(techniques.size());
        for (String id : techniques) {
            factories.add(registry.resolve(id));
            ids.add(id);
        }

        // 3) 순서대로 실행 + 병합
        Candidates acc = new Candidates();
        for (int i = 0; i < factories.size(); i++) {
            String id = ids.get(i);
            Technique technique = factories.get(i).create(context);
            if (technique == null) throw ConfigurationException.brokenFactory(id);

            Map<String, List<String>> out = technique.extract(markup, parsed.clone());
            merge(acc, id, out);
            if (LOG.isDebugEnabled()) {
                LOG.debug("technique {} reported categories {}", id, out.keySet());
            }
        }

        // 4) URL 후처리
        Map<String, List<String>> merged = postProcess(acc.toMap(), base);

        // 5) 결과
        R result = resultFactory.create(merged, sourceUrl, singularCategories);
        if (result == null) throw new ConfigurationException("result factory returned null");

        SLOG.debug("extract.done",
                "techniques", ids.size(),
                "categories", merged.size(),
                "sourceUrl", sourceUrl);
        return result;
    }

    /** 기법 출력 검증 + 누적. null 맵/목록/값은 기법 결함으로 본다 */
    private static void merge(Candidates acc, String id, Map<String, List<String>> out) {
        if (out == null) {
            throw new TechniqueFailureException(id, "returned null instead of a category map");
        }
        out.forEach((category, values) -> {
            if (category == null) {
                throw new TechniqueFailureException(id, "returned a null category name");
            }
            if (values == null) {
                throw new TechniqueFailureException(id, "returned null candidates for '" + category + "'");
            }
            for (String v : values) {
                if (v == null) {
                    throw new TechniqueFailureException(id, "returned a null candidate for '" + category + "'");
                }
            }
            acc.addAll(category, values);
        });
    }

    /**
     * 병합 후처리. 기본은 URL 카테고리의 상대 참조를 base 기준 절대 URL로 바꾼다.
     * base == null(source URL 미지정)이면 그대로 통과. 순서는 절대 바꾸지 않는다.
     */
    protected Map<String, List<String>> postProcess(Map<String, List<String>> merged, URI base) {
        if (base == null) return merged;
        Map<String, List<String>> out = new LinkedHashMap<>();
        merged.forEach((category, values) -> {
            if (!context.isUrlCategory(category)) {
                out.put(category, values);
                return;
            }
            List<String> resolved = new ArrayList<>(values.size());
            for (String v : values) resolved.add(absolutize(base, v));
            out.put(category, Collections.unmodifiableList(resolved));
        });
        return Collections.unmodifiableMap(out);
    }

    protected String absolutize(URI base, String candidate) {
        return UrlResolver.absolutize(base, candidate);
    }

    // ---------- 설정 조회 (불변) ----------
    public List<String> getTechniques() { return techniques; }
    public Map<String, String> getSingularCategories() { return singularCategories; }
    public Set<String> getUrlCategories() { return urlCategories; }
}
