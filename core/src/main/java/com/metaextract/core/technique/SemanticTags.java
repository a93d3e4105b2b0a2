package com.metaextract.core.technique;

import com.metaextract.core.api.TechniqueContext;
import com.metaextract.core.model.Candidates;
import com.metaextract.core.model.Categories;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;

/**
 * 문서 전체의 의미 태그. 가장 노이즈가 많으므로 체인 마지막에 두는 것을 권장.
 * titles는 h1 전부 → h2 전부 → h3 전부 순서.
 */
public class SemanticTags extends JsoupTechnique {

    public static final String ID = SemanticTags.class.getName();

    private static final List<String> HEADINGS = List.of("h1", "h2", "h3");

    public SemanticTags(TechniqueContext context) {
        super(context);
    }

    @Override
    protected void collect(Document document, Candidates out) {
        out.ensure(Categories.TITLES).ensure(Categories.DESCRIPTIONS).ensure(Categories.IMAGES);

        for (String tag : HEADINGS) {
            for (Element h : document.select(tag)) {
                String text = h.text();
                if (!text.isBlank()) out.add(Categories.TITLES, text);
            }
        }
        for (Element p : document.select("p")) {
            String text = p.text();
            if (!text.isBlank()) out.add(Categories.DESCRIPTIONS, text);
        }
        for (Element img : document.select("img[src]")) {
            String src = img.attr("src");
            if (!src.isBlank()) out.add(Categories.IMAGES, src);
        }
    }
}
