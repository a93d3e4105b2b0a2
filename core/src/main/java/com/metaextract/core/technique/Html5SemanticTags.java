package com.metaextract.core.technique;

import com.metaextract.core.api.TechniqueContext;
import com.metaextract.core.model.Candidates;
import com.metaextract.core.model.Categories;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/** HTML5 article 요소 내부만 본다: h1 → titles, p → descriptions, img[src] → images */
public class Html5SemanticTags extends JsoupTechnique {

    public static final String ID = Html5SemanticTags.class.getName();

    public Html5SemanticTags(TechniqueContext context) {
        super(context);
    }

    @Override
    protected void collect(Document document, Candidates out) {
        out.ensure(Categories.TITLES).ensure(Categories.DESCRIPTIONS).ensure(Categories.IMAGES);

        for (Element h : document.select("article h1")) {
            String text = h.text();
            if (!text.isBlank()) out.add(Categories.TITLES, text);
        }
        for (Element p : document.select("article p")) {
            String text = p.text();
            if (!text.isBlank()) out.add(Categories.DESCRIPTIONS, text);
        }
        for (Element img : document.select("article img[src]")) {
            String src = img.attr("src");
            if (!src.isBlank()) out.add(Categories.IMAGES, src);
        }
    }
}
