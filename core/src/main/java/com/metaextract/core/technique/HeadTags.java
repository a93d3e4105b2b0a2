package com.metaextract.core.technique;

import com.metaextract.core.api.TechniqueContext;
import com.metaextract.core.model.Candidates;
import com.metaextract.core.model.Categories;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Locale;
import java.util.Set;

/**
 * 일반 head 태그 기반 기법.
 * - title                         → titles
 * - meta[name=description]        → descriptions
 * - link[rel=image_src]           → images
 * - link[rel=canonical]           → urls
 * - link[rel=alternate] RSS/Atom  → feeds
 */
public class HeadTags extends JsoupTechnique {

    public static final String ID = HeadTags.class.getName();

    private static final Set<String> FEED_TYPES = Set.of(
            "application/rss+xml", "application/atom+xml", "application/feed+json");

    public HeadTags(TechniqueContext context) {
        super(context);
    }

    @Override
    protected void collect(Document document, Candidates out) {
        out.ensure(Categories.TITLES)
           .ensure(Categories.DESCRIPTIONS)
           .ensure(Categories.IMAGES)
           .ensure(Categories.URLS)
           .ensure(Categories.FEEDS);

        for (Element t : document.select("title")) {
            String text = t.text();
            if (!text.isBlank()) out.add(Categories.TITLES, text);
        }

        for (Element meta : document.select("meta[name][content]")) {
            if ("description".equalsIgnoreCase(meta.attr("name").trim())) {
                out.add(Categories.DESCRIPTIONS, meta.attr("content"));
            }
        }

        for (Element link : document.select("link[rel][href]")) {
            String href = link.attr("href");
            if (hasRel(link, "image_src")) out.add(Categories.IMAGES, href);
            if (hasRel(link, "canonical")) out.add(Categories.URLS, href);
            if (hasRel(link, "alternate") && isFeedType(link.attr("type"))) out.add(Categories.FEEDS, href);
        }
    }

    /** rel은 공백 구분 토큰 목록 (예: rel="alternate nofollow") */
    private static boolean hasRel(Element link, String token) {
        for (String r : link.attr("rel").trim().split("\\s+")) {
            if (r.equalsIgnoreCase(token)) return true;
        }
        return false;
    }

    private static boolean isFeedType(String type) {
        if (type == null) return false;
        String t = type.trim().toLowerCase(Locale.ROOT);
        int semi = t.indexOf(';');
        if (semi >= 0) t = t.substring(0, semi).trim();
        return FEED_TYPES.contains(t);
    }
}
