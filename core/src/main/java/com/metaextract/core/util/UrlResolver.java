package com.metaextract.core.util;

import com.metaextract.core.error.MalformedInputException;
import org.jsoup.internal.StringUtil;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.regex.Pattern;

/** source URL 기준 상대 URL 절대화 유틸 */
public final class UrlResolver {
    private UrlResolver() {}

    // RFC 3986 scheme ("http:", "data:", "mailto:" ...)
    private static final Pattern SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*:");

    /**
     * source URL을 해석 기준(base)으로 변환.
     * - 절대(hierarchical) URI만 허용: "http://host/..." 형태
     * - 경로가 비어 있으면 "/"로 보정
     * - fragment 제거
     */
    public static URI parseBase(String sourceUrl) {
        if (sourceUrl == null || sourceUrl.isBlank()) {
            throw new MalformedInputException("source url is empty");
        }
        URI u;
        try {
            u = new URI(sourceUrl.trim());
        } catch (URISyntaxException e) {
            throw new MalformedInputException("source url is not a valid URI: " + sourceUrl, e);
        }
        if (!u.isAbsolute() || u.isOpaque() || u.getRawAuthority() == null) {
            throw new MalformedInputException("source url must be absolute: " + sourceUrl);
        }

        String path = u.getRawPath();
        StringBuilder sb = new StringBuilder()
                .append(u.getScheme().toLowerCase(Locale.ROOT)).append("://")
                .append(u.getRawAuthority())
                .append(path == null || path.isEmpty() ? "/" : path);
        if (u.getRawQuery() != null) sb.append('?').append(u.getRawQuery());
        return URI.create(sb.toString());
    }

    /**
     * 후보가 상대 참조면 base 기준 절대 URL로, 아니면 원본 그대로.
     * 해석은 jsoup(StringUtil.resolve, abs:href와 같은 규칙)에 맡긴다.
     * - base == null: 원본 유지
     * - 빈 문자열/공백: 원본 유지
     * - 절대 URL(http:, data:, mailto: 등): 원본 유지
     * - "/img.png", "img.png", "../x", "//cdn/x", "?q=1": base 기준으로 해석
     * - 해석 불가(jsoup이 빈 문자열 반환): 원본 유지
     */
    public static String absolutize(URI base, String candidate) {
        if (base == null || candidate == null) return candidate;
        String c = candidate.trim();
        if (c.isEmpty()) return candidate;
        if (SCHEME.matcher(c).find()) return candidate;

        String resolved = StringUtil.resolve(base.toString(), c);
        return resolved.isEmpty() ? candidate : resolved;
    }
}
