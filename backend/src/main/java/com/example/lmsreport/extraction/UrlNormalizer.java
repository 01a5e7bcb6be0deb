package com.example.lmsreport.extraction;

import org.jsoup.internal.StringUtil;
import org.jsoup.nodes.Element;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;

/**
 * 重複排除キーとして使うURLの正規化ユーティリティ。
 * 相対URLの解決はJsoupに任せる。空白や "|" を含むhrefも落とさない。
 */
public final class UrlNormalizer {

    private UrlNormalizer() {
    }

    /**
     * リンク要素のhrefを、ドキュメントの基準URLで解決した絶対URLを返します。
     * javascript: / mailto: / "#" のみのリンクは対象外です。
     */
    public static Optional<String> absoluteHref(Element link) {
        if (link == null || !isNavigable(link.attr("href"))) {
            return Optional.empty();
        }
        return finish(link.absUrl("href"));
    }

    /**
     * hrefを基準URLに対して解決し、フラグメントを除いた絶対URLを返します。
     * LLMが返したURL文字列のように、要素を持たない値に使います。
     */
    public static Optional<String> toAbsolute(String baseUrl, String href) {
        if (!isNavigable(href)) {
            return Optional.empty();
        }
        String trimmed = href.trim();
        String resolved = baseUrl == null || baseUrl.isBlank()
                ? trimmed
                : StringUtil.resolve(baseUrl.trim(), trimmed);
        return finish(resolved);
    }

    private static boolean isNavigable(String href) {
        if (href == null) return false;
        String trimmed = href.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) return false;
        String lower = trimmed.toLowerCase(Locale.ROOT);
        return !(lower.startsWith("javascript:") || lower.startsWith("mailto:") || lower.startsWith("tel:"));
    }

    private static Optional<String> finish(String resolved) {
        if (resolved == null || resolved.isEmpty() || hostOf(resolved).isEmpty()) {
            return Optional.empty();
        }
        int hash = resolved.indexOf('#');
        return Optional.of(hash >= 0 ? resolved.substring(0, hash) : resolved);
    }

    /**
     * ログインURLなどが渡された場合も、scheme + host の origin に正規化します。
     * 例: https://campus.example.edu/login/index.php → https://campus.example.edu
     */
    public static String normalizeBaseUrl(String url) {
        if (url == null || url.isBlank()) return url == null ? "" : url;
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        Optional<UriComponents> parsed = parse(trimmed);
        if (parsed.isEmpty() || parsed.get().getHost() == null) {
            return trimmed;
        }
        UriComponents uri = parsed.get();
        String scheme = uri.getScheme() == null ? "https" : uri.getScheme();
        String port = uri.getPort() == -1 ? "" : ":" + uri.getPort();
        return scheme + "://" + uri.getHost() + port;
    }

    /** URLのパスを "/" で区切ったセグメントのいずれかがキーワードと一致するか。 */
    public static boolean hasPathSegment(String url, Collection<String> keywords) {
        String path = pathOf(url);
        if (path.isEmpty()) return false;
        for (String segment : path.split("/")) {
            for (String keyword : keywords) {
                if (!segment.isEmpty() && segment.equalsIgnoreCase(keyword)) {
                    return true;
                }
            }
        }
        return false;
    }

    public static boolean isSameHost(String url, String otherUrl) {
        String host = hostOf(url);
        return !host.isEmpty() && host.equalsIgnoreCase(hostOf(otherUrl));
    }

    public static String hostOf(String url) {
        return parse(url).map(UriComponents::getHost).orElse("");
    }

    public static String pathOf(String url) {
        return parse(url).map(UriComponents::getPath).orElse("");
    }

    // UriComponentsBuilder は文字の妥当性を検査しないので、エンコードされていないhrefも扱える
    private static Optional<UriComponents> parse(String url) {
        if (url == null || url.isBlank()) return Optional.empty();
        try {
            return Optional.of(UriComponentsBuilder.fromUriString(url.trim()).build());
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
