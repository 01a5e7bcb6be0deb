package com.example.lmsreport.browser;

import com.example.lmsreport.config.ScraperProperties;
import com.example.lmsreport.dto.SessionCookie;
import com.example.lmsreport.extraction.PageSnapshot;
import com.example.lmsreport.extraction.UrlNormalizer;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * JsoupでセッションCookie付きのHTTP GETを行うフェッチャー。
 * ログインページにリダイレクトされた場合はセッション切れとみなして空を返す。
 */
@Component
public class JsoupPageFetcher implements PageFetcher {

    private static final Logger log = LoggerFactory.getLogger(JsoupPageFetcher.class);
    private static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120 Safari/537.36";

    private final ScraperProperties properties;

    public JsoupPageFetcher(ScraperProperties properties) {
        this.properties = properties;
    }

    @Override
    public Optional<PageSnapshot> fetch(String url, List<SessionCookie> cookies) {
        try {
            Connection.Response response = Jsoup.connect(url)
                    .cookies(toCookieMap(cookies))
                    .userAgent(USER_AGENT)
                    .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                    .timeout(properties.getRequestTimeoutMillis())
                    .followRedirects(true)
                    .execute();
            Document doc = response.parse();
            if (isLoginPage(doc, response.url().toString())) {
                log.warn("ログインページにリダイレクトされました。セッションが無効の可能性があります: {}", url);
                return Optional.empty();
            }
            return Optional.of(new PageSnapshot(response.url().toString(), doc.outerHtml()));
        } catch (IOException e) {
            log.warn("ページの取得に失敗しました: {} ({})", url, e.getMessage());
            return Optional.empty();
        }
    }

    static Map<String, String> toCookieMap(List<SessionCookie> cookies) {
        Map<String, String> map = new LinkedHashMap<>();
        for (SessionCookie cookie : cookies) {
            if (cookie.name() != null && cookie.value() != null) {
                map.put(cookie.name(), cookie.value());
            }
        }
        return map;
    }

    /**
     * 最終URLがログインパスか、パスワード入力を持つログインフォームがあればログインページと判定します。
     * タイトルの文言は判定に使わない。
     */
    static boolean isLoginPage(Document document, String finalUrl) {
        if (document == null) return true;
        String path = UrlNormalizer.pathOf(finalUrl).toLowerCase(Locale.ROOT);
        if (path.contains("/login")) {
            return true;
        }
        return document.selectFirst("form[action*='login'] input[type=password]") != null;
    }
}
