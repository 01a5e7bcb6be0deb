package com.example.lmsreport.extraction;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

/**
 * LLMに渡すためのHTML縮約。script/style/noscript を除去して先頭 maxChars 文字に切り詰める。
 */
public final class HtmlSnapshots {

    private HtmlSnapshots() {
    }

    public static String stripAndTruncate(String html, int maxChars) {
        if (html == null || html.isEmpty()) return "";
        Document doc = Jsoup.parse(html);
        doc.select("script, style, noscript, svg").remove();
        String reduced = doc.outerHtml();
        return reduced.length() > maxChars ? reduced.substring(0, maxChars) : reduced;
    }
}
