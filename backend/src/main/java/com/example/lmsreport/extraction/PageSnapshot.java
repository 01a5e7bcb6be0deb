package com.example.lmsreport.extraction;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

/**
 * 取得済みページのURLとHTML。相対URLはこのURLを基準に解決する。
 */
public record PageSnapshot(String url, String html) {

    public PageSnapshot {
        url = url == null ? "" : url;
        html = html == null ? "" : html;
    }

    public Document parse() {
        return Jsoup.parse(html, url);
    }

    public boolean isBlank() {
        return html.isBlank();
    }
}
