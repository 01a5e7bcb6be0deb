package com.example.lmsreport.browser;

import java.util.Optional;

/**
 * Cookie注入済みのブラウザタブ。一度に1ページずつ順番に描画する。
 */
public interface BrowserPage extends AutoCloseable {

    /**
     * URLへ移動し、読み込みが落ち着くまで待ってからHTMLを返します。
     * タイムアウトや描画失敗の場合は空を返します。
     */
    Optional<String> render(String url);

    @Override
    void close();
}
