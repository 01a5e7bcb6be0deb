package com.example.lmsreport.browser;

import com.example.lmsreport.dto.SessionCookie;

import java.io.IOException;
import java.util.List;

/**
 * ブラウザ自動操作の窓口。ログインと、JavaScriptで描画されるページの取得に使う。
 * 利用できない環境もあるため、呼び出し側は必ず isAvailable() を先に確認すること。
 */
public interface BrowserAutomation {

    boolean isAvailable();

    /**
     * フォームに資格情報を入力してログインし、成功時はセッションCookieを返します。
     * 例外は投げず、失敗は LoginResult.error に入れて返します。
     */
    LoginResult login(LoginRequest request);

    /**
     * Cookieを注入したブラウザセッションを開きます。使い終わったら必ず close() すること。
     * @param baseUrl Cookieを設定するためのポータルのorigin
     * @throws IOException ブラウザを起動できなかった場合
     */
    BrowserPage open(String baseUrl, List<SessionCookie> cookies) throws IOException;
}
