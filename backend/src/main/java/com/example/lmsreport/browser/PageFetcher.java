package com.example.lmsreport.browser;

import com.example.lmsreport.dto.SessionCookie;
import com.example.lmsreport.extraction.PageSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * セッションCookieを付けてページを取得する。失敗時は空を返す。
 */
public interface PageFetcher {

    Optional<PageSnapshot> fetch(String url, List<SessionCookie> cookies);
}
