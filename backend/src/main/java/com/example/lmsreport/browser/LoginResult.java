package com.example.lmsreport.browser;

import com.example.lmsreport.dto.SessionCookie;

import java.util.List;

/**
 * ログイン結果。失敗時は cookies が空で error に理由が入る。
 */
public record LoginResult(
    boolean success,
    List<SessionCookie> cookies,
    String error
) {
    public LoginResult {
        cookies = cookies == null ? List.of() : List.copyOf(cookies);
    }

    public static LoginResult succeeded(List<SessionCookie> cookies) {
        return new LoginResult(true, cookies, null);
    }

    public static LoginResult failed(String error) {
        return new LoginResult(false, List.of(), error);
    }
}
