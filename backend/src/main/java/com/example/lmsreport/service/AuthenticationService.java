package com.example.lmsreport.service;

import com.example.lmsreport.browser.BrowserAutomation;
import com.example.lmsreport.browser.LoginRequest;
import com.example.lmsreport.browser.LoginResult;
import com.example.lmsreport.config.ScraperProperties;
import com.example.lmsreport.extraction.UrlNormalizer;
import com.example.lmsreport.pipeline.RunRequest;
import com.example.lmsreport.profile.PortalProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * プロファイルのログイン設定に従ってポータルにログインし、セッションCookieを取得するService。
 * 接続先や資格情報が未設定の場合はエラーにせず「未認証」として返す。
 */
@Service
public class AuthenticationService {

    private static final Logger log = LoggerFactory.getLogger(AuthenticationService.class);

    private final BrowserAutomation browser;
    private final ScraperProperties properties;

    public AuthenticationService(BrowserAutomation browser, ScraperProperties properties) {
        this.browser = browser;
        this.properties = properties;
    }

    public StageResult<LoginResult> authenticate(RunRequest request, PortalProfile profile) {
        String baseUrl = UrlNormalizer.normalizeBaseUrl(request.baseUrl());
        if (baseUrl.isBlank() || !request.hasCredentials()) {
            log.warn("接続先URLまたは資格情報が未設定のため、ログインをスキップします。");
            return StageResult.of(LoginResult.failed("接続先URLまたは資格情報が未設定です。"));
        }
        if (!browser.isAvailable()) {
            String message = "ブラウザ自動操作が利用できないため、ログインできません。";
            log.warn(message);
            return StageResult.failed(LoginResult.failed(message), message);
        }

        PortalProfile.AuthProfile auth = profile.auth();
        LoginRequest loginRequest = new LoginRequest(
                baseUrl + auth.loginPath(),
                auth.formSelectors(),
                request.username(),
                request.password(),
                auth.successIndicators(),
                auth.errorIndicators(),
                Duration.ofMillis(properties.getRequestTimeoutMillis()));
        log.info("  ログインを試行します: {}", loginRequest);

        LoginResult result = browser.login(loginRequest);
        if (result.success()) {
            log.info("  ログインに成功しました。Cookie {}件を取得。", result.cookies().size());
            return StageResult.of(result);
        }
        String message = "ログインに失敗しました: " + result.error();
        log.warn("  {}", message);
        return StageResult.failed(result, message);
    }
}
