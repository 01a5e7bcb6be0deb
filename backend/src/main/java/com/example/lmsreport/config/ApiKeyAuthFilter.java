package com.example.lmsreport.config;

import com.google.gson.Gson;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * レポートAPI (/api/report とその配下) を保護するAPIキーフィルター。
 * X-API-Key が security.report-api-key と一致しないリクエストは401を返す。
 * エラー応答はJSONで、拒否したパスを含む。
 */
@Component
public class ApiKeyAuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyAuthFilter.class);

    static final String REPORT_API_ROOT = "/api/report";
    static final String API_KEY_HEADER = "X-API-Key";

    private static final Gson GSON = new Gson();

    private final byte[] expectedApiKey;

    public ApiKeyAuthFilter(@Value("${security.report-api-key:}") String expectedApiKey) {
        this.expectedApiKey = StringUtils.hasText(expectedApiKey)
                ? expectedApiKey.getBytes(StandardCharsets.UTF_8)
                : new byte[0];
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return !isReportApi(request.getRequestURI())
                || HttpMethod.OPTIONS.matches(request.getMethod());
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        if (expectedApiKey.length == 0) {
            log.error("security.report-api-key が未設定のため、レポートAPIへのリクエストを拒否しました: {} {}",
                    request.getMethod(), request.getRequestURI());
            respondWithError(response, HttpServletResponse.SC_INTERNAL_SERVER_ERROR,
                    "security.report-api-key is not configured", request.getRequestURI());
            return;
        }

        String providedKey = request.getHeader(API_KEY_HEADER);
        if (!matches(providedKey)) {
            log.warn("APIキーが不正なリクエストを拒否しました: {} {}", request.getMethod(), request.getRequestURI());
            respondWithError(response, HttpServletResponse.SC_UNAUTHORIZED,
                    "Missing or invalid API key", request.getRequestURI());
            return;
        }

        filterChain.doFilter(request, response);
    }

    static boolean isReportApi(String path) {
        return path != null && (path.equals(REPORT_API_ROOT) || path.startsWith(REPORT_API_ROOT + "/"));
    }

    // 固定時間比較
    private boolean matches(String providedKey) {
        if (providedKey == null) return false;
        return MessageDigest.isEqual(expectedApiKey, providedKey.getBytes(StandardCharsets.UTF_8));
    }

    private void respondWithError(HttpServletResponse response, int status, String message, String path)
            throws IOException {
        response.setStatus(status);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(GSON.toJson(new ErrorBody(message, path)));
    }

    record ErrorBody(String error, String path) {}
}
