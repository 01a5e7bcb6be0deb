package com.example.lmsreport.pipeline;

import com.example.lmsreport.config.ScraperProperties;

/**
 * 1回のパイプライン実行に必要なパラメータ。実行ごとに値として渡す。
 */
public record RunRequest(
    String profile,
    String baseUrl,
    String username,
    String password,
    int daysAhead,
    int daysBehind,
    int maxCourses,
    String outputDir,
    boolean useLlmForAssignments
) {
    public RunRequest {
        profile = profile == null || profile.isBlank() ? "moodle_default" : profile;
        baseUrl = baseUrl == null ? "" : baseUrl;
        outputDir = outputDir == null || outputDir.isBlank() ? "reports" : outputDir;
        if (daysAhead < 0 || daysBehind < 0) {
            throw new IllegalArgumentException("daysAhead / daysBehind は0以上である必要があります。");
        }
    }

    public static RunRequest from(ScraperProperties properties) {
        return new RunRequest(
                properties.getProfile(),
                properties.getBaseUrl(),
                properties.getUsername(),
                properties.getPassword(),
                properties.getDaysAhead(),
                properties.getDaysBehind(),
                properties.getMaxCourses(),
                properties.getOutputDir(),
                properties.isUseLlmForAssignments());
    }

    public boolean hasCredentials() {
        return username != null && !username.isBlank() && password != null && !password.isBlank();
    }

    // パスワードをログに出さない
    @Override
    public String toString() {
        return "RunRequest[profile=" + profile + ", baseUrl=" + baseUrl + ", username=" + username
                + ", daysAhead=" + daysAhead + ", daysBehind=" + daysBehind + ", maxCourses=" + maxCourses + "]";
    }
}
