package com.example.lmsreport.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * scraper.* の設定値。ポータルの接続先・資格情報と、レポートの期間などの実行パラメータを保持する。
 */
@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {

    /** 使用するポータルプロファイル名 (classpath:profiles/&lt;name&gt;.yml)。 */
    private String profile = "moodle_default";

    private String baseUrl = "";
    private String username = "";
    private String password = "";

    private int daysAhead = 7;
    private int daysBehind = 7;

    /** 課題抽出で巡回するコースの上限。0は無制限。 */
    private int maxCourses = 0;

    private String outputDir = "reports";

    private int requestTimeoutMillis = 30_000;

    /** 連続するページ取得の間に挟む待機時間。 */
    private long fetchDelayMillis = 500;

    private boolean browserEnabled = true;
    private boolean headless = true;

    /** Chromeバイナリのパス。未指定ならWebDriverManagerの既定に任せる。 */
    private String chromeBinary;

    private boolean useLlmForAssignments = false;

    /** trueなら起動時にパイプラインを一度だけ実行する。 */
    private boolean runOnStartup = false;

    public String getProfile() { return profile; }
    public void setProfile(String profile) { this.profile = profile; }
    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public int getDaysAhead() { return daysAhead; }
    public void setDaysAhead(int daysAhead) { this.daysAhead = daysAhead; }
    public int getDaysBehind() { return daysBehind; }
    public void setDaysBehind(int daysBehind) { this.daysBehind = daysBehind; }
    public int getMaxCourses() { return maxCourses; }
    public void setMaxCourses(int maxCourses) { this.maxCourses = maxCourses; }
    public String getOutputDir() { return outputDir; }
    public void setOutputDir(String outputDir) { this.outputDir = outputDir; }
    public int getRequestTimeoutMillis() { return requestTimeoutMillis; }
    public void setRequestTimeoutMillis(int requestTimeoutMillis) { this.requestTimeoutMillis = requestTimeoutMillis; }
    public long getFetchDelayMillis() { return fetchDelayMillis; }
    public void setFetchDelayMillis(long fetchDelayMillis) { this.fetchDelayMillis = fetchDelayMillis; }
    public boolean isBrowserEnabled() { return browserEnabled; }
    public void setBrowserEnabled(boolean browserEnabled) { this.browserEnabled = browserEnabled; }
    public boolean isHeadless() { return headless; }
    public void setHeadless(boolean headless) { this.headless = headless; }
    public String getChromeBinary() { return chromeBinary; }
    public void setChromeBinary(String chromeBinary) { this.chromeBinary = chromeBinary; }
    public boolean isUseLlmForAssignments() { return useLlmForAssignments; }
    public void setUseLlmForAssignments(boolean useLlmForAssignments) { this.useLlmForAssignments = useLlmForAssignments; }
    public boolean isRunOnStartup() { return runOnStartup; }
    public void setRunOnStartup(boolean runOnStartup) { this.runOnStartup = runOnStartup; }
}
