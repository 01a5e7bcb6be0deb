package com.example.lmsreport.browser;

import com.example.lmsreport.config.ScraperProperties;
import com.example.lmsreport.dto.SessionCookie;
import com.example.lmsreport.extraction.UrlNormalizer;
import com.example.lmsreport.profile.PortalProfile.Indicator;
import io.github.bonigarcia.wdm.WebDriverManager;
import org.openqa.selenium.By;
import org.openqa.selenium.Cookie;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Selenium (ChromeDriver) によるログインとページ描画。
 * ドライバは呼び出しごとに起動し、finallyで必ず終了する。
 */
@Component
public class SeleniumBrowserAutomation implements BrowserAutomation {

    private static final Logger log = LoggerFactory.getLogger(SeleniumBrowserAutomation.class);

    private static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120 Safari/537.36";
    private static final Duration INDICATOR_WAIT = Duration.ofSeconds(5);
    private static final long SETTLE_MILLIS = 1_000;

    private final ScraperProperties properties;

    public SeleniumBrowserAutomation(ScraperProperties properties) {
        this.properties = properties;
    }

    @Override
    public boolean isAvailable() {
        return properties.isBrowserEnabled();
    }

    @Override
    public LoginResult login(LoginRequest request) {
        if (!isAvailable()) {
            return LoginResult.failed("ブラウザ自動操作が無効です (scraper.browser-enabled=false)");
        }
        WebDriver driver = null;
        try {
            driver = createDriver(request.timeout());
            return performLogin(driver, request);
        } catch (TimeoutException e) {
            log.error("ログイン操作中にタイムアウトが発生しました。", e);
            return LoginResult.failed("Timeout: " + e.getMessage());
        } catch (Exception e) {
            log.error("ログイン中にエラーが発生しました。", e);
            return LoginResult.failed(e.getMessage());
        } finally {
            quitQuietly(driver);
        }
    }

    @Override
    public BrowserPage open(String baseUrl, List<SessionCookie> cookies) throws IOException {
        Duration timeout = Duration.ofMillis(properties.getRequestTimeoutMillis());
        WebDriver driver;
        try {
            driver = createDriver(timeout);
        } catch (WebDriverException e) {
            throw new IOException("ブラウザを起動できませんでした: " + e.getMessage(), e);
        }
        try {
            // Cookieを追加するには対象ドメインを一度開いておく必要がある
            driver.get(baseUrl);
            String defaultDomain = UrlNormalizer.hostOf(baseUrl);
            for (SessionCookie cookie : cookies) {
                String domain = cookie.domain() == null || cookie.domain().isBlank()
                        ? defaultDomain : stripLeadingDot(cookie.domain());
                driver.manage().addCookie(new Cookie.Builder(cookie.name(), cookie.value())
                        .domain(domain)
                        .path("/")
                        .build());
            }
        } catch (WebDriverException e) {
            quitQuietly(driver);
            throw new IOException("セッションCookieの注入に失敗しました: " + e.getMessage(), e);
        }
        return new SeleniumBrowserPage(driver, timeout);
    }

    private LoginResult performLogin(WebDriver driver, LoginRequest request) {
        WebDriverWait wait = new WebDriverWait(driver, request.timeout());

        log.info("  -> ログインページに移動します: {}", request.loginUrl());
        driver.get(request.loginUrl());

        log.info("  -> 資格情報を送信してリダイレクトを待機します...");
        wait.until(ExpectedConditions.visibilityOfElementLocated(By.cssSelector(request.selectors().username())))
                .sendKeys(request.username());
        driver.findElement(By.cssSelector(request.selectors().password())).sendKeys(request.password());
        wait.until(ExpectedConditions.elementToBeClickable(By.cssSelector(request.selectors().submit()))).click();

        waitForDocumentReady(driver, request.timeout());
        sleepSilently(SETTLE_MILLIS);

        boolean success = waitForErrorOrAdvance(
                driver,
                drv -> firstMatchingError(drv, request.errorIndicators()) != null,
                drv -> anySuccessIndicator(drv, request.successIndicators()),
                INDICATOR_WAIT
        );
        String currentUrl = driver.getCurrentUrl();
        if (success) {
            List<SessionCookie> cookies = extractCookies(driver);
            log.info("  -> ログイン成功を確認しました。Cookie {}件", cookies.size());
            return LoginResult.succeeded(cookies);
        }
        String error = firstMatchingError(driver, request.errorIndicators());
        if (error == null) {
            error = "Login failed: redirected to " + currentUrl;
        }
        log.warn("  -> ログイン失敗: {}", error);
        return LoginResult.failed(error);
    }

    /**
     * エラー表示か成功条件のどちらかが満たされるまでポーリングします。
     * @return 成功条件を満たした場合true。エラー表示またはタイムアウトの場合false
     */
    private boolean waitForErrorOrAdvance(WebDriver driver, Predicate<WebDriver> errorCondition,
                                          Predicate<WebDriver> progressCondition, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            try {
                if (progressCondition.test(driver)) {
                    return true;
                }
                if (errorCondition.test(driver)) {
                    return false;
                }
            } catch (WebDriverException e) {
                log.debug("ログイン状態の判定中に一時的なエラー: {}", e.getMessage());
            }
            sleepSilently(200);
        }
        return progressCondition.test(driver);
    }

    private boolean anySuccessIndicator(WebDriver driver, List<Indicator> indicators) {
        String currentUrl = driver.getCurrentUrl();
        for (Indicator indicator : indicators) {
            if (indicator.urlContains() != null && currentUrl != null && currentUrl.contains(indicator.urlContains())) {
                return true;
            }
            if (indicator.elementPresent() != null && isElementDisplayed(driver, By.cssSelector(indicator.elementPresent()))) {
                return true;
            }
        }
        return false;
    }

    private String firstMatchingError(WebDriver driver, List<Indicator> indicators) {
        for (Indicator indicator : indicators) {
            if (indicator.textContains() != null) {
                String source = driver.getPageSource();
                if (source != null && source.toLowerCase(Locale.ROOT).contains(indicator.textContains().toLowerCase(Locale.ROOT))) {
                    return "Login failed: page contains '" + indicator.textContains() + "'";
                }
            }
            if (indicator.elementPresent() != null && !driver.findElements(By.cssSelector(indicator.elementPresent())).isEmpty()) {
                return "Login failed: error element present";
            }
        }
        return null;
    }

    private WebDriver createDriver(Duration timeout) {
        WebDriverManager.chromedriver().setup();
        ChromeOptions options = new ChromeOptions();
        if (properties.getChromeBinary() != null && !properties.getChromeBinary().isBlank()) {
            options.setBinary(properties.getChromeBinary());
        }
        if (properties.isHeadless()) {
            options.addArguments("--headless");
        }
        options.addArguments("--disable-gpu", "--window-size=1920,1080", "--no-sandbox", "--disable-dev-shm-usage",
                "--user-agent=" + USER_AGENT);
        log.info("ChromeDriverを初期化します...");
        WebDriver driver = new ChromeDriver(options);
        driver.manage().timeouts().pageLoadTimeout(timeout);
        return driver;
    }

    private List<SessionCookie> extractCookies(WebDriver driver) {
        List<SessionCookie> cookies = new ArrayList<>();
        try {
            driver.manage().getCookies().forEach(c -> cookies.add(new SessionCookie(c.getName(), c.getValue(),
                    c.getDomain() == null ? "" : c.getDomain())));
        } catch (WebDriverException e) {
            log.error("Cookieの抽出中にエラーが発生しました。", e);
        }
        return cookies;
    }

    static void waitForDocumentReady(WebDriver driver, Duration timeout) {
        try {
            new WebDriverWait(driver, timeout).until(drv ->
                    "complete".equals(((JavascriptExecutor) drv).executeScript("return document.readyState")));
        } catch (TimeoutException e) {
            log.debug("document.readyState が complete になりませんでした。現在の内容で続行します。");
        }
    }

    private boolean isElementDisplayed(WebDriver driver, By locator) {
        try {
            List<WebElement> elements = driver.findElements(locator);
            return !elements.isEmpty() && elements.get(0).isDisplayed();
        } catch (StaleElementReferenceException ignored) {
            return false;
        }
    }

    private static String stripLeadingDot(String domain) {
        return domain.startsWith(".") ? domain.substring(1) : domain;
    }

    private static void quitQuietly(WebDriver driver) {
        if (driver == null) return;
        try {
            driver.quit();
            log.info("WebDriverを終了しました。");
        } catch (WebDriverException e) {
            log.warn("WebDriverの終了に失敗しました: {}", e.getMessage());
        }
    }

    static void sleepSilently(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 1つのChromeDriverを使い回してページを順番に描画する。
     */
    private static final class SeleniumBrowserPage implements BrowserPage {

        private final WebDriver driver;
        private final Duration timeout;

        private SeleniumBrowserPage(WebDriver driver, Duration timeout) {
            this.driver = driver;
            this.timeout = timeout;
        }

        @Override
        public Optional<String> render(String url) {
            try {
                driver.get(url);
                waitForDocumentReady(driver, timeout);
                sleepSilently(SETTLE_MILLIS);
                return Optional.ofNullable(driver.getPageSource());
            } catch (WebDriverException e) {
                log.warn("ページの描画に失敗しました: {} ({})", url, e.getMessage());
                return Optional.empty();
            }
        }

        @Override
        public void close() {
            quitQuietly(driver);
        }
    }
}
