package com.example.lmsreport.extraction.course;

import com.example.lmsreport.browser.BrowserAutomation;
import com.example.lmsreport.browser.BrowserPage;
import com.example.lmsreport.dto.Course;
import com.example.lmsreport.dto.SessionCookie;
import com.example.lmsreport.extraction.ExtractionStrategy;
import com.example.lmsreport.extraction.PageSnapshot;
import com.example.lmsreport.extraction.UrlNormalizer;
import com.example.lmsreport.llm.CoursePageClassification;
import com.example.lmsreport.llm.LocalLlmClient;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * 最後の手段。同一ホストのリンクを候補として集め、1件ずつブラウザで開いて
 * 「コースページかどうか」をLLMに判定させる。訪問数は maxCandidates で打ち切る。
 * ブラウザとLLMの両方が使えない場合は何もしない。
 */
public class ExploratoryCourseStrategy implements ExtractionStrategy<PageSnapshot, Course> {

    private static final Logger log = LoggerFactory.getLogger(ExploratoryCourseStrategy.class);

    public static final String NAME = "exploratory";

    static final int DEFAULT_MAX_CHARS = 8_000;

    private final BrowserAutomation browser;
    private final LocalLlmClient llmClient;
    private final String baseUrl;
    private final List<SessionCookie> cookies;
    private final List<String> candidatePatterns;
    private final List<String> excludePatterns;
    private final int maxCandidates;
    private final int maxChars;

    public ExploratoryCourseStrategy(BrowserAutomation browser, LocalLlmClient llmClient, String baseUrl,
                                     List<SessionCookie> cookies, List<String> candidatePatterns,
                                     List<String> excludePatterns, int maxCandidates) {
        this.browser = browser;
        this.llmClient = llmClient;
        this.baseUrl = baseUrl;
        this.cookies = List.copyOf(cookies);
        this.candidatePatterns = lower(candidatePatterns);
        this.excludePatterns = lower(excludePatterns);
        this.maxCandidates = maxCandidates;
        this.maxChars = DEFAULT_MAX_CHARS;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Course> extract(PageSnapshot page) {
        if (page == null || page.isBlank()) {
            return List.of();
        }
        if (!browser.isAvailable() || !llmClient.isAvailable()) {
            log.info("  [探索] ブラウザまたはLLMが利用できないためスキップします。");
            return List.of();
        }
        List<String> candidates = candidateLinks(page);
        if (candidates.isEmpty()) {
            return List.of();
        }
        log.info("  [探索] {}件の候補リンクを訪問します。", candidates.size());

        List<Course> courses = new ArrayList<>();
        try (BrowserPage tab = browser.open(baseUrl, cookies)) {
            for (String url : candidates) {
                Optional<String> html = tab.render(url);
                if (html.isEmpty()) {
                    continue;
                }
                Optional<CoursePageClassification> verdict = llmClient.classifyCoursePage(html.get(), url, maxChars);
                if (verdict.isPresent() && verdict.get().isCourse()) {
                    String name = verdict.get().courseName();
                    courses.add(new Course(url, name == null || name.isBlank() ? "Unnamed course" : name));
                    log.debug("  [探索] コースと判定: {}", url);
                }
            }
        } catch (IOException e) {
            log.warn("  [探索] ブラウザを起動できませんでした: {}", e.getMessage());
        }
        return courses;
    }

    /** 同一ホストで、除外パターンを含まないリンク。候補パターンに一致するものを先に並べる。 */
    List<String> candidateLinks(PageSnapshot page) {
        Set<String> preferred = new LinkedHashSet<>();
        Set<String> others = new LinkedHashSet<>();
        String origin = page.url().isEmpty() ? baseUrl : page.url();
        for (Element link : new PageSnapshot(origin, page.html()).parse().select("a[href]")) {
            Optional<String> url = UrlNormalizer.absoluteHref(link);
            if (url.isEmpty() || !UrlNormalizer.isSameHost(url.get(), origin)) {
                continue;
            }
            String lower = url.get().toLowerCase(Locale.ROOT);
            if (excludePatterns.stream().anyMatch(lower::contains) || url.get().equals(page.url())) {
                continue;
            }
            if (candidatePatterns.stream().anyMatch(lower::contains)) {
                preferred.add(url.get());
            } else {
                others.add(url.get());
            }
        }
        List<String> ordered = new ArrayList<>(preferred);
        others.stream().filter(u -> !preferred.contains(u)).forEach(ordered::add);
        return ordered.size() > maxCandidates ? List.copyOf(ordered.subList(0, maxCandidates)) : ordered;
    }

    private static List<String> lower(List<String> values) {
        return values.stream().map(v -> v.toLowerCase(Locale.ROOT)).toList();
    }
}
