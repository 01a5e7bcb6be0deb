package com.example.lmsreport.service;

import com.example.lmsreport.browser.BrowserAutomation;
import com.example.lmsreport.browser.BrowserPage;
import com.example.lmsreport.browser.PageFetcher;
import com.example.lmsreport.dto.Course;
import com.example.lmsreport.dto.SessionCookie;
import com.example.lmsreport.extraction.ExtractionStrategy;
import com.example.lmsreport.extraction.PageSnapshot;
import com.example.lmsreport.extraction.StrategyCascade;
import com.example.lmsreport.extraction.StrategyCascade.CascadeResult;
import com.example.lmsreport.extraction.UrlNormalizer;
import com.example.lmsreport.extraction.course.ExploratoryCourseStrategy;
import com.example.lmsreport.extraction.course.LinkSegmentCourseStrategy;
import com.example.lmsreport.extraction.course.LlmCourseStrategy;
import com.example.lmsreport.extraction.course.StructuralCourseStrategy;
import com.example.lmsreport.llm.LocalLlmClient;
import com.example.lmsreport.pipeline.RunRequest;
import com.example.lmsreport.profile.PortalProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 「マイコース」ページを取得し、プロファイルで指定された順に抽出戦略を試してコース一覧を得るService。
 */
@Service
public class CourseDiscoveryService {

    private static final Logger log = LoggerFactory.getLogger(CourseDiscoveryService.class);

    private final BrowserAutomation browser;
    private final PageFetcher pageFetcher;
    private final LocalLlmClient llmClient;

    public CourseDiscoveryService(BrowserAutomation browser, PageFetcher pageFetcher, LocalLlmClient llmClient) {
        this.browser = browser;
        this.pageFetcher = pageFetcher;
        this.llmClient = llmClient;
    }

    /**
     * @param authenticated 前ステージでログインできたか。false なら何もせず空を返す
     */
    public StageResult<List<Course>> discover(RunRequest request, PortalProfile profile,
                                              boolean authenticated, List<SessionCookie> cookies) {
        if (!authenticated) {
            log.info("  未認証のためコース検出をスキップします。");
            return StageResult.of(List.of());
        }
        String baseUrl = UrlNormalizer.normalizeBaseUrl(request.baseUrl());
        String coursesUrl = baseUrl + profile.navigation().coursesPage();

        Optional<PageSnapshot> page = loadCoursesPage(baseUrl, coursesUrl, cookies);
        if (page.isEmpty()) {
            return StageResult.failed(List.of(), "コース一覧ページを取得できませんでした: " + coursesUrl);
        }

        StrategyCascade<PageSnapshot, Course> cascade =
                new StrategyCascade<>("コース検出", buildStrategies(profile, baseUrl, cookies), Course::url);
        log.info("  戦略の順序: {}", cascade.strategyNames());
        CascadeResult<Course> result = cascade.run(page.get());
        if (result.isEmpty()) {
            log.warn("  どの戦略でもコースを検出できませんでした。");
        }
        return StageResult.of(result.items());
    }

    /** プロファイルの strategy_order に従って戦略を並べる。未知の名前は無視する。 */
    List<ExtractionStrategy<PageSnapshot, Course>> buildStrategies(PortalProfile profile, String baseUrl,
                                                                  List<SessionCookie> cookies) {
        PortalProfile.CoursesProfile courses = profile.courses();
        PortalProfile.CourseDiscoveryProfile discovery = profile.courseDiscovery();
        List<ExtractionStrategy<PageSnapshot, Course>> strategies = new ArrayList<>();
        for (String name : discovery.strategyOrder()) {
            switch (name) {
                case LinkSegmentCourseStrategy.NAME -> strategies.add(
                        new LinkSegmentCourseStrategy(courses.linkKeywords(), discovery.excludePatterns()));
                case StructuralCourseStrategy.NAME -> strategies.add(new StructuralCourseStrategy(
                        courses.cardSelectors(), courses.nameSelectors(), courses.containerSelectors(), courses.linkPattern()));
                case LlmCourseStrategy.NAME -> strategies.add(
                        new LlmCourseStrategy(llmClient, courses.linkPattern(), courses.linkKeywords()));
                case ExploratoryCourseStrategy.NAME -> {
                    if (discovery.fallbackWhenEmpty()) {
                        strategies.add(new ExploratoryCourseStrategy(browser, llmClient, baseUrl, cookies,
                                discovery.candidatePatterns(), discovery.excludePatterns(), discovery.maxCandidates()));
                    }
                }
                default -> log.warn("  未知のコース検出戦略のため無視します: {}", name);
            }
        }
        return strategies;
    }

    // マイコースはJavaScriptで描画されることが多いため、ブラウザを優先する
    private Optional<PageSnapshot> loadCoursesPage(String baseUrl, String coursesUrl, List<SessionCookie> cookies) {
        if (browser.isAvailable()) {
            try (BrowserPage tab = browser.open(baseUrl, cookies)) {
                Optional<String> html = tab.render(coursesUrl);
                if (html.isPresent()) {
                    return Optional.of(new PageSnapshot(coursesUrl, html.get()));
                }
            } catch (IOException e) {
                log.warn("  ブラウザでコース一覧を開けませんでした。HTTP取得に切り替えます: {}", e.getMessage());
            }
        }
        return pageFetcher.fetch(coursesUrl, cookies);
    }
}
