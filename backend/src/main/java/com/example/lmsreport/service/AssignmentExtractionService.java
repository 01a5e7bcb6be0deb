package com.example.lmsreport.service;

import com.example.lmsreport.browser.PageFetcher;
import com.example.lmsreport.config.ScraperProperties;
import com.example.lmsreport.date.DueDateNormalizer;
import com.example.lmsreport.dto.Assignment;
import com.example.lmsreport.dto.Course;
import com.example.lmsreport.dto.SessionCookie;
import com.example.lmsreport.extraction.ExtractionStrategy;
import com.example.lmsreport.extraction.PageSnapshot;
import com.example.lmsreport.extraction.StrategyCascade;
import com.example.lmsreport.extraction.assignment.CoursePage;
import com.example.lmsreport.extraction.assignment.LlmAssignmentStrategy;
import com.example.lmsreport.extraction.assignment.SelectorAssignmentStrategy;
import com.example.lmsreport.extraction.assignment.SubmissionStatusDetector;
import com.example.lmsreport.llm.LocalLlmClient;
import com.example.lmsreport.pipeline.RunRequest;
import com.example.lmsreport.profile.PortalProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 検出したコースを1件ずつ順番に取得し、課題を抽出するService。
 * 取得の間には一定の待機を挟む。
 */
@Service
public class AssignmentExtractionService {

    private static final Logger log = LoggerFactory.getLogger(AssignmentExtractionService.class);

    private final PageFetcher pageFetcher;
    private final LocalLlmClient llmClient;
    private final DueDateNormalizer normalizer;
    private final ScraperProperties properties;
    private final Clock clock;

    public AssignmentExtractionService(PageFetcher pageFetcher, LocalLlmClient llmClient, DueDateNormalizer normalizer,
                                       ScraperProperties properties, Clock clock) {
        this.pageFetcher = pageFetcher;
        this.llmClient = llmClient;
        this.normalizer = normalizer;
        this.properties = properties;
        this.clock = clock;
    }

    public StageResult<List<Assignment>> extract(RunRequest request, PortalProfile profile,
                                                 List<Course> courses, List<SessionCookie> cookies) {
        if (courses.isEmpty()) {
            log.info("  コースが0件のため課題抽出をスキップします。");
            return StageResult.of(List.of());
        }
        List<Course> targets = request.maxCourses() > 0 && courses.size() > request.maxCourses()
                ? courses.subList(0, request.maxCourses())
                : courses;

        StrategyCascade<CoursePage, Assignment> cascade =
                new StrategyCascade<>("課題抽出", buildStrategies(request, profile), Assignment::url);

        List<Assignment> assignments = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (int i = 0; i < targets.size(); i++) {
            Course course = targets.get(i);
            if (i > 0) {
                pause();
            }
            log.info("  ({}/{}) {}", i + 1, targets.size(), course.name());
            Optional<PageSnapshot> page = pageFetcher.fetch(course.url(), cookies);
            if (page.isEmpty()) {
                errors.add("コースページを取得できませんでした: " + course.name() + " (" + course.url() + ")");
                continue;
            }
            for (Assignment assignment : cascade.run(new CoursePage(course, page.get())).items()) {
                if (seen.add(course.url() + "|" + assignment.url())) {
                    assignments.add(assignment);
                }
            }
        }
        log.info("  課題を合計 {}件抽出しました。", assignments.size());
        return StageResult.withErrors(assignments, errors);
    }

    List<ExtractionStrategy<CoursePage, Assignment>> buildStrategies(RunRequest request, PortalProfile profile) {
        PortalProfile.SubmissionProfile submission = profile.submission();
        SubmissionStatusDetector detector = new SubmissionStatusDetector(normalizer, clock,
                submission.indicators(), submission.negativeIndicators(), submission.datePatterns());
        SelectorAssignmentStrategy selector = new SelectorAssignmentStrategy(profile.assignmentSelectors(),
                profile.dates().selectors(), profile.dates().patterns(), detector);
        LlmAssignmentStrategy llm = new LlmAssignmentStrategy(llmClient);
        if (profile.assignments().useLlmFirst() || request.useLlmForAssignments()) {
            return List.of(llm, selector);
        }
        return List.of(selector, llm);
    }

    private void pause() {
        long delay = properties.getFetchDelayMillis();
        if (delay <= 0) return;
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
