package com.example.lmsreport.extraction.course;

import com.example.lmsreport.dto.Course;
import com.example.lmsreport.extraction.ExtractionStrategy;
import com.example.lmsreport.extraction.PageSnapshot;
import com.example.lmsreport.extraction.UrlNormalizer;
import com.example.lmsreport.llm.LlmCourse;
import com.example.lmsreport.llm.LocalLlmClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * ローカルLLMにページのHTMLを渡してコース一覧を抽出させる。
 * 返ってきたURLがコースを指していそうにないもの (リンクパターンもキーワードも含まない) は捨てる。
 */
public class LlmCourseStrategy implements ExtractionStrategy<PageSnapshot, Course> {

    public static final String NAME = "llm";

    static final int DEFAULT_MAX_CHARS = 18_000;

    private final LocalLlmClient llmClient;
    private final String linkPattern;
    private final List<String> keywords;
    private final int maxChars;

    public LlmCourseStrategy(LocalLlmClient llmClient, String linkPattern, List<String> keywords) {
        this(llmClient, linkPattern, keywords, DEFAULT_MAX_CHARS);
    }

    public LlmCourseStrategy(LocalLlmClient llmClient, String linkPattern, List<String> keywords, int maxChars) {
        this.llmClient = llmClient;
        this.linkPattern = linkPattern == null ? "" : linkPattern.toLowerCase(Locale.ROOT);
        this.keywords = List.copyOf(keywords);
        this.maxChars = maxChars;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Course> extract(PageSnapshot page) {
        if (page == null || page.isBlank() || !llmClient.isAvailable()) {
            return List.of();
        }
        List<Course> courses = new ArrayList<>();
        for (LlmCourse candidate : llmClient.extractCourses(page.html(), page.url(), maxChars)) {
            Optional<String> url = UrlNormalizer.toAbsolute(page.url(), candidate.url());
            if (url.isEmpty() || !looksLikeCourse(url.get())) {
                continue;
            }
            String name = candidate.name() == null || candidate.name().isBlank() ? "Unnamed course" : candidate.name().trim();
            courses.add(new Course(url.get(), name));
        }
        return courses;
    }

    private boolean looksLikeCourse(String url) {
        if (!linkPattern.isEmpty() && url.toLowerCase(Locale.ROOT).contains(linkPattern)) {
            return true;
        }
        return UrlNormalizer.hasPathSegment(url, keywords);
    }
}
