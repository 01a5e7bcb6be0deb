package com.example.lmsreport.extraction.course;

import com.example.lmsreport.dto.Course;
import com.example.lmsreport.extraction.ExtractionStrategy;
import com.example.lmsreport.extraction.PageSnapshot;
import com.example.lmsreport.extraction.UrlNormalizer;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * ページ内の全リンクを走査し、URLのパスセグメントにキーワード (course, courses, cursos など) を
 * 丸ごと含むものをコースとして採用する。クエリ文字列中の一致は対象外。
 */
public class LinkSegmentCourseStrategy implements ExtractionStrategy<PageSnapshot, Course> {

    public static final String NAME = "link-segment";

    private static final String LABELLED_SPAN = "span.multiline, span[title], span[aria-label]";

    private final List<String> keywords;
    private final List<String> excludePatterns;

    public LinkSegmentCourseStrategy(List<String> keywords, List<String> excludePatterns) {
        this.keywords = List.copyOf(keywords);
        this.excludePatterns = excludePatterns.stream().map(p -> p.toLowerCase(Locale.ROOT)).toList();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Course> extract(PageSnapshot page) {
        if (page == null || page.isBlank() || keywords.isEmpty()) {
            return List.of();
        }
        Document doc = page.parse();
        Map<String, Course> found = new LinkedHashMap<>();
        for (Element link : doc.select("a[href]")) {
            Optional<String> url = UrlNormalizer.absoluteHref(link);
            if (url.isEmpty() || found.containsKey(url.get()) || isExcluded(url.get())) {
                continue;
            }
            if (!UrlNormalizer.hasPathSegment(url.get(), keywords)) {
                continue;
            }
            String name = courseName(link);
            if (name.length() < 2) {
                continue;
            }
            found.put(url.get(), new Course(url.get(), name));
        }
        return new ArrayList<>(found.values());
    }

    private boolean isExcluded(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        return excludePatterns.stream().anyMatch(lower::contains);
    }

    // リンク文字列 → リンク内/隣接するラベル付きspan → title属性 の順
    static String courseName(Element link) {
        String text = link.text().trim();
        if (!text.isEmpty()) {
            return text;
        }
        Element span = link.selectFirst(LABELLED_SPAN);
        if (span == null && link.parent() != null) {
            span = link.parent().selectFirst(LABELLED_SPAN);
        }
        if (span != null) {
            String label = span.text().trim();
            if (label.isEmpty()) label = span.attr("title").trim();
            if (label.isEmpty()) label = span.attr("aria-label").trim();
            if (!label.isEmpty()) return label;
        }
        String title = link.attr("title").trim();
        return title.isEmpty() ? link.attr("aria-label").trim() : title;
    }
}
