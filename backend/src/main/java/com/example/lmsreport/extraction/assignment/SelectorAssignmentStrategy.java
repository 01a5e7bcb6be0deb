package com.example.lmsreport.extraction.assignment;

import com.example.lmsreport.date.DueDateNormalizer;
import com.example.lmsreport.dto.Assignment;
import com.example.lmsreport.dto.AssignmentType;
import com.example.lmsreport.extraction.ExtractionStrategy;
import com.example.lmsreport.extraction.UrlNormalizer;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 活動リンクのセレクタ (プロファイルで種別ごとに定義) に一致するリンクを課題として拾う。
 * 締切はリンクの親要素のテキスト → 日付セレクタ → 活動ブロック全体のテキスト の順に探す。
 */
public class SelectorAssignmentStrategy implements ExtractionStrategy<CoursePage, Assignment> {

    private static final Logger log = LoggerFactory.getLogger(SelectorAssignmentStrategy.class);

    public static final String NAME = "selector";

    private static final String ACTIVITY_BLOCK = "li.activity, li, tr, .activity-item";
    private static final String DEFAULT_SECTION = "Main";
    private static final int MIN_TITLE_LENGTH = 3;

    private final List<String> selectors;
    private final List<String> dateSelectors;
    private final List<String> datePatterns;
    private final SubmissionStatusDetector submissionDetector;

    public SelectorAssignmentStrategy(List<String> selectors, List<String> dateSelectors, List<String> datePatterns,
                                      SubmissionStatusDetector submissionDetector) {
        this.selectors = List.copyOf(selectors);
        this.dateSelectors = List.copyOf(dateSelectors);
        this.datePatterns = List.copyOf(datePatterns);
        this.submissionDetector = submissionDetector;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Assignment> extract(CoursePage input) {
        if (input == null || input.page() == null || input.page().isBlank()) {
            return List.of();
        }
        Document doc = input.page().parse();
        Map<String, Assignment> found = new LinkedHashMap<>();
        for (String selector : selectors) {
            Elements links;
            try {
                links = doc.select(selector);
            } catch (Selector.SelectorParseException e) {
                log.warn("活動セレクタが不正なためスキップします: {}", selector);
                continue;
            }
            for (Element link : links) {
                Optional<String> url = UrlNormalizer.absoluteHref(link);
                if (url.isEmpty() || found.containsKey(url.get())) {
                    continue;
                }
                String title = titleOf(link);
                if (title.length() < MIN_TITLE_LENGTH) {
                    continue;
                }
                Element block = link.closest(ACTIVITY_BLOCK);
                String context = block != null ? block.text() : parentText(link);
                found.put(url.get(), Assignment.extracted(
                        title,
                        findDueDate(link, block),
                        input.course().name(),
                        AssignmentType.fromUrl(url.get(), AssignmentType.ACTIVITY),
                        url.get(),
                        sectionOf(link),
                        submissionDetector.detect(context)));
            }
        }
        return new ArrayList<>(found.values());
    }

    private String findDueDate(Element link, Element block) {
        Optional<String> fromParent = DueDateNormalizer.extractDateFromText(parentText(link), datePatterns);
        if (fromParent.isPresent()) {
            return fromParent.get();
        }
        Element scope = block != null ? block : link.parent();
        if (scope != null) {
            for (String selector : dateSelectors) {
                try {
                    Element dateEl = scope.selectFirst(selector);
                    if (dateEl != null && !dateEl.text().isBlank()) {
                        // "Opened: … Due: …" のように複数の日付を含むため、パターンで締切部分を選ぶ
                        String text = dateEl.text().trim();
                        return DueDateNormalizer.extractDateFromText(text, datePatterns).orElse(text);
                    }
                } catch (Selector.SelectorParseException e) {
                    log.warn("日付セレクタが不正なためスキップします: {}", selector);
                }
            }
        }
        if (block != null) {
            return DueDateNormalizer.extractDateFromText(block.text(), datePatterns).orElse("");
        }
        return "";
    }

    // Moodleの "accesshide" (スクリーンリーダー用の種別名) はタイトルから外す
    private static String titleOf(Element link) {
        Element name = link.selectFirst(".instancename");
        Element source = name != null ? name.clone() : link.clone();
        source.select(".accesshide").remove();
        return source.text().trim();
    }

    private static String parentText(Element link) {
        Element parent = link.parent();
        return parent == null ? link.text() : parent.text();
    }

    private static String sectionOf(Element link) {
        Element section = link.closest("li.section, .course-section");
        if (section != null) {
            Element name = section.selectFirst(".sectionname, h3, h4");
            if (name != null && !name.text().isBlank()) {
                return name.text().trim();
            }
        }
        return DEFAULT_SECTION;
    }
}
