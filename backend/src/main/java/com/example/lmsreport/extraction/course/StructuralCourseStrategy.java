package com.example.lmsreport.extraction.course;

import com.example.lmsreport.dto.Course;
import com.example.lmsreport.extraction.ExtractionStrategy;
import com.example.lmsreport.extraction.PageSnapshot;
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
 * プロファイルのセレクタで「コースカード」を探し、カード内の名前要素からコース名を取る。
 * カードが見つからない場合は、一覧コンテナ内のコースリンクを直接走査する。
 */
public class StructuralCourseStrategy implements ExtractionStrategy<PageSnapshot, Course> {

    private static final Logger log = LoggerFactory.getLogger(StructuralCourseStrategy.class);

    public static final String NAME = "structural";

    private final List<String> cardSelectors;
    private final List<String> nameSelectors;
    private final List<String> containerSelectors;
    private final String linkPattern;

    public StructuralCourseStrategy(List<String> cardSelectors, List<String> nameSelectors,
                                    List<String> containerSelectors, String linkPattern) {
        this.cardSelectors = List.copyOf(cardSelectors);
        this.nameSelectors = List.copyOf(nameSelectors);
        this.containerSelectors = List.copyOf(containerSelectors);
        this.linkPattern = linkPattern;
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
        Document doc = page.parse();
        Elements cards = findCards(doc);
        if (cards.isEmpty()) {
            return fromContainers(doc);
        }
        Map<String, Course> found = new LinkedHashMap<>();
        for (Element card : cards) {
            Element link = card.selectFirst(courseLinkQuery());
            if (link == null) continue;
            Optional<String> url = UrlNormalizer.absoluteHref(link);
            if (url.isEmpty() || found.containsKey(url.get())) continue;
            String name = nameFromCard(card, link);
            found.put(url.get(), new Course(url.get(), name.isEmpty() ? "Unnamed course" : name));
        }
        return new ArrayList<>(found.values());
    }

    private Elements findCards(Document doc) {
        for (String selector : cardSelectors) {
            try {
                Elements cards = doc.select(selector);
                if (!cards.isEmpty()) {
                    log.debug("  [HTML] {} で {}件のカードを検出", selector, cards.size());
                    return cards;
                }
            } catch (Selector.SelectorParseException e) {
                log.warn("カードセレクタが不正なためスキップします: {}", selector);
            }
        }
        return new Elements();
    }

    private List<Course> fromContainers(Document doc) {
        Map<String, Course> found = new LinkedHashMap<>();
        for (String selector : containerSelectors) {
            Elements containers;
            try {
                containers = doc.select(selector);
            } catch (Selector.SelectorParseException e) {
                log.warn("コンテナセレクタが不正なためスキップします: {}", selector);
                continue;
            }
            for (Element container : containers) {
                for (Element link : container.select(courseLinkQuery())) {
                    Optional<String> url = UrlNormalizer.absoluteHref(link);
                    if (url.isEmpty() || found.containsKey(url.get())) continue;
                    String name = LinkSegmentCourseStrategy.courseName(link);
                    if (name.length() >= 2) {
                        found.put(url.get(), new Course(url.get(), name));
                    }
                }
            }
        }
        return new ArrayList<>(found.values());
    }

    // 名前の優先順: プロファイルの名前セレクタ → リンク文字列 → title属性
    private String nameFromCard(Element card, Element link) {
        for (String selector : nameSelectors) {
            try {
                Element nameEl = card.selectFirst(selector);
                if (nameEl != null) {
                    String name = nameEl.text().trim();
                    if (name.isEmpty()) name = nameEl.attr("title").trim();
                    if (!name.isEmpty()) return name;
                }
            } catch (Selector.SelectorParseException e) {
                log.warn("名前セレクタが不正なためスキップします: {}", selector);
            }
        }
        String text = link.text().trim();
        if (!text.isEmpty()) return text;
        Element titled = card.selectFirst("[title]");
        return titled == null ? "" : titled.attr("title").trim();
    }

    private String courseLinkQuery() {
        return "a[href*='" + linkPattern + "']";
    }
}
