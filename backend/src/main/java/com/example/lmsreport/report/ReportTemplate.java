package com.example.lmsreport.report;

import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {name} 形式のプレースホルダを持つMarkdownテンプレート。
 * 置換は単純な文字列置換のみで、テンプレートの文面には依存しない。
 */
public final class ReportTemplate {

    public static final String DEFAULT_LOCATION = "templates/report_template.md";

    static final List<String> REQUIRED_PLACEHOLDERS = List.of(
            "title", "generation_date", "period", "total_tasks", "courses_count_line",
            "courses_explored_section", "section_recently_submitted", "section_overdue",
            "section_due_today", "section_upcoming", "empty_message", "footer"
    );

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z_]+)}");

    private final String text;

    /**
     * @throws IllegalStateException 必須のプレースホルダが欠けている場合
     */
    public ReportTemplate(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalStateException("レポートテンプレートが空です。");
        }
        List<String> missing = REQUIRED_PLACEHOLDERS.stream()
                .filter(name -> !text.contains("{" + name + "}"))
                .toList();
        if (!missing.isEmpty()) {
            throw new IllegalStateException("レポートテンプレートに必須のプレースホルダがありません: " + missing);
        }
        this.text = text;
    }

    public static ReportTemplate fromClasspath(String location) {
        Resource resource = new ClassPathResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("レポートテンプレートが見つかりません: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return new ReportTemplate(StreamUtils.copyToString(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("レポートテンプレートの読み込みに失敗しました: " + location, e);
        }
    }

    /** 既知のプレースホルダだけを置き換え、それ以外の {..} はそのまま残します。 */
    public String render(Map<String, String> values) {
        Matcher m = PLACEHOLDER.matcher(text);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String value = values.get(m.group(1));
            m.appendReplacement(out, Matcher.quoteReplacement(value != null ? value : m.group()));
        }
        m.appendTail(out);
        return out.toString();
    }
}
