package com.example.lmsreport.report;

import com.example.lmsreport.classify.ClassificationResult;
import com.example.lmsreport.dto.Assignment;
import com.example.lmsreport.dto.ClassifiedAssignment;
import com.example.lmsreport.dto.Course;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 分類済みの課題をMarkdownのレポートに組み立てる。
 * セクション順: 探索したコース → 直近の提出済み → 期限切れ → 今日締切 → 今後。
 * コース一覧以外の空のセクションは出力しない。
 */
@Component
public class ReportAssembler {

    static final String NO_COURSES_MESSAGE = "No courses were explored.";
    static final String NO_PENDING_MESSAGE = "## No pending items in the selected period.\n\n";
    static final String FOOTER = "*Report generated by LMS Report*";

    private static final DateTimeFormatter GENERATED_AT = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss");
    private static final DateTimeFormatter DUE_DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    private final ReportTemplate template;

    public ReportAssembler() {
        this(ReportTemplate.fromClasspath(ReportTemplate.DEFAULT_LOCATION));
    }

    ReportAssembler(ReportTemplate template) {
        this.template = template;
    }

    public String render(ClassificationResult result, List<Course> courses, ReportMetadata metadata) {
        boolean hasAny = !result.isEmpty();

        Map<String, String> values = new HashMap<>();
        values.put("title", metadata.title());
        values.put("generation_date", metadata.generatedAt().format(GENERATED_AT));
        values.put("period", "Last %d days and next %d days".formatted(metadata.daysBehind(), metadata.daysAhead()));
        values.put("total_tasks", String.valueOf(result.countTasksInPeriod()));
        values.put("courses_count_line",
                metadata.coursesCount() == null ? "" : "**Courses found:** " + metadata.coursesCount());
        values.put("courses_explored_section", coursesExplored(courses));
        values.put("section_recently_submitted", recentlySubmitted(result.recentlySubmitted()));
        values.put("section_overdue", overdue(result.overdue()));
        values.put("section_due_today", dueToday(result.dueToday()));
        values.put("section_upcoming", upcoming(result.upcoming()));
        values.put("empty_message", hasAny ? "" : NO_PENDING_MESSAGE);
        values.put("footer", FOOTER);
        return template.render(values);
    }

    private static String coursesExplored(List<Course> courses) {
        StringBuilder sb = new StringBuilder("## Courses explored\n\n");
        if (courses == null || courses.isEmpty()) {
            sb.append(NO_COURSES_MESSAGE).append('\n');
        } else {
            for (Course course : courses) {
                String name = course.name() == null || course.name().isBlank() ? "Unnamed course" : course.name();
                sb.append("- ").append(name).append('\n');
            }
        }
        return sb.toString();
    }

    private static String recentlySubmitted(List<Assignment> items) {
        if (items.isEmpty()) return "";
        StringBuilder sb = new StringBuilder("## Recently submitted (last 7 days)\n\n");
        for (Assignment a : items) {
            heading(sb, a);
            sb.append("  - *Status:* ").append(a.submissionStatus().statusText()).append('\n');
            sb.append("  - *URL:* ").append(a.url()).append('\n');
        }
        return sb.append("\n---\n\n").toString();
    }

    private static String overdue(List<ClassifiedAssignment> items) {
        if (items.isEmpty()) return "";
        StringBuilder sb = new StringBuilder("## Overdue\n\n");
        for (ClassifiedAssignment c : items) {
            heading(sb, c.assignment());
            sb.append("  - *Due:* ").append(c.dueDate().format(DUE_DATE))
                    .append(" (").append(c.daysOverdue()).append(" days ago)\n");
            sb.append("  - *URL:* ").append(c.assignment().url()).append('\n');
        }
        return sb.append('\n').toString();
    }

    private static String dueToday(List<ClassifiedAssignment> items) {
        if (items.isEmpty()) return "";
        StringBuilder sb = new StringBuilder("## Due today\n\n");
        for (ClassifiedAssignment c : items) {
            heading(sb, c.assignment());
            sb.append("  - *URL:* ").append(c.assignment().url()).append('\n');
        }
        return sb.append('\n').toString();
    }

    private static String upcoming(List<ClassifiedAssignment> items) {
        if (items.isEmpty()) return "";
        StringBuilder sb = new StringBuilder("## Upcoming\n\n");
        for (ClassifiedAssignment c : items) {
            heading(sb, c.assignment());
            sb.append("  - *Due:* ").append(c.dueDate().format(DUE_DATE))
                    .append(" (in ").append(c.daysUntilDue()).append(" days)\n");
            sb.append("  - *URL:* ").append(c.assignment().url()).append('\n');
        }
        return sb.append('\n').toString();
    }

    private static void heading(StringBuilder sb, Assignment a) {
        sb.append("- **").append(a.title()).append("** in **").append(a.course()).append("**")
                .append(" [").append(a.type().label()).append("]\n");
    }
}
