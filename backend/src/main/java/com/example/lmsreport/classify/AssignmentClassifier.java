package com.example.lmsreport.classify;

import com.example.lmsreport.date.DueDateNormalizer;
import com.example.lmsreport.dto.Assignment;
import com.example.lmsreport.dto.ClassifiedAssignment;
import com.example.lmsreport.dto.DueStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 締切日と「今日」を比べて課題を期限切れ / 今日締切 / 今後 に振り分ける。
 * 締切日を正規化できない課題は推測で分類せず、期間内の集計から除外する。
 */
@Component
public class AssignmentClassifier {

    private static final Logger log = LoggerFactory.getLogger(AssignmentClassifier.class);

    static final int RECENT_SUBMISSION_DAYS = 7;
    // days_ago が不明な提出済み課題は「直近」に含めない
    private static final int UNKNOWN_DAYS_AGO = 999;

    private final Clock clock;
    private final DueDateNormalizer normalizer;

    public AssignmentClassifier(Clock clock, DueDateNormalizer normalizer) {
        this.clock = clock;
        this.normalizer = normalizer;
    }

    /**
     * 期間 [今日 - daysBehind, 今日 + daysAhead] に締切がある課題を分類します。
     * 結果は締切日の昇順 (同日はタイトル順) に並びます。
     */
    public List<ClassifiedAssignment> classify(List<Assignment> assignments, int daysAhead, int daysBehind) {
        LocalDate today = LocalDate.now(clock);
        LocalDate from = today.minusDays(daysBehind);
        LocalDate to = today.plusDays(daysAhead);

        List<ClassifiedAssignment> classified = new ArrayList<>();
        int unparsed = 0;
        for (Assignment assignment : assignments) {
            Optional<LocalDate> due = dueDateOf(assignment);
            if (due.isEmpty()) {
                unparsed++;
                continue;
            }
            LocalDate d = due.get();
            if (d.isBefore(from) || d.isAfter(to)) {
                continue;
            }
            Assignment dated = assignment.withNormalizedDueDate(d);
            if (d.isBefore(today)) {
                classified.add(new ClassifiedAssignment(dated, d, DueStatus.OVERDUE,
                        (int) ChronoUnit.DAYS.between(d, today), null));
            } else if (d.isEqual(today)) {
                classified.add(new ClassifiedAssignment(dated, d, DueStatus.DUE_TODAY, null, 0));
            } else {
                classified.add(new ClassifiedAssignment(dated, d, DueStatus.UPCOMING,
                        null, (int) ChronoUnit.DAYS.between(today, d)));
            }
        }
        if (unparsed > 0) {
            log.info("  締切日を解釈できなかった課題: {}件 (集計対象外)", unparsed);
        }
        classified.sort(Comparator.comparing(ClassifiedAssignment::dueDate)
                .thenComparing(c -> c.assignment().title()));
        return classified;
    }

    /**
     * 期間に関係なく、提出済みかつ提出から7日以内の課題を選びます。
     */
    public List<Assignment> recentlySubmitted(List<Assignment> assignments) {
        return assignments.stream()
                .filter(a -> a.submissionStatus().submitted())
                .filter(a -> daysAgo(a) <= RECENT_SUBMISSION_DAYS)
                .toList();
    }

    public ClassificationResult classifyAll(List<Assignment> assignments, int daysAhead, int daysBehind) {
        return new ClassificationResult(classify(assignments, daysAhead, daysBehind), recentlySubmitted(assignments));
    }

    private Optional<LocalDate> dueDateOf(Assignment assignment) {
        if (assignment.normalizedDueDate() != null) {
            return Optional.of(assignment.normalizedDueDate());
        }
        return normalizer.normalize(assignment.rawDueDate());
    }

    private static int daysAgo(Assignment assignment) {
        Integer daysAgo = assignment.submissionStatus().daysAgo();
        return daysAgo == null ? UNKNOWN_DAYS_AGO : daysAgo;
    }
}
