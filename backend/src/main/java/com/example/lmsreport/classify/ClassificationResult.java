package com.example.lmsreport.classify;

import com.example.lmsreport.dto.Assignment;
import com.example.lmsreport.dto.ClassifiedAssignment;
import com.example.lmsreport.dto.DueStatus;

import java.util.List;

/**
 * 分類ステージの出力。classified は期間内の課題 (締切日の昇順)、
 * recentlySubmitted は期間とは無関係に選ばれた直近の提出済み課題。
 */
public record ClassificationResult(List<ClassifiedAssignment> classified, List<Assignment> recentlySubmitted) {

    public ClassificationResult {
        classified = classified == null ? List.of() : List.copyOf(classified);
        recentlySubmitted = recentlySubmitted == null ? List.of() : List.copyOf(recentlySubmitted);
    }

    public static ClassificationResult empty() {
        return new ClassificationResult(List.of(), List.of());
    }

    public List<ClassifiedAssignment> overdue() {
        return byStatus(DueStatus.OVERDUE);
    }

    public List<ClassifiedAssignment> dueToday() {
        return byStatus(DueStatus.DUE_TODAY);
    }

    public List<ClassifiedAssignment> upcoming() {
        return byStatus(DueStatus.UPCOMING);
    }

    /** 期間内の件数 + 直近の提出済み件数。 */
    public int countTasksInPeriod() {
        return classified.size() + recentlySubmitted.size();
    }

    public boolean isEmpty() {
        return classified.isEmpty() && recentlySubmitted.isEmpty();
    }

    private List<ClassifiedAssignment> byStatus(DueStatus status) {
        return classified.stream().filter(c -> c.status() == status).toList();
    }
}
