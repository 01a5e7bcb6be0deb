package com.example.lmsreport.dto;

import java.time.LocalDate;

/**
 * 抽出された課題。normalizedDueDate は抽出時には常に null で、分類ステージで付与される。
 */
public record Assignment(
    String title,
    String rawDueDate,
    LocalDate normalizedDueDate,
    String course,
    AssignmentType type,
    String url,
    String section,
    SubmissionStatus submissionStatus
) {
    public Assignment {
        if (submissionStatus == null) {
            submissionStatus = SubmissionStatus.notSubmitted();
        }
        if (rawDueDate == null) {
            rawDueDate = "";
        }
    }

    /** 抽出ステージ用。正規化日付なしで生成する。 */
    public static Assignment extracted(String title, String rawDueDate, String course, AssignmentType type,
                                       String url, String section, SubmissionStatus submissionStatus) {
        return new Assignment(title, rawDueDate, null, course, type, url, section, submissionStatus);
    }

    public Assignment withNormalizedDueDate(LocalDate date) {
        return new Assignment(title, rawDueDate, date, course, type, url, section, submissionStatus);
    }
}
