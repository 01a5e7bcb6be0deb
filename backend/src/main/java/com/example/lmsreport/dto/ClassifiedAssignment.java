package com.example.lmsreport.dto;

import java.time.LocalDate;

/**
 * 期間内に入った課題とその分類結果。レポート生成の間だけ存在する。
 * daysOverdue は OVERDUE のときのみ、daysUntilDue は DUE_TODAY(0) と UPCOMING のときのみ値を持つ。
 */
public record ClassifiedAssignment(
    Assignment assignment,
    LocalDate dueDate,
    DueStatus status,
    Integer daysOverdue,
    Integer daysUntilDue
) {}
