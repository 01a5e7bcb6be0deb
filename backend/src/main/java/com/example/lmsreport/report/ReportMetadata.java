package com.example.lmsreport.report;

import java.time.LocalDateTime;

/**
 * レポートのヘッダ情報。generatedAt を固定すれば同じ入力から同じ文面が得られる。
 */
public record ReportMetadata(
    String title,
    LocalDateTime generatedAt,
    int daysAhead,
    int daysBehind,
    Integer coursesCount
) {}
