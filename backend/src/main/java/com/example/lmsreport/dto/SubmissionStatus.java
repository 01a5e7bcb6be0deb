package com.example.lmsreport.dto;

/**
 * 提出状況。daysAgo は提出日が分からない場合 null。
 */
public record SubmissionStatus(
    boolean submitted,
    String statusText,
    Integer daysAgo
) {
    public static SubmissionStatus notSubmitted() {
        return new SubmissionStatus(false, "Not submitted", null);
    }
}
